/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dxwdl.wdlCompiler.frontend.ast;

/**
 * Depth-first traversal of workflow statements.
 * Expressions nested in statements are not visited.
 */
@SuppressWarnings("SameReturnValue")
public abstract class StatementVisitor {
    final boolean visitSuper;

    public StatementVisitor(boolean visitSuper) {
        this.visitSuper = visitSuper;
    }

    public boolean preorder(WdlStatement node) { return true; }

    public boolean preorder(WdlDeclaration node) {
        if (this.visitSuper) return this.preorder((WdlStatement) node);
        else return true;
    }

    public boolean preorder(WdlCall node) {
        if (this.visitSuper) return this.preorder((WdlStatement) node);
        else return true;
    }

    public boolean preorder(WdlBlockStatement node) {
        if (this.visitSuper) return this.preorder((WdlStatement) node);
        else return true;
    }

    public boolean preorder(WdlScatter node) {
        if (this.visitSuper) return this.preorder((WdlBlockStatement) node);
        else return true;
    }

    public boolean preorder(WdlConditional node) {
        if (this.visitSuper) return this.preorder((WdlBlockStatement) node);
        else return true;
    }

    public boolean preorder(WdlOutputSection node) {
        if (this.visitSuper) return this.preorder((WdlStatement) node);
        else return true;
    }

    public void postorder(WdlStatement node) {}

    public void postorder(WdlDeclaration node) {
        if (this.visitSuper) this.postorder((WdlStatement) node);
    }

    public void postorder(WdlCall node) {
        if (this.visitSuper) this.postorder((WdlStatement) node);
    }

    public void postorder(WdlBlockStatement node) {
        if (this.visitSuper) this.postorder((WdlStatement) node);
    }

    public void postorder(WdlScatter node) {
        if (this.visitSuper) this.postorder((WdlBlockStatement) node);
    }

    public void postorder(WdlConditional node) {
        if (this.visitSuper) this.postorder((WdlBlockStatement) node);
    }

    public void postorder(WdlOutputSection node) {
        if (this.visitSuper) this.postorder((WdlStatement) node);
    }
}
