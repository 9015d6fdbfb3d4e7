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
 * Depth-first traversal of a WDL expression tree.
 */
@SuppressWarnings("SameReturnValue")
public abstract class ExpressionVisitor {
    /// If true each visit call will visit by default the superclass.
    final boolean visitSuper;

    public ExpressionVisitor(boolean visitSuper) {
        this.visitSuper = visitSuper;
    }

    /************************* PREORDER *****************************/

    // preorder methods return 'true' when normal traversal is desired,
    // and 'false' when the traversal should stop right away at the current node.
    public boolean preorder(WdlExpression node) { return true; }

    public boolean preorder(WdlIdentifier node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlMemberAccess node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlLiteral node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlIntLiteral node) {
        if (this.visitSuper) return this.preorder((WdlLiteral) node);
        else return true;
    }

    public boolean preorder(WdlFloatLiteral node) {
        if (this.visitSuper) return this.preorder((WdlLiteral) node);
        else return true;
    }

    public boolean preorder(WdlBoolLiteral node) {
        if (this.visitSuper) return this.preorder((WdlLiteral) node);
        else return true;
    }

    public boolean preorder(WdlStringLiteral node) {
        if (this.visitSuper) return this.preorder((WdlLiteral) node);
        else return true;
    }

    public boolean preorder(WdlUnaryExpression node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlBinaryExpression node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlApplyExpression node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlIndexExpression node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlArrayLiteral node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlMapLiteral node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlPairLiteral node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    public boolean preorder(WdlIfThenElse node) {
        if (this.visitSuper) return this.preorder((WdlExpression) node);
        else return true;
    }

    /************************* POSTORDER *****************************/

    public void postorder(WdlExpression node) {}

    public void postorder(WdlIdentifier node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlMemberAccess node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlLiteral node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlIntLiteral node) {
        if (this.visitSuper) this.postorder((WdlLiteral) node);
    }

    public void postorder(WdlFloatLiteral node) {
        if (this.visitSuper) this.postorder((WdlLiteral) node);
    }

    public void postorder(WdlBoolLiteral node) {
        if (this.visitSuper) this.postorder((WdlLiteral) node);
    }

    public void postorder(WdlStringLiteral node) {
        if (this.visitSuper) this.postorder((WdlLiteral) node);
    }

    public void postorder(WdlUnaryExpression node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlBinaryExpression node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlApplyExpression node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlIndexExpression node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlArrayLiteral node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlMapLiteral node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlPairLiteral node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }

    public void postorder(WdlIfThenElse node) {
        if (this.visitSuper) this.postorder((WdlExpression) node);
    }
}
