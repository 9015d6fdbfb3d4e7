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

import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;

import javax.annotation.Nullable;

/**
 * Base class for WDL expressions.
 */
public abstract class WdlExpression extends WdlNode {
    protected WdlExpression(@Nullable SourcePositionRange position) {
        super(position);
    }

    public abstract void accept(ExpressionVisitor visitor);

    /**
     * True for expressions of the shape A.B.C.
     */
    public boolean isMemberAccess() {
        return false;
    }

    /**
     * The canonical WDL text of this expression.
     * Environments are keyed by the canonical text of dotted names.
     */
    public String toWdlString() {
        return WdlPrettyPrinter.toString(this);
    }

    @Override
    public String toString() {
        return this.toWdlString();
    }
}
