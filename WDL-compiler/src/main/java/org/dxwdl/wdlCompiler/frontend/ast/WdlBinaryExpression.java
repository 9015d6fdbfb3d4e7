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

import javax.annotation.Nullable;

public class WdlBinaryExpression extends WdlExpression {
    public final String operation;
    public final WdlExpression left;
    public final WdlExpression right;

    public WdlBinaryExpression(@Nullable SourcePositionRange position, String operation,
                               WdlExpression left, WdlExpression right) {
        super(position);
        this.operation = operation;
        this.left = left;
        this.right = right;
    }

    public WdlBinaryExpression(String operation, WdlExpression left, WdlExpression right) {
        this(null, operation, left, right);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        if (!visitor.preorder(this)) return;
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.postorder(this);
    }
}
