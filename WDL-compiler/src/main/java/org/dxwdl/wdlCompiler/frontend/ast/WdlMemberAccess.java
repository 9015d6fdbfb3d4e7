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

/**
 * An expression of the form lhs.member.
 * WDL uses the same syntax for call outputs (Add.result),
 * pair components (p.left) and object fields.
 */
public class WdlMemberAccess extends WdlExpression {
    public final WdlExpression lhs;
    public final String member;

    public WdlMemberAccess(@Nullable SourcePositionRange position, WdlExpression lhs, String member) {
        super(position);
        this.lhs = lhs;
        this.member = member;
    }

    public WdlMemberAccess(WdlExpression lhs, String member) {
        this(null, lhs, member);
    }

    /**
     * True only for dotted chains of identifiers such as A.B.C.
     */
    @Override
    public boolean isMemberAccess() {
        return this.lhs.is(WdlIdentifier.class) || this.lhs.isMemberAccess();
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        if (!visitor.preorder(this)) return;
        this.lhs.accept(visitor);
        visitor.postorder(this);
    }
}
