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
 * A declaration 'Type name' or 'Type name = expression'.
 */
public class WdlDeclaration extends WdlStatement {
    public final WdlType type;
    public final String name;
    @Nullable
    public final WdlExpression expression;

    public WdlDeclaration(@Nullable SourcePositionRange position, WdlType type,
                          String name, @Nullable WdlExpression expression) {
        super(position);
        this.type = type;
        this.name = name;
        this.expression = expression;
    }

    public WdlDeclaration(WdlType type, String name, @Nullable WdlExpression expression) {
        this(null, type, name, expression);
    }

    public WdlDeclaration withExpression(@Nullable WdlExpression expression) {
        if (expression == this.expression)
            return this;
        return new WdlDeclaration(this.getPositionOrNull(), this.type, this.name, expression);
    }

    /**
     * A declaration is an input if it is unassigned, or if it is
     * assigned but has an optional type; in the latter case the
     * expression is the default value.
     */
    public boolean isInput() {
        return this.expression == null || this.type.isOptional();
    }

    @Override
    public void accept(StatementVisitor visitor) {
        if (!visitor.preorder(this)) return;
        visitor.postorder(this);
    }
}
