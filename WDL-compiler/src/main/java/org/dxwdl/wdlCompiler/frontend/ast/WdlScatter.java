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
import java.util.List;

/**
 * scatter (variable in collection) { body }
 */
public class WdlScatter extends WdlBlockStatement {
    public final String variable;
    public final WdlExpression collection;

    public WdlScatter(@Nullable SourcePositionRange position, String variable,
                      WdlExpression collection, List<WdlStatement> body) {
        super(position, body);
        this.variable = variable;
        this.collection = collection;
    }

    @Override
    public WdlExpression getControlExpression() {
        return this.collection;
    }

    @Override
    public WdlScatter rebuild(WdlExpression control, List<WdlStatement> body) {
        return new WdlScatter(this.getPositionOrNull(), this.variable, control, body);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        if (!visitor.preorder(this)) return;
        this.acceptBody(visitor);
        visitor.postorder(this);
    }
}
