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
import java.util.Collections;
import java.util.List;

/**
 * A statement with a nested body: a scatter or a conditional.
 */
public abstract class WdlBlockStatement extends WdlStatement {
    public final List<WdlStatement> body;

    protected WdlBlockStatement(@Nullable SourcePositionRange position, List<WdlStatement> body) {
        super(position);
        this.body = Collections.unmodifiableList(body);
    }

    /**
     * The expression that controls the block: the scatter collection or the condition.
     */
    public abstract WdlExpression getControlExpression();

    /**
     * A copy of this block with a different control expression and body.
     */
    public abstract WdlBlockStatement rebuild(WdlExpression control, List<WdlStatement> body);

    protected void acceptBody(StatementVisitor visitor) {
        for (WdlStatement statement: this.body)
            statement.accept(visitor);
    }
}
