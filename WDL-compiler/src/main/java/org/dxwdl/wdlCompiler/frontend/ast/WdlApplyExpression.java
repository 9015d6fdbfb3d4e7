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
 * Application of a standard library function, e.g., read_int(stdout()).
 * The function name is not a variable reference.
 */
public class WdlApplyExpression extends WdlExpression {
    public final String function;
    public final List<WdlExpression> arguments;

    public WdlApplyExpression(@Nullable SourcePositionRange position, String function, List<WdlExpression> arguments) {
        super(position);
        this.function = function;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        if (!visitor.preorder(this)) return;
        for (WdlExpression arg: this.arguments)
            arg.accept(visitor);
        visitor.postorder(this);
    }
}
