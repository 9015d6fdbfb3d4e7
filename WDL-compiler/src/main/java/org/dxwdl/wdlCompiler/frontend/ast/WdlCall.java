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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A call of a task: 'call lib.Task as alias { input: a = expr, ... }'.
 */
public class WdlCall extends WdlStatement {
    /**
     * Task name as written, possibly qualified by an import namespace.
     */
    public final String qualifiedTaskName;
    @Nullable
    public final String alias;
    /**
     * Actual arguments, in source order.
     */
    public final Map<String, WdlExpression> inputs;

    public WdlCall(@Nullable SourcePositionRange position, String qualifiedTaskName,
                   @Nullable String alias, LinkedHashMap<String, WdlExpression> inputs) {
        super(position);
        this.qualifiedTaskName = qualifiedTaskName;
        this.alias = alias;
        this.inputs = Collections.unmodifiableMap(inputs);
    }

    /**
     * The name of the task without the namespace qualifier.
     */
    public String getTaskName() {
        int index = this.qualifiedTaskName.lastIndexOf('.');
        if (index < 0)
            return this.qualifiedTaskName;
        return this.qualifiedTaskName.substring(index + 1);
    }

    /**
     * The name under which the call outputs are visible: the alias, if present,
     * otherwise the task name.
     */
    public String getUnqualifiedName() {
        if (this.alias != null)
            return this.alias;
        return this.getTaskName();
    }

    public WdlCall withInputs(LinkedHashMap<String, WdlExpression> inputs) {
        return new WdlCall(this.getPositionOrNull(), this.qualifiedTaskName, this.alias, inputs);
    }

    @Override
    public void accept(StatementVisitor visitor) {
        if (!visitor.preorder(this)) return;
        visitor.postorder(this);
    }
}
