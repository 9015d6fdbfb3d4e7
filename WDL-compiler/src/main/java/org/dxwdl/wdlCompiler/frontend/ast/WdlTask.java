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
import java.util.List;
import java.util.Map;

public class WdlTask extends WdlNode {
    public final String name;
    public final List<WdlDeclaration> declarations;
    @Nullable
    public final WdlCommand command;
    public final List<WdlDeclaration> outputs;
    public final Map<String, WdlExpression> runtime;
    public final Map<String, WdlExpression> meta;
    public final Map<String, WdlExpression> parameterMeta;

    public WdlTask(@Nullable SourcePositionRange position, String name,
                   List<WdlDeclaration> declarations, @Nullable WdlCommand command,
                   List<WdlDeclaration> outputs,
                   LinkedHashMap<String, WdlExpression> runtime,
                   LinkedHashMap<String, WdlExpression> meta,
                   LinkedHashMap<String, WdlExpression> parameterMeta) {
        super(position);
        this.name = name;
        this.declarations = Collections.unmodifiableList(declarations);
        this.command = command;
        this.outputs = Collections.unmodifiableList(outputs);
        this.runtime = Collections.unmodifiableMap(runtime);
        this.meta = Collections.unmodifiableMap(meta);
        this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    }

    /**
     * The value of a meta attribute, if it is a constant string; null otherwise.
     */
    @Nullable
    public String getMetaString(String key) {
        return constantString(this.meta.get(key));
    }

    @Nullable
    public String getParameterMetaString(String key) {
        return constantString(this.parameterMeta.get(key));
    }

    @Nullable
    static String constantString(@Nullable WdlExpression expression) {
        if (expression == null)
            return null;
        WdlStringLiteral literal = expression.as(WdlStringLiteral.class);
        if (literal == null || !literal.isConstant())
            return null;
        return literal.getValue();
    }

    /**
     * A copy of this task with a different runtime section.
     */
    public WdlTask withRuntime(LinkedHashMap<String, WdlExpression> runtime) {
        return new WdlTask(this.getPositionOrNull(), this.name, this.declarations, this.command,
                this.outputs, runtime, new LinkedHashMap<>(this.meta), new LinkedHashMap<>(this.parameterMeta));
    }
}
