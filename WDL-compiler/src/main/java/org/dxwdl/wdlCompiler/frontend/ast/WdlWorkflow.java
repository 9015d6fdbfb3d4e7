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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class WdlWorkflow extends WdlNode {
    public final String name;
    /**
     * Statements in source order, including output sections.
     */
    public final List<WdlStatement> body;
    public final Map<String, WdlExpression> meta;
    public final Map<String, WdlExpression> parameterMeta;

    public WdlWorkflow(@Nullable SourcePositionRange position, String name, List<WdlStatement> body,
                       LinkedHashMap<String, WdlExpression> meta,
                       LinkedHashMap<String, WdlExpression> parameterMeta) {
        super(position);
        this.name = name;
        this.body = Collections.unmodifiableList(body);
        this.meta = Collections.unmodifiableMap(meta);
        this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    }

    public WdlWorkflow(String name, List<WdlStatement> body) {
        this(null, name, body, new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * All the workflow output declarations, from all output sections.
     * Returns null if the workflow has no output section.
     */
    @Nullable
    public List<WdlDeclaration> getOutputs() {
        List<WdlDeclaration> result = null;
        for (WdlStatement statement: this.body) {
            WdlOutputSection section = statement.as(WdlOutputSection.class);
            if (section != null) {
                if (result == null)
                    result = new ArrayList<>();
                result.addAll(section.outputs);
            }
        }
        return result;
    }

    public WdlWorkflow withBody(List<WdlStatement> body) {
        return new WdlWorkflow(this.getPositionOrNull(), this.name, body,
                new LinkedHashMap<>(this.meta), new LinkedHashMap<>(this.parameterMeta));
    }
}
