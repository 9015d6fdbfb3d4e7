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

package org.dxwdl.wdlCompiler.compiler.lowering;

import org.dxwdl.util.Linq;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.ir.CVar;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces references to qualified variables such as A.x with
 * references to their platform names, such as A_x.
 * Only the dotted chains that denote one of the given variables are renamed;
 * a member access that starts with a variable, such as p.left, keeps its member.
 */
public class VariableRenamer extends ExpressionRewriter {
    final Map<String, String> renamed = new HashMap<>();

    public VariableRenamer(List<CVar> variables) {
        for (CVar var: variables)
            if (!var.name.equals(var.getPlatformName()))
                this.renamed.put(var.name, var.getPlatformName());
    }

    @Override
    public boolean preorder(WdlMemberAccess expression) {
        if (expression.isMemberAccess()) {
            String newName = this.renamed.get(expression.toWdlString());
            if (newName != null) {
                this.map(expression, new WdlIdentifier(expression.getPositionOrNull(), newName));
                return false;
            }
        }
        return super.preorder(expression);
    }

    public WdlDeclaration rename(WdlDeclaration declaration) {
        return declaration.withExpression(this.applyN(declaration.expression));
    }

    public WdlCall rename(WdlCall call) {
        LinkedHashMap<String, WdlExpression> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, WdlExpression> input: call.inputs.entrySet())
            inputs.put(input.getKey(), this.apply(input.getValue()));
        return call.withInputs(inputs);
    }

    /**
     * Rename the variables in all the expressions of a statement, including nested statements.
     */
    public WdlStatement rename(WdlStatement statement) {
        if (statement.is(WdlDeclaration.class))
            return this.rename(statement.to(WdlDeclaration.class));
        if (statement.is(WdlCall.class))
            return this.rename(statement.to(WdlCall.class));
        if (statement.is(WdlBlockStatement.class)) {
            WdlBlockStatement block = statement.to(WdlBlockStatement.class);
            List<WdlStatement> body = Linq.map(block.body, (WdlStatement s) -> this.rename(s));
            return block.rebuild(this.apply(block.getControlExpression()), body);
        }
        if (statement.is(WdlOutputSection.class)) {
            WdlOutputSection section = statement.to(WdlOutputSection.class);
            List<WdlDeclaration> outputs = Linq.map(section.outputs, (WdlDeclaration d) -> this.rename(d));
            return new WdlOutputSection(section.getPositionOrNull(), outputs);
        }
        throw new IllegalArgumentException("Unexpected statement " + statement);
    }
}
