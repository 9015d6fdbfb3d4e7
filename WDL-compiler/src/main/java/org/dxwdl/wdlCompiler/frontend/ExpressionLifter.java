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

package org.dxwdl.wdlCompiler.frontend;

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.frontend.ast.*;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Moves complex expressions out of call arguments and block headers
 * into fresh declarations, so that the lowering only sees variables
 * and constants in these positions.
 *
 * <pre>
 * call Add { input: a = x + 1 }
 * </pre>
 * becomes
 * <pre>
 * Int xtmp0 = x + 1
 * call Add { input: a = xtmp0 }
 * </pre>
 */
public class ExpressionLifter implements IModule {
    /**
     * Prefix of the names of the declarations generated by the compiler.
     */
    public static final String GENERATED_PREFIX = "xtmp";

    final WdlNamespace namespace;
    final Set<String> usedNames = new HashSet<>();
    int nextId = 0;

    ExpressionLifter(WdlNamespace namespace) {
        this.namespace = namespace;
    }

    /**
     * Lift the expressions of the workflow of a namespace.
     */
    public static WdlNamespace lift(WdlNamespace namespace) {
        if (namespace.workflow == null)
            return namespace;
        ExpressionLifter lifter = new ExpressionLifter(namespace);
        return namespace.withWorkflow(lifter.lift(namespace.workflow));
    }

    /**
     * Collects the names and the types of the variables declared in a workflow,
     * as seen from its top level.
     */
    class VariableTypes {
        final Map<String, WdlType> types = new HashMap<>();

        void collect(List<WdlStatement> statements, UnaryOperator<WdlType> promote) {
            for (WdlStatement statement: statements) {
                if (statement.is(WdlDeclaration.class)) {
                    WdlDeclaration decl = statement.to(WdlDeclaration.class);
                    this.types.put(decl.name, promote.apply(decl.type));
                    ExpressionLifter.this.usedNames.add(decl.name);
                } else if (statement.is(WdlCall.class)) {
                    WdlCall call = statement.to(WdlCall.class);
                    ExpressionLifter.this.usedNames.add(call.getUnqualifiedName());
                    WdlTask task = ExpressionLifter.this.namespace.findTask(call.qualifiedTaskName);
                    if (task == null)
                        continue;
                    for (WdlDeclaration output: task.outputs)
                        this.types.put(call.getUnqualifiedName() + "." + output.name, promote.apply(output.type));
                } else if (statement.is(WdlScatter.class)) {
                    WdlScatter scatter = statement.to(WdlScatter.class);
                    ExpressionLifter.this.usedNames.add(scatter.variable);
                    this.collect(scatter.body, t -> promote.apply(new WdlArrayType(t)));
                } else if (statement.is(WdlConditional.class)) {
                    this.collect(statement.to(WdlConditional.class).body, t -> promote.apply(t.makeOptional()));
                } else if (statement.is(WdlOutputSection.class)) {
                    for (WdlDeclaration output: statement.to(WdlOutputSection.class).outputs)
                        ExpressionLifter.this.usedNames.add(output.name);
                }
            }
        }
    }

    String freshName() {
        while (true) {
            String name = GENERATED_PREFIX + this.nextId++;
            if (this.usedNames.add(name))
                return name;
        }
    }

    /**
     * Variables, member accesses and constants do not need to be lifted.
     */
    static boolean isTrivial(WdlExpression expression) {
        return expression.is(WdlIdentifier.class) ||
                expression.isMemberAccess() ||
                IdentifierCollector.collect(expression).isEmpty();
    }

    WdlDeclaration declare(WdlType type, WdlExpression expression) {
        WdlDeclaration result = new WdlDeclaration(expression.getPositionOrNull(),
                type, this.freshName(), expression);
        Logger.INSTANCE.from(this, 1)
                .append("Lifting ")
                .append(WdlPrettyPrinter.toString(result))
                .newline();
        return result;
    }

    @Nullable
    WdlType parameterType(WdlCall call, String parameter) {
        WdlTask task = this.namespace.findTask(call.qualifiedTaskName);
        if (task == null)
            return null;
        for (WdlDeclaration decl: task.declarations)
            if (decl.name.equals(parameter))
                return decl.type;
        return null;
    }

    /**
     * Lift the complex arguments of a call.
     * @param lifted         Receives the generated declarations.
     * @param blockCalls     Names of the calls in the same block; arguments that read them stay in place.
     */
    WdlCall liftCall(WdlCall call, List<WdlDeclaration> lifted, Set<String> blockCalls) {
        LinkedHashMap<String, WdlExpression> inputs = new LinkedHashMap<>();
        boolean changed = false;
        for (Map.Entry<String, WdlExpression> input: call.inputs.entrySet()) {
            WdlExpression argument = input.getValue();
            WdlType type = this.parameterType(call, input.getKey());
            boolean readsBlockCall = false;
            for (String name: IdentifierCollector.collect(argument))
                readsBlockCall = readsBlockCall || blockCalls.contains(name);
            if (isTrivial(argument) || type == null || readsBlockCall) {
                inputs.put(input.getKey(), argument);
                continue;
            }
            WdlDeclaration decl = this.declare(type, argument);
            lifted.add(decl);
            inputs.put(input.getKey(), new WdlIdentifier(argument.getPositionOrNull(), decl.name));
            changed = true;
        }
        if (!changed)
            return call;
        return call.withInputs(inputs);
    }

    /**
     * Lift the arguments of the calls of a block into the leading declarations of the block.
     */
    List<WdlStatement> liftBlockBody(List<WdlStatement> body) {
        int leading = 0;
        while (leading < body.size() && body.get(leading).is(WdlDeclaration.class))
            leading++;
        Set<String> blockCalls = new HashSet<>();
        for (WdlStatement statement: body)
            if (statement.is(WdlCall.class))
                blockCalls.add(statement.to(WdlCall.class).getUnqualifiedName());

        List<WdlDeclaration> lifted = new ArrayList<>();
        List<WdlStatement> rest = new ArrayList<>();
        for (WdlStatement statement: body.subList(leading, body.size())) {
            if (statement.is(WdlCall.class))
                rest.add(this.liftCall(statement.to(WdlCall.class), lifted, blockCalls));
            else
                rest.add(statement);
        }
        List<WdlStatement> result = new ArrayList<>(body.subList(0, leading));
        result.addAll(lifted);
        result.addAll(rest);
        return result;
    }

    WdlWorkflow lift(WdlWorkflow workflow) {
        VariableTypes types = new VariableTypes();
        types.collect(workflow.body, t -> t);
        TypeInference inference = new TypeInference(types.types);

        List<WdlStatement> body = new ArrayList<>();
        for (WdlStatement statement: workflow.body) {
            List<WdlDeclaration> lifted = new ArrayList<>();
            WdlStatement result = statement;
            if (statement.is(WdlCall.class)) {
                result = this.liftCall(statement.to(WdlCall.class), lifted, new HashSet<>());
            } else if (statement.is(WdlBlockStatement.class)) {
                WdlBlockStatement block = statement.to(WdlBlockStatement.class);
                WdlExpression control = block.getControlExpression();
                if (!isTrivial(control)) {
                    WdlType type = block.is(WdlConditional.class) ?
                            WdlPrimitiveType.BOOLEAN : inference.infer(control);
                    if (type != null) {
                        WdlDeclaration decl = this.declare(type, control);
                        lifted.add(decl);
                        control = new WdlIdentifier(control.getPositionOrNull(), decl.name);
                    } else {
                        Logger.INSTANCE.from(this, 1)
                                .append("Cannot infer the type of ")
                                .append(control.toString())
                                .append("; leaving it in place")
                                .newline();
                    }
                }
                List<WdlStatement> blockBody = this.liftBlockBody(block.body);
                if (control != block.getControlExpression() || !blockBody.equals(block.body))
                    result = block.rebuild(control, blockBody);
            }
            body.addAll(lifted);
            body.add(result);
        }
        return workflow.withBody(body);
    }
}
