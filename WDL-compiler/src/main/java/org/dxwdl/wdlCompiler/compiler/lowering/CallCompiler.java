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

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.frontend.ast.WdlCall;
import org.dxwdl.wdlCompiler.frontend.ast.WdlExpression;
import org.dxwdl.wdlCompiler.frontend.ast.WdlIdentifier;
import org.dxwdl.wdlCompiler.frontend.values.EvaluationException;
import org.dxwdl.wdlCompiler.ir.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles a call of a task into a stage.
 */
public class CallCompiler implements IModule {
    /**
     * Prefixes used for the names of the stages generated by the compiler.
     */
    static final String[] RESERVED_PREFIXES = { "scatter_", "if_", "eval_" };
    static final String RESERVED_SUBSTRING = "___";

    final LoweringSession session;

    public CallCompiler(LoweringSession session) {
        this.session = session;
    }

    /**
     * The name of the stage for a call: the alias, or the task name.
     */
    public static String stageName(WdlCall call) {
        String name = call.getUnqualifiedName();
        for (String prefix: RESERVED_PREFIXES)
            if (name.startsWith(prefix))
                throw new LoweringException(LoweringException.Kind.IllegalStageName, call,
                        "Call name " + name + " starts with the reserved prefix " + prefix);
        if (name.contains(RESERVED_SUBSTRING))
            throw new LoweringException(LoweringException.Kind.IllegalStageName, call,
                    "Call name " + name + " contains the reserved substring " + RESERVED_SUBSTRING);
        return name;
    }

    /**
     * Find the compiled task invoked by a call.
     */
    public static TaskCompiler.CompiledTask callee(WdlCall call, Map<String, TaskCompiler.CompiledTask> tasks) {
        TaskCompiler.CompiledTask callee = tasks.get(call.getTaskName());
        if (callee == null)
            throw new LoweringException(LoweringException.Kind.UndefinedTask, call,
                    "Call to undefined task " + call.qualifiedTaskName);
        return callee;
    }

    SArg argument(WdlCall call, String parameter, WdlExpression argument, CallEnv env) {
        if (argument.is(WdlIdentifier.class) || argument.isMemberAccess())
            return ClosureAnalyzer.lookupExact(env, argument).sArg;
        if (ClosureAnalyzer.referencedIdentifiers(argument).isEmpty()) {
            try {
                return new SArg.Const(this.session.evaluator.evaluateConstant(argument));
            } catch (EvaluationException ex) {
                throw new LoweringException(LoweringException.Kind.UnsupportedCallArgument, argument,
                        "Argument " + parameter + " of call " + call.getUnqualifiedName() +
                                " cannot be evaluated: " + ex.getMessage());
            }
        }
        throw new LoweringException(LoweringException.Kind.UnsupportedCallArgument, argument,
                "Argument " + parameter + " of call " + call.getUnqualifiedName() +
                        " must be a variable or a constant: " + argument);
    }

    public Stage compileCall(WdlCall call, CallEnv env, Map<String, TaskCompiler.CompiledTask> tasks) {
        TaskCompiler.CompiledTask callee = callee(call, tasks);
        String name = stageName(call);
        Logger.INSTANCE.from(this, 1)
                .append("Compiling call ")
                .append(name)
                .append(" of ")
                .append(callee.applet.name)
                .newline();

        for (String parameter: call.inputs.keySet()) {
            boolean found = false;
            for (CVar input: callee.applet.inputs)
                found = found || input.name.equals(parameter);
            if (!found)
                throw new LoweringException(LoweringException.Kind.UnsupportedCallArgument, call,
                        "Task " + callee.applet.name + " has no input named " + parameter);
        }

        List<SArg> arguments = new ArrayList<>();
        for (CVar input: callee.applet.inputs) {
            WdlExpression argument = call.inputs.get(input.name);
            if (argument == null) {
                if (!input.type.isOptional())
                    throw new LoweringException(LoweringException.Kind.MissingRequiredArgument, call,
                            "Call " + name + " does not provide the required argument " + input.name);
                arguments.add(SArg.Empty.INSTANCE);
            } else {
                arguments.add(this.argument(call, input.name, argument, env));
            }
        }
        return new Stage(name, this.session.nextStageId(), callee.applet.name, arguments, callee.outputs);
    }
}
