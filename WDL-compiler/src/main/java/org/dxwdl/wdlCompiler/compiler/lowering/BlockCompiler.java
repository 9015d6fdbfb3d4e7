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
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.ir.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a scatter or a conditional block into an applet that runs
 * a self-contained sub-workflow, and a stage that invokes it.
 * The applet inputs are the closure of the block; its outputs are the
 * preceding declarations and the results of the block, with types
 * promoted to arrays (for scatters) or optionals (for conditionals).
 */
public class BlockCompiler implements IModule {
    final LoweringSession session;
    final WorkflowScopes scopes;

    public BlockCompiler(LoweringSession session, WorkflowScopes scopes) {
        this.session = session;
        this.scopes = scopes;
    }

    public static class CompiledBlock {
        public final Stage stage;
        public final Applet applet;

        public CompiledBlock(Stage stage, Applet applet) {
            this.stage = stage;
            this.applet = applet;
        }
    }

    /**
     * True for the types that the platform represents natively:
     * primitive types other than Object, arrays of those, and optionals of both.
     */
    public static boolean isNativeType(WdlType type) {
        WdlType stripped = type.stripOptional();
        if (stripped.is(WdlArrayType.class))
            stripped = stripped.to(WdlArrayType.class).elementType;
        WdlPrimitiveType primitive = stripped.as(WdlPrimitiveType.class);
        return primitive != null && primitive.kind != WdlPrimitiveType.Kind.Object;
    }

    public CompiledBlock compileScatter(String workflowName, String stageName, List<WdlDeclaration> preceding,
                                        WdlScatter scatter, Map<String, TaskCompiler.CompiledTask> tasks,
                                        CallEnv env) {
        return this.compileBlock(workflowName, stageName, preceding, scatter, tasks, env);
    }

    public CompiledBlock compileIf(String workflowName, String stageName, List<WdlDeclaration> preceding,
                                   WdlConditional conditional, Map<String, TaskCompiler.CompiledTask> tasks,
                                   CallEnv env) {
        return this.compileBlock(workflowName, stageName, preceding, conditional, tasks, env);
    }

    WdlType promote(WdlBlockStatement block, WdlType type) {
        if (block.is(WdlScatter.class))
            return new WdlArrayType(type);
        return type.makeOptional();
    }

    CompiledBlock compileBlock(String workflowName, String stageName, List<WdlDeclaration> preceding,
                               WdlBlockStatement block, Map<String, TaskCompiler.CompiledTask> tasks,
                               CallEnv env) {
        String appletName = workflowName + "_" + stageName;
        Logger.INSTANCE.from(this, 1)
                .append("Compiling block ")
                .append(appletName)
                .newline();

        BlockSplitter.LeadingDeclarations split = BlockSplitter.splitLeadingDeclarations(block.body);
        List<WdlCall> calls = new ArrayList<>();
        for (WdlStatement statement: split.rest) {
            WdlCall call = statement.as(WdlCall.class);
            if (call == null)
                throw new LoweringException(LoweringException.Kind.UnsupportedBlockElement, statement,
                        "Only declarations followed by calls are supported inside a block; found "
                                + WdlPrettyPrinter.toString(statement));
            calls.add(call);
        }

        // Closure
        CallEnv closure = CallEnv.EMPTY;
        for (WdlDeclaration decl: preceding)
            if (decl.expression != null)
                closure = ClosureAnalyzer.updateClosure(closure, env, decl.expression);
        closure = ClosureAnalyzer.updateClosure(closure, env, block.getControlExpression());
        for (WdlDeclaration decl: split.declarations)
            if (decl.expression != null)
                closure = ClosureAnalyzer.updateClosure(closure, env, decl.expression);
        for (WdlCall call: calls)
            for (WdlExpression argument: call.inputs.values())
                closure = ClosureAnalyzer.updateClosure(closure, env, argument);
        for (Map.Entry<String, LinkedVar> entry: closure.entrySet())
            if (env.get(entry.getKey()) != entry.getValue())
                throw new IllegalStateException("Closure variable " + entry.getKey() + " is not in the environment");

        List<CVar> inputs = new ArrayList<>();
        List<SArg> arguments = new ArrayList<>();
        for (Map.Entry<String, LinkedVar> entry: closure.entrySet()) {
            CVar var = entry.getValue().cVar;
            inputs.add(new CVar(entry.getKey(), var.type, DeclAttrs.EMPTY, var.provenance));
            arguments.add(entry.getValue().sArg);
        }

        // Outputs
        List<CVar> outputs = new ArrayList<>();
        for (WdlDeclaration decl: preceding)
            outputs.add(new CVar(decl.name, decl.type, DeclAttrs.EMPTY, decl));
        for (WdlDeclaration decl: split.declarations) {
            if (this.scopes.isLocal(decl))
                continue;
            outputs.add(new CVar(decl.name, this.promote(block, decl.type), DeclAttrs.EMPTY, decl));
        }
        LinkedHashMap<String, String> taskMap = new LinkedHashMap<>();
        LinkedHashMap<String, WdlTask> stubs = new LinkedHashMap<>();
        for (WdlCall call: calls) {
            TaskCompiler.CompiledTask callee = CallCompiler.callee(call, tasks);
            String callName = CallCompiler.stageName(call);
            taskMap.put(callName, callee.applet.name);
            stubs.putIfAbsent(callee.applet.name, AppletStubs.stub(callee.applet));
            for (CVar output: callee.outputs)
                outputs.add(new CVar(callName + "." + output.name,
                        this.promote(block, output.type), DeclAttrs.EMPTY, call));
        }

        // Sub-program
        VariableRenamer renamer = new VariableRenamer(inputs);
        List<WdlStatement> body = new ArrayList<>();
        for (CVar input: inputs)
            body.add(new WdlDeclaration(input.type, input.getPlatformName(), null));
        for (WdlDeclaration decl: preceding)
            body.add(renamer.rename(decl));
        List<WdlStatement> blockBody = new ArrayList<>();
        for (WdlDeclaration decl: split.declarations)
            blockBody.add(renamer.rename(decl));
        for (WdlCall call: calls) {
            // The stubs are not in a namespace
            WdlCall renamed = renamer.rename(call);
            blockBody.add(new WdlCall(renamed.getPositionOrNull(), call.getTaskName(),
                    call.alias, new LinkedHashMap<>(renamed.inputs)));
        }
        body.add(block.rebuild(renamer.apply(block.getControlExpression()), blockBody));
        List<WdlDeclaration> outputSection = new ArrayList<>();
        for (CVar output: outputs) {
            WdlExpression reference = WdlFrontend.parseExpression(output.name);
            outputSection.add(new WdlDeclaration(output.type, output.getPlatformName(), reference));
        }
        body.add(new WdlOutputSection(null, outputSection));
        WdlWorkflow workflow = new WdlWorkflow(appletName, body);
        WdlNamespace program = new WdlNamespace(new ArrayList<>(stubs.values()), workflow);
        this.session.validator.validate(program, appletName, inputs);

        AppletKind kind;
        if (block.is(WdlScatter.class)) {
            boolean allNative = true;
            for (CVar output: outputs)
                allNative = allNative && isNativeType(output.type);
            if (allNative)
                kind = new AppletKind.Scatter(taskMap);
            else
                kind = new AppletKind.ScatterCollect(taskMap);
        } else {
            kind = new AppletKind.If(taskMap);
        }

        Applet applet = new Applet(appletName, inputs, outputs, InstanceType.Default.INSTANCE,
                DockerImage.None.INSTANCE, this.session.destination, kind, program, null);
        Stage stage = new Stage(stageName, this.session.nextStageId(), appletName, arguments, outputs);
        Logger.INSTANCE.from(this, 1)
                .append(applet.toString())
                .newline();
        return new CompiledBlock(stage, applet);
    }
}
