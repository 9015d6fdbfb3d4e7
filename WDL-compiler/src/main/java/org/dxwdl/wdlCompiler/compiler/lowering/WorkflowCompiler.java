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
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.frontend.values.EvaluationException;
import org.dxwdl.wdlCompiler.ir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a workflow into a sequence of stages.
 * The workflow body is split into blocks; each block becomes one stage.
 * An environment maps each visible variable to the stage output that produces it.
 */
public class WorkflowCompiler implements IModule {
    static final String REORG = "reorg";
    /**
     * Declared by evaluation programs that would otherwise be empty.
     */
    static final String DUMMY_VARIABLE = "xxxx";

    final LoweringSession session;
    final CallCompiler callCompiler;

    public WorkflowCompiler(LoweringSession session) {
        this.session = session;
        this.callCompiler = new CallCompiler(session);
    }

    /**
     * The result of compiling one block: the stage, and the applet
     * generated for it, if any.
     */
    static class CompiledStage {
        final Stage stage;
        final List<Applet> applets;

        CompiledStage(Stage stage, List<Applet> applets) {
            this.stage = stage;
            this.applets = applets;
        }
    }

    /**
     * Build an applet that evaluates a sequence of declarations.
     */
    CompiledStage compileEval(String appletName, List<WdlDeclaration> declarations, CallEnv env) {
        Logger.INSTANCE.from(this, 1)
                .append("Compiling evaluation applet ")
                .append(appletName)
                .newline();

        CallEnv closure = CallEnv.EMPTY;
        for (WdlDeclaration decl: declarations)
            if (decl.expression != null)
                closure = ClosureAnalyzer.updateClosure(closure, env, decl.expression);

        List<CVar> inputs = new ArrayList<>();
        List<SArg> arguments = new ArrayList<>();
        for (Map.Entry<String, LinkedVar> entry: closure.entrySet()) {
            CVar var = entry.getValue().cVar;
            inputs.add(new CVar(entry.getKey(), var.type, DeclAttrs.EMPTY, var.provenance));
            arguments.add(entry.getValue().sArg);
        }
        List<CVar> outputs = new ArrayList<>();
        for (WdlDeclaration decl: declarations)
            outputs.add(new CVar(decl.name, decl.type, DeclAttrs.EMPTY, decl));

        VariableRenamer renamer = new VariableRenamer(inputs);
        List<WdlStatement> body = new ArrayList<>();
        for (CVar input: inputs)
            body.add(new WdlDeclaration(input.type, input.getPlatformName(), null));
        for (WdlDeclaration decl: declarations)
            body.add(renamer.rename(decl));
        if (body.isEmpty())
            body.add(new WdlDeclaration(WdlPrimitiveType.INT, DUMMY_VARIABLE, new WdlIntLiteral(0)));
        List<WdlDeclaration> outputSection = new ArrayList<>();
        for (CVar output: outputs)
            outputSection.add(new WdlDeclaration(output.type, output.name, new WdlIdentifier(output.name)));
        if (!outputSection.isEmpty())
            body.add(new WdlOutputSection(null, outputSection));

        WdlNamespace program = new WdlNamespace(Collections.emptyList(), new WdlWorkflow(appletName, body));
        this.session.validator.validate(program, appletName, inputs);
        Applet applet = new Applet(appletName, inputs, outputs, InstanceType.Default.INSTANCE,
                DockerImage.None.INSTANCE, this.session.destination, AppletKind.Eval.INSTANCE, program, null);
        Stage stage = new Stage(appletName, this.session.nextStageId(), appletName, arguments, outputs);
        return new CompiledStage(stage, Collections.singletonList(applet));
    }

    /**
     * Build the applet that reorganizes the workflow outputs.
     */
    CompiledStage compileReorg(String workflowName, List<LinkedVar> workflowOutputs) {
        String appletName = workflowName + "_" + REORG;
        List<CVar> inputs = new ArrayList<>();
        List<SArg> arguments = new ArrayList<>();
        List<WdlStatement> body = new ArrayList<>();
        List<WdlDeclaration> outputSection = new ArrayList<>();
        for (LinkedVar output: workflowOutputs) {
            CVar var = output.cVar;
            inputs.add(var);
            arguments.add(output.sArg);
            String name = var.getPlatformName();
            body.add(new WdlDeclaration(var.type, name, null));
            outputSection.add(new WdlDeclaration(var.type, name, new WdlIdentifier(name)));
        }
        if (body.isEmpty())
            body.add(new WdlDeclaration(WdlPrimitiveType.INT, DUMMY_VARIABLE, new WdlIntLiteral(0)));
        else
            body.add(new WdlOutputSection(null, outputSection));

        WdlNamespace program = new WdlNamespace(Collections.emptyList(), new WdlWorkflow(appletName, body));
        this.session.validator.validate(program, appletName, inputs);
        Applet applet = new Applet(appletName, inputs, inputs, InstanceType.Default.INSTANCE,
                DockerImage.None.INSTANCE, this.session.destination, AppletKind.OutputReorg.INSTANCE,
                program, null);
        Stage stage = new Stage(REORG, this.session.nextStageId(), appletName, arguments, inputs);
        return new CompiledStage(stage, Collections.singletonList(applet));
    }

    LinkedVar workflowInput(WdlDeclaration decl) {
        CVar var = new CVar(decl.name, decl.type, DeclAttrs.EMPTY, decl);
        if (decl.expression == null)
            return new LinkedVar(var, new SArg.WorkflowInput(var));
        try {
            return new LinkedVar(var, new SArg.Const(this.session.evaluator.evaluateConstant(decl.expression)));
        } catch (EvaluationException ex) {
            throw new LoweringException(LoweringException.Kind.WorkflowInputDefaultNotConst, decl,
                    "Default value of workflow input " + decl.name + " is not a constant: " + decl.expression);
        }
    }

    LinkedVar workflowOutput(WdlDeclaration output, CallEnv env) {
        CVar var = new CVar(output.name, output.type, DeclAttrs.EMPTY, output);
        WdlExpression expression = output.expression;
        if (expression == null || !(expression.is(WdlIdentifier.class) || expression.isMemberAccess()))
            throw new LoweringException(LoweringException.Kind.UnsupportedOutputExpression, output,
                    "Workflow output " + output.name + " must refer to a variable");
        return new LinkedVar(var, ClosureAnalyzer.lookupExact(env, expression).sArg);
    }

    static CallEnv addOutputs(CallEnv env, Stage stage, boolean qualified) {
        CallEnv result = env;
        for (CVar output: stage.outputs) {
            String name = qualified ? stage.name + "." + output.name : output.name;
            result = result.plus(name, new LinkedVar(output, new SArg.Link(stage.name, output)));
        }
        return result;
    }

    /**
     * Compile a workflow.
     * @param tasks  Compiled tasks, indexed by task name.
     * @return a namespace with the task applets, the applets generated for the workflow,
     * and the workflow.
     */
    public IRNamespace compileWorkflow(WdlWorkflow workflow, Map<String, TaskCompiler.CompiledTask> tasks) {
        Logger.INSTANCE.from(this, 1)
                .append("Compiling workflow ")
                .append(workflow.name)
                .newline();
        WorkflowScopes scopes = new WorkflowScopes(workflow);
        BlockCompiler blockCompiler = new BlockCompiler(this.session, scopes);

        List<WdlStatement> statements = new ArrayList<>();
        for (WdlStatement statement: workflow.body)
            if (!statement.is(WdlOutputSection.class))
                statements.add(statement);

        BlockSplitter.LeadingDeclarations leading = BlockSplitter.splitLeadingDeclarations(statements);
        List<LinkedVar> inputs = new ArrayList<>();
        List<WdlStatement> body = new ArrayList<>();
        CallEnv env = CallEnv.EMPTY;
        for (WdlDeclaration decl: leading.declarations) {
            if (decl.isInput() && !WorkflowScopes.isGenerated(decl.name)) {
                LinkedVar input = this.workflowInput(decl);
                inputs.add(input);
                env = env.plus(input.cVar.name, input);
            } else {
                body.add(decl);
            }
        }
        body.addAll(leading.rest);

        List<Stage> stages = new ArrayList<>();
        List<Applet> generated = new ArrayList<>();
        int evalCount = 0;
        int scatterCount = 0;
        int ifCount = 0;
        for (Block block: BlockSplitter.split(body)) {
            final CallEnv current = env;
            CompiledStage compiled;
            boolean qualified = false;
            if (block.is(Block.DeclRun.class)) {
                evalCount++;
                compiled = this.compileEval(workflow.name + "_eval" + evalCount,
                        block.to(Block.DeclRun.class).declarations, current);
            } else if (block.is(Block.ScatterBlock.class)) {
                scatterCount++;
                Block.ScatterBlock scatter = block.to(Block.ScatterBlock.class);
                BlockCompiler.CompiledBlock result = blockCompiler.compileScatter(workflow.name,
                        "scatter_" + scatterCount, scatter.preceding, scatter.scatter, tasks, current);
                compiled = new CompiledStage(result.stage, Collections.singletonList(result.applet));
            } else if (block.is(Block.ConditionalBlock.class)) {
                ifCount++;
                Block.ConditionalBlock conditional = block.to(Block.ConditionalBlock.class);
                BlockCompiler.CompiledBlock result = blockCompiler.compileIf(workflow.name,
                        "if_" + ifCount, conditional.preceding, conditional.conditional, tasks, current);
                compiled = new CompiledStage(result.stage, Collections.singletonList(result.applet));
            } else {
                WdlStatement statement = block.to(Block.OpaqueScope.class).statement;
                WdlCall call = statement.as(WdlCall.class);
                if (call == null)
                    throw new LoweringException(LoweringException.Kind.UnsupportedBlockElement, statement,
                            "Unsupported workflow element " + statement);
                compiled = new CompiledStage(this.callCompiler.compileCall(call, current, tasks),
                        Collections.emptyList());
                qualified = true;
            }
            stages.add(compiled.stage);
            generated.addAll(compiled.applets);
            env = addOutputs(env, compiled.stage, qualified);
        }

        List<LinkedVar> outputs = new ArrayList<>();
        List<WdlDeclaration> outputDeclarations = workflow.getOutputs();
        if (outputDeclarations != null)
            for (WdlDeclaration output: outputDeclarations)
                outputs.add(this.workflowOutput(output, env));

        if (this.session.reorg) {
            CompiledStage reorg = this.compileReorg(workflow.name, outputs);
            stages.add(reorg.stage);
            generated.addAll(reorg.applets);
        }

        LinkedHashMap<String, Applet> applets = new LinkedHashMap<>();
        for (TaskCompiler.CompiledTask task: tasks.values())
            applets.put(task.applet.name, task.applet);
        for (Applet applet: generated) {
            if (applets.containsKey(applet.name))
                throw new LoweringException(LoweringException.Kind.DuplicateAppletName, workflow,
                        "Generated applet " + applet.name + " has the same name as another applet");
            applets.put(applet.name, applet);
        }
        IRWorkflow irWorkflow = new IRWorkflow(workflow.name, inputs, outputs, stages);
        return new IRNamespace(applets, irWorkflow);
    }
}
