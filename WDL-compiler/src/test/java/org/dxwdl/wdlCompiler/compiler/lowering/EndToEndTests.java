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

import org.dxwdl.wdlCompiler.frontend.values.WdlIntValue;
import org.dxwdl.wdlCompiler.ir.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;

/**
 * Lowers complete documents and checks the resulting IR.
 */
public class EndToEndTests extends LoweringTestBase {
    static final String ADD_WORKFLOW = ADD_TASK +
            "workflow w {\n" +
            "    Int ai\n" +
            "    call Add { input: a=ai, b=3 }\n" +
            "    Int x = Add.result + 10\n" +
            "}\n";

    @Test
    public void addTaskTest() {
        IRNamespace ns = lower(ADD_TASK);
        Assert.assertNull(ns.workflow);
        Assert.assertEquals(1, ns.applets.size());
        Applet add = ns.applets.get("Add");
        Assert.assertNotNull(add);
        Assert.assertTrue(add.instanceType.is(InstanceType.Default.class));
        Assert.assertTrue(add.docker.is(DockerImage.None.class));
        Assert.assertTrue(add.kind.is(AppletKind.Task.class));
        Assert.assertEquals(Arrays.asList("a", "b"), names(add.inputs));
        Assert.assertEquals(Collections.singletonList("result"), names(add.outputs));
        Assert.assertEquals("/", add.destination);
    }

    @Test
    public void addWorkflowTest() {
        IRNamespace ns = lower(ADD_WORKFLOW);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Assert.assertEquals("w", wf.name);
        Assert.assertEquals(1, wf.inputs.size());
        Assert.assertEquals("ai", wf.inputs.get(0).cVar.name);
        Assert.assertTrue(wf.inputs.get(0).sArg.is(SArg.WorkflowInput.class));
        Assert.assertTrue(wf.outputs.isEmpty());

        Assert.assertEquals(2, wf.stages.size());
        Stage call = wf.stages.get(0);
        Assert.assertEquals("Add", call.name);
        Assert.assertEquals("Add", call.callee);
        Assert.assertEquals("stage_0", call.getStageId());
        Assert.assertEquals(2, call.inputs.size());
        SArg.WorkflowInput a = call.inputs.get(0).to(SArg.WorkflowInput.class);
        Assert.assertEquals("ai", a.cVar.name);
        SArg.Const b = call.inputs.get(1).to(SArg.Const.class);
        Assert.assertEquals(new WdlIntValue(3), b.value);

        Stage eval = wf.stages.get(1);
        Assert.assertEquals("w_eval1", eval.name);
        Assert.assertEquals("stage_1", eval.getStageId());
        Applet evalApplet = ns.applets.get(eval.callee);
        Assert.assertNotNull(evalApplet);
        Assert.assertTrue(evalApplet.kind.is(AppletKind.Eval.class));
        Assert.assertEquals(Collections.singletonList("Add.result"), names(evalApplet.inputs));
        Assert.assertEquals("Add_result", evalApplet.inputs.get(0).getPlatformName());
        Assert.assertEquals(Collections.singletonList("x"), names(evalApplet.outputs));
        SArg.Link link = eval.inputs.get(0).to(SArg.Link.class);
        Assert.assertEquals("Add", link.stageName);
        Assert.assertEquals("result", link.cVar.name);

        Assert.assertEquals(Arrays.asList("Add", "w_eval1"), Arrays.asList(ns.applets.keySet().toArray()));
    }

    @Test
    public void workflowOutputsTest() {
        String program = ADD_TASK +
                "workflow w {\n" +
                "    Int ai\n" +
                "    call Add { input: a=ai, b=ai }\n" +
                "    output {\n" +
                "        Int sum = Add.result\n" +
                "    }\n" +
                "}\n";
        IRNamespace ns = lower(program);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Assert.assertEquals(1, wf.outputs.size());
        LinkedVar sum = wf.outputs.get(0);
        Assert.assertEquals("sum", sum.cVar.name);
        SArg.Link link = sum.sArg.to(SArg.Link.class);
        Assert.assertEquals("Add", link.stageName);
        Assert.assertEquals("result", link.cVar.name);
        // Both arguments come from the same input
        Stage call = wf.stages.get(0);
        Assert.assertSame(call.inputs.get(0), call.inputs.get(1));
    }

    @Test
    public void reorgTest() {
        String program = ADD_TASK +
                "workflow w {\n" +
                "    call Add { input: a=1, b=2 }\n" +
                "    output {\n" +
                "        Int sum = Add.result\n" +
                "    }\n" +
                "}\n";
        LoweringSession session = LoweringSession.createDefault().withReorg(true);
        IRNamespace ns = lower(program, session);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Stage last = wf.stages.get(wf.stages.size() - 1);
        Assert.assertEquals("reorg", last.name);
        Assert.assertEquals("w_reorg", last.callee);
        Applet reorg = ns.applets.get("w_reorg");
        Assert.assertTrue(reorg.kind.is(AppletKind.OutputReorg.class));
        Assert.assertEquals(Collections.singletonList("sum"), names(reorg.inputs));
        Assert.assertEquals(Collections.singletonList("sum"), names(reorg.outputs));
    }

    @Test
    public void workflowInputDefaultTest() {
        String program = ADD_TASK +
                "workflow w {\n" +
                "    Int? ai = 2 + 3\n" +
                "    call Add { input: a=ai, b=1 }\n" +
                "}\n";
        IRNamespace ns = lower(program);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        SArg.Const value = wf.inputs.get(0).sArg.to(SArg.Const.class);
        Assert.assertEquals(new WdlIntValue(5), value.value);
    }

    @Test
    public void stageIdsAreSessionScopedTest() {
        IRNamespace first = lower(ADD_WORKFLOW);
        IRNamespace second = lower(ADD_WORKFLOW);
        Assert.assertEquals("stage_0", Objects.requireNonNull(first.workflow).stages.get(0).getStageId());
        Assert.assertEquals("stage_0", Objects.requireNonNull(second.workflow).stages.get(0).getStageId());
    }
}
