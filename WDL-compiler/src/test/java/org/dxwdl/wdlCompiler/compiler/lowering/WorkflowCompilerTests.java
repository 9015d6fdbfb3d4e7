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

import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.ir.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Objects;

public class WorkflowCompilerTests extends LoweringTestBase {
    static LoweringException.Kind failureKind(String program) {
        try {
            lower(program);
        } catch (LoweringException ex) {
            return ex.kind;
        }
        Assert.fail("Expected lowering to fail");
        throw new RuntimeException("unreachable");
    }

    @Test
    public void stageNamesTest() {
        IRNamespace ns = lower(INC_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    Boolean b\n" +
                "    Int one = 1\n" +
                "    call Inc { input: i=one }\n" +
                "    Int two = Inc.out + 1\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc as inner { input: i=x }\n" +
                "    }\n" +
                "    if (b) {\n" +
                "        call Inc as maybe { input: i=two }\n" +
                "    }\n" +
                "    scatter (y in xs) {\n" +
                "        call Inc as again { input: i=y }\n" +
                "    }\n" +
                "}\n");
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        String[] names = new String[wf.stages.size()];
        String[] ids = new String[wf.stages.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = wf.stages.get(i).name;
            ids[i] = wf.stages.get(i).getStageId();
        }
        // 'two' is absorbed by the following scatter
        Assert.assertArrayEquals(new String[] { "w_eval1", "Inc", "scatter_1", "if_1", "scatter_2" }, names);
        Assert.assertArrayEquals(new String[] { "stage_0", "stage_1", "stage_2", "stage_3", "stage_4" }, ids);
        Assert.assertEquals(Arrays.asList("Inc", "w_eval1", "w_scatter_1", "w_if_1", "w_scatter_2"),
                Arrays.asList(ns.applets.keySet().toArray()));

        Applet scatter = ns.applets.get("w_scatter_1");
        Assert.assertEquals(Arrays.asList("Inc.out", "xs"), names(scatter.inputs));
        Assert.assertEquals(Arrays.asList("two", "inner.out"), names(scatter.outputs));

        // The conditional reads 'two' from the scatter stage
        Stage conditional = wf.stages.get(3);
        Assert.assertEquals(2, conditional.inputs.size());
        Assert.assertTrue(conditional.inputs.get(0).is(SArg.WorkflowInput.class));
        SArg.Link two = conditional.inputs.get(1).to(SArg.Link.class);
        Assert.assertEquals("scatter_1", two.stageName);
    }

    @Test
    public void emptyWorkflowTest() {
        IRNamespace ns = lower("workflow w {\n}\n");
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Assert.assertTrue(wf.stages.isEmpty());
        Assert.assertTrue(ns.applets.isEmpty());
    }

    @Test
    public void outputExpressionTest() {
        Assert.assertEquals(LoweringException.Kind.UnsupportedOutputExpression, failureKind(INC_TASK +
                "workflow w {\n" +
                "    call Inc { input: i=1 }\n" +
                "    output {\n" +
                "        Int total = Inc.out + 1\n" +
                "    }\n" +
                "}\n"));
    }

    @Test
    public void inputDefaultNotConstantTest() {
        Assert.assertEquals(LoweringException.Kind.WorkflowInputDefaultNotConst, failureKind(
                "workflow w {\n" +
                "    Int a\n" +
                "    Int? b = a + 1\n" +
                "}\n"));
    }

    @Test
    public void duplicateAppletTest() {
        Assert.assertEquals(LoweringException.Kind.DuplicateAppletName, failureKind(
                "task w_eval1 {\n" +
                "    command {\n" +
                "    }\n" +
                "}\n" +
                "workflow w {\n" +
                "    Int x = 1\n" +
                "}\n"));
    }

    @Test
    public void unboundDeclarationTest() {
        // z is not a workflow input, and no stage produces its value
        Assert.assertEquals(LoweringException.Kind.GeneratedProgramInvalid, failureKind(ADD_TASK + INC_TASK +
                "workflow w {\n" +
                "    call Inc { input: i=1 }\n" +
                "    Int z\n" +
                "    call Add { input: a=z, b=Inc.out }\n" +
                "}\n"));
    }

    @Test
    public void unboundPrecedingDeclarationTest() {
        Assert.assertEquals(LoweringException.Kind.GeneratedProgramInvalid, failureKind(INC_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    call Inc { input: i=1 }\n" +
                "    Int offset\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc as inner { input: i=offset }\n" +
                "    }\n" +
                "}\n"));
    }
}
