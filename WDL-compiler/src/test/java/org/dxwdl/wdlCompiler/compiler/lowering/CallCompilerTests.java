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
import org.dxwdl.wdlCompiler.frontend.values.WdlIntValue;
import org.dxwdl.wdlCompiler.ir.IRNamespace;
import org.dxwdl.wdlCompiler.ir.SArg;
import org.dxwdl.wdlCompiler.ir.Stage;
import org.junit.Assert;
import org.junit.Test;

import java.util.Objects;

public class CallCompilerTests extends LoweringTestBase {
    static final String OPT_TASK = "task Opt {\n" +
            "    Int a\n" +
            "    Int? b\n" +
            "    command {\n" +
            "        echo ${a} ${b}\n" +
            "    }\n" +
            "    output {\n" +
            "        String out = read_string(stdout())\n" +
            "    }\n" +
            "}\n";

    static Stage firstStage(String workflow) {
        IRNamespace ns = lower(OPT_TASK + workflow);
        return Objects.requireNonNull(ns.workflow).stages.get(0);
    }

    static LoweringException.Kind failureKind(String workflow) {
        try {
            lower(OPT_TASK + workflow);
        } catch (LoweringException ex) {
            return ex.kind;
        }
        Assert.fail("Expected lowering to fail");
        throw new RuntimeException("unreachable");
    }

    @Test
    public void optionalArgumentTest() {
        Stage stage = firstStage("workflow w {\n" +
                "    call Opt { input: a=1 }\n" +
                "}\n");
        Assert.assertEquals(2, stage.inputs.size());
        Assert.assertEquals(new WdlIntValue(1), stage.inputs.get(0).to(SArg.Const.class).value);
        Assert.assertSame(SArg.Empty.INSTANCE, stage.inputs.get(1));
    }

    @Test
    public void missingRequiredArgumentTest() {
        try {
            lower(OPT_TASK + "workflow w {\n" +
                    "    call Opt\n" +
                    "}\n");
            Assert.fail("Expected lowering to fail");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.MissingRequiredArgument, ex.kind);
            Assert.assertTrue(ex.getMessage().contains(" a"));
        }
    }

    @Test
    public void aliasTest() {
        Stage stage = firstStage("workflow w {\n" +
                "    Int x\n" +
                "    call Opt as first { input: a=x, b=x }\n" +
                "}\n");
        Assert.assertEquals("first", stage.name);
        Assert.assertEquals("Opt", stage.callee);
        Assert.assertTrue(stage.inputs.get(1).is(SArg.WorkflowInput.class));
    }

    @Test
    public void foldedConstantTest() {
        Stage stage = firstStage("workflow w {\n" +
                "    call Opt { input: a=2 * 21 }\n" +
                "}\n");
        Assert.assertEquals(new WdlIntValue(42), stage.inputs.get(0).to(SArg.Const.class).value);
    }

    @Test
    public void unknownArgumentTest() {
        Assert.assertEquals(LoweringException.Kind.UnsupportedCallArgument, failureKind("workflow w {\n" +
                "    call Opt { input: a=1, c=2 }\n" +
                "}\n"));
    }

    @Test
    public void complexArgumentTest() {
        // Without lifting, arguments must be variables or constants
        Assert.assertEquals(LoweringException.Kind.UnsupportedCallArgument, failureKind("workflow w {\n" +
                "    Int x\n" +
                "    call Opt { input: a=x + 1 }\n" +
                "}\n"));
    }

    @Test
    public void undefinedVariableTest() {
        Assert.assertEquals(LoweringException.Kind.MissingVariableReference, failureKind("workflow w {\n" +
                "    call Opt { input: a=nowhere }\n" +
                "}\n"));
    }

    @Test
    public void reservedNamesTest() {
        Assert.assertEquals(LoweringException.Kind.IllegalStageName, failureKind("workflow w {\n" +
                "    call Opt as scatter_1 { input: a=1 }\n" +
                "}\n"));
        Assert.assertEquals(LoweringException.Kind.IllegalStageName, failureKind("workflow w {\n" +
                "    call Opt as my___call { input: a=1 }\n" +
                "}\n"));
    }

    @Test
    public void undefinedTaskTest() {
        Assert.assertEquals(LoweringException.Kind.UndefinedTask, failureKind("workflow w {\n" +
                "    call Missing { input: a=1 }\n" +
                "}\n"));
    }
}
