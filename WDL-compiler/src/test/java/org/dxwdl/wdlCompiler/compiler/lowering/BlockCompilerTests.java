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
import org.dxwdl.wdlCompiler.frontend.ExpressionLifter;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.ir.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;

public class BlockCompilerTests extends LoweringTestBase {
    static final String MAYBE_TASK = "task MaybeInc {\n" +
            "    Int i\n" +
            "    command {\n" +
            "        echo ${i}\n" +
            "    }\n" +
            "    output {\n" +
            "        Int? out = read_int(stdout())\n" +
            "    }\n" +
            "}\n";

    static final String TABLE_TASK = "task Table {\n" +
            "    Int i\n" +
            "    command {\n" +
            "        echo ${i}\n" +
            "    }\n" +
            "    output {\n" +
            "        Map[String, Int] table = read_map(stdout())\n" +
            "    }\n" +
            "}\n";

    static final String PROMOTION = INC_TASK + MAYBE_TASK +
            "workflow w {\n" +
            "    Array[Int] xs\n" +
            "    Boolean flag\n" +
            "    scatter (x in xs) {\n" +
            "        call Inc { input: i=x }\n" +
            "    }\n" +
            "    if (flag) {\n" +
            "        call Inc as inc2 { input: i=1 }\n" +
            "        call MaybeInc { input: i=1 }\n" +
            "    }\n" +
            "    output {\n" +
            "        Array[Int] all = Inc.out\n" +
            "        Int? maybe = inc2.out\n" +
            "    }\n" +
            "}\n";

    static CVar output(Applet applet, String name) {
        for (CVar var: applet.outputs)
            if (var.name.equals(name))
                return var;
        throw new RuntimeException("No output " + name + " in " + applet);
    }

    @Test
    public void scatterPromotionTest() {
        IRNamespace ns = lower(PROMOTION);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Stage scatter = wf.stages.get(0);
        Assert.assertEquals("scatter_1", scatter.name);
        Applet applet = ns.applets.get("w_scatter_1");
        Assert.assertNotNull(applet);
        Assert.assertEquals(Collections.singletonList("xs"), names(applet.inputs));
        Assert.assertTrue(scatter.inputs.get(0).is(SArg.WorkflowInput.class));
        Assert.assertEquals(new WdlArrayType(WdlPrimitiveType.INT), output(applet, "Inc.out").type);
        AppletKind.Scatter kind = applet.kind.to(AppletKind.Scatter.class);
        Assert.assertEquals("Inc", kind.taskMap.get("Inc"));
    }

    @Test
    public void conditionalPromotionTest() {
        IRNamespace ns = lower(PROMOTION);
        Applet applet = ns.applets.get("w_if_1");
        Assert.assertNotNull(applet);
        Assert.assertTrue(applet.kind.is(AppletKind.If.class));
        Assert.assertEquals(Collections.singletonList("flag"), names(applet.inputs));
        Assert.assertEquals(Arrays.asList("inc2.out", "MaybeInc.out"), names(applet.outputs));
        Assert.assertEquals(WdlPrimitiveType.INT.makeOptional(), output(applet, "inc2.out").type);
        // Already optional: unchanged
        Assert.assertEquals("Int?", output(applet, "MaybeInc.out").type.toString());
    }

    @Test
    public void blockOutputsAreLinkedTest() {
        IRNamespace ns = lower(PROMOTION);
        IRWorkflow wf = Objects.requireNonNull(ns.workflow);
        Assert.assertEquals(2, wf.outputs.size());
        SArg.Link all = wf.outputs.get(0).sArg.to(SArg.Link.class);
        Assert.assertEquals("scatter_1", all.stageName);
        Assert.assertEquals("Inc.out", all.cVar.name);
        SArg.Link maybe = wf.outputs.get(1).sArg.to(SArg.Link.class);
        Assert.assertEquals("if_1", maybe.stageName);
    }

    @Test
    public void scatterCollectTest() {
        IRNamespace ns = lower(TABLE_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    scatter (x in xs) {\n" +
                "        call Table { input: i=x }\n" +
                "    }\n" +
                "}\n");
        Applet applet = ns.applets.get("w_scatter_1");
        Assert.assertTrue(applet.kind.is(AppletKind.ScatterCollect.class));
    }

    @Test
    public void precedingDeclarationsTest() {
        IRNamespace ns = lower(INC_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    Int offset\n" +
                "    Int base = offset + 10\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc { input: i=base }\n" +
                "    }\n" +
                "}\n");
        Applet applet = ns.applets.get("w_scatter_1");
        // Only the inputs are workflow inputs; 'base' is computed by the block
        Assert.assertEquals(2, Objects.requireNonNull(ns.workflow).inputs.size());
        Assert.assertEquals(Arrays.asList("offset", "xs"), names(applet.inputs));
        Assert.assertEquals(Arrays.asList("base", "Inc.out"), names(applet.outputs));
        Assert.assertEquals(WdlPrimitiveType.INT, output(applet, "base").type);
    }

    @Test
    public void userDeclarationsAreExportedTest() {
        IRNamespace ns = lower(INC_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    scatter (x in xs) {\n" +
                "        Int y = x + 1\n" +
                "        call Inc { input: i=y }\n" +
                "    }\n" +
                "}\n");
        Applet applet = ns.applets.get("w_scatter_1");
        // 'y' is only used inside the block, but it is not a generated name
        Assert.assertEquals(Arrays.asList("y", "Inc.out"), names(applet.outputs));
        Assert.assertEquals(new WdlArrayType(WdlPrimitiveType.INT), output(applet, "y").type);
    }

    @Test
    public void liftedDeclarationsAreLocalTest() {
        WdlNamespace namespace = parse(INC_TASK +
                "workflow w {\n" +
                "    Array[Int] xs\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc { input: i=x + 1 }\n" +
                "    }\n" +
                "}\n");
        namespace = ExpressionLifter.lift(namespace);
        IRNamespace ns = new NamespaceCompiler(LoweringSession.createDefault()).compile(namespace);
        Applet applet = ns.applets.get("w_scatter_1");
        Assert.assertEquals(Collections.singletonList("Inc.out"), names(applet.outputs));
    }

    @Test
    public void unsupportedBlockElementTest() {
        try {
            lower(INC_TASK +
                    "workflow w {\n" +
                    "    Array[Int] xs\n" +
                    "    scatter (x in xs) {\n" +
                    "        call Inc { input: i=x }\n" +
                    "        Int after = 2\n" +
                    "    }\n" +
                    "}\n");
            Assert.fail("Expected lowering to fail");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.UnsupportedBlockElement, ex.kind);
        }
    }

    @Test
    public void nativeTypesTest() {
        Assert.assertTrue(BlockCompiler.isNativeType(WdlPrimitiveType.FILE));
        Assert.assertTrue(BlockCompiler.isNativeType(new WdlArrayType(WdlPrimitiveType.STRING).makeOptional()));
        Assert.assertFalse(BlockCompiler.isNativeType(WdlPrimitiveType.OBJECT));
        Assert.assertFalse(BlockCompiler.isNativeType(new WdlArrayType(new WdlArrayType(WdlPrimitiveType.INT))));
        Assert.assertFalse(BlockCompiler.isNativeType(new WdlPairType(WdlPrimitiveType.INT, WdlPrimitiveType.INT)));
    }
}
