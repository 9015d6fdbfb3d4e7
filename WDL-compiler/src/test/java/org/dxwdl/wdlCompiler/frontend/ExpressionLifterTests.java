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

import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Objects;

public class ExpressionLifterTests {
    static final String INC = "task Inc {\n" +
            "    Int i\n" +
            "    command {\n" +
            "    }\n" +
            "    output {\n" +
            "        Int out = i + 1\n" +
            "    }\n" +
            "}\n";

    static List<WdlStatement> liftedBody(String workflow) {
        WdlNamespace ns = new WdlFrontend().parse(INC + workflow);
        return Objects.requireNonNull(ExpressionLifter.lift(ns).workflow).body;
    }

    @Test
    public void liftCallArgumentTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Int a\n" +
                "    call Inc { input: i=a * 2 }\n" +
                "}\n");
        Assert.assertEquals(3, body.size());
        WdlDeclaration lifted = body.get(1).to(WdlDeclaration.class);
        Assert.assertTrue(lifted.name.startsWith(ExpressionLifter.GENERATED_PREFIX));
        Assert.assertEquals(WdlPrimitiveType.INT, lifted.type);
        Assert.assertEquals("a * 2", Objects.requireNonNull(lifted.expression).toWdlString());
        WdlCall call = body.get(2).to(WdlCall.class);
        Assert.assertEquals(lifted.name, call.inputs.get("i").toWdlString());
    }

    @Test
    public void trivialArgumentsStayTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Int a\n" +
                "    call Inc { input: i=a }\n" +
                "    call Inc as two { input: i=Inc.out }\n" +
                "    call Inc as three { input: i=1 + 2 }\n" +
                "}\n");
        Assert.assertEquals(4, body.size());
    }

    @Test
    public void liftScatterCollectionTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Int n\n" +
                "    scatter (x in range(n)) {\n" +
                "        call Inc { input: i=x + 1 }\n" +
                "    }\n" +
                "}\n");
        Assert.assertEquals(3, body.size());
        WdlDeclaration collection = body.get(1).to(WdlDeclaration.class);
        Assert.assertEquals("Array[Int]", collection.type.toString());
        WdlScatter scatter = body.get(2).to(WdlScatter.class);
        Assert.assertEquals(collection.name, scatter.collection.toWdlString());
        // The call argument is lifted inside the block
        Assert.assertEquals(2, scatter.body.size());
        WdlDeclaration inner = scatter.body.get(0).to(WdlDeclaration.class);
        Assert.assertNotEquals(collection.name, inner.name);
    }

    @Test
    public void liftConditionTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Int n\n" +
                "    if (n > 3) {\n" +
                "        call Inc { input: i=n }\n" +
                "    }\n" +
                "}\n");
        WdlDeclaration condition = body.get(1).to(WdlDeclaration.class);
        Assert.assertEquals(WdlPrimitiveType.BOOLEAN, condition.type);
        Assert.assertTrue(body.get(2).is(WdlConditional.class));
    }

    @Test
    public void freshNamesAvoidCollisionsTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Int xtmp0\n" +
                "    Int xtmp1\n" +
                "    call Inc { input: i=xtmp0 + xtmp1 }\n" +
                "}\n");
        WdlDeclaration lifted = body.get(2).to(WdlDeclaration.class);
        Assert.assertNotEquals("xtmp0", lifted.name);
        Assert.assertNotEquals("xtmp1", lifted.name);
    }

    @Test
    public void sameBlockReferencesStayTest() {
        List<WdlStatement> body = liftedBody("workflow w {\n" +
                "    Array[Int] xs\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc { input: i=x }\n" +
                "        call Inc as next { input: i=Inc.out + 1 }\n" +
                "    }\n" +
                "}\n");
        WdlScatter scatter = body.get(1).to(WdlScatter.class);
        Assert.assertEquals(2, scatter.body.size());
    }
}
