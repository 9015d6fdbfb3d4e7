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

import org.dxwdl.wdlCompiler.frontend.ast.WdlStatement;
import org.dxwdl.wdlCompiler.frontend.ast.WdlWorkflow;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class BlockSplitterTests extends LoweringTestBase {
    static List<WdlStatement> body(String workflow) {
        WdlWorkflow wf = Objects.requireNonNull(parse(INC_TASK + workflow).workflow);
        return wf.body;
    }

    /**
     * The blocks contain all the statements, in the original order.
     */
    static void checkTotal(List<WdlStatement> statements, List<Block> blocks) {
        List<WdlStatement> flattened = new ArrayList<>();
        for (Block block: blocks)
            flattened.addAll(block.getStatements());
        Assert.assertEquals(statements.size(), flattened.size());
        for (int i = 0; i < statements.size(); i++)
            Assert.assertSame(statements.get(i), flattened.get(i));
    }

    @Test
    public void splitTest() {
        List<WdlStatement> statements = body("workflow w {\n" +
                "    Array[Int] xs\n" +
                "    Int y = 2\n" +
                "    scatter (x in xs) {\n" +
                "        call Inc { input: i=x }\n" +
                "    }\n" +
                "    Int z = 3\n" +
                "    call Inc as inc2 { input: i=z }\n" +
                "    Boolean b = true\n" +
                "    if (b) {\n" +
                "        call Inc as inc3 { input: i=z }\n" +
                "    }\n" +
                "    Int last = 4\n" +
                "}\n");
        List<Block> blocks = BlockSplitter.split(statements);
        checkTotal(statements, blocks);
        Assert.assertEquals(5, blocks.size());
        Block.ScatterBlock scatter = blocks.get(0).to(Block.ScatterBlock.class);
        Assert.assertEquals(2, scatter.preceding.size());
        Assert.assertEquals(1, blocks.get(1).to(Block.DeclRun.class).declarations.size());
        Assert.assertTrue(blocks.get(2).is(Block.OpaqueScope.class));
        Block.ConditionalBlock conditional = blocks.get(3).to(Block.ConditionalBlock.class);
        Assert.assertEquals(1, conditional.preceding.size());
        Assert.assertEquals(1, blocks.get(4).to(Block.DeclRun.class).declarations.size());
    }

    @Test
    public void consecutiveCallsTest() {
        List<WdlStatement> statements = body("workflow w {\n" +
                "    call Inc { input: i=1 }\n" +
                "    call Inc as again { input: i=2 }\n" +
                "}\n");
        List<Block> blocks = BlockSplitter.split(statements);
        checkTotal(statements, blocks);
        Assert.assertEquals(2, blocks.size());
        Assert.assertTrue(blocks.get(0).is(Block.OpaqueScope.class));
        Assert.assertTrue(blocks.get(1).is(Block.OpaqueScope.class));
    }

    @Test
    public void emptyTest() {
        Assert.assertTrue(BlockSplitter.split(new ArrayList<>()).isEmpty());
    }

    @Test
    public void leadingDeclarationsTest() {
        List<WdlStatement> statements = body("workflow w {\n" +
                "    Int a\n" +
                "    Int b = 1\n" +
                "    call Inc { input: i=a }\n" +
                "    Int c = 2\n" +
                "}\n");
        BlockSplitter.LeadingDeclarations split = BlockSplitter.splitLeadingDeclarations(statements);
        Assert.assertEquals(2, split.declarations.size());
        Assert.assertEquals("b", split.declarations.get(1).name);
        Assert.assertEquals(2, split.rest.size());
    }
}
