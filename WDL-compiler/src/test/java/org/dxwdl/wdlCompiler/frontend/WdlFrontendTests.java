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

import org.dxwdl.wdlCompiler.compiler.errors.WdlSyntaxException;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Objects;

public class WdlFrontendTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    static final String PROGRAM = "task Add {\n" +
            "    Int a\n" +
            "    Int b = 2\n" +
            "    command {\n" +
            "        echo $((${a} + ${b}))\n" +
            "    }\n" +
            "    runtime {\n" +
            "        docker: \"ubuntu:20.04\"\n" +
            "    }\n" +
            "    output {\n" +
            "        Int result = read_int(stdout())\n" +
            "    }\n" +
            "}\n" +
            "\n" +
            "workflow w {\n" +
            "    Array[Int] xs\n" +
            "    Map[String, Pair[Int, File?]] m = {\"a\": (1, \"f.txt\")}\n" +
            "    scatter (x in xs) {\n" +
            "        call Add as add { input: a=x }\n" +
            "    }\n" +
            "    if (length(xs) > 2 && !false) {\n" +
            "        Int y = if xs[0] == 1 then -1 else 2 % 3\n" +
            "    }\n" +
            "    output {\n" +
            "        Array[Int] sums = add.result\n" +
            "    }\n" +
            "}\n";

    void write(String name, String contents) throws IOException {
        File file = new File(this.folder.getRoot(), name);
        Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void parseTest() {
        WdlNamespace ns = new WdlFrontend().parse(PROGRAM);
        Assert.assertEquals(1, ns.tasks.size());
        WdlTask add = ns.tasks.get(0);
        Assert.assertEquals("Add", add.name);
        Assert.assertEquals(2, add.declarations.size());
        Assert.assertTrue(add.declarations.get(0).isInput());
        Assert.assertFalse(add.declarations.get(1).isInput());
        Assert.assertTrue(add.runtime.containsKey("docker"));

        WdlWorkflow wf = Objects.requireNonNull(ns.workflow);
        Assert.assertEquals(5, wf.body.size());
        WdlScatter scatter = wf.body.get(2).to(WdlScatter.class);
        Assert.assertEquals("x", scatter.variable);
        WdlCall call = scatter.body.get(0).to(WdlCall.class);
        Assert.assertEquals("add", call.getUnqualifiedName());
        Assert.assertEquals("Add", call.getTaskName());
        Assert.assertEquals(1, wf.getOutputs().size());
    }

    @Test
    public void prettyPrintTest() {
        WdlNamespace ns = new WdlFrontend().parse(PROGRAM);
        String printed = WdlPrettyPrinter.toString(ns);
        WdlNamespace reparsed = new WdlFrontend().parse(printed);
        Assert.assertEquals(printed, WdlPrettyPrinter.toString(reparsed));
    }

    @Test
    public void expressionTest() {
        Assert.assertEquals("1 + 2 * 3", WdlFrontend.parseExpression("1 + 2 * 3").toWdlString());
        Assert.assertEquals("(1 + 2) * 3", WdlFrontend.parseExpression("(1 + 2) * 3").toWdlString());
        WdlExpression access = WdlFrontend.parseExpression("A.b.c");
        Assert.assertTrue(access.isMemberAccess());
        Assert.assertFalse(WdlFrontend.parseExpression("f(x).c").isMemberAccess());
        WdlStringLiteral string = WdlFrontend.parseExpression("\"a ${x} b\"").to(WdlStringLiteral.class);
        Assert.assertEquals(1, string.placeholders.size());
        Assert.assertFalse(string.isConstant());
    }

    @Test
    public void syntaxErrorTest() {
        try {
            new WdlFrontend().parse("workflow w {\n" +
                    "    Int = 3\n" +
                    "}\n");
            Assert.fail("Expected a syntax error");
        } catch (WdlSyntaxException ex) {
            Assert.assertEquals(2, ex.range.start.line);
        }
    }

    @Test(expected = WdlSyntaxException.class)
    public void duplicateArgumentTest() {
        new WdlFrontend().parse("workflow w {\n" +
                "    call A { input: x=1, x=2 }\n" +
                "}\n");
    }

    @Test
    public void importTest() throws IOException {
        this.write("lib.wdl", "task Inc {\n" +
                "    Int i\n" +
                "    command {\n" +
                "    }\n" +
                "    output {\n" +
                "        Int out = i + 1\n" +
                "    }\n" +
                "}\n");
        String main = "import \"lib.wdl\"\n" +
                "workflow w {\n" +
                "    call lib.Inc { input: i=1 }\n" +
                "}\n";
        ImportResolver resolver = new ImportResolver(Collections.singletonList(this.folder.getRoot().toPath()));
        WdlNamespace ns = new WdlFrontend().parse(main, resolver);
        Assert.assertNotNull(ns.findTask("lib.Inc"));
        Assert.assertNull(ns.findTask("Inc"));
        Assert.assertNull(ns.findTask("other.Inc"));
    }

    @Test
    public void circularImportTest() throws IOException {
        this.write("a.wdl", "import \"b.wdl\"\n");
        this.write("b.wdl", "import \"a.wdl\"\n");
        ImportResolver resolver = new ImportResolver(Collections.singletonList(this.folder.getRoot().toPath()));
        try {
            new WdlFrontend().parse("import \"a.wdl\"\n", resolver);
            Assert.fail("Expected an exception");
        } catch (WdlSyntaxException ex) {
            Assert.assertTrue(ex.getMessage().contains("Circular"));
        }
    }

    @Test(expected = FileNotFoundException.class)
    public void missingImportTest() throws IOException {
        new WdlFrontend().parse("import \"missing.wdl\"\n", new ImportResolver());
    }

    @Test
    public void scatterVariableCollisionTest() {
        WdlFrontend frontend = new WdlFrontend();
        try {
            frontend.parse("workflow w {\n" +
                    "    Int x\n" +
                    "    Array[Int] xs\n" +
                    "    scatter (x in xs) {\n" +
                    "        Int y = x + 1\n" +
                    "    }\n" +
                    "}\n");
            Assert.fail("Expected the scatter variable to be rejected");
        } catch (WdlSyntaxException ex) {
            Assert.assertTrue(ex.getMessage().contains("Scatter variable x"));
            Assert.assertEquals(4, ex.range.start.line);
        }
    }

    @Test
    public void siblingScattersTest() {
        WdlNamespace namespace = new WdlFrontend().parse("workflow w {\n" +
                "    Array[Int] xs\n" +
                "    scatter (x in xs) {\n" +
                "        Int y = x + 1\n" +
                "    }\n" +
                "    scatter (x in xs) {\n" +
                "        Int z = x + 2\n" +
                "    }\n" +
                "}\n");
        Assert.assertEquals(3, Objects.requireNonNull(namespace.workflow).body.size());
    }
}
