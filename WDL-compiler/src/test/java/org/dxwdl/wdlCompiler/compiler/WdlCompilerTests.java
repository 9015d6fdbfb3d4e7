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

package org.dxwdl.wdlCompiler.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxwdl.wdlCompiler.compiler.errors.CompilerMessages;
import org.dxwdl.wdlCompiler.ir.Applet;
import org.dxwdl.wdlCompiler.ir.IRNamespace;
import org.junit.Assert;
import org.junit.Test;

import java.util.Objects;

/**
 * Tests that invoke the compiler through its library interface.
 */
public class WdlCompilerTests {
    static final String INC = "task Inc {\n" +
            "    Int i\n" +
            "    command {\n" +
            "        echo $((${i} + 1))\n" +
            "    }\n" +
            "    output {\n" +
            "        Int out = read_int(stdout())\n" +
            "    }\n" +
            "}\n";

    @Test
    public void compileTest() {
        CompilerOptions options = new CompilerOptions();
        WdlCompiler compiler = new WdlCompiler(options);
        compiler.compileProgram(INC +
                "workflow w {\n" +
                "    Int n\n" +
                "    call Inc { input: i=n * 2 }\n" +
                "}\n");
        compiler.throwOnError();
        IRNamespace ir = Objects.requireNonNull(compiler.getIR());
        // The argument is lifted into an evaluation stage
        Assert.assertEquals(2, Objects.requireNonNull(ir.workflow).stages.size());
        Applet inc = ir.applets.get("Inc");
        Assert.assertEquals(INC.trim(), Objects.requireNonNull(inc.sourceText).trim());
    }

    @Test
    public void noLiftTest() {
        CompilerOptions options = new CompilerOptions();
        options.loweringOptions.noLift = true;
        WdlCompiler compiler = new WdlCompiler(options);
        compiler.compileProgram(INC +
                "workflow w {\n" +
                "    Int n\n" +
                "    call Inc { input: i=n * 2 }\n" +
                "}\n");
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertNull(compiler.getIR());
        CompilerMessages.Error error = compiler.messages.getError(0);
        Assert.assertEquals("Unsupported call argument", error.errorType);
        Assert.assertEquals(12, error.range.start.line);
    }

    @Test
    public void syntaxErrorTest() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.emitJsonErrors = true;
        WdlCompiler compiler = new WdlCompiler(options);
        compiler.compileProgram("workflow w {\n    call\n}\n");
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.errorCount());
        JsonNode errors = compiler.messages.toJson();
        Assert.assertEquals(1, errors.size());
        Assert.assertEquals("Error parsing WDL", errors.get(0).get("errorType").asText());
        Assert.assertFalse(errors.get(0).get("warning").asBoolean());
        Assert.assertTrue(compiler.messages.toString().startsWith("["));
    }

    @Test
    public void reorgOptionTest() {
        CompilerOptions options = new CompilerOptions();
        options.loweringOptions.reorg = true;
        options.loweringOptions.destination = "/project/applets";
        WdlCompiler compiler = new WdlCompiler(options);
        compiler.compileProgram(INC +
                "workflow w {\n" +
                "    call Inc { input: i=1 }\n" +
                "    output {\n" +
                "        Int o = Inc.out\n" +
                "    }\n" +
                "}\n");
        compiler.throwOnError();
        IRNamespace ir = Objects.requireNonNull(compiler.getIR());
        Assert.assertNotNull(ir.applets.get("w_reorg"));
        Assert.assertEquals("/project/applets", ir.applets.get("Inc").destination);
    }

    @Test(expected = RuntimeException.class)
    public void singleProgramTest() {
        WdlCompiler compiler = new WdlCompiler(new CompilerOptions());
        compiler.compileProgram(INC);
        compiler.compileProgram(INC);
    }
}
