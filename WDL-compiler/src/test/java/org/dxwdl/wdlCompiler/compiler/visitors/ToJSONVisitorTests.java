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

package org.dxwdl.wdlCompiler.compiler.visitors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxwdl.wdlCompiler.compiler.lowering.LoweringSession;
import org.dxwdl.wdlCompiler.compiler.lowering.NamespaceCompiler;
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.ir.IRNamespace;
import org.junit.Assert;
import org.junit.Test;

public class ToJSONVisitorTests {
    static final String PROGRAM = "task Add {\n" +
            "    Int a\n" +
            "    Int? b\n" +
            "    command {\n" +
            "        echo $((${a} + ${b}))\n" +
            "    }\n" +
            "    runtime {\n" +
            "        memory: \"4 GB\"\n" +
            "    }\n" +
            "    output {\n" +
            "        Int result = read_int(stdout())\n" +
            "    }\n" +
            "}\n" +
            "workflow w {\n" +
            "    Int ai\n" +
            "    call Add { input: a=ai }\n" +
            "    output {\n" +
            "        Int r = Add.result\n" +
            "    }\n" +
            "}\n";

    @Test
    public void irToJsonTest() throws JsonProcessingException {
        WdlFrontend frontend = new WdlFrontend();
        IRNamespace ir = new NamespaceCompiler(LoweringSession.createDefault()).compile(frontend.parse(PROGRAM));
        String json = ToJSONVisitor.irToJSON(ir);
        JsonNode root = new ObjectMapper().readTree(json);

        JsonNode applet = root.get("applets").get(0);
        Assert.assertEquals("Add", applet.get("name").asText());
        Assert.assertEquals("Const", applet.get("instanceType").get("kind").asText());
        Assert.assertEquals("mem2_ssd1_x2", applet.get("instanceType").get("name").asText());
        Assert.assertEquals("None", applet.get("docker").get("kind").asText());
        Assert.assertEquals("Task", applet.get("kind").get("kind").asText());
        Assert.assertEquals(2, applet.get("inputs").size());
        Assert.assertTrue(applet.get("code").asText().contains("task Add"));

        JsonNode workflow = root.get("workflow");
        Assert.assertEquals("w", workflow.get("name").asText());
        JsonNode stage = workflow.get("stages").get(0);
        Assert.assertEquals("stage_0", stage.get("id").asText());
        Assert.assertEquals("WorkflowInput", stage.get("inputs").get(0).get("kind").asText());
        Assert.assertEquals("Empty", stage.get("inputs").get(1).get("kind").asText());
        JsonNode output = workflow.get("outputs").get(0);
        Assert.assertEquals("r", output.get("name").asText());
        Assert.assertEquals("Link", output.get("source").get("kind").asText());
        Assert.assertEquals("Add", output.get("source").get("stage").asText());
    }
}
