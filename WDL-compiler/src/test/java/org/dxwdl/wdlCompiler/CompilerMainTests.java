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

package org.dxwdl.wdlCompiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxwdl.wdlCompiler.compiler.errors.CompilerMessages;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;

/**
 * Tests that invoke the compiler through the command line interface.
 */
public class CompilerMainTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    File write(String name, String contents) throws IOException {
        File file = this.folder.newFile(name);
        Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void compileFileTest() throws IOException {
        this.write("lib.wdl", "task Inc {\n" +
                "    Int i\n" +
                "    command {\n" +
                "    }\n" +
                "    output {\n" +
                "        Int out = i + 1\n" +
                "    }\n" +
                "}\n");
        File main = this.write("main.wdl", "import \"lib.wdl\" as lib\n" +
                "workflow w {\n" +
                "    Int n\n" +
                "    call lib.Inc { input: i=n }\n" +
                "}\n");
        File output = new File(this.folder.getRoot(), "out.json");
        CompilerMessages messages = Objects.requireNonNull(
                CompilerMain.execute("-o", output.getPath(), main.getPath()));
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        JsonNode root = new ObjectMapper().readTree(output);
        Assert.assertEquals("Inc", root.get("applets").get(0).get("name").asText());
        Assert.assertEquals("Inc", root.get("workflow").get("stages").get(0).get("applet").asText());
    }

    @Test
    public void instanceTypesOptionTest() throws IOException {
        File types = this.write("types.json",
                "[ { \"name\": \"only\", \"memoryMiB\": 1024, \"diskGiB\": 10, \"cpu\": 1, \"price\": 0.5 } ]");
        File main = this.write("task.wdl", "task T {\n" +
                "    command {\n" +
                "    }\n" +
                "    runtime {\n" +
                "        cpu: 1\n" +
                "    }\n" +
                "}\n");
        File output = new File(this.folder.getRoot(), "out.json");
        CompilerMessages messages = Objects.requireNonNull(CompilerMain.execute(
                "--instance-types", types.getPath(), "-o", output.getPath(), main.getPath()));
        Assert.assertEquals(0, messages.exitCode);
        JsonNode root = new ObjectMapper().readTree(output);
        Assert.assertEquals("only", root.get("applets").get(0).get("instanceType").get("name").asText());
    }

    @Test
    public void errorTest() throws IOException {
        File main = this.write("bad.wdl", "workflow w {\n" +
                "    call Missing\n" +
                "}\n");
        CompilerMessages messages = Objects.requireNonNull(CompilerMain.execute("-je", main.getPath()));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Undefined task", messages.getError(0).errorType);
        Assert.assertEquals(2, messages.getError(0).range.start.line);
    }

    @Test
    public void missingFileTest() {
        CompilerMessages messages = Objects.requireNonNull(
                CompilerMain.execute(new File(this.folder.getRoot(), "none.wdl").getPath()));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading file", messages.getError(0).errorType);
    }

    @Test
    public void badOptionTest() {
        Assert.assertNull(CompilerMain.execute("--no-such-option"));
    }
}
