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
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.frontend.ast.WdlTask;
import org.dxwdl.wdlCompiler.frontend.values.ConstantEvaluator;
import org.dxwdl.wdlCompiler.ir.*;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TaskCompilerTests extends LoweringTestBase {
    static String task(String name, String body) {
        return "task " + name + " {\n" +
                "    Int n\n" +
                "    command {\n" +
                "        run ${n}\n" +
                "    }\n" +
                body +
                "    output {\n" +
                "        File log = stdout()\n" +
                "    }\n" +
                "}\n";
    }

    static String runtime(String attributes) {
        return "    runtime {\n" + attributes + "    }\n";
    }

    static Applet compile(String program, LoweringSession session) {
        WdlNamespace namespace = parse(program);
        TaskCompiler compiler = new TaskCompiler(session);
        return compiler.compileTask(namespace.tasks.get(0)).applet;
    }

    static Applet compile(String program) {
        return compile(program, LoweringSession.createDefault());
    }

    static String instanceName(Applet applet) {
        return applet.instanceType.to(InstanceType.Const.class).instance.name;
    }

    @Test
    public void memoryTest() {
        Applet applet = compile(task("Big", runtime("        memory: \"4 GB\"\n")));
        Assert.assertEquals("mem2_ssd1_x2", instanceName(applet));
    }

    @Test
    public void cpuAndDiskTest() {
        Assert.assertEquals("mem1_ssd1_x8",
                instanceName(compile(task("Cpu", runtime("        cpu: 8\n")))));
        Assert.assertEquals("mem1_ssd1_x16",
                instanceName(compile(task("Disk", runtime("        disks: \"local-disk 300 SSD\"\n")))));
    }

    @Test
    public void explicitInstanceTypeTest() {
        Applet applet = compile(task("Named", runtime("        dx_instance_type: \"mem3_ssd1_x4\"\n")));
        Assert.assertEquals("mem3_ssd1_x4", instanceName(applet));
        try {
            compile(task("Named", runtime("        dx_instance_type: \"mem9_ssd9_x99\"\n")));
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.NoSuitableInstanceType, ex.kind);
        }
    }

    @Test
    public void runtimeInstanceTypeTest() {
        Applet applet = compile(task("Dynamic", runtime("        memory: \"${n} GB\"\n")));
        Assert.assertTrue(applet.instanceType.is(InstanceType.Runtime.class));
    }

    @Test
    public void tooLargeTest() {
        try {
            compile(task("Huge", runtime("        memory: \"2 TB\"\n")));
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.NoSuitableInstanceType, ex.kind);
        }
    }

    @Test
    public void networkDockerTest() {
        Applet applet = compile(task("Docker", runtime("        docker: \"ubuntu:20.04\"\n")));
        Assert.assertTrue(applet.docker.is(DockerImage.Network.class));
        Assert.assertTrue(applet.instanceType.is(InstanceType.Default.class));
    }

    @Test
    public void platformDockerTest() {
        LinkedHashMap<String, String> known = new LinkedHashMap<>();
        known.put("dx://my-image", "dx://project-A1:record-B2");
        LoweringSession session = new LoweringSession("/apps", false, new ConstantEvaluator(),
                InstanceTypeDB.builtIn(), new AssetResolver(known), Collections.emptyMap());
        Applet applet = compile(task("Asset", runtime("        docker: \"dx://my-image\"\n")), session);
        DockerImage.PlatformAsset asset = applet.docker.to(DockerImage.PlatformAsset.class);
        Assert.assertEquals("dx://project-A1:record-B2", asset.reference);
        Assert.assertEquals("/apps", applet.destination);
        // The generated program refers to the resolved asset
        String code = WdlPrettyPrinter.toString(applet.program);
        Assert.assertTrue(code.contains("dx://project-A1:record-B2"));
        Assert.assertFalse(code.contains("dx://my-image"));
    }

    @Test
    public void unresolvedDockerTest() {
        try {
            compile(task("Asset", runtime("        docker: \"dx://unknown\"\n")));
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.UnresolvedPlatformAsset, ex.kind);
        }
    }

    @Test
    public void nativeStubTest() {
        String program = "task Native {\n" +
                "    String name\n" +
                "    command {\n" +
                "    }\n" +
                "    output {\n" +
                "        File result = \"result.txt\"\n" +
                "    }\n" +
                "    meta {\n" +
                "        type: \"native\"\n" +
                "        id: \"applet-xyz\"\n" +
                "    }\n" +
                "}\n";
        Applet applet = compile(program);
        Assert.assertEquals("applet-xyz", applet.kind.to(AppletKind.NativeStub.class).id);
    }

    @Test
    public void inputAttributesTest() {
        String program = "task Attrs {\n" +
                "    File reads\n" +
                "    String sample\n" +
                "    Int? threads = 4\n" +
                "    Int derived = 2\n" +
                "    command {\n" +
                "        align ${reads} ${sample} ${threads}\n" +
                "    }\n" +
                "    output {\n" +
                "        File bam = \"out.bam\"\n" +
                "    }\n" +
                "    parameter_meta {\n" +
                "        reads: \"stream\"\n" +
                "        sample: \"The sample name\"\n" +
                "    }\n" +
                "}\n";
        Applet applet = compile(program);
        Assert.assertEquals(3, applet.inputs.size());
        Map<String, String> reads = applet.inputs.get(0).attrs.asMap();
        Assert.assertEquals("true", reads.get(DeclAttrs.STREAM));
        Assert.assertEquals("The sample name", applet.inputs.get(1).attrs.get(DeclAttrs.HELP));
        Assert.assertEquals("4", applet.inputs.get(2).attrs.get(DeclAttrs.DEFAULT));
    }

    /**
     * The program of a task applet parses again.
     */
    @Test
    public void roundTripTest() {
        String program = "task Shapes {\n" +
                "    Array[File]+ files\n" +
                "    Map[String, Int] counts\n" +
                "    Pair[Int, String]? pair\n" +
                "    String prefix = \"out\"\n" +
                "    command <<<\n" +
                "        cat ${sep=' ' files} > ${prefix}.txt\n" +
                "    >>>\n" +
                "    runtime {\n" +
                "        docker: \"ubuntu:20.04\"\n" +
                "        cpu: 2\n" +
                "    }\n" +
                "    output {\n" +
                "        File merged = \"${prefix}.txt\"\n" +
                "        Array[String] lines = read_lines(merged)\n" +
                "    }\n" +
                "}\n";
        String source = program;
        LoweringSession session = new LoweringSession("/", false, new ConstantEvaluator(),
                InstanceTypeDB.builtIn(), AssetResolver.EMPTY,
                Collections.singletonMap("Shapes", source));
        Applet applet = compile(program, session);
        Assert.assertEquals(source, applet.sourceText);
        WdlNamespace reparsed = new WdlFrontend().parse(WdlPrettyPrinter.toString(applet.program));
        Assert.assertEquals(1, reparsed.tasks.size());
        WdlTask task = reparsed.tasks.get(0);
        Assert.assertEquals("Shapes", task.name);
        Assert.assertEquals(4, task.declarations.size());
        Assert.assertEquals(2, task.outputs.size());
    }
}
