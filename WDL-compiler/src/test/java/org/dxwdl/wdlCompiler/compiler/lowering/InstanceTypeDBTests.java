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
import org.dxwdl.wdlCompiler.frontend.values.WdlFloatValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlIntValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlStringValue;
import org.dxwdl.wdlCompiler.ir.PlatformInstance;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class InstanceTypeDBTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void memoryUnitsTest() {
        Assert.assertEquals(3815, InstanceTypeDB.parseMemoryMiB(new WdlStringValue("4 GB")));
        Assert.assertEquals(4096, InstanceTypeDB.parseMemoryMiB(new WdlStringValue("4 GiB")));
        Assert.assertEquals(512, InstanceTypeDB.parseMemoryMiB(new WdlStringValue("512MiB")));
        Assert.assertEquals(2, InstanceTypeDB.parseMemoryMiB(new WdlStringValue("1.5 MiB")));
        Assert.assertEquals(1, InstanceTypeDB.parseMemoryMiB(new WdlIntValue(1000)));
        Assert.assertEquals(1024, InstanceTypeDB.parseMemoryMiB(new WdlFloatValue(1024.0 * 1024 * 1024)));
    }

    @Test
    public void badMemoryTest() {
        try {
            InstanceTypeDB.parseMemoryMiB(new WdlStringValue("4 bananas"));
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.NoSuitableInstanceType, ex.kind);
        }
    }

    @Test
    public void diskAndCpuTest() {
        Assert.assertEquals(100, InstanceTypeDB.parseDiskGiB(new WdlStringValue("local-disk 100 SSD")));
        Assert.assertEquals(50, InstanceTypeDB.parseDiskGiB(new WdlStringValue("50")));
        Assert.assertEquals(20, InstanceTypeDB.parseDiskGiB(new WdlIntValue(20)));
        Assert.assertEquals(3, InstanceTypeDB.parseCpu(new WdlFloatValue(2.5)));
        Assert.assertEquals(4, InstanceTypeDB.parseCpu(new WdlStringValue("4")));
    }

    @Test
    public void chooseCheapestTest() {
        InstanceTypeDB db = InstanceTypeDB.builtIn();
        PlatformInstance instance = db.choose(null, null, null, null);
        Assert.assertEquals("mem1_ssd1_x2", instance.name);
        instance = db.choose(null, new WdlStringValue("60 GiB"), null, new WdlIntValue(8));
        Assert.assertEquals("mem3_ssd1_x8", instance.name);
        Assert.assertNotNull(db.find("mem1_ssd2_x36"));
        Assert.assertNull(db.find("nothing"));
    }

    @Test
    public void loadTest() throws IOException {
        File file = this.folder.newFile("instances.json");
        String json = "[ { \"name\": \"small\", \"memoryMiB\": 1024, \"diskGiB\": 10, \"cpu\": 1, \"price\": 0.01 },\n" +
                "  { \"name\": \"large\", \"memoryMiB\": 65536, \"diskGiB\": 100, \"cpu\": 16, \"price\": 1.0 } ]";
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        InstanceTypeDB db = InstanceTypeDB.load(file.toPath());
        Assert.assertEquals(2, db.instances.size());
        Assert.assertEquals("large", db.choose(null, new WdlStringValue("2 GiB"), null, null).name);
    }

    @Test(expected = IOException.class)
    public void loadMissingFieldTest() throws IOException {
        File file = this.folder.newFile("broken.json");
        Files.write(file.toPath(), "[ { \"name\": \"small\" } ]".getBytes(StandardCharsets.UTF_8));
        InstanceTypeDB.load(file.toPath());
    }
}
