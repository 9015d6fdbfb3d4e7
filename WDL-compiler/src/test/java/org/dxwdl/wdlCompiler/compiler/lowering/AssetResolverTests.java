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
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class AssetResolverTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void directReferenceTest() {
        String reference = "dx://project-F00:record-B4R";
        Assert.assertEquals(reference, AssetResolver.EMPTY.resolve(reference));
        Assert.assertTrue(AssetResolver.isPlatformUrl(reference));
        Assert.assertFalse(AssetResolver.isPlatformUrl("quay.io/ubuntu"));
    }

    @Test
    public void loadTest() throws IOException {
        File file = this.folder.newFile("assets.json");
        Files.write(file.toPath(), "{ \"dx://samtools\": \"dx://project-X:record-Y\" }"
                .getBytes(StandardCharsets.UTF_8));
        AssetResolver resolver = AssetResolver.load(file.toPath());
        Assert.assertEquals("dx://project-X:record-Y", resolver.resolve("dx://samtools"));
    }

    @Test
    public void unresolvedTest() {
        try {
            AssetResolver.EMPTY.resolve("dx://samtools");
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.UnresolvedPlatformAsset, ex.kind);
        }
    }
}
