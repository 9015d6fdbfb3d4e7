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

import java.util.HashMap;
import java.util.Map;

public class TypeInferenceTests {
    static String infer(String expression) {
        Map<String, WdlType> variables = new HashMap<>();
        variables.put("n", WdlPrimitiveType.INT);
        variables.put("files", new WdlArrayType(WdlPrimitiveType.FILE));
        variables.put("p", new WdlPairType(WdlPrimitiveType.STRING, WdlPrimitiveType.FLOAT));
        variables.put("A.out", WdlPrimitiveType.INT.makeOptional());
        WdlType type = new TypeInference(variables).infer(WdlFrontend.parseExpression(expression));
        return type == null ? null : type.toString();
    }

    @Test
    public void inferTest() {
        Assert.assertEquals("Int", infer("n + 1"));
        Assert.assertEquals("Float", infer("n * 1.5"));
        Assert.assertEquals("String", infer("\"a\" + n"));
        Assert.assertEquals("Boolean", infer("n > 2"));
        Assert.assertEquals("Array[Int]", infer("range(n)"));
        Assert.assertEquals("File", infer("files[0]"));
        Assert.assertEquals("Float", infer("p.right"));
        Assert.assertEquals("Int?", infer("A.out"));
        Assert.assertEquals("Int", infer("select_first([A.out, 1])"));
        Assert.assertEquals("Pair[Int, String]", infer("(1, \"a\")"));
        Assert.assertNull(infer("unknown"));
        Assert.assertNull(infer("[]"));
    }
}
