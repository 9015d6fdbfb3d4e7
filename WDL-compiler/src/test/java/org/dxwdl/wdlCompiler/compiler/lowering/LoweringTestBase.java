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

import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.ir.CVar;
import org.dxwdl.wdlCompiler.ir.IRNamespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the lowering tests.
 */
public abstract class LoweringTestBase {
    static final String ADD_TASK = "task Add {\n" +
            "    Int a\n" +
            "    Int b\n" +
            "    command {\n" +
            "        echo $((${a} + ${b}))\n" +
            "    }\n" +
            "    output {\n" +
            "        Int result = read_int(stdout())\n" +
            "    }\n" +
            "}\n";

    static final String INC_TASK = "task Inc {\n" +
            "    Int i\n" +
            "    command {\n" +
            "        echo $((${i} + 1))\n" +
            "    }\n" +
            "    output {\n" +
            "        Int out = read_int(stdout())\n" +
            "    }\n" +
            "}\n";

    public static WdlNamespace parse(String program) {
        WdlFrontend frontend = new WdlFrontend();
        return frontend.parse(program);
    }

    public static IRNamespace lower(String program, LoweringSession session) {
        WdlNamespace namespace = parse(program);
        NamespaceCompiler compiler = new NamespaceCompiler(session);
        return compiler.compile(namespace);
    }

    public static IRNamespace lower(String program) {
        return lower(program, LoweringSession.createDefault());
    }

    public static List<String> names(List<CVar> vars) {
        List<String> result = new ArrayList<>();
        for (CVar var: vars)
            result.add(var.name);
        return result;
    }
}
