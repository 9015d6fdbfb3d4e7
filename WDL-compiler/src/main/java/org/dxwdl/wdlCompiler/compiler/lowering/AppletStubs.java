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

import org.dxwdl.wdlCompiler.frontend.ast.WdlDeclaration;
import org.dxwdl.wdlCompiler.frontend.ast.WdlTask;
import org.dxwdl.wdlCompiler.ir.Applet;
import org.dxwdl.wdlCompiler.ir.CVar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Task definitions that only carry the signature of an applet.
 * They allow a generated program to call applets that are compiled separately.
 */
public class AppletStubs {
    private AppletStubs() {}

    public static WdlTask stub(Applet applet) {
        List<WdlDeclaration> inputs = new ArrayList<>();
        for (CVar input: applet.inputs)
            inputs.add(new WdlDeclaration(input.type, input.name, null));
        List<WdlDeclaration> outputs = new ArrayList<>();
        for (CVar output: applet.outputs)
            outputs.add(new WdlDeclaration(output.type, output.name, null));
        return new WdlTask(null, applet.name, inputs, null, outputs,
                new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }
}
