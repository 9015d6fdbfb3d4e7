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

package org.dxwdl.wdlCompiler.ir;

import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * An independently executable unit with a fixed signature.
 * The program is a self-contained WDL namespace whose free variables
 * are exactly the applet inputs.
 */
public class Applet {
    public final String name;
    public final List<CVar> inputs;
    public final List<CVar> outputs;
    public final InstanceType instanceType;
    public final DockerImage docker;
    /**
     * Folder where the applet is placed on the platform.
     */
    public final String destination;
    public final AppletKind kind;
    public final WdlNamespace program;
    /**
     * Verbatim source of the task this applet was compiled from, if known.
     */
    @Nullable
    public final String sourceText;

    public Applet(String name, List<CVar> inputs, List<CVar> outputs,
                  InstanceType instanceType, DockerImage docker, String destination,
                  AppletKind kind, WdlNamespace program, @Nullable String sourceText) {
        this.name = name;
        this.inputs = Collections.unmodifiableList(inputs);
        this.outputs = Collections.unmodifiableList(outputs);
        this.instanceType = instanceType;
        this.docker = docker;
        this.destination = destination;
        this.kind = kind;
        this.program = program;
        this.sourceText = sourceText;
    }

    @Override
    public String toString() {
        return "Applet " + this.name + "(" + this.inputs + ") -> " + this.outputs + " " + this.kind;
    }
}
