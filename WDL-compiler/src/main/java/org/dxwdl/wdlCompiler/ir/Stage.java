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

import java.util.Collections;
import java.util.List;

/**
 * An invocation of an applet inside a workflow.
 */
public class Stage {
    public final String name;
    public final int id;
    /**
     * Name of the applet invoked.
     */
    public final String callee;
    /**
     * Actual arguments, matched by position with the callee inputs.
     */
    public final List<SArg> inputs;
    public final List<CVar> outputs;

    public Stage(String name, int id, String callee, List<SArg> inputs, List<CVar> outputs) {
        this.name = name;
        this.id = id;
        this.callee = callee;
        this.inputs = Collections.unmodifiableList(inputs);
        this.outputs = Collections.unmodifiableList(outputs);
    }

    /**
     * The stage id as used on the platform.
     */
    public String getStageId() {
        return "stage_" + this.id;
    }

    @Override
    public String toString() {
        return "Stage " + this.name + "(" + this.getStageId() + ") = " + this.callee + this.inputs;
    }
}
