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

import org.dxwdl.wdlCompiler.frontend.ast.WdlNode;
import org.dxwdl.wdlCompiler.frontend.ast.WdlType;

import javax.annotation.Nullable;

/**
 * A compiled variable: a named, typed slot on the boundary of an applet or stage.
 */
public class CVar {
    public final String name;
    public final WdlType type;
    public final DeclAttrs attrs;
    /**
     * Source node this variable originates from; only used for diagnostics.
     */
    @Nullable
    public final WdlNode provenance;

    public CVar(String name, WdlType type, DeclAttrs attrs, @Nullable WdlNode provenance) {
        this.name = name;
        this.type = type;
        this.attrs = attrs;
        this.provenance = provenance;
    }

    public CVar(String name, WdlType type) {
        this(name, type, DeclAttrs.EMPTY, null);
    }

    /**
     * The name used on the platform, where dots are not legal: A.x becomes A_x.
     */
    public String getPlatformName() {
        return this.name.replace('.', '_');
    }

    public CVar withType(WdlType type) {
        return new CVar(this.name, type, this.attrs, this.provenance);
    }

    public CVar withName(String name) {
        return new CVar(name, this.type, this.attrs, this.provenance);
    }

    @Override
    public String toString() {
        return this.type + " " + this.name;
    }
}
