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

package org.dxwdl.wdlCompiler.frontend.ast;

public class WdlPrimitiveType extends WdlType {
    public enum Kind {
        Int,
        Float,
        Boolean,
        String,
        File,
        Object
    }

    public final Kind kind;

    public static final WdlPrimitiveType INT = new WdlPrimitiveType(Kind.Int);
    public static final WdlPrimitiveType FLOAT = new WdlPrimitiveType(Kind.Float);
    public static final WdlPrimitiveType BOOLEAN = new WdlPrimitiveType(Kind.Boolean);
    public static final WdlPrimitiveType STRING = new WdlPrimitiveType(Kind.String);
    public static final WdlPrimitiveType FILE = new WdlPrimitiveType(Kind.File);
    public static final WdlPrimitiveType OBJECT = new WdlPrimitiveType(Kind.Object);

    private WdlPrimitiveType(Kind kind) {
        this.kind = kind;
    }

    public static WdlPrimitiveType get(Kind kind) {
        switch (kind) {
            case Int:
                return INT;
            case Float:
                return FLOAT;
            case Boolean:
                return BOOLEAN;
            case String:
                return STRING;
            case File:
                return FILE;
            case Object:
                return OBJECT;
        }
        throw new IllegalArgumentException("Unexpected kind " + kind);
    }

    @Override
    public String toString() {
        return this.kind.name();
    }
}
