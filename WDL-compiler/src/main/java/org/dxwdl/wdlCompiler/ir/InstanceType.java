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

import org.dxwdl.util.ICastable;

/**
 * The compute instance an applet runs on.
 */
public abstract class InstanceType implements ICastable {
    public interface Visitor<T> {
        T visit(Default type);
        T visit(Const type);
        T visit(Runtime type);
    }

    private InstanceType() {}

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * The platform default instance.
     */
    public static final class Default extends InstanceType {
        public static final Default INSTANCE = new Default();

        private Default() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Default";
        }
    }

    /**
     * An instance chosen at compile time.
     */
    public static final class Const extends InstanceType {
        public final PlatformInstance instance;

        public Const(PlatformInstance instance) {
            this.instance = instance;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Const(" + this.instance.name + ")";
        }
    }

    /**
     * The instance can only be chosen when the applet executes.
     */
    public static final class Runtime extends InstanceType {
        public static final Runtime INSTANCE = new Runtime();

        private Runtime() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Runtime";
        }
    }
}
