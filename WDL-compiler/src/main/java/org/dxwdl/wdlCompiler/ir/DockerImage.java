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
 * The container image an applet requires.
 */
public abstract class DockerImage implements ICastable {
    public interface Visitor<T> {
        T visit(None image);
        T visit(Network image);
        T visit(PlatformAsset image);
    }

    private DockerImage() {}

    public abstract <T> T accept(Visitor<T> visitor);

    public static final class None extends DockerImage {
        public static final None INSTANCE = new None();

        private None() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    /**
     * Image downloaded from the network when the applet starts.
     */
    public static final class Network extends DockerImage {
        public static final Network INSTANCE = new Network();

        private Network() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Network";
        }
    }

    /**
     * Image stored on the platform as an asset.
     */
    public static final class PlatformAsset extends DockerImage {
        /**
         * Resolved reference, dx://project-xxxx:record-yyyy.
         */
        public final String reference;

        public PlatformAsset(String reference) {
            this.reference = reference;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "PlatformAsset(" + this.reference + ")";
        }
    }
}
