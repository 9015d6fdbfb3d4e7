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
import org.dxwdl.wdlCompiler.frontend.values.WdlValue;

/**
 * The source of the value of a stage argument.
 * The set of variants is closed; use a Visitor to dispatch on them.
 */
public abstract class SArg implements ICastable {
    public interface Visitor<T> {
        T visit(Const arg);
        T visit(WorkflowInput arg);
        T visit(Link arg);
        T visit(Empty arg);
    }

    private SArg() {}

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * A compile-time constant.
     */
    public static final class Const extends SArg {
        public final WdlValue value;

        public Const(WdlValue value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Const(" + this.value + ")";
        }
    }

    /**
     * An input supplied to the workflow when it is launched.
     */
    public static final class WorkflowInput extends SArg {
        public final CVar cVar;

        public WorkflowInput(CVar cVar) {
            this.cVar = cVar;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "WorkflowInput(" + this.cVar.name + ")";
        }
    }

    /**
     * An output of a stage that executes earlier.
     */
    public static final class Link extends SArg {
        public final String stageName;
        public final CVar cVar;

        public Link(String stageName, CVar cVar) {
            this.stageName = stageName;
            this.cVar = cVar;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Link(" + this.stageName + "." + this.cVar.name + ")";
        }
    }

    /**
     * An optional argument that is intentionally left unbound.
     */
    public static final class Empty extends SArg {
        public static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }
}
