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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an applet does.
 */
public abstract class AppletKind implements ICastable {
    public interface Visitor<T> {
        T visit(Task kind);
        T visit(NativeStub kind);
        T visit(Eval kind);
        T visit(Scatter kind);
        T visit(ScatterCollect kind);
        T visit(If kind);
        T visit(OutputReorg kind);
    }

    private AppletKind() {}

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * A WDL task.
     */
    public static final class Task extends AppletKind {
        public static final Task INSTANCE = new Task();

        private Task() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Task";
        }
    }

    /**
     * A signature for an executable that already exists on the platform.
     */
    public static final class NativeStub extends AppletKind {
        public final String id;

        public NativeStub(String id) {
            this.id = id;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "NativeStub(" + this.id + ")";
        }
    }

    /**
     * Evaluates a run of declarations.
     */
    public static final class Eval extends AppletKind {
        public static final Eval INSTANCE = new Eval();

        private Eval() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "Eval";
        }
    }

    /**
     * Base class for the kinds that run a block with calls.
     */
    public abstract static class BlockKind extends AppletKind {
        /**
         * Maps each call in the block to the task it calls.
         */
        public final Map<String, String> taskMap;

        BlockKind(Map<String, String> taskMap) {
            this.taskMap = Collections.unmodifiableMap(new LinkedHashMap<>(taskMap));
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName() + this.taskMap;
        }
    }

    public static final class Scatter extends BlockKind {
        public Scatter(Map<String, String> taskMap) {
            super(taskMap);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A scatter whose outputs need an additional step to be collected.
     */
    public static final class ScatterCollect extends BlockKind {
        public ScatterCollect(Map<String, String> taskMap) {
            super(taskMap);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class If extends BlockKind {
        public If(Map<String, String> taskMap) {
            super(taskMap);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Moves the intermediate results of a workflow; its outputs echo its inputs.
     */
    public static final class OutputReorg extends AppletKind {
        public static final OutputReorg INSTANCE = new OutputReorg();

        private OutputReorg() {}

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "OutputReorg";
        }
    }
}
