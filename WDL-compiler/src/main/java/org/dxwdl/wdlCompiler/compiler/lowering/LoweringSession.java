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

import org.dxwdl.util.NameGen;
import org.dxwdl.wdlCompiler.frontend.values.ConstantEvaluator;
import org.dxwdl.wdlCompiler.frontend.values.ExpressionEvaluator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * State shared by all the lowering steps of one compilation.
 * Sessions are independent; each one numbers its stages starting from 0.
 */
public class LoweringSession {
    /**
     * Folder where the applets are placed on the platform.
     */
    public final String destination;
    /**
     * If true, add an applet that reorganizes the workflow outputs.
     */
    public final boolean reorg;
    public final ExpressionEvaluator evaluator;
    public final InstanceTypeDB instanceTypes;
    public final AssetResolver assets;
    public final ProgramValidator validator;
    /**
     * Verbatim source of the tasks, indexed by task name.
     */
    public final Map<String, String> taskSources;
    private final NameGen stageIds;

    public LoweringSession(String destination, boolean reorg, ExpressionEvaluator evaluator,
                           InstanceTypeDB instanceTypes, AssetResolver assets,
                           Map<String, String> taskSources) {
        this.destination = destination;
        this.reorg = reorg;
        this.evaluator = evaluator;
        this.instanceTypes = instanceTypes;
        this.assets = assets;
        this.validator = new ProgramValidator();
        this.taskSources = Collections.unmodifiableMap(new HashMap<>(taskSources));
        this.stageIds = new NameGen("stage_");
    }

    /**
     * A session with the default services, placing applets in the root folder.
     */
    public static LoweringSession createDefault() {
        return new LoweringSession("/", false, new ConstantEvaluator(),
                InstanceTypeDB.builtIn(), AssetResolver.EMPTY, Collections.emptyMap());
    }

    public LoweringSession withReorg(boolean reorg) {
        return new LoweringSession(this.destination, reorg, this.evaluator,
                this.instanceTypes, this.assets, this.taskSources);
    }

    public int nextStageId() {
        return this.stageIds.nextId();
    }
}
