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

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.frontend.ast.WdlDeclaration;
import org.dxwdl.wdlCompiler.frontend.ast.WdlExpression;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.frontend.ast.WdlStringLiteral;
import org.dxwdl.wdlCompiler.frontend.ast.WdlTask;
import org.dxwdl.wdlCompiler.frontend.values.EvaluationException;
import org.dxwdl.wdlCompiler.frontend.values.WdlStringValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlValue;
import org.dxwdl.wdlCompiler.ir.*;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Compiles a WDL task into an applet.
 */
public class TaskCompiler implements IModule {
    static final String MEMORY = "memory";
    static final String DISKS = "disks";
    static final String CPU = "cpu";
    static final String INSTANCE_TYPE = "dx_instance_type";
    static final String DOCKER = "docker";

    final LoweringSession session;

    public TaskCompiler(LoweringSession session) {
        this.session = session;
    }

    /**
     * A compiled task: the applet, and its outputs.
     */
    public static class CompiledTask {
        public final Applet applet;
        public final List<CVar> outputs;

        public CompiledTask(Applet applet) {
            this.applet = applet;
            this.outputs = applet.outputs;
        }
    }

    /**
     * Evaluate an expression at compile time.
     * @return null if the expression is not a constant.
     */
    @Nullable
    WdlValue tryEvaluate(WdlExpression expression) {
        try {
            return this.session.evaluator.evaluateConstant(expression);
        } catch (EvaluationException ex) {
            Logger.INSTANCE.from(this, 2)
                    .append("Not a constant: ")
                    .append(expression.toString())
                    .append(" (")
                    .append(ex.getMessage())
                    .append(")")
                    .newline();
            return null;
        }
    }

    DeclAttrs inputAttributes(WdlTask task, WdlDeclaration decl) {
        DeclAttrs attrs = DeclAttrs.EMPTY;
        String meta = task.getParameterMetaString(decl.name);
        if (meta != null) {
            if (meta.equals("stream"))
                attrs = attrs.with(DeclAttrs.STREAM, "true");
            else
                attrs = attrs.with(DeclAttrs.HELP, meta);
        }
        if (decl.expression != null && decl.type.isOptional()) {
            WdlValue value = this.tryEvaluate(decl.expression);
            if (value != null)
                attrs = attrs.with(DeclAttrs.DEFAULT, value.toString());
        }
        return attrs;
    }

    InstanceType instanceType(WdlTask task) {
        boolean hasAttributes = false;
        for (String attribute: new String[] { MEMORY, DISKS, CPU, INSTANCE_TYPE })
            hasAttributes = hasAttributes || task.runtime.containsKey(attribute);
        if (!hasAttributes)
            return InstanceType.Default.INSTANCE;

        WdlValue[] values = new WdlValue[4];
        String[] attributes = new String[] { INSTANCE_TYPE, MEMORY, DISKS, CPU };
        for (int i = 0; i < attributes.length; i++) {
            WdlExpression expression = task.runtime.get(attributes[i]);
            if (expression == null)
                continue;
            values[i] = this.tryEvaluate(expression);
            if (values[i] == null)
                // Depends on the task inputs
                return InstanceType.Runtime.INSTANCE;
        }
        PlatformInstance instance = this.session.instanceTypes.choose(values[0], values[1], values[2], values[3]);
        return new InstanceType.Const(instance);
    }

    /**
     * Determine the docker image of a task.  Platform assets are resolved,
     * and the runtime section of the task is rewritten to refer to the resolved asset.
     */
    DockerImage docker(WdlTask task, LinkedHashMap<String, WdlExpression> runtime) {
        WdlExpression expression = task.runtime.get(DOCKER);
        if (expression == null)
            return DockerImage.None.INSTANCE;
        WdlValue value = this.tryEvaluate(expression);
        if (value != null && value.is(WdlStringValue.class)) {
            String url = value.to(WdlStringValue.class).value;
            if (AssetResolver.isPlatformUrl(url)) {
                String reference = this.session.assets.resolve(url);
                runtime.put(DOCKER, new WdlStringLiteral(reference));
                return new DockerImage.PlatformAsset(reference);
            }
        }
        return DockerImage.Network.INSTANCE;
    }

    AppletKind kind(WdlTask task) {
        String type = task.getMetaString("type");
        String id = task.getMetaString("id");
        if ("native".equals(type) && id != null)
            return new AppletKind.NativeStub(id);
        return AppletKind.Task.INSTANCE;
    }

    public CompiledTask compileTask(WdlTask task) {
        Logger.INSTANCE.from(this, 1)
                .append("Compiling task ")
                .append(task.name)
                .newline();

        List<CVar> inputs = new ArrayList<>();
        for (WdlDeclaration decl: task.declarations) {
            if (!decl.isInput())
                continue;
            inputs.add(new CVar(decl.name, decl.type, this.inputAttributes(task, decl), decl));
        }
        List<CVar> outputs = new ArrayList<>();
        for (WdlDeclaration decl: task.outputs)
            outputs.add(new CVar(decl.name, decl.type, DeclAttrs.EMPTY, decl));

        InstanceType instanceType = this.instanceType(task);
        LinkedHashMap<String, WdlExpression> runtime = new LinkedHashMap<>(task.runtime);
        DockerImage docker = this.docker(task, runtime);
        AppletKind kind = this.kind(task);

        WdlTask cleaned = task.withRuntime(runtime);
        WdlNamespace program = new WdlNamespace(Collections.singletonList(cleaned), null);
        this.session.validator.validate(program, task.name);

        Applet applet = new Applet(task.name, inputs, outputs, instanceType, docker,
                this.session.destination, kind, program, this.session.taskSources.get(task.name));
        Logger.INSTANCE.from(this, 1)
                .append(applet.toString())
                .newline();
        return new CompiledTask(applet);
    }
}
