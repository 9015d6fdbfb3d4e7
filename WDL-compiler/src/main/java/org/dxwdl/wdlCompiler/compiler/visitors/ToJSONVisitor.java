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

package org.dxwdl.wdlCompiler.compiler.visitors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;
import org.dxwdl.wdlCompiler.ir.*;

import java.util.List;
import java.util.Map;

/**
 * Serializes the IR of a namespace as JSON for the code generator.
 * Stages refer to each other by name, so the result has no cycles.
 */
public class ToJSONVisitor implements
        SArg.Visitor<JsonNode>,
        InstanceType.Visitor<JsonNode>,
        DockerImage.Visitor<JsonNode>,
        AppletKind.Visitor<JsonNode>,
        IModule {
    protected final ObjectMapper topMapper;

    public ToJSONVisitor() {
        this.topMapper = new ObjectMapper();
    }

    ObjectNode tagged(String kind) {
        ObjectNode result = this.topMapper.createObjectNode();
        result.put("kind", kind);
        return result;
    }

    /////////////////// Stage arguments

    @Override
    public JsonNode visit(SArg.Const arg) {
        ObjectNode result = this.tagged("Const");
        result.put("value", arg.value.toString());
        return result;
    }

    @Override
    public JsonNode visit(SArg.WorkflowInput arg) {
        ObjectNode result = this.tagged("WorkflowInput");
        result.put("variable", arg.cVar.name);
        return result;
    }

    @Override
    public JsonNode visit(SArg.Link arg) {
        ObjectNode result = this.tagged("Link");
        result.put("stage", arg.stageName);
        result.put("variable", arg.cVar.name);
        return result;
    }

    @Override
    public JsonNode visit(SArg.Empty arg) {
        return this.tagged("Empty");
    }

    /////////////////// Instance types

    @Override
    public JsonNode visit(InstanceType.Default type) {
        return this.tagged("Default");
    }

    @Override
    public JsonNode visit(InstanceType.Const type) {
        ObjectNode result = this.tagged("Const");
        PlatformInstance instance = type.instance;
        result.put("name", instance.name);
        result.put("memoryMiB", instance.memoryMiB);
        result.put("diskGiB", instance.diskGiB);
        result.put("cpu", instance.cpu);
        return result;
    }

    @Override
    public JsonNode visit(InstanceType.Runtime type) {
        return this.tagged("Runtime");
    }

    /////////////////// Docker images

    @Override
    public JsonNode visit(DockerImage.None image) {
        return this.tagged("None");
    }

    @Override
    public JsonNode visit(DockerImage.Network image) {
        return this.tagged("Network");
    }

    @Override
    public JsonNode visit(DockerImage.PlatformAsset image) {
        ObjectNode result = this.tagged("PlatformAsset");
        result.put("reference", image.reference);
        return result;
    }

    /////////////////// Applet kinds

    @Override
    public JsonNode visit(AppletKind.Task kind) {
        return this.tagged("Task");
    }

    @Override
    public JsonNode visit(AppletKind.NativeStub kind) {
        ObjectNode result = this.tagged("NativeStub");
        result.put("id", kind.id);
        return result;
    }

    @Override
    public JsonNode visit(AppletKind.Eval kind) {
        return this.tagged("Eval");
    }

    ObjectNode block(String name, AppletKind.BlockKind kind) {
        ObjectNode result = this.tagged(name);
        ObjectNode calls = result.putObject("calls");
        for (Map.Entry<String, String> entry: kind.taskMap.entrySet())
            calls.put(entry.getKey(), entry.getValue());
        return result;
    }

    @Override
    public JsonNode visit(AppletKind.Scatter kind) {
        return this.block("Scatter", kind);
    }

    @Override
    public JsonNode visit(AppletKind.ScatterCollect kind) {
        return this.block("ScatterCollect", kind);
    }

    @Override
    public JsonNode visit(AppletKind.If kind) {
        return this.block("If", kind);
    }

    @Override
    public JsonNode visit(AppletKind.OutputReorg kind) {
        return this.tagged("OutputReorg");
    }

    /////////////////// Structures

    public ObjectNode toJson(CVar var) {
        ObjectNode result = this.topMapper.createObjectNode();
        result.put("name", var.name);
        result.put("platformName", var.getPlatformName());
        result.put("type", var.type.toString());
        if (!var.attrs.isEmpty()) {
            ObjectNode attrs = result.putObject("attributes");
            for (Map.Entry<String, String> entry: var.attrs.asMap().entrySet())
                attrs.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    ArrayNode variables(List<CVar> vars) {
        ArrayNode result = this.topMapper.createArrayNode();
        for (CVar var: vars)
            result.add(this.toJson(var));
        return result;
    }

    ArrayNode linked(List<LinkedVar> vars) {
        ArrayNode result = this.topMapper.createArrayNode();
        for (LinkedVar var: vars) {
            ObjectNode node = this.toJson(var.cVar);
            node.set("source", var.sArg.accept(this));
            result.add(node);
        }
        return result;
    }

    public ObjectNode toJson(Applet applet) {
        ObjectNode result = this.topMapper.createObjectNode();
        result.put("name", applet.name);
        result.set("inputs", this.variables(applet.inputs));
        result.set("outputs", this.variables(applet.outputs));
        result.set("instanceType", applet.instanceType.accept(this));
        result.set("docker", applet.docker.accept(this));
        result.put("destination", applet.destination);
        result.set("kind", applet.kind.accept(this));
        result.put("code", WdlPrettyPrinter.toString(applet.program));
        if (applet.sourceText != null)
            result.put("source", applet.sourceText);
        return result;
    }

    public ObjectNode toJson(Stage stage) {
        ObjectNode result = this.topMapper.createObjectNode();
        result.put("name", stage.name);
        result.put("id", stage.getStageId());
        result.put("applet", stage.callee);
        ArrayNode inputs = result.putArray("inputs");
        for (SArg arg: stage.inputs)
            inputs.add(arg.accept(this));
        result.set("outputs", this.variables(stage.outputs));
        return result;
    }

    public ObjectNode toJson(IRWorkflow workflow) {
        ObjectNode result = this.topMapper.createObjectNode();
        result.put("name", workflow.name);
        result.set("inputs", this.linked(workflow.inputs));
        result.set("outputs", this.linked(workflow.outputs));
        ArrayNode stages = result.putArray("stages");
        for (Stage stage: workflow.stages)
            stages.add(this.toJson(stage));
        return result;
    }

    public ObjectNode toJson(IRNamespace namespace) {
        ObjectNode result = this.topMapper.createObjectNode();
        ArrayNode applets = result.putArray("applets");
        for (Applet applet: namespace.applets.values())
            applets.add(this.toJson(applet));
        if (namespace.workflow != null)
            result.set("workflow", this.toJson(namespace.workflow));
        return result;
    }

    public static String irToJSON(IRNamespace namespace) {
        ToJSONVisitor visitor = new ToJSONVisitor();
        Logger.INSTANCE.from(visitor, 1)
                .append("Serializing ")
                .append(namespace.toString())
                .newline();
        return visitor.toJson(namespace).toPrettyString();
    }
}
