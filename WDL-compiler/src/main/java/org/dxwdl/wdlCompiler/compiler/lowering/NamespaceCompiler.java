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
import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.frontend.ast.StatementVisitor;
import org.dxwdl.wdlCompiler.frontend.ast.WdlCall;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.frontend.ast.WdlStatement;
import org.dxwdl.wdlCompiler.frontend.ast.WdlTask;
import org.dxwdl.wdlCompiler.ir.Applet;
import org.dxwdl.wdlCompiler.ir.IRNamespace;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiles a WDL namespace: all the tasks it can access, and its workflow.
 */
public class NamespaceCompiler implements IModule {
    final LoweringSession session;

    public NamespaceCompiler(LoweringSession session) {
        this.session = session;
    }

    static void addTask(Map<String, WdlTask> tasks, WdlTask task) {
        WdlTask previous = tasks.get(task.name);
        if (previous != null && previous != task)
            throw new LoweringException(LoweringException.Kind.DuplicateAppletName, task,
                    "Two different tasks are named " + task.name);
        tasks.put(task.name, task);
    }

    /**
     * The local tasks, followed by the imported tasks that the workflow calls.
     */
    static Map<String, WdlTask> accessibleTasks(WdlNamespace namespace) {
        LinkedHashMap<String, WdlTask> result = new LinkedHashMap<>();
        for (WdlTask task: namespace.tasks)
            addTask(result, task);
        if (namespace.workflow == null)
            return result;
        StatementVisitor visitor = new StatementVisitor(false) {
            @Override
            public boolean preorder(WdlCall node) {
                WdlTask task = namespace.findTask(node.qualifiedTaskName);
                if (task == null)
                    throw new LoweringException(LoweringException.Kind.UndefinedTask, node,
                            "Call to undefined task " + node.qualifiedTaskName);
                addTask(result, task);
                return true;
            }
        };
        for (WdlStatement statement: namespace.workflow.body)
            statement.accept(visitor);
        return result;
    }

    public IRNamespace compile(WdlNamespace namespace) {
        TaskCompiler taskCompiler = new TaskCompiler(this.session);
        LinkedHashMap<String, TaskCompiler.CompiledTask> compiled = new LinkedHashMap<>();
        for (WdlTask task: accessibleTasks(namespace).values())
            compiled.put(task.name, taskCompiler.compileTask(task));

        if (namespace.workflow == null) {
            LinkedHashMap<String, Applet> applets = new LinkedHashMap<>();
            for (TaskCompiler.CompiledTask task: compiled.values())
                applets.put(task.applet.name, task.applet);
            return new IRNamespace(applets, null);
        }
        WorkflowCompiler workflowCompiler = new WorkflowCompiler(this.session);
        IRNamespace result = workflowCompiler.compileWorkflow(namespace.workflow, compiled);
        Logger.INSTANCE.from(this, 1)
                .append(result.toString())
                .newline();
        return result;
    }
}
