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

import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed WDL document: imports, tasks, and at most one workflow.
 */
public class WdlNamespace extends WdlNode {
    public final List<WdlImport> imports;
    public final List<WdlTask> tasks;
    @Nullable
    public final WdlWorkflow workflow;
    /**
     * Imported namespaces, indexed by namespace name.
     * Empty until imports have been resolved.
     */
    public final Map<String, WdlNamespace> importedNamespaces;

    public WdlNamespace(@Nullable SourcePositionRange position, List<WdlImport> imports,
                        List<WdlTask> tasks, @Nullable WdlWorkflow workflow,
                        LinkedHashMap<String, WdlNamespace> importedNamespaces) {
        super(position);
        this.imports = Collections.unmodifiableList(imports);
        this.tasks = Collections.unmodifiableList(tasks);
        this.workflow = workflow;
        this.importedNamespaces = Collections.unmodifiableMap(importedNamespaces);
    }

    public WdlNamespace(List<WdlTask> tasks, @Nullable WdlWorkflow workflow) {
        this(null, Collections.emptyList(), tasks, workflow, new LinkedHashMap<>());
    }

    public WdlNamespace withImportedNamespaces(LinkedHashMap<String, WdlNamespace> importedNamespaces) {
        return new WdlNamespace(this.getPositionOrNull(), this.imports, this.tasks,
                this.workflow, importedNamespaces);
    }

    public WdlNamespace withWorkflow(@Nullable WdlWorkflow workflow) {
        return new WdlNamespace(this.getPositionOrNull(), this.imports, this.tasks,
                workflow, new LinkedHashMap<>(this.importedNamespaces));
    }

    /**
     * Find a task by its possibly qualified name, e.g., 'Add' or 'lib.Add'.
     * Returns null if the task does not exist.
     */
    @Nullable
    public WdlTask findTask(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            for (WdlTask task: this.tasks)
                if (task.name.equals(qualifiedName))
                    return task;
            return null;
        }
        String namespace = qualifiedName.substring(0, dot);
        WdlNamespace imported = this.importedNamespaces.get(namespace);
        if (imported == null)
            return null;
        return imported.findTask(qualifiedName.substring(dot + 1));
    }
}
