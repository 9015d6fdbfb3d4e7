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

import org.dxwdl.wdlCompiler.frontend.ExpressionLifter;
import org.dxwdl.wdlCompiler.frontend.ast.*;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The nesting structure of a workflow: the enclosing block of each statement,
 * and the statements that read each variable.
 */
public class WorkflowScopes {
    /**
     * Maps each statement to the block that contains it; top-level statements map to null.
     */
    final Map<WdlStatement, WdlBlockStatement> parent = new IdentityHashMap<>();
    final Map<String, List<WdlStatement>> readers = new HashMap<>();

    class Analyzer extends StatementVisitor {
        final List<WdlBlockStatement> stack = new ArrayList<>();

        Analyzer() {
            super(false);
        }

        void enter(WdlStatement statement) {
            WdlBlockStatement enclosing = this.stack.isEmpty() ? null : this.stack.get(this.stack.size() - 1);
            WorkflowScopes.this.parent.put(statement, enclosing);
        }

        void reads(WdlStatement statement, @Nullable WdlExpression expression) {
            if (expression == null)
                return;
            for (String name: ClosureAnalyzer.referencedIdentifiers(expression))
                WorkflowScopes.this.readers
                        .computeIfAbsent(name, k -> new ArrayList<>())
                        .add(statement);
        }

        @Override
        public boolean preorder(WdlDeclaration node) {
            this.enter(node);
            this.reads(node, node.expression);
            return true;
        }

        @Override
        public boolean preorder(WdlCall node) {
            this.enter(node);
            for (WdlExpression argument: node.inputs.values())
                this.reads(node, argument);
            return true;
        }

        @Override
        public boolean preorder(WdlBlockStatement node) {
            this.enter(node);
            this.reads(node, node.getControlExpression());
            this.stack.add(node);
            return true;
        }

        @Override
        public boolean preorder(WdlScatter node) {
            return this.preorder((WdlBlockStatement) node);
        }

        @Override
        public boolean preorder(WdlConditional node) {
            return this.preorder((WdlBlockStatement) node);
        }

        @Override
        public void postorder(WdlScatter node) {
            this.stack.remove(this.stack.size() - 1);
        }

        @Override
        public void postorder(WdlConditional node) {
            this.stack.remove(this.stack.size() - 1);
        }

        @Override
        public boolean preorder(WdlOutputSection node) {
            this.enter(node);
            for (WdlDeclaration output: node.outputs)
                this.reads(node, output.expression);
            return true;
        }
    }

    public WorkflowScopes(WdlWorkflow workflow) {
        Analyzer analyzer = new Analyzer();
        for (WdlStatement statement: workflow.body)
            statement.accept(analyzer);
    }

    @Nullable
    public WdlBlockStatement getParent(WdlStatement statement) {
        if (!this.parent.containsKey(statement))
            throw new IllegalArgumentException("Statement is not part of the workflow: " + statement);
        return this.parent.get(statement);
    }

    /**
     * The statements that read a variable, in source order.
     */
    public List<WdlStatement> getReaders(String name) {
        return Collections.unmodifiableList(this.readers.getOrDefault(name, Collections.emptyList()));
    }

    public static boolean isGenerated(String name) {
        return name.startsWith(ExpressionLifter.GENERATED_PREFIX);
    }

    /**
     * True if a declaration is only used within its own block.
     * Only declarations generated by the compiler are considered;
     * user declarations are always visible outside their block.
     */
    public boolean isLocal(WdlDeclaration declaration) {
        if (!isGenerated(declaration.name))
            return false;
        WdlBlockStatement scope = this.getParent(declaration);
        for (WdlStatement reader: this.getReaders(declaration.name))
            if (this.getParent(reader) != scope)
                return false;
        return true;
    }
}
