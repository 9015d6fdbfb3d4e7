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
import org.dxwdl.wdlCompiler.compiler.errors.WdlSyntaxException;
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.ir.CVar;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the program generated for an applet is self-contained:
 * it must print to valid WDL, parse back, and have no free variables.
 */
public class ProgramValidator implements IModule {
    final WdlFrontend frontend;

    public ProgramValidator() {
        this.frontend = new WdlFrontend();
    }

    /**
     * Collects the names declared anywhere in a workflow.
     * Draft-2 WDL makes the declarations of nested blocks visible in the enclosing scopes.
     */
    static class DeclaredNames extends StatementVisitor {
        final Set<String> names = new HashSet<>();

        DeclaredNames() {
            super(false);
        }

        @Override
        public boolean preorder(WdlDeclaration node) {
            this.names.add(node.name);
            return true;
        }

        @Override
        public boolean preorder(WdlCall node) {
            this.names.add(node.getUnqualifiedName());
            return true;
        }

        @Override
        public boolean preorder(WdlScatter node) {
            this.names.add(node.variable);
            return true;
        }

        @Override
        public boolean preorder(WdlOutputSection node) {
            for (WdlDeclaration output: node.outputs)
                this.names.add(output.name);
            return true;
        }
    }

    /**
     * Collects the declarations without an expression, at any depth.
     * These are the values the program expects to receive.
     */
    static class UnassignedNames extends StatementVisitor {
        final Set<String> names = new TreeSet<>();

        UnassignedNames() {
            super(false);
        }

        @Override
        public boolean preorder(WdlDeclaration node) {
            if (node.expression == null)
                this.names.add(node.name);
            return true;
        }

        @Override
        public boolean preorder(WdlOutputSection node) {
            return false;
        }
    }

    /**
     * Checks all the expressions of a workflow against a set of declared names,
     * and all the calls against the tasks of the namespace.
     */
    class FreeVariableChecker extends StatementVisitor {
        final WdlNamespace namespace;
        final Set<String> declared;
        final String appletName;

        FreeVariableChecker(WdlNamespace namespace, Set<String> declared, String appletName) {
            super(false);
            this.namespace = namespace;
            this.declared = declared;
            this.appletName = appletName;
        }

        void check(WdlExpression expression) {
            ProgramValidator.this.checkExpression(expression, this.declared, this.appletName);
        }

        @Override
        public boolean preorder(WdlDeclaration node) {
            if (node.expression != null)
                this.check(node.expression);
            return true;
        }

        @Override
        public boolean preorder(WdlCall node) {
            WdlTask task = this.namespace.findTask(node.qualifiedTaskName);
            if (task == null)
                throw ProgramValidator.this.invalid(this.appletName,
                        "calls undefined task " + node.qualifiedTaskName);
            for (Map.Entry<String, WdlExpression> input: node.inputs.entrySet()) {
                boolean found = false;
                for (WdlDeclaration decl: task.declarations)
                    if (decl.name.equals(input.getKey())) {
                        found = true;
                        break;
                    }
                if (!found)
                    throw ProgramValidator.this.invalid(this.appletName,
                            "task " + task.name + " has no input " + input.getKey());
                this.check(input.getValue());
            }
            return true;
        }

        @Override
        public boolean preorder(WdlBlockStatement node) {
            this.check(node.getControlExpression());
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
        public boolean preorder(WdlOutputSection node) {
            for (WdlDeclaration output: node.outputs)
                this.preorder(output);
            return false;
        }
    }

    LoweringException invalid(String appletName, String message) {
        return new LoweringException(LoweringException.Kind.GeneratedProgramInvalid,
                "Program generated for applet " + appletName + " " + message);
    }

    void checkExpression(WdlExpression expression, Set<String> declared, String appletName) {
        for (String name: ClosureAnalyzer.referencedIdentifiers(expression))
            if (!declared.contains(name))
                throw this.invalid(appletName, "has a free variable " + name + " in " + expression);
    }

    void checkTask(WdlTask task, String appletName) {
        Set<String> declared = new HashSet<>();
        for (WdlDeclaration decl: task.declarations)
            declared.add(decl.name);
        for (WdlDeclaration output: task.outputs)
            declared.add(output.name);
        for (WdlDeclaration decl: task.declarations)
            if (decl.expression != null)
                this.checkExpression(decl.expression, declared, appletName);
        for (WdlDeclaration output: task.outputs)
            if (output.expression != null)
                this.checkExpression(output.expression, declared, appletName);
        for (WdlExpression expression: task.runtime.values())
            this.checkExpression(expression, declared, appletName);
    }

    void checkWorkflow(WdlNamespace namespace, WdlWorkflow workflow, String appletName) {
        DeclaredNames names = new DeclaredNames();
        for (WdlStatement statement: workflow.body)
            statement.accept(names);
        FreeVariableChecker checker = new FreeVariableChecker(namespace, names.names, appletName);
        for (WdlStatement statement: workflow.body)
            statement.accept(checker);
    }

    /**
     * Every unassigned declaration of the workflow must be an applet input,
     * and every applet input must be declared without a value.
     */
    void checkInputs(WdlWorkflow workflow, List<CVar> inputs, String appletName) {
        UnassignedNames unassigned = new UnassignedNames();
        for (WdlStatement statement: workflow.body)
            statement.accept(unassigned);
        Set<String> expected = new TreeSet<>();
        for (CVar input: inputs)
            expected.add(input.getPlatformName());
        if (!unassigned.names.equals(expected))
            throw this.invalid(appletName, "expects the values " + unassigned.names +
                    " but the applet inputs are " + expected);
    }

    /**
     * Validate the program of a task applet.
     * @throws LoweringException GeneratedProgramInvalid if the program is not self-contained.
     */
    public void validate(WdlNamespace program, String appletName) {
        this.validate(program, appletName, null);
    }

    /**
     * Validate the program of an applet.
     * @param inputs  Inputs of the applet.  When supplied, the unassigned declarations
     *                of the workflow must be exactly these inputs.
     * @throws LoweringException GeneratedProgramInvalid if the program is not self-contained.
     */
    public void validate(WdlNamespace program, String appletName, @Nullable List<CVar> inputs) {
        String text = WdlPrettyPrinter.toString(program);
        Logger.INSTANCE.from(this, 2)
                .append("Program for applet ")
                .append(appletName)
                .newline()
                .append(text)
                .newline();
        WdlNamespace reparsed;
        try {
            reparsed = this.frontend.parse(text);
        } catch (WdlSyntaxException ex) {
            throw new LoweringException(LoweringException.Kind.GeneratedProgramInvalid,
                    "Program generated for applet " + appletName + " does not parse: " +
                            ex.getMessage() + "\n" + text, ex);
        }
        for (WdlTask task: reparsed.tasks)
            this.checkTask(task, appletName);
        if (reparsed.workflow != null) {
            this.checkWorkflow(reparsed, reparsed.workflow, appletName);
            if (inputs != null)
                this.checkInputs(reparsed.workflow, inputs, appletName);
        }
    }
}
