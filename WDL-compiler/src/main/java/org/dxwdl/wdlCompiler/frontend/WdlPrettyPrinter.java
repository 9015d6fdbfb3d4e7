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

package org.dxwdl.wdlCompiler.frontend;

import org.apache.commons.text.StringEscapeUtils;
import org.dxwdl.util.IndentStream;
import org.dxwdl.wdlCompiler.frontend.ast.*;

import java.util.List;
import java.util.Map;

/**
 * Prints WDL syntax trees as canonical WDL source.
 * The output of the printer can be parsed back by the WdlFrontend.
 * Expressions are printed with the minimum number of parentheses.
 */
public class WdlPrettyPrinter extends ExpressionVisitor {
    private final IndentStream builder;

    static final int IF_PRECEDENCE = 0;
    static final int UNARY_PRECEDENCE = 7;
    static final int POSTFIX_PRECEDENCE = 8;
    static final int PRIMARY_PRECEDENCE = 9;

    public WdlPrettyPrinter(IndentStream builder) {
        super(false);
        this.builder = builder;
    }

    public static String toString(WdlExpression expression) {
        StringBuilder result = new StringBuilder();
        WdlPrettyPrinter printer = new WdlPrettyPrinter(new IndentStream(result));
        expression.accept(printer);
        return result.toString();
    }

    public static String toString(WdlStatement statement) {
        StringBuilder result = new StringBuilder();
        WdlPrettyPrinter printer = new WdlPrettyPrinter(new IndentStream(result));
        printer.print(statement);
        return result.toString();
    }

    public static String toString(WdlTask task) {
        StringBuilder result = new StringBuilder();
        WdlPrettyPrinter printer = new WdlPrettyPrinter(new IndentStream(result));
        printer.print(task);
        return result.toString();
    }

    public static String toString(WdlNamespace namespace) {
        StringBuilder result = new StringBuilder();
        WdlPrettyPrinter printer = new WdlPrettyPrinter(new IndentStream(result));
        printer.print(namespace);
        return result.toString();
    }

    static int precedence(String binaryOperation) {
        switch (binaryOperation) {
            case "||":
                return 1;
            case "&&":
                return 2;
            case "==":
            case "!=":
                return 3;
            case "<":
            case "<=":
            case ">":
            case ">=":
                return 4;
            case "+":
            case "-":
                return 5;
            case "*":
            case "/":
            case "%":
                return 6;
            default:
                throw new IllegalArgumentException("Unknown binary operation " + binaryOperation);
        }
    }

    static int precedence(WdlExpression expression) {
        if (expression.is(WdlBinaryExpression.class))
            return precedence(expression.to(WdlBinaryExpression.class).operation);
        if (expression.is(WdlIfThenElse.class))
            return IF_PRECEDENCE;
        if (expression.is(WdlUnaryExpression.class))
            return UNARY_PRECEDENCE;
        if (expression.is(WdlMemberAccess.class) || expression.is(WdlIndexExpression.class))
            return POSTFIX_PRECEDENCE;
        // Negative literals print with a leading minus
        if (expression.is(WdlIntLiteral.class) && expression.to(WdlIntLiteral.class).value < 0)
            return UNARY_PRECEDENCE;
        if (expression.is(WdlFloatLiteral.class) && expression.to(WdlFloatLiteral.class).value < 0)
            return UNARY_PRECEDENCE;
        return PRIMARY_PRECEDENCE;
    }

    /**
     * Print an operand, in parentheses if it binds less tightly than 'minimum'.
     */
    void operand(WdlExpression expression, int minimum) {
        boolean parens = precedence(expression) < minimum;
        if (parens)
            this.builder.append("(");
        expression.accept(this);
        if (parens)
            this.builder.append(")");
    }

    void list(List<WdlExpression> expressions) {
        boolean first = true;
        for (WdlExpression e: expressions) {
            if (!first)
                this.builder.append(", ");
            first = false;
            e.accept(this);
        }
    }

    /////////////////// Expressions

    @Override
    public boolean preorder(WdlIdentifier expression) {
        this.builder.append(expression.name);
        return false;
    }

    @Override
    public boolean preorder(WdlMemberAccess expression) {
        this.operand(expression.lhs, POSTFIX_PRECEDENCE);
        this.builder.append(".").append(expression.member);
        return false;
    }

    @Override
    public boolean preorder(WdlIntLiteral expression) {
        this.builder.append(expression.value);
        return false;
    }

    @Override
    public boolean preorder(WdlFloatLiteral expression) {
        this.builder.append(Double.toString(expression.value));
        return false;
    }

    @Override
    public boolean preorder(WdlBoolLiteral expression) {
        this.builder.append(expression.value);
        return false;
    }

    @Override
    public boolean preorder(WdlStringLiteral expression) {
        this.builder.append("\"");
        for (int i = 0; i < expression.fragments.size(); i++) {
            this.builder.append(StringEscapeUtils.escapeJava(expression.fragments.get(i)));
            if (i < expression.placeholders.size()) {
                this.builder.append("${");
                expression.placeholders.get(i).accept(this);
                this.builder.append("}");
            }
        }
        this.builder.append("\"");
        return false;
    }

    @Override
    public boolean preorder(WdlUnaryExpression expression) {
        this.builder.append(expression.operation);
        this.operand(expression.operand, UNARY_PRECEDENCE);
        return false;
    }

    @Override
    public boolean preorder(WdlBinaryExpression expression) {
        int precedence = precedence(expression.operation);
        // All binary operators are left-associative.
        this.operand(expression.left, precedence);
        this.builder.append(" ").append(expression.operation).append(" ");
        this.operand(expression.right, precedence + 1);
        return false;
    }

    @Override
    public boolean preorder(WdlApplyExpression expression) {
        this.builder.append(expression.function).append("(");
        this.list(expression.arguments);
        this.builder.append(")");
        return false;
    }

    @Override
    public boolean preorder(WdlIndexExpression expression) {
        this.operand(expression.collection, POSTFIX_PRECEDENCE);
        this.builder.append("[");
        expression.index.accept(this);
        this.builder.append("]");
        return false;
    }

    @Override
    public boolean preorder(WdlArrayLiteral expression) {
        this.builder.append("[");
        this.list(expression.elements);
        this.builder.append("]");
        return false;
    }

    @Override
    public boolean preorder(WdlMapLiteral expression) {
        this.builder.append("{");
        for (int i = 0; i < expression.keys.size(); i++) {
            if (i > 0)
                this.builder.append(", ");
            expression.keys.get(i).accept(this);
            this.builder.append(": ");
            expression.values.get(i).accept(this);
        }
        this.builder.append("}");
        return false;
    }

    @Override
    public boolean preorder(WdlPairLiteral expression) {
        this.builder.append("(");
        expression.left.accept(this);
        this.builder.append(", ");
        expression.right.accept(this);
        this.builder.append(")");
        return false;
    }

    @Override
    public boolean preorder(WdlIfThenElse expression) {
        this.builder.append("if ");
        expression.condition.accept(this);
        this.builder.append(" then ");
        expression.positive.accept(this);
        this.builder.append(" else ");
        expression.negative.accept(this);
        return false;
    }

    /////////////////// Statements

    public void print(WdlDeclaration declaration) {
        this.builder.append(declaration.type.toString())
                .append(" ")
                .append(declaration.name);
        if (declaration.expression != null) {
            this.builder.append(" = ");
            declaration.expression.accept(this);
        }
        this.builder.newline();
    }

    public void print(WdlCall call) {
        this.builder.append("call ").append(call.qualifiedTaskName);
        if (call.alias != null)
            this.builder.append(" as ").append(call.alias);
        if (!call.inputs.isEmpty()) {
            this.builder.append(" {").increase()
                    .append("input:").increase();
            boolean first = true;
            for (Map.Entry<String, WdlExpression> input: call.inputs.entrySet()) {
                if (!first)
                    this.builder.append(",").newline();
                first = false;
                this.builder.append(input.getKey()).append(" = ");
                input.getValue().accept(this);
            }
            this.builder.decrease().newline()
                    .decrease().append("}");
        }
        this.builder.newline();
    }

    void body(List<WdlStatement> body) {
        this.builder.append(" {").increase();
        for (WdlStatement statement: body)
            this.print(statement);
        this.builder.decrease().append("}").newline();
    }

    public void print(WdlScatter scatter) {
        this.builder.append("scatter (").append(scatter.variable).append(" in ");
        scatter.collection.accept(this);
        this.builder.append(")");
        this.body(scatter.body);
    }

    public void print(WdlConditional conditional) {
        this.builder.append("if (");
        conditional.condition.accept(this);
        this.builder.append(")");
        this.body(conditional.body);
    }

    public void print(WdlOutputSection section) {
        this.builder.append("output {").increase();
        for (WdlDeclaration output: section.outputs)
            this.print(output);
        this.builder.decrease().append("}").newline();
    }

    public void print(WdlStatement statement) {
        if (statement.is(WdlDeclaration.class))
            this.print(statement.to(WdlDeclaration.class));
        else if (statement.is(WdlCall.class))
            this.print(statement.to(WdlCall.class));
        else if (statement.is(WdlScatter.class))
            this.print(statement.to(WdlScatter.class));
        else if (statement.is(WdlConditional.class))
            this.print(statement.to(WdlConditional.class));
        else if (statement.is(WdlOutputSection.class))
            this.print(statement.to(WdlOutputSection.class));
        else
            throw new IllegalArgumentException("Unexpected statement " + statement.getClass());
    }

    /////////////////// Documents

    void section(String name, Map<String, WdlExpression> entries) {
        if (entries.isEmpty())
            return;
        this.builder.append(name).append(" {").increase();
        for (Map.Entry<String, WdlExpression> entry: entries.entrySet()) {
            this.builder.append(entry.getKey()).append(": ");
            entry.getValue().accept(this);
            this.builder.newline();
        }
        this.builder.decrease().append("}").newline();
    }

    public void print(WdlCommand command) {
        if (command.heredoc) {
            this.builder.append("command <<<");
            this.builder.appendVerbatim(command.text);
            this.builder.append(">>>");
        } else {
            this.builder.append("command {");
            this.builder.appendVerbatim(command.text);
            this.builder.append("}");
        }
        this.builder.newline();
    }

    public void print(WdlTask task) {
        this.builder.append("task ").append(task.name).append(" {").increase();
        for (WdlDeclaration declaration: task.declarations)
            this.print(declaration);
        if (task.command != null)
            this.print(task.command);
        this.section("runtime", task.runtime);
        if (!task.outputs.isEmpty()) {
            this.builder.append("output {").increase();
            for (WdlDeclaration output: task.outputs)
                this.print(output);
            this.builder.decrease().append("}").newline();
        }
        this.section("meta", task.meta);
        this.section("parameter_meta", task.parameterMeta);
        this.builder.decrease().append("}").newline();
    }

    public void print(WdlWorkflow workflow) {
        this.builder.append("workflow ").append(workflow.name).append(" {").increase();
        for (WdlStatement statement: workflow.body)
            this.print(statement);
        this.section("meta", workflow.meta);
        this.section("parameter_meta", workflow.parameterMeta);
        this.builder.decrease().append("}").newline();
    }

    public void print(WdlImport wdlImport) {
        this.builder.append("import ")
                .append("\"")
                .append(StringEscapeUtils.escapeJava(wdlImport.uri))
                .append("\"");
        if (wdlImport.alias != null)
            this.builder.append(" as ").append(wdlImport.alias);
        this.builder.newline();
    }

    public void print(WdlNamespace namespace) {
        for (WdlImport wdlImport: namespace.imports)
            this.print(wdlImport);
        if (!namespace.imports.isEmpty())
            this.builder.newline();
        boolean first = true;
        for (WdlTask task: namespace.tasks) {
            if (!first)
                this.builder.newline();
            first = false;
            this.print(task);
        }
        if (namespace.workflow != null) {
            if (!namespace.tasks.isEmpty())
                this.builder.newline();
            this.print(namespace.workflow);
        }
    }
}
