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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.apache.commons.text.StringEscapeUtils;
import org.dxwdl.util.IModule;
import org.dxwdl.util.Linq;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePosition;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;
import org.dxwdl.wdlCompiler.compiler.errors.WdlSyntaxException;
import org.dxwdl.wdlCompiler.frontend.ast.*;
import org.dxwdl.wdlCompiler.frontend.parser.WdlBaseVisitor;
import org.dxwdl.wdlCompiler.frontend.parser.WdlParser;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * This visitor converts a parse tree produced by ANTLR into
 * a WDL abstract syntax tree.
 */
public class AstBuilder extends WdlBaseVisitor<Object> implements IModule {
    /**
     * Added to all line numbers; used when parsing string placeholders,
     * which are parsed separately from the enclosing document.
     */
    final int lineOffset;
    /**
     * Added to the column numbers of the first line.
     */
    final int columnOffset;

    public AstBuilder(int lineOffset, int columnOffset) {
        this.lineOffset = lineOffset;
        this.columnOffset = columnOffset;
    }

    public AstBuilder() {
        this(0, 0);
    }

    SourcePosition position(int line, int charPositionInLine) {
        int column = charPositionInLine + 1;
        if (line == 1)
            column += this.columnOffset;
        return new SourcePosition(line + this.lineOffset, column);
    }

    SourcePositionRange range(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null)
            stop = start;
        return new SourcePositionRange(
                this.position(start.getLine(), start.getCharPositionInLine()),
                this.position(stop.getLine(), stop.getCharPositionInLine() + stop.getText().length() - 1));
    }

    SourcePositionRange range(Token token) {
        return new SourcePositionRange(
                this.position(token.getLine(), token.getCharPositionInLine()),
                this.position(token.getLine(), token.getCharPositionInLine() + token.getText().length() - 1));
    }

    WdlExpression expression(WdlParser.ExpressionContext ctx) {
        return (WdlExpression) this.visit(ctx);
    }

    WdlType type(WdlParser.WdlTypeContext ctx) {
        return (WdlType) this.visit(ctx);
    }

    WdlDeclaration declaration(WdlParser.DeclarationContext ctx) {
        return (WdlDeclaration) this.visit(ctx);
    }

    WdlStatement statement(WdlParser.WorkflowElementContext ctx) {
        return (WdlStatement) this.visit(ctx);
    }

    //////////////////// Documents

    @Override
    public WdlNamespace visitDocument(WdlParser.DocumentContext ctx) {
        List<WdlImport> imports = new ArrayList<>();
        for (WdlParser.ImportStatementContext i: ctx.importStatement())
            imports.add(this.visitImportStatement(i));
        List<WdlTask> tasks = new ArrayList<>();
        WdlWorkflow workflow = null;
        for (WdlParser.DocumentElementContext element: ctx.documentElement()) {
            if (element.task() != null) {
                tasks.add(this.visitTask(element.task()));
            } else {
                if (workflow != null)
                    throw new WdlSyntaxException(this.range(element),
                            "Only one workflow is allowed in a document");
                workflow = this.visitWorkflow(element.workflow());
            }
        }
        return new WdlNamespace(this.range(ctx), imports, tasks, workflow, new LinkedHashMap<>());
    }

    @Override
    public WdlImport visitImportStatement(WdlParser.ImportStatementContext ctx) {
        String uri = this.stringValue(ctx.STRING().getSymbol());
        String alias = ctx.Identifier() != null ? ctx.Identifier().getText() : null;
        return new WdlImport(this.range(ctx), uri, alias);
    }

    /**
     * Parse the key-value pairs of a runtime or meta section into 'into'.
     */
    void keyValues(List<WdlParser.KeyValueContext> keyValues, LinkedHashMap<String, WdlExpression> into) {
        for (WdlParser.KeyValueContext kv: keyValues) {
            String key = kv.Identifier().getText();
            if (into.containsKey(key))
                throw new WdlSyntaxException(this.range(kv), "Duplicate key " + key);
            into.put(key, this.expression(kv.expression()));
        }
    }

    @Override
    public WdlTask visitTask(WdlParser.TaskContext ctx) {
        String name = ctx.Identifier().getText();
        Logger.INSTANCE.from(this, 2)
                .append("Visiting task ")
                .append(name)
                .newline();
        List<WdlDeclaration> declarations = new ArrayList<>();
        List<WdlDeclaration> outputs = new ArrayList<>();
        LinkedHashMap<String, WdlExpression> runtime = new LinkedHashMap<>();
        LinkedHashMap<String, WdlExpression> meta = new LinkedHashMap<>();
        LinkedHashMap<String, WdlExpression> parameterMeta = new LinkedHashMap<>();
        WdlCommand command = null;
        for (WdlParser.TaskElementContext element: ctx.taskElement()) {
            if (element.declaration() != null) {
                declarations.add(this.declaration(element.declaration()));
            } else if (element.commandSection() != null) {
                if (command != null)
                    throw new WdlSyntaxException(this.range(element), "Task " + name + " has two command sections");
                command = this.visitCommandSection(element.commandSection());
            } else if (element.outputSection() != null) {
                outputs.addAll(this.visitOutputSection(element.outputSection()).outputs);
            } else if (element.runtimeSection() != null) {
                this.keyValues(element.runtimeSection().keyValue(), runtime);
            } else {
                WdlParser.MetaSectionContext section = element.metaSection();
                if (section.META() != null)
                    this.keyValues(section.keyValue(), meta);
                else
                    this.keyValues(section.keyValue(), parameterMeta);
            }
        }
        return new WdlTask(this.range(ctx), name, declarations, command,
                outputs, runtime, meta, parameterMeta);
    }

    @Override
    public WdlCommand visitCommandSection(WdlParser.CommandSectionContext ctx) {
        String text = ctx.COMMAND_BLOCK().getText();
        int heredoc = text.indexOf("<<<");
        int brace = text.indexOf('{');
        // The lexer guarantees that the body starts with one of the two delimiters
        if (heredoc >= 0 && (brace < 0 || heredoc < brace)) {
            String body = text.substring(heredoc + 3, text.length() - 3);
            return new WdlCommand(this.range(ctx), body, true);
        }
        String body = text.substring(brace + 1, text.length() - 1);
        return new WdlCommand(this.range(ctx), body, false);
    }

    @Override
    public WdlOutputSection visitOutputSection(WdlParser.OutputSectionContext ctx) {
        List<WdlDeclaration> outputs = Linq.map(ctx.declaration(), this::declaration);
        return new WdlOutputSection(this.range(ctx), outputs);
    }

    @Override
    public WdlWorkflow visitWorkflow(WdlParser.WorkflowContext ctx) {
        String name = ctx.Identifier().getText();
        Logger.INSTANCE.from(this, 2)
                .append("Visiting workflow ")
                .append(name)
                .newline();
        List<WdlStatement> body = new ArrayList<>();
        LinkedHashMap<String, WdlExpression> meta = new LinkedHashMap<>();
        LinkedHashMap<String, WdlExpression> parameterMeta = new LinkedHashMap<>();
        for (WdlParser.WorkflowElementContext element: ctx.workflowElement()) {
            WdlParser.MetaSectionContext section = element.metaSection();
            if (section != null) {
                if (section.META() != null)
                    this.keyValues(section.keyValue(), meta);
                else
                    this.keyValues(section.keyValue(), parameterMeta);
            } else {
                body.add(this.statement(element));
            }
        }
        return new WdlWorkflow(this.range(ctx), name, body, meta, parameterMeta);
    }

    //////////////////// Statements

    /**
     * The body of a scatter or conditional; output and meta sections
     * are only legal at the top level of a workflow.
     */
    List<WdlStatement> nestedBody(List<WdlParser.WorkflowElementContext> elements) {
        List<WdlStatement> body = new ArrayList<>();
        for (WdlParser.WorkflowElementContext element: elements) {
            if (element.outputSection() != null || element.metaSection() != null)
                throw new WdlSyntaxException(this.range(element),
                        "Section is only allowed at the top level of a workflow");
            body.add(this.statement(element));
        }
        return body;
    }

    @Override
    public WdlStatement visitWorkflowElement(WdlParser.WorkflowElementContext ctx) {
        if (ctx.declaration() != null)
            return this.declaration(ctx.declaration());
        if (ctx.call() != null)
            return this.visitCall(ctx.call());
        if (ctx.scatter() != null)
            return this.visitScatter(ctx.scatter());
        if (ctx.conditional() != null)
            return this.visitConditional(ctx.conditional());
        if (ctx.outputSection() != null)
            return this.visitOutputSection(ctx.outputSection());
        throw new WdlSyntaxException(this.range(ctx), "Unexpected workflow element");
    }

    @Override
    public WdlDeclaration visitDeclaration(WdlParser.DeclarationContext ctx) {
        WdlType type = this.type(ctx.wdlType());
        String name = ctx.Identifier().getText();
        WdlExpression expression = null;
        if (ctx.expression() != null)
            expression = this.expression(ctx.expression());
        return new WdlDeclaration(this.range(ctx), type, name, expression);
    }

    @Override
    public WdlCall visitCall(WdlParser.CallContext ctx) {
        String taskName = ctx.qualifiedName().getText();
        String alias = ctx.Identifier() != null ? ctx.Identifier().getText() : null;
        LinkedHashMap<String, WdlExpression> inputs = new LinkedHashMap<>();
        if (ctx.callBody() != null) {
            for (WdlParser.CallInputContext input: ctx.callBody().callInput()) {
                String name = input.Identifier().getText();
                if (inputs.containsKey(name))
                    throw new WdlSyntaxException(this.range(input),
                            "Argument " + name + " supplied twice");
                inputs.put(name, this.expression(input.expression()));
            }
        }
        return new WdlCall(this.range(ctx), taskName, alias, inputs);
    }

    @Override
    public WdlScatter visitScatter(WdlParser.ScatterContext ctx) {
        String variable = ctx.Identifier().getText();
        WdlExpression collection = this.expression(ctx.expression());
        return new WdlScatter(this.range(ctx), variable, collection, this.nestedBody(ctx.workflowElement()));
    }

    @Override
    public WdlConditional visitConditional(WdlParser.ConditionalContext ctx) {
        WdlExpression condition = this.expression(ctx.expression());
        return new WdlConditional(this.range(ctx), condition, this.nestedBody(ctx.workflowElement()));
    }

    //////////////////// Types

    @Override
    public WdlType visitWdlType(WdlParser.WdlTypeContext ctx) {
        WdlType type = (WdlType) this.visit(ctx.typeBody());
        if (ctx.PLUS() != null) {
            WdlArrayType array = type.as(WdlArrayType.class);
            if (array == null)
                throw new WdlSyntaxException(this.range(ctx), "Only array types can be non-empty");
            type = new WdlArrayType(array.elementType, true);
        }
        if (ctx.QUESTION() != null)
            type = type.makeOptional();
        return type;
    }

    @Override
    public WdlType visitIntType(WdlParser.IntTypeContext ctx) {
        return WdlPrimitiveType.INT;
    }

    @Override
    public WdlType visitFloatType(WdlParser.FloatTypeContext ctx) {
        return WdlPrimitiveType.FLOAT;
    }

    @Override
    public WdlType visitBooleanType(WdlParser.BooleanTypeContext ctx) {
        return WdlPrimitiveType.BOOLEAN;
    }

    @Override
    public WdlType visitStringType(WdlParser.StringTypeContext ctx) {
        return WdlPrimitiveType.STRING;
    }

    @Override
    public WdlType visitFileType(WdlParser.FileTypeContext ctx) {
        return WdlPrimitiveType.FILE;
    }

    @Override
    public WdlType visitObjectType(WdlParser.ObjectTypeContext ctx) {
        return WdlPrimitiveType.OBJECT;
    }

    @Override
    public WdlType visitArrayType(WdlParser.ArrayTypeContext ctx) {
        return new WdlArrayType(this.type(ctx.wdlType()), false);
    }

    @Override
    public WdlType visitMapType(WdlParser.MapTypeContext ctx) {
        return new WdlMapType(this.type(ctx.wdlType(0)), this.type(ctx.wdlType(1)));
    }

    @Override
    public WdlType visitPairType(WdlParser.PairTypeContext ctx) {
        return new WdlPairType(this.type(ctx.wdlType(0)), this.type(ctx.wdlType(1)));
    }

    //////////////////// Expressions

    @Override
    public WdlExpression visitPrimaryExpr(WdlParser.PrimaryExprContext ctx) {
        return (WdlExpression) this.visit(ctx.primary());
    }

    @Override
    public WdlExpression visitMemberAccessExpr(WdlParser.MemberAccessExprContext ctx) {
        return new WdlMemberAccess(this.range(ctx), this.expression(ctx.expression()), ctx.Identifier().getText());
    }

    @Override
    public WdlExpression visitIndexExpr(WdlParser.IndexExprContext ctx) {
        return new WdlIndexExpression(this.range(ctx),
                this.expression(ctx.expression(0)), this.expression(ctx.expression(1)));
    }

    @Override
    public WdlExpression visitUnaryExpr(WdlParser.UnaryExprContext ctx) {
        return new WdlUnaryExpression(this.range(ctx), ctx.op.getText(), this.expression(ctx.expression()));
    }

    WdlExpression binary(ParserRuleContext ctx, String operation,
                         WdlParser.ExpressionContext left, WdlParser.ExpressionContext right) {
        return new WdlBinaryExpression(this.range(ctx), operation, this.expression(left), this.expression(right));
    }

    @Override
    public WdlExpression visitMultiplicativeExpr(WdlParser.MultiplicativeExprContext ctx) {
        return this.binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitAdditiveExpr(WdlParser.AdditiveExprContext ctx) {
        return this.binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitRelationalExpr(WdlParser.RelationalExprContext ctx) {
        return this.binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitEqualityExpr(WdlParser.EqualityExprContext ctx) {
        return this.binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitAndExpr(WdlParser.AndExprContext ctx) {
        return this.binary(ctx, "&&", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitOrExpr(WdlParser.OrExprContext ctx) {
        return this.binary(ctx, "||", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public WdlExpression visitIfThenElseExpr(WdlParser.IfThenElseExprContext ctx) {
        return new WdlIfThenElse(this.range(ctx),
                this.expression(ctx.expression(0)),
                this.expression(ctx.expression(1)),
                this.expression(ctx.expression(2)));
    }

    @Override
    public WdlExpression visitIntLiteral(WdlParser.IntLiteralContext ctx) {
        try {
            return new WdlIntLiteral(this.range(ctx), Long.parseLong(ctx.getText()));
        } catch (NumberFormatException ex) {
            throw new WdlSyntaxException(this.range(ctx), "Integer literal out of range: " + ctx.getText());
        }
    }

    @Override
    public WdlExpression visitFloatLiteral(WdlParser.FloatLiteralContext ctx) {
        return new WdlFloatLiteral(this.range(ctx), Double.parseDouble(ctx.getText()));
    }

    @Override
    public WdlExpression visitBoolLiteral(WdlParser.BoolLiteralContext ctx) {
        return new WdlBoolLiteral(this.range(ctx), ctx.TRUE() != null);
    }

    @Override
    public WdlExpression visitStringLiteral(WdlParser.StringLiteralContext ctx) {
        return this.stringLiteral(ctx.STRING().getSymbol());
    }

    @Override
    public WdlExpression visitApplyExpr(WdlParser.ApplyExprContext ctx) {
        List<WdlExpression> arguments = Linq.map(ctx.expression(), this::expression);
        return new WdlApplyExpression(this.range(ctx), ctx.Identifier().getText(), arguments);
    }

    @Override
    public WdlExpression visitIdentifierExpr(WdlParser.IdentifierExprContext ctx) {
        return new WdlIdentifier(this.range(ctx), ctx.Identifier().getText());
    }

    @Override
    public WdlExpression visitPairLiteral(WdlParser.PairLiteralContext ctx) {
        return new WdlPairLiteral(this.range(ctx),
                this.expression(ctx.expression(0)), this.expression(ctx.expression(1)));
    }

    @Override
    public WdlExpression visitParenExpr(WdlParser.ParenExprContext ctx) {
        return this.expression(ctx.expression());
    }

    @Override
    public WdlExpression visitArrayLiteral(WdlParser.ArrayLiteralContext ctx) {
        return new WdlArrayLiteral(this.range(ctx), Linq.map(ctx.expression(), this::expression));
    }

    @Override
    public WdlExpression visitMapLiteral(WdlParser.MapLiteralContext ctx) {
        List<WdlExpression> keys = new ArrayList<>();
        List<WdlExpression> values = new ArrayList<>();
        for (WdlParser.MapEntryContext entry: ctx.mapEntry()) {
            keys.add(this.expression(entry.expression(0)));
            values.add(this.expression(entry.expression(1)));
        }
        return new WdlMapLiteral(this.range(ctx), keys, values);
    }

    //////////////////// Strings

    /**
     * The value of a string token that must not contain placeholders.
     */
    String stringValue(Token token) {
        WdlStringLiteral literal = this.stringLiteral(token);
        if (!literal.isConstant())
            throw new WdlSyntaxException(this.range(token), "Expected a constant string");
        return literal.getValue();
    }

    /**
     * Split the text of a string token into fragments and ${} placeholders.
     * Placeholders are parsed as expressions.
     */
    WdlStringLiteral stringLiteral(Token token) {
        String text = token.getText();
        // strip the quotes
        String body = text.substring(1, text.length() - 1);
        List<String> fragments = new ArrayList<>();
        List<WdlExpression> placeholders = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int index = 0;
        while (index < body.length()) {
            char c = body.charAt(index);
            if (c == '\\' && index + 1 < body.length()) {
                current.append(c).append(body.charAt(index + 1));
                index += 2;
                continue;
            }
            if (c == '$' && index + 1 < body.length() && body.charAt(index + 1) == '{') {
                int end = matchingBrace(body, index + 1);
                if (end < 0)
                    throw new WdlSyntaxException(this.range(token), "Unterminated placeholder in string " + text);
                String inner = body.substring(index + 2, end);
                // +1 for the quote, +2 for the ${
                int column = token.getCharPositionInLine() + 1 + index + 2;
                WdlExpression placeholder = WdlFrontend.parseExpression(
                        inner, token.getLine() - 1 + this.lineOffset, column + (token.getLine() == 1 ? this.columnOffset : 0));
                fragments.add(StringEscapeUtils.unescapeJava(current.toString()));
                placeholders.add(placeholder);
                current.setLength(0);
                index = end + 1;
                continue;
            }
            current.append(c);
            index++;
        }
        fragments.add(StringEscapeUtils.unescapeJava(current.toString()));
        return new WdlStringLiteral(this.range(token), fragments, placeholders);
    }

    /**
     * Index of the brace that closes the one at 'open', or -1.
     * Quoted strings inside the placeholder are skipped.
     */
    static int matchingBrace(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\')
                    i++;
                else if (c == quote)
                    quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0)
                    return i;
            }
        }
        return -1;
    }

    @Override
    @Nullable
    public Object visitTerminal(TerminalNode node) {
        return null;
    }

    /**
     * Convert a parse tree for a whole document.
     */
    public WdlNamespace build(WdlParser.DocumentContext document) {
        WdlNamespace result = this.visitDocument(document);
        Logger.INSTANCE.from(this, 3)
                .append("Parsed ")
                .append(result.tasks.size())
                .append(" tasks")
                .newline();
        return result;
    }
}
