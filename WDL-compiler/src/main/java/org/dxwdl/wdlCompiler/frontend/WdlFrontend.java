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

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePosition;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;
import org.dxwdl.wdlCompiler.compiler.errors.WdlSyntaxException;
import org.dxwdl.wdlCompiler.frontend.ast.StatementVisitor;
import org.dxwdl.wdlCompiler.frontend.ast.WdlCall;
import org.dxwdl.wdlCompiler.frontend.ast.WdlDeclaration;
import org.dxwdl.wdlCompiler.frontend.ast.WdlExpression;
import org.dxwdl.wdlCompiler.frontend.ast.WdlImport;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.frontend.ast.WdlOutputSection;
import org.dxwdl.wdlCompiler.frontend.ast.WdlScatter;
import org.dxwdl.wdlCompiler.frontend.ast.WdlStatement;
import org.dxwdl.wdlCompiler.frontend.parser.WdlLexer;
import org.dxwdl.wdlCompiler.frontend.parser.WdlParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Parses WDL source text into syntax trees.
 */
public class WdlFrontend implements IModule {
    /**
     * Turns ANTLR syntax errors into exceptions.
     */
    static class ThrowingErrorListener extends BaseErrorListener {
        final int lineOffset;
        final int columnOffset;

        ThrowingErrorListener(int lineOffset, int columnOffset) {
            this.lineOffset = lineOffset;
            this.columnOffset = columnOffset;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            int column = charPositionInLine + 1;
            if (line == 1)
                column += this.columnOffset;
            SourcePosition position = new SourcePosition(line + this.lineOffset, column);
            throw new WdlSyntaxException(new SourcePositionRange(position, position), msg);
        }
    }

    /**
     * Collects the names bound by declarations and calls in a workflow,
     * and its scatters.  Draft-2 WDL has a single namespace per workflow,
     * so nested names count as well.
     */
    static class WorkflowNames extends StatementVisitor {
        final Set<String> bound = new HashSet<>();
        final List<WdlScatter> scatters = new ArrayList<>();

        WorkflowNames() {
            super(false);
        }

        @Override
        public boolean preorder(WdlDeclaration node) {
            this.bound.add(node.name);
            return true;
        }

        @Override
        public boolean preorder(WdlCall node) {
            this.bound.add(node.getUnqualifiedName());
            return true;
        }

        @Override
        public boolean preorder(WdlScatter node) {
            this.scatters.add(node);
            return true;
        }

        @Override
        public boolean preorder(WdlOutputSection node) {
            return false;
        }
    }

    /**
     * A scatter variable may not reuse the name of a declaration or call of the workflow.
     */
    static void checkScatterVariables(WdlNamespace namespace) {
        if (namespace.workflow == null)
            return;
        WorkflowNames names = new WorkflowNames();
        for (WdlStatement statement: namespace.workflow.body)
            statement.accept(names);
        for (WdlScatter scatter: names.scatters)
            if (names.bound.contains(scatter.variable))
                throw new WdlSyntaxException(scatter.getPosition(),
                        "Scatter variable " + scatter.variable + " collides with another name in workflow "
                                + namespace.workflow.name);
    }

    static WdlParser createParser(String text, int lineOffset, int columnOffset) {
        ThrowingErrorListener listener = new ThrowingErrorListener(lineOffset, columnOffset);
        WdlLexer lexer = new WdlLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        WdlParser parser = new WdlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        return parser;
    }

    /**
     * Parse a complete WDL document.  Imports are not resolved.
     * @param program  Source text.
     */
    public WdlNamespace parse(String program) {
        WdlParser parser = createParser(program, 0, 0);
        WdlNamespace result = new AstBuilder().build(parser.document());
        checkScatterVariables(result);
        Logger.INSTANCE.from(this, 3)
                .append("Parsed program")
                .newline()
                .append(WdlPrettyPrinter.toString(result))
                .newline();
        return result;
    }

    /**
     * Parse a complete WDL document and all the documents it imports.
     * @param program   Source text.
     * @param resolver  Used to locate the imported documents.
     */
    public WdlNamespace parse(String program, ImportResolver resolver) throws IOException {
        return this.parseWithImports(program, resolver, new HashSet<>());
    }

    WdlNamespace parseWithImports(String program, ImportResolver resolver, Set<String> importing)
            throws IOException {
        WdlNamespace namespace = this.parse(program);
        if (namespace.imports.isEmpty())
            return namespace;
        LinkedHashMap<String, WdlNamespace> imported = new LinkedHashMap<>();
        for (WdlImport wdlImport: namespace.imports) {
            String name = wdlImport.getNamespaceName();
            if (imported.containsKey(name))
                throw new WdlSyntaxException(wdlImport.getPosition(), "Duplicate import namespace " + name);
            if (importing.contains(wdlImport.uri))
                throw new WdlSyntaxException(wdlImport.getPosition(), "Circular import of " + wdlImport.uri);
            Logger.INSTANCE.from(this, 1)
                    .append("Importing ")
                    .append(wdlImport.uri)
                    .append(" as ")
                    .append(name)
                    .newline();
            String text = resolver.resolve(wdlImport.uri);
            importing.add(wdlImport.uri);
            imported.put(name, this.parseWithImports(text, resolver, importing));
            importing.remove(wdlImport.uri);
        }
        return namespace.withImportedNamespaces(imported);
    }

    /**
     * Parse a standalone expression.
     */
    public static WdlExpression parseExpression(String text) {
        return parseExpression(text, 0, 0);
    }

    /**
     * Parse an expression that appears inside a larger source text.
     * @param lineOffset    Added to line numbers.
     * @param columnOffset  Added to column numbers on the first line.
     */
    static WdlExpression parseExpression(String text, int lineOffset, int columnOffset) {
        WdlParser parser = createParser(text, lineOffset, columnOffset);
        WdlParser.ExpressionContext ctx = parser.expression();
        if (parser.getCurrentToken().getType() != WdlParser.EOF)
            throw new WdlSyntaxException(SourcePositionRange.INVALID,
                    "Unexpected text after expression: " + text);
        return (WdlExpression) new AstBuilder(lineOffset, columnOffset).visit(ctx);
    }
}
