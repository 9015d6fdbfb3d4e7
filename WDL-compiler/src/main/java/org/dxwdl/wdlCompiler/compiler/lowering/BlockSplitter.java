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

import org.dxwdl.wdlCompiler.frontend.ast.WdlConditional;
import org.dxwdl.wdlCompiler.frontend.ast.WdlDeclaration;
import org.dxwdl.wdlCompiler.frontend.ast.WdlScatter;
import org.dxwdl.wdlCompiler.frontend.ast.WdlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions a sequence of workflow statements into blocks.
 */
public class BlockSplitter {
    private BlockSplitter() {}

    /**
     * The leading declarations of a statement sequence, and the rest.
     */
    public static class LeadingDeclarations {
        public final List<WdlDeclaration> declarations;
        public final List<WdlStatement> rest;

        LeadingDeclarations(List<WdlDeclaration> declarations, List<WdlStatement> rest) {
            this.declarations = Collections.unmodifiableList(declarations);
            this.rest = Collections.unmodifiableList(rest);
        }
    }

    /**
     * Declarations are accumulated until a statement of another kind is found.
     * Scatters and conditionals absorb the pending declarations; any other
     * statement flushes them as a separate run.
     */
    public static List<Block> split(List<WdlStatement> statements) {
        List<Block> result = new ArrayList<>();
        List<WdlDeclaration> pending = new ArrayList<>();
        for (WdlStatement statement: statements) {
            if (statement.is(WdlDeclaration.class)) {
                pending.add(statement.to(WdlDeclaration.class));
                continue;
            }
            if (statement.is(WdlScatter.class)) {
                result.add(new Block.ScatterBlock(pending, statement.to(WdlScatter.class)));
            } else if (statement.is(WdlConditional.class)) {
                result.add(new Block.ConditionalBlock(pending, statement.to(WdlConditional.class)));
            } else {
                if (!pending.isEmpty())
                    result.add(new Block.DeclRun(pending));
                result.add(new Block.OpaqueScope(statement));
            }
            pending = new ArrayList<>();
        }
        if (!pending.isEmpty())
            result.add(new Block.DeclRun(pending));
        return result;
    }

    public static LeadingDeclarations splitLeadingDeclarations(List<WdlStatement> statements) {
        List<WdlDeclaration> declarations = new ArrayList<>();
        int index = 0;
        while (index < statements.size() && statements.get(index).is(WdlDeclaration.class)) {
            declarations.add(statements.get(index).to(WdlDeclaration.class));
            index++;
        }
        List<WdlStatement> rest = new ArrayList<>(statements.subList(index, statements.size()));
        return new LeadingDeclarations(declarations, rest);
    }
}
