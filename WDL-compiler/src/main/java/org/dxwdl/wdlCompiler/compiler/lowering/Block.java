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

import org.dxwdl.util.ICastable;
import org.dxwdl.wdlCompiler.frontend.ast.WdlBlockStatement;
import org.dxwdl.wdlCompiler.frontend.ast.WdlConditional;
import org.dxwdl.wdlCompiler.frontend.ast.WdlDeclaration;
import org.dxwdl.wdlCompiler.frontend.ast.WdlScatter;
import org.dxwdl.wdlCompiler.frontend.ast.WdlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A unit of a workflow body that is compiled into a single stage.
 */
public abstract class Block implements ICastable {
    public interface Visitor<T> {
        T visit(DeclRun block);
        T visit(ScatterBlock block);
        T visit(ConditionalBlock block);
        T visit(OpaqueScope block);
    }

    private Block() {}

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * The statements of the original sequence covered by this block, in order.
     */
    public abstract List<WdlStatement> getStatements();

    /**
     * A maximal run of declarations.
     */
    public static final class DeclRun extends Block {
        public final List<WdlDeclaration> declarations;

        public DeclRun(List<WdlDeclaration> declarations) {
            this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<WdlStatement> getStatements() {
            return new ArrayList<>(this.declarations);
        }
    }

    /**
     * Base class for the blocks built around a scatter or a conditional.
     */
    public abstract static class ControlBlock extends Block {
        /**
         * The declarations immediately before the block statement.
         */
        public final List<WdlDeclaration> preceding;

        ControlBlock(List<WdlDeclaration> preceding) {
            this.preceding = Collections.unmodifiableList(new ArrayList<>(preceding));
        }

        public abstract WdlBlockStatement getBlockStatement();

        @Override
        public List<WdlStatement> getStatements() {
            List<WdlStatement> result = new ArrayList<>(this.preceding);
            result.add(this.getBlockStatement());
            return result;
        }
    }

    public static final class ScatterBlock extends ControlBlock {
        public final WdlScatter scatter;

        public ScatterBlock(List<WdlDeclaration> preceding, WdlScatter scatter) {
            super(preceding);
            this.scatter = scatter;
        }

        @Override
        public WdlBlockStatement getBlockStatement() {
            return this.scatter;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class ConditionalBlock extends ControlBlock {
        public final WdlConditional conditional;

        public ConditionalBlock(List<WdlDeclaration> preceding, WdlConditional conditional) {
            super(preceding);
            this.conditional = conditional;
        }

        @Override
        public WdlBlockStatement getBlockStatement() {
            return this.conditional;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Any other statement: a call, or something the lowering may reject.
     */
    public static final class OpaqueScope extends Block {
        public final WdlStatement statement;

        public OpaqueScope(WdlStatement statement) {
            this.statement = statement;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        public List<WdlStatement> getStatements() {
            return Collections.singletonList(this.statement);
        }
    }
}
