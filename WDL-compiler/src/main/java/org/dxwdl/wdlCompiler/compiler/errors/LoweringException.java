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

package org.dxwdl.wdlCompiler.compiler.errors;

import org.dxwdl.wdlCompiler.frontend.ast.WdlNode;

import javax.annotation.Nullable;

/**
 * An error in a WDL program discovered while lowering it to IR.
 * These are errors that the author of the WDL program can fix;
 * internal compiler defects are reported with other exception types.
 * Every lowering error is terminal: no partial IR is produced.
 */
public class LoweringException extends RuntimeException {
    public enum Kind {
        MissingVariableReference("Missing variable reference"),
        IllegalStageName("Illegal stage name"),
        UndefinedTask("Undefined task"),
        MissingRequiredArgument("Missing required argument"),
        UnsupportedCallArgument("Unsupported call argument"),
        UnsupportedBlockElement("Unsupported block element"),
        UnsupportedOutputExpression("Unsupported output expression"),
        WorkflowInputDefaultNotConst("Workflow input default is not a constant"),
        GeneratedProgramInvalid("Generated program is invalid"),
        NoSuitableInstanceType("No suitable instance type"),
        UnresolvedPlatformAsset("Unresolved platform asset"),
        DuplicateAppletName("Duplicate applet name");

        public final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    public final Kind kind;
    public final SourcePositionRange range;

    public LoweringException(Kind kind, SourcePositionRange range, String message) {
        super(message);
        this.kind = kind;
        this.range = range;
    }

    public LoweringException(Kind kind, @Nullable WdlNode node, String message) {
        this(kind, node == null ? SourcePositionRange.INVALID : node.getPosition(), message);
    }

    public LoweringException(Kind kind, String message) {
        this(kind, SourcePositionRange.INVALID, message);
    }

    public LoweringException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.range = SourcePositionRange.INVALID;
    }

    @Override
    public String toString() {
        return this.kind + ": " + this.getMessage();
    }
}
