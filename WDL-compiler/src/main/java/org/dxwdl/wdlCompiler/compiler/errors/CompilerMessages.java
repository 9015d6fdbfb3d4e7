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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxwdl.wdlCompiler.compiler.CompilerOptions;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings produced by a compilation.
 */
public class CompilerMessages {
    public class Error {
        public final SourcePositionRange range;
        public final boolean warning;
        public final String errorType;
        public final String message;

        Error(SourcePositionRange range, boolean warning, String errorType, String message) {
            this.range = range;
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Error(WdlSyntaxException e) {
            this.range = e.range;
            this.warning = false;
            this.errorType = "Error parsing WDL";
            this.message = e.getMessage();
        }

        Error(LoweringException e) {
            this.range = e.range;
            this.warning = false;
            this.errorType = e.kind.description;
            this.message = e.getMessage();
        }

        Error(Unimplemented e) {
            this.range = e.getRange();
            this.warning = false;
            this.errorType = "Feature not yet implemented";
            this.message = e.getMessage();
        }

        Error(Throwable e) {
            this.range = SourcePositionRange.INVALID;
            this.warning = false;
            this.errorType = "This is a bug in the compiler (please report it to the developers)";
            this.message = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        public void format(StringBuilder output) {
            String sourceFile = "(none)";
            if (CompilerMessages.this.contents != null)
                sourceFile = CompilerMessages.this.contents.getSourceFileName();
            output.append(sourceFile)
                    .append(": ")
                    .append(this.errorType)
                    .append(SourceFileContents.newline());
            output.append(sourceFile)
                    .append(":")
                    .append(this.range.start)
                    .append(":");
            if (this.warning)
                output.append(" warning");
            else
                output.append(" error");
            output.append(": ")
                    .append(this.message)
                    .append(SourceFileContents.newline());
            if (CompilerMessages.this.contents != null)
                output.append(CompilerMessages.this.contents.getFragment(this.range));
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("startLineNumber", this.range.start.line);
            result.put("startColumn", this.range.start.column);
            result.put("endLineNumber", this.range.end.line);
            result.put("endColumn", this.range.end.column);
            result.put("warning", this.warning);
            result.put("errorType", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final CompilerOptions options;
    @Nullable
    public SourceFileContents contents;
    public final List<Error> messages;
    public int exitCode = 0;

    public CompilerMessages(CompilerOptions options, @Nullable SourceFileContents contents) {
        this.contents = contents;
        this.options = options;
        this.messages = new ArrayList<>();
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Error message) {
        this.messages.add(message);
        if (!message.warning)
            this.setExitCode(1);
    }

    public void reportError(SourcePositionRange range, boolean warning,
                            String errorType, String message) {
        Error msg = new Error(range, warning, errorType, message);
        this.reportError(msg);
    }

    public void reportError(WdlSyntaxException e) {
        this.reportError(new Error(e));
    }

    public void reportError(LoweringException e) {
        this.reportError(new Error(e));
    }

    public void reportError(Unimplemented e) {
        this.reportError(new Error(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Error(e));
    }

    public int errorCount() {
        return this.messages.size();
    }

    public Error getError(int ct) {
        return this.messages.get(ct);
    }

    public void show(PrintStream stream) {
        stream.print(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.options.ioOptions.emitJsonErrors) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            for (Error message: this.messages) {
                message.format(builder);
            }
        }
        return builder.toString();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = new ObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Error message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }
}
