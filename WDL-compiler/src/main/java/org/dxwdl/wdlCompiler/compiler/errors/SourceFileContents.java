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

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Keep track of the contents of the source file supplied to the compiler.
 */
public class SourceFileContents {
    /**
     * Imported files are not tracked; positions always refer to the main file.
     */
    @Nullable
    String sourceFileName;
    final List<String> lines;
    final StringBuilder builder;

    public SourceFileContents() {
        this.sourceFileName = null;
        this.lines = new ArrayList<>();
        this.builder = new StringBuilder();
    }

    public void setEntireInput(@Nullable String sourceFileName, InputStream stream) throws IOException {
        this.sourceFileName = sourceFileName;
        BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        String line;
        while ((line = br.readLine()) != null) {
            this.lines.add(line);
            this.builder.append(line)
                    .append(SourceFileContents.newline());
        }
    }

    public void append(String program) {
        for (String line: program.split("\n", -1))
            this.lines.add(line);
        this.builder.append(program);
    }

    public String getWholeProgram() {
        return this.builder.toString();
    }

    public static String newline() {
        return System.lineSeparator();
    }

    public String getFragment(SourcePositionRange range) {
        if (!range.isValid())
            return "";
        int startLine = range.start.line - 1;
        int endLine = range.end.line - 1;
        int startCol = range.start.column - 1;
        int endCol = range.end.column;
        StringBuilder result = new StringBuilder();
        if (startLine == endLine) {
            if (startLine >= this.lines.size())
                // This should not really happen.
                return "";
            String line = this.lines.get(startLine);
            result.append(line).append(SourceFileContents.newline());
            for (int i = 0; i < startCol; i++)
                result.append(" ");
            for (int i = startCol; i < Math.max(endCol, startCol + 1); i++)
                result.append("^");
            result.append(SourceFileContents.newline());
        } else {
            if (endLine - startLine < 5 && endLine < this.lines.size()) {
                result.append("Error appears in this block:").append(SourceFileContents.newline());
                for (int i = startLine; i <= endLine; i++) {
                    result.append(this.lines.get(i)).append(SourceFileContents.newline());
                }
            }
        }
        return result.toString();
    }

    public String getSourceFileName() {
        if (this.sourceFileName == null)
            return "(none)";
        return this.sourceFileName;
    }
}
