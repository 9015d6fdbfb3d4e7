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

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the verbatim source text of each task from a WDL document.
 * This works on the raw text, so it preserves the formatting and
 * the comments of the original source.  The result is only used
 * for provenance.
 */
public class SourceScanner implements IModule {
    final String text;
    int index;

    SourceScanner(String text) {
        this.text = text;
        this.index = 0;
    }

    /**
     * Map each task name to the text of its definition,
     * from the 'task' keyword to the closing brace.
     */
    public static Map<String, String> scanForTasks(String text) {
        SourceScanner scanner = new SourceScanner(text);
        return scanner.scan();
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    boolean atKeyword(String keyword) {
        if (!this.text.startsWith(keyword, this.index))
            return false;
        if (this.index > 0 && isIdentifierChar(this.text.charAt(this.index - 1)))
            return false;
        int end = this.index + keyword.length();
        return end >= this.text.length() || !isIdentifierChar(this.text.charAt(end));
    }

    /**
     * If the current position starts a string, comment or heredoc,
     * skip it and return true.
     */
    boolean skipOpaque() {
        char c = this.text.charAt(this.index);
        if (c == '#') {
            while (this.index < this.text.length() && this.text.charAt(this.index) != '\n')
                this.index++;
            return true;
        }
        if (c == '"' || c == '\'') {
            this.index++;
            while (this.index < this.text.length()) {
                char d = this.text.charAt(this.index);
                if (d == '\\') {
                    this.index += 2;
                    continue;
                }
                this.index++;
                if (d == c || d == '\n')
                    break;
            }
            return true;
        }
        if (this.text.startsWith("<<<", this.index)) {
            int end = this.text.indexOf(">>>", this.index + 3);
            this.index = end < 0 ? this.text.length() : end + 3;
            return true;
        }
        return false;
    }

    Map<String, String> scan() {
        Map<String, String> result = new LinkedHashMap<>();
        while (this.index < this.text.length()) {
            if (this.skipOpaque())
                continue;
            if (this.atKeyword("task")) {
                int start = this.index;
                this.index += "task".length();
                while (this.index < this.text.length() && Character.isWhitespace(this.text.charAt(this.index)))
                    this.index++;
                int nameStart = this.index;
                while (this.index < this.text.length() && isIdentifierChar(this.text.charAt(this.index)))
                    this.index++;
                String name = this.text.substring(nameStart, this.index);
                int end = this.matchBraces();
                if (!name.isEmpty() && end > 0) {
                    Logger.INSTANCE.from(this, 2)
                            .append("Found source for task ")
                            .append(name)
                            .newline();
                    result.put(name, this.text.substring(start, end));
                }
                continue;
            }
            this.index++;
        }
        return result;
    }

    /**
     * Advance past the next balanced {...} group.
     * @return the index after the closing brace, or -1 if there is none.
     */
    int matchBraces() {
        int depth = 0;
        while (this.index < this.text.length()) {
            if (this.skipOpaque())
                continue;
            char c = this.text.charAt(this.index);
            this.index++;
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0)
                    return this.index;
                if (depth < 0)
                    return -1;
            }
        }
        return -1;
    }
}
