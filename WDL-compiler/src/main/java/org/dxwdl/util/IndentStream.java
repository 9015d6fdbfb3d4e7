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

package org.dxwdl.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * An indent stream wraps an Appendable and indents each new line
 * by the current indentation amount.
 */
public class IndentStream implements IIndentStream {
    private Appendable stream;
    int indent = 0;
    final int amount = 4;
    boolean emitIndent = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
    }

    /**
     * Change the underlying output.
     * @return the previous output.
     */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    @Override
    public IIndentStream appendChar(char c) {
        try {
            if (this.emitIndent && c != '\n') {
                for (int i = 0; i < this.indent; i++)
                    this.stream.append(' ');
                this.emitIndent = false;
            }
            this.stream.append(c);
            if (c == '\n')
                this.emitIndent = true;
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public IIndentStream append(String string) {
        for (int i = 0; i < string.length(); i++)
            this.appendChar(string.charAt(i));
        return this;
    }

    /**
     * Append text without indenting the lines it contains.
     */
    public IIndentStream appendVerbatim(String string) {
        try {
            this.stream.append(string);
            if (!string.isEmpty())
                this.emitIndent = string.charAt(string.length() - 1) == '\n';
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public IIndentStream append(boolean b) {
        return this.append(Boolean.toString(b));
    }

    @Override
    public IIndentStream append(long value) {
        return this.append(Long.toString(value));
    }

    @Override
    public IIndentStream newline() {
        return this.appendChar('\n');
    }

    @Override
    public IIndentStream increase() {
        this.indent += this.amount;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        this.indent -= this.amount;
        if (this.indent < 0)
            throw new RuntimeException("Negative indent");
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
