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

package org.dxwdl.wdlCompiler.frontend.ast;

import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * A string literal, possibly containing ${expression} placeholders.
 * The text fragments and the placeholders alternate:
 * fragments.size() == placeholders.size() + 1.
 */
public class WdlStringLiteral extends WdlLiteral {
    public final List<String> fragments;
    public final List<WdlExpression> placeholders;

    public WdlStringLiteral(@Nullable SourcePositionRange position,
                            List<String> fragments, List<WdlExpression> placeholders) {
        super(position);
        if (fragments.size() != placeholders.size() + 1)
            throw new IllegalArgumentException("Mismatched string fragments " + fragments + " and " + placeholders);
        this.fragments = Collections.unmodifiableList(fragments);
        this.placeholders = Collections.unmodifiableList(placeholders);
    }

    public WdlStringLiteral(String value) {
        this(null, Collections.singletonList(value), Collections.emptyList());
    }

    /**
     * True if the string contains no placeholders.
     */
    public boolean isConstant() {
        return this.placeholders.isEmpty();
    }

    /**
     * The string value; only valid for constant strings.
     */
    public String getValue() {
        if (!this.isConstant())
            throw new IllegalStateException("String with placeholders has no constant value: " + this);
        return this.fragments.get(0);
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        if (!visitor.preorder(this)) return;
        for (WdlExpression e: this.placeholders)
            e.accept(visitor);
        visitor.postorder(this);
    }
}
