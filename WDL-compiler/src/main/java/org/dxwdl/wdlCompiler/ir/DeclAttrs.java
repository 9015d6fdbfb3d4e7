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

package org.dxwdl.wdlCompiler.ir;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes of a declaration, such as help text or a default value.
 */
public class DeclAttrs {
    public static final String HELP = "help";
    public static final String STREAM = "stream";
    public static final String DEFAULT = "default";

    public static final DeclAttrs EMPTY = new DeclAttrs(new LinkedHashMap<>());

    final Map<String, String> attributes;

    DeclAttrs(LinkedHashMap<String, String> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /**
     * A copy of these attributes with an additional attribute.
     */
    public DeclAttrs with(String key, String value) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(this.attributes);
        copy.put(key, value);
        return new DeclAttrs(copy);
    }

    @Nullable
    public String get(String key) {
        return this.attributes.get(key);
    }

    public Map<String, String> asMap() {
        return this.attributes;
    }

    public boolean isEmpty() {
        return this.attributes.isEmpty();
    }

    @Override
    public String toString() {
        return this.attributes.toString();
    }
}
