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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An environment: maps fully qualified source names such as x, A.x or A.B.x
 * to the variables that hold their values.  Environments are immutable;
 * every extension produces a new environment.  Iteration follows insertion order.
 */
public class CallEnv {
    public static final CallEnv EMPTY = new CallEnv(new LinkedHashMap<>());

    private final Map<String, LinkedVar> bindings;

    private CallEnv(LinkedHashMap<String, LinkedVar> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    /**
     * An environment with one more binding.  If the name is already bound
     * the new binding replaces it, keeping the original position.
     */
    public CallEnv plus(String name, LinkedVar var) {
        LinkedHashMap<String, LinkedVar> copy = new LinkedHashMap<>(this.bindings);
        copy.put(name, var);
        return new CallEnv(copy);
    }

    public CallEnv plusAll(CallEnv other) {
        if (other.isEmpty())
            return this;
        LinkedHashMap<String, LinkedVar> copy = new LinkedHashMap<>(this.bindings);
        copy.putAll(other.bindings);
        return new CallEnv(copy);
    }

    @Nullable
    public LinkedVar get(String name) {
        return this.bindings.get(name);
    }

    public boolean containsKey(String name) {
        return this.bindings.containsKey(name);
    }

    public Set<Map.Entry<String, LinkedVar>> entrySet() {
        return this.bindings.entrySet();
    }

    public Set<String> keySet() {
        return this.bindings.keySet();
    }

    public Collection<LinkedVar> values() {
        return this.bindings.values();
    }

    public int size() {
        return this.bindings.size();
    }

    public boolean isEmpty() {
        return this.bindings.isEmpty();
    }

    @Override
    public String toString() {
        return this.bindings.toString();
    }
}
