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

import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.ast.WdlPairType;
import org.dxwdl.wdlCompiler.frontend.ast.WdlPrimitiveType;
import org.dxwdl.wdlCompiler.frontend.ast.WdlType;
import org.dxwdl.wdlCompiler.ir.CVar;
import org.dxwdl.wdlCompiler.ir.CallEnv;
import org.dxwdl.wdlCompiler.ir.LinkedVar;
import org.dxwdl.wdlCompiler.ir.SArg;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;

public class ClosureAnalyzerTests {
    static LinkedVar input(String name, WdlType type) {
        CVar var = new CVar(name, type);
        return new LinkedVar(var, new SArg.WorkflowInput(var));
    }

    static LinkedVar link(String stage, String name, WdlType type) {
        CVar var = new CVar(name, type);
        return new LinkedVar(var, new SArg.Link(stage, var));
    }

    final CallEnv env = CallEnv.EMPTY
            .plus("a", input("a", WdlPrimitiveType.INT))
            .plus("b", input("b", WdlPrimitiveType.INT))
            .plus("s", input("s", WdlPrimitiveType.STRING))
            .plus("A.x", link("A", "x", WdlPrimitiveType.INT))
            .plus("P.p", link("P", "p", new WdlPairType(WdlPrimitiveType.INT, WdlPrimitiveType.STRING)));

    CallEnv closure(String expression) {
        return ClosureAnalyzer.closure(this.env, WdlFrontend.parseExpression(expression));
    }

    /**
     * Every binding in a closure is the binding of the environment.
     */
    void checkSound(CallEnv closure) {
        for (Map.Entry<String, LinkedVar> entry: closure.entrySet())
            Assert.assertSame(this.env.get(entry.getKey()), entry.getValue());
    }

    @Test
    public void identifierTest() {
        CallEnv closure = this.closure("a");
        Assert.assertEquals(new HashSet<>(Arrays.asList("a")), closure.keySet());
        this.checkSound(closure);
    }

    @Test
    public void expressionTest() {
        CallEnv closure = this.closure("a + A.x * 2");
        Assert.assertEquals(new HashSet<>(Arrays.asList("a", "A.x")), closure.keySet());
        this.checkSound(closure);
    }

    @Test
    public void unknownNamesAreIgnoredTest() {
        CallEnv closure = this.closure("local + b");
        Assert.assertEquals(new HashSet<>(Arrays.asList("b")), closure.keySet());
        this.checkSound(closure);
    }

    @Test
    public void constantTest() {
        Assert.assertTrue(this.closure("1 + 2").isEmpty());
    }

    @Test
    public void trailSearchTest() {
        // P.p.left is a member access of the pair P.p
        CallEnv closure = this.closure("P.p.left");
        Assert.assertEquals(new HashSet<>(Arrays.asList("P.p")), closure.keySet());
        this.checkSound(closure);
        closure = this.closure("length([P.p.right, s])");
        Assert.assertEquals(new HashSet<>(Arrays.asList("P.p", "s")), closure.keySet());
        this.checkSound(closure);
    }

    @Test
    public void interpolationTest() {
        CallEnv closure = this.closure("\"prefix ${s} ${a}\"");
        Assert.assertEquals(new HashSet<>(Arrays.asList("s", "a")), closure.keySet());
        this.checkSound(closure);
    }

    @Test
    public void updateClosureTest() {
        CallEnv closure = ClosureAnalyzer.closure(this.env, WdlFrontend.parseExpression("a"));
        closure = ClosureAnalyzer.updateClosure(closure, this.env, WdlFrontend.parseExpression("b + A.x"));
        Assert.assertEquals(new HashSet<>(Arrays.asList("a", "b", "A.x")), closure.keySet());
        this.checkSound(closure);
    }

    CallEnv update(CallEnv closure, String expression) {
        return ClosureAnalyzer.updateClosure(closure, this.env, WdlFrontend.parseExpression(expression));
    }

    /**
     * Same keys, each bound to the same object.
     */
    static void assertSameBindings(CallEnv expected, CallEnv actual) {
        Assert.assertEquals(expected.keySet(), actual.keySet());
        for (String key: expected.keySet())
            Assert.assertSame(expected.get(key), actual.get(key));
    }

    @Test
    public void updateClosureIdempotentTest() {
        CallEnv start = this.closure("s");
        CallEnv once = this.update(start, "A.x + a");
        CallEnv twice = this.update(once, "A.x + a");
        Assert.assertEquals(3, twice.size());
        assertSameBindings(once, twice);
        this.checkSound(twice);
    }

    @Test
    public void updateClosureOrderTest() {
        CallEnv forward = this.update(this.update(CallEnv.EMPTY, "A.x"), "A.x + a");
        CallEnv backward = this.update(this.update(CallEnv.EMPTY, "A.x + a"), "A.x");
        Assert.assertEquals(new HashSet<>(Arrays.asList("A.x", "a")), forward.keySet());
        assertSameBindings(forward, backward);
        this.checkSound(forward);

        // Grouping does not matter either
        CallEnv left = this.update(this.update(this.closure("P.p.left"), "b"), "A.x + s");
        CallEnv right = this.update(this.closure("P.p.left"), "b + (A.x + s)");
        assertSameBindings(left, right);
    }

    @Test
    public void lookupExactTest() {
        LinkedVar var = ClosureAnalyzer.lookupExact(this.env, WdlFrontend.parseExpression("A.x"));
        Assert.assertSame(this.env.get("A.x"), var);
        try {
            ClosureAnalyzer.lookupExact(this.env, WdlFrontend.parseExpression("B.y"));
            Assert.fail("Expected an exception");
        } catch (LoweringException ex) {
            Assert.assertEquals(LoweringException.Kind.MissingVariableReference, ex.kind);
            Assert.assertTrue(ex.getMessage().contains("B.y"));
        }
    }
}
