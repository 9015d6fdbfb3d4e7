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

import org.dxwdl.wdlCompiler.frontend.values.*;
import org.junit.Assert;
import org.junit.Test;

public class ConstantEvaluatorTests {
    final ExpressionEvaluator evaluator = new ConstantEvaluator();

    WdlValue evaluate(String expression) {
        return this.evaluator.evaluateConstant(WdlFrontend.parseExpression(expression));
    }

    void checkFails(String expression) {
        try {
            this.evaluate(expression);
            Assert.fail("Expected " + expression + " to fail");
        } catch (EvaluationException ex) {
            Assert.assertNotNull(ex.getMessage());
        }
    }

    @Test
    public void arithmeticTest() {
        Assert.assertEquals(new WdlIntValue(7), this.evaluate("1 + 2 * 3"));
        Assert.assertEquals(new WdlIntValue(2), this.evaluate("5 / 2"));
        Assert.assertEquals(new WdlFloatValue(2.5), this.evaluate("5.0 / 2"));
        Assert.assertEquals(new WdlIntValue(-4), this.evaluate("-(2 + 2)"));
        this.checkFails("7 / 0");
        this.checkFails("1 + true");
    }

    @Test
    public void stringTest() {
        Assert.assertEquals(new WdlStringValue("ab"), this.evaluate("\"a\" + \"b\""));
        Assert.assertEquals(new WdlStringValue("n=3"), this.evaluate("\"n=${1 + 2}\""));
        Assert.assertEquals(new WdlStringValue("x1"), this.evaluate("\"x\" + 1"));
    }

    @Test
    public void logicTest() {
        Assert.assertEquals(WdlBooleanValue.TRUE, this.evaluate("1 < 2 && !false"));
        Assert.assertEquals(new WdlStringValue("no"), this.evaluate("if 1 > 2 then \"yes\" else \"no\""));
        Assert.assertEquals(WdlBooleanValue.FALSE, this.evaluate("\"a\" == \"b\""));
    }

    @Test
    public void collectionTest() {
        Assert.assertEquals(new WdlIntValue(2), this.evaluate("[1, 2, 3][1]"));
        Assert.assertEquals(new WdlIntValue(3), this.evaluate("length([1, 2, 3])"));
        Assert.assertEquals(new WdlIntValue(5), this.evaluate("{\"a\": 5}[\"a\"]"));
        Assert.assertEquals(new WdlIntValue(1), this.evaluate("(1, \"x\").left"));
        this.checkFails("[1, 2][5]");
    }

    @Test
    public void variablesTest() {
        WdlValue value = this.evaluator.evaluate(WdlFrontend.parseExpression("x + 1"),
                name -> new WdlIntValue(41));
        Assert.assertEquals(new WdlIntValue(42), value);
        this.checkFails("x + 1");
        this.checkFails("read_int(\"file.txt\")");
    }
}
