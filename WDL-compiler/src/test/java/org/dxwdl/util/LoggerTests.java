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

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class LoggerTests implements IModule {
    @Test
    public void loggerTest() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        Logger.INSTANCE.setDebugLevel(this.getModule(), 1);
        Assert.assertEquals("LoggerTests", this.getModule());
        Logger.INSTANCE.from(this, 1)
                .append("Logging one statement")
                .newline();
        Logger.INSTANCE.setDebugLevel(this.getModule(), 0);
        Logger.INSTANCE.from(this, 1)
                .append("This one is not logged")
                .newline();
        Logger.INSTANCE.setDebugStream(save);
        Assert.assertEquals("Logging one statement\n", builder.toString());
    }

    @Test
    public void linqTest() {
        Assert.assertEquals(Arrays.asList(2, 4, 6), Linq.map(Arrays.asList(1, 2, 3), x -> x * 2));
    }

    @Test
    public void nameGenTest() {
        NameGen gen = new NameGen("stage_");
        Assert.assertEquals(0, gen.nextId());
        Assert.assertEquals(1, gen.nextId());
        Assert.assertEquals("stage_2", gen.toString());
    }
}
