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

package org.dxwdl.wdlCompiler.compiler;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Packages options for a compiler from WDL to the workflow IR.
 */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /**
     * Options that control the lowering.
     */
    @SuppressWarnings("CanBeFinal")
    public static class Lowering {
        @Parameter(names = "--destination", description = "Platform folder where the applets are placed")
        public String destination = "/";
        @Parameter(names = "--reorg", description = "Add a stage that reorganizes the workflow outputs")
        public boolean reorg = false;
        /**
         * If true, complex call arguments are not moved into separate declarations.
         */
        @Parameter(names = "--no-lift", description = "Do not lift complex expressions out of calls")
        public boolean noLift = false;
        @Parameter(names = "--instance-types", description = "JSON file describing the platform instance types")
        @Nullable
        public String instanceTypes = null;
        @Parameter(names = "--assets", description = "JSON file mapping asset URLs to asset references")
        @Nullable
        public String assets = null;
    }

    /**
     * Options related to input and output.
     */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @Parameter(names = "-o", description = "Output file; stdout if null")
        @Nullable
        public String outputFile = null;
        @Parameter(names = "-je", description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(description = "Input file to compile; stdin if missing")
        @Nullable
        public String inputFile = null;
        @Parameter(names = "-I", description = "Directory searched for imported files; can be repeated")
        public List<String> importDirectories = new ArrayList<>();
        @Parameter(names = "-v", description = "Verbosity of the log written to stderr")
        public int verbosity = 0;
    }

    @Parameter(names = {"-h", "--help"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Lowering loweringOptions = new Lowering();
}
