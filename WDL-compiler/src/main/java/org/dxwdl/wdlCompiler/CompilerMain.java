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

package org.dxwdl.wdlCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.dxwdl.wdlCompiler.compiler.CompilerOptions;
import org.dxwdl.wdlCompiler.compiler.WdlCompiler;
import org.dxwdl.wdlCompiler.compiler.errors.CompilerMessages;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;
import org.dxwdl.wdlCompiler.compiler.visitors.ToJSONVisitor;
import org.dxwdl.wdlCompiler.ir.IRNamespace;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Main entry point of the WDL compiler.
 */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    /**
     * Parse the command line.
     * @return false if the compiler should not run.
     */
    boolean parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("wdl-to-ir");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            commander.usage();
            return false;
        }
        if (this.options.help) {
            commander.usage();
            return false;
        }
        return true;
    }

    void writeToOutput(String program, @Nullable String outputFile) throws IOException {
        PrintStream outputStream;
        if (outputFile == null) {
            outputStream = System.out;
        } else {
            outputStream = new PrintStream(Files.newOutputStream(Paths.get(outputFile)));
        }
        outputStream.print(program);
        if (outputFile != null)
            outputStream.close();
        else
            outputStream.flush();
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null) {
            return System.in;
        } else {
            return Files.newInputStream(Paths.get(inputFile));
        }
    }

    /**
     * Run compiler, return the messages produced.
     */
    CompilerMessages run() {
        WdlCompiler compiler = new WdlCompiler(this.options);
        try {
            InputStream input = this.getInputFile(this.options.ioOptions.inputFile);
            compiler.setEntireInput(this.options.ioOptions.inputFile, input);
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID, false,
                    "Error reading file", e.getMessage());
            return compiler.messages;
        }
        compiler.compileInput();
        if (compiler.hasErrors())
            return compiler.messages;
        IRNamespace ir = Objects.requireNonNull(compiler.getIR());
        String output = ToJSONVisitor.irToJSON(ir);
        try {
            this.writeToOutput(output, this.options.ioOptions.outputFile);
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID,
                    false, "Error writing to file", e.getMessage());
        }
        return compiler.messages;
    }

    /**
     * Run the compiler with the given command line.
     * @return the messages produced, or null if the command line was not accepted.
     */
    @Nullable
    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        if (!main.parseOptions(argv))
            return null;
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        if (messages == null)
            System.exit(1);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
