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

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.wdlCompiler.compiler.errors.CompilerMessages;
import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.compiler.errors.SourceFileContents;
import org.dxwdl.wdlCompiler.compiler.errors.SourcePositionRange;
import org.dxwdl.wdlCompiler.compiler.errors.Unimplemented;
import org.dxwdl.wdlCompiler.compiler.errors.WdlSyntaxException;
import org.dxwdl.wdlCompiler.compiler.lowering.AssetResolver;
import org.dxwdl.wdlCompiler.compiler.lowering.InstanceTypeDB;
import org.dxwdl.wdlCompiler.compiler.lowering.LoweringSession;
import org.dxwdl.wdlCompiler.compiler.lowering.NamespaceCompiler;
import org.dxwdl.wdlCompiler.frontend.ExpressionLifter;
import org.dxwdl.wdlCompiler.frontend.ImportResolver;
import org.dxwdl.wdlCompiler.frontend.SourceScanner;
import org.dxwdl.wdlCompiler.frontend.WdlFrontend;
import org.dxwdl.wdlCompiler.frontend.WdlPrettyPrinter;
import org.dxwdl.wdlCompiler.frontend.ast.WdlNamespace;
import org.dxwdl.wdlCompiler.frontend.values.ConstantEvaluator;
import org.dxwdl.wdlCompiler.ir.IRNamespace;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * This class compiles WDL documents into the workflow IR.
 * It is designed to be used either as a library or through the command line.
 * A compiler instance compiles exactly one document;
 * errors are accumulated in 'messages' instead of being thrown.
 */
public class WdlCompiler implements IModule {
    enum InputSource {
        /**
         * No data source set yet.
         */
        None,
        /**
         * Data received from stdin.
         */
        Stdin,
        /**
         * Data read from a file.  Imports are searched next to it first.
         */
        File,
        /**
         * Data received through an API call (compileProgram).
         */
        API,
    }

    /**
     * Modules whose log level is controlled by the -v option.
     */
    static final String[] LOGGED_MODULES = {
            "WdlCompiler", "WdlFrontend", "ImportResolver", "ExpressionLifter",
            "NamespaceCompiler", "WorkflowCompiler", "BlockCompiler", "CallCompiler",
            "TaskCompiler", "ProgramValidator", "InstanceTypeDB", "AssetResolver",
    };

    final WdlFrontend frontend;
    public final CompilerOptions options;
    public final CompilerMessages messages;
    public final SourceFileContents sources;
    public InputSource inputSources = InputSource.None;
    /**
     * IR produced by the compiler.  Once produced, nothing more can be compiled.
     */
    @Nullable
    IRNamespace ir;

    public WdlCompiler(CompilerOptions options) {
        this.options = options;
        this.frontend = new WdlFrontend();
        this.sources = new SourceFileContents();
        this.messages = new CompilerMessages(options, this.sources);
        this.ir = null;
        if (options.ioOptions.verbosity > 0) {
            for (String module: LOGGED_MODULES)
                Logger.INSTANCE.setDebugLevel(module, options.ioOptions.verbosity);
        }
    }

    public void reportError(SourcePositionRange range, boolean warning,
                            String errorType, String message) {
        this.messages.reportError(range, warning, errorType, message);
    }

    void checkNoIR() {
        if (this.ir != null)
            throw new RuntimeException("No more programs can be compiled once the IR has been produced");
    }

    void setSource(InputSource source) {
        this.checkNoIR();
        if (this.inputSources != InputSource.None)
            throw new RuntimeException("Input data already received from " + this.inputSources);
        this.inputSources = source;
    }

    ImportResolver createImportResolver() {
        List<Path> directories = new ArrayList<>();
        for (String dir: this.options.ioOptions.importDirectories)
            directories.add(Paths.get(dir));
        ImportResolver resolver = new ImportResolver(directories);
        String input = this.options.ioOptions.inputFile;
        if (this.inputSources == InputSource.File && input != null) {
            Path parent = Paths.get(input).toAbsolutePath().getParent();
            if (parent != null)
                resolver = resolver.withFirstDirectory(parent);
        }
        return resolver;
    }

    LoweringSession createSession(Map<String, String> taskSources) throws IOException {
        CompilerOptions.Lowering lowering = this.options.loweringOptions;
        InstanceTypeDB instanceTypes = lowering.instanceTypes == null ?
                InstanceTypeDB.builtIn() : InstanceTypeDB.load(Paths.get(lowering.instanceTypes));
        AssetResolver assets = lowering.assets == null ?
                AssetResolver.EMPTY : AssetResolver.load(Paths.get(lowering.assets));
        return new LoweringSession(lowering.destination, lowering.reorg,
                new ConstantEvaluator(), instanceTypes, assets, taskSources);
    }

    private void compileInternal(String program) {
        this.checkNoIR();
        if (this.inputSources == InputSource.API)
            this.sources.append(program);
        try {
            WdlNamespace namespace = this.frontend.parse(program, this.createImportResolver());
            if (!this.options.loweringOptions.noLift) {
                namespace = ExpressionLifter.lift(namespace);
                Logger.INSTANCE.from(this, 2)
                        .append("Program after lifting expressions")
                        .newline()
                        .append(WdlPrettyPrinter.toString(namespace))
                        .newline();
            }
            LoweringSession session = this.createSession(SourceScanner.scanForTasks(program));
            NamespaceCompiler compiler = new NamespaceCompiler(session);
            this.ir = compiler.compile(namespace);
            Logger.INSTANCE.from(this, 1)
                    .append("Produced ")
                    .append(this.ir.applets.size())
                    .append(" applets")
                    .newline();
        } catch (WdlSyntaxException e) {
            this.messages.reportError(e);
        } catch (LoweringException e) {
            this.messages.reportError(e);
        } catch (Unimplemented e) {
            this.messages.reportError(e);
        } catch (IOException e) {
            this.reportError(SourcePositionRange.INVALID, false,
                    "Error reading file", e.getMessage());
        } catch (Throwable e) {
            this.messages.reportError(e);
        }
    }

    /**
     * Compile a program supplied as a string.
     * Imports are resolved in the directories given with -I.
     */
    public void compileProgram(String program) {
        this.setSource(InputSource.API);
        this.compileInternal(program);
    }

    public void setEntireInput(@Nullable String filename, InputStream contents) throws IOException {
        if (filename != null)
            this.setSource(InputSource.File);
        else
            this.setSource(InputSource.Stdin);
        this.sources.setEntireInput(filename, contents);
    }

    public void compileInput() {
        if (this.inputSources == InputSource.None)
            throw new RuntimeException("compileInput has been called without calling setEntireInput");
        this.compileInternal(this.sources.getWholeProgram());
    }

    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    /**
     * The IR produced by the compilation, or null if compilation failed.
     */
    @Nullable
    public IRNamespace getIR() {
        return this.ir;
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /**
     * Throw if any error has been encountered.
     * Displays the errors on stderr as well.
     */
    public void throwOnError() {
        if (this.hasErrors()) {
            this.showErrors(System.err);
            throw new RuntimeException("Error during compilation");
        }
    }
}
