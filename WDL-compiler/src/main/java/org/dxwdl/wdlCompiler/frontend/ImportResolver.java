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

import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the documents named in import statements.
 * Relative paths are searched in a list of directories, in order.
 */
public class ImportResolver implements IModule {
    final List<Path> directories;

    public ImportResolver(List<Path> directories) {
        this.directories = new ArrayList<>(directories);
    }

    public ImportResolver() {
        this(new ArrayList<>());
    }

    /**
     * A resolver that searches 'directory' first and then this resolver's directories.
     */
    public ImportResolver withFirstDirectory(Path directory) {
        List<Path> dirs = new ArrayList<>();
        dirs.add(directory);
        dirs.addAll(this.directories);
        return new ImportResolver(dirs);
    }

    /**
     * Find the document with the given uri and return its contents.
     */
    public String resolve(String uri) throws IOException {
        Path path = Paths.get(uri);
        if (path.isAbsolute()) {
            if (Files.isRegularFile(path))
                return this.read(path);
        } else {
            for (Path directory: this.directories) {
                Path candidate = directory.resolve(path);
                if (Files.isRegularFile(candidate))
                    return this.read(candidate);
            }
        }
        throw new FileNotFoundException("Cannot find imported file " + uri + " in " + this.directories);
    }

    String read(Path path) throws IOException {
        Logger.INSTANCE.from(this, 1)
                .append("Reading ")
                .append(path.toString())
                .newline();
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
