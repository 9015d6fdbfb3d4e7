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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxwdl.util.IModule;
import org.dxwdl.util.Logger;
import org.dxwdl.util.Utilities;
import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.frontend.values.WdlFloatValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlIntValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlStringValue;
import org.dxwdl.wdlCompiler.frontend.values.WdlValue;
import org.dxwdl.wdlCompiler.ir.PlatformInstance;

import javax.annotation.Nullable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The table of instance types available on the platform,
 * and the logic to choose one for the runtime requirements of a task.
 */
public class InstanceTypeDB implements IModule {
    static final String BUILT_IN_RESOURCE = "/instance-types.json";
    static final long MiB = 1024L * 1024L;

    public final List<PlatformInstance> instances;

    public InstanceTypeDB(List<PlatformInstance> instances) {
        this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
    }

    /**
     * The instance table shipped with the compiler.
     */
    public static InstanceTypeDB builtIn() {
        try (InputStream stream = InstanceTypeDB.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (stream == null)
                throw new FileNotFoundException("Resource " + BUILT_IN_RESOURCE + " not found");
            return fromJson(new ObjectMapper().readTree(stream));
        } catch (IOException ex) {
            throw new RuntimeException("Cannot load the built-in instance types", ex);
        }
    }

    /**
     * Load an instance table from a JSON file: an array of objects
     * with the fields name, memoryMiB, diskGiB, cpu, and price.
     */
    public static InstanceTypeDB load(Path file) throws IOException {
        JsonNode node = new ObjectMapper().readTree(Files.readAllBytes(file));
        return fromJson(node);
    }

    static InstanceTypeDB fromJson(JsonNode node) throws IOException {
        if (!node.isArray())
            throw new IOException("Expected a JSON array of instance types");
        List<PlatformInstance> instances = new ArrayList<>();
        for (JsonNode element: node) {
            for (String field: new String[] { "name", "memoryMiB", "diskGiB", "cpu", "price" })
                if (!element.has(field))
                    throw new IOException("Instance type description is missing field " + field + ": " + element);
            instances.add(new PlatformInstance(
                    element.get("name").asText(),
                    element.get("memoryMiB").asLong(),
                    element.get("diskGiB").asLong(),
                    element.get("cpu").asInt(),
                    element.get("price").asDouble()));
        }
        return new InstanceTypeDB(instances);
    }

    @Nullable
    public PlatformInstance find(String name) {
        for (PlatformInstance instance: this.instances)
            if (instance.name.equals(name))
                return instance;
        return null;
    }

    static final Pattern MEMORY = Pattern.compile("^\\s*([0-9]+(\\.[0-9]*)?)\\s*([A-Za-z]*)\\s*$");

    static long unitMultiplier(String unit, String text) {
        switch (unit) {
            case "":
            case "B":
                return 1;
            case "K":
            case "KB":
                return 1000L;
            case "KiB":
                return 1024L;
            case "M":
            case "MB":
                return 1000L * 1000;
            case "MiB":
                return MiB;
            case "G":
            case "GB":
                return 1000L * 1000 * 1000;
            case "GiB":
                return 1024L * MiB;
            case "T":
            case "TB":
                return 1000L * 1000 * 1000 * 1000;
            case "TiB":
                return 1024L * 1024 * MiB;
            default:
                throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                        "Unknown memory unit " + Utilities.singleQuote(unit) + " in " + text);
        }
    }

    /**
     * Parse a memory requirement, e.g. "4 GB", "512 MiB", or a number of bytes.
     * @return the requirement in MiB, rounded up.
     */
    public static long parseMemoryMiB(WdlValue memory) {
        double bytes;
        if (memory.is(WdlIntValue.class)) {
            bytes = memory.to(WdlIntValue.class).value;
        } else if (memory.is(WdlFloatValue.class)) {
            bytes = memory.to(WdlFloatValue.class).value;
        } else if (memory.is(WdlStringValue.class)) {
            String text = memory.to(WdlStringValue.class).value;
            Matcher matcher = MEMORY.matcher(text);
            if (!matcher.matches())
                throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                        "Cannot parse memory requirement " + Utilities.singleQuote(text));
            bytes = Double.parseDouble(matcher.group(1)) * unitMultiplier(matcher.group(3), text);
        } else {
            throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                    "Unexpected memory requirement " + memory);
        }
        return (long) Math.ceil(bytes / MiB);
    }

    static final Pattern DISKS = Pattern.compile("^\\s*(local-disk\\s+)?([0-9]+)(\\s+\\w+)?\\s*$");

    /**
     * Parse a disk requirement, e.g. "local-disk 100 SSD", or a number of GiB.
     */
    public static long parseDiskGiB(WdlValue disks) {
        if (disks.is(WdlIntValue.class))
            return disks.to(WdlIntValue.class).value;
        if (disks.is(WdlStringValue.class)) {
            String text = disks.to(WdlStringValue.class).value;
            Matcher matcher = DISKS.matcher(text);
            if (matcher.matches())
                return Long.parseLong(matcher.group(2));
        }
        throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                "Cannot parse disk requirement " + disks);
    }

    public static int parseCpu(WdlValue cpu) {
        if (cpu.is(WdlIntValue.class))
            return (int) cpu.to(WdlIntValue.class).value;
        if (cpu.is(WdlFloatValue.class))
            return (int) Math.ceil(cpu.to(WdlFloatValue.class).value);
        if (cpu.is(WdlStringValue.class)) {
            String text = cpu.to(WdlStringValue.class).value.trim();
            try {
                return (int) Math.ceil(Double.parseDouble(text));
            } catch (NumberFormatException ex) {
                throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                        "Cannot parse cpu requirement " + Utilities.singleQuote(text), ex);
            }
        }
        throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                "Unexpected cpu requirement " + cpu);
    }

    /**
     * Choose an instance type for the runtime requirements of a task.
     * Each argument is null if the corresponding attribute is missing.
     * @param instanceTypeName  An explicit instance type name, which must exist.
     * @return the cheapest instance that satisfies all requirements.
     */
    public PlatformInstance choose(@Nullable WdlValue instanceTypeName, @Nullable WdlValue memory,
                                   @Nullable WdlValue disks, @Nullable WdlValue cpu) {
        if (instanceTypeName != null) {
            String name = instanceTypeName.asString();
            PlatformInstance instance = this.find(name);
            if (instance == null)
                throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                        "Unknown instance type " + Utilities.singleQuote(name));
            return instance;
        }

        long memoryMiB = memory == null ? 0 : parseMemoryMiB(memory);
        long diskGiB = disks == null ? 0 : parseDiskGiB(disks);
        int cpuCount = cpu == null ? 0 : parseCpu(cpu);
        PlatformInstance best = null;
        for (PlatformInstance instance: this.instances) {
            if (instance.memoryMiB < memoryMiB || instance.diskGiB < diskGiB || instance.cpu < cpuCount)
                continue;
            if (best == null || instance.price < best.price)
                best = instance;
        }
        if (best == null)
            throw new LoweringException(LoweringException.Kind.NoSuitableInstanceType,
                    "No instance type has " + memoryMiB + " MiB of memory, " +
                            diskGiB + " GiB of disk, and " + cpuCount + " CPUs");
        Logger.INSTANCE.from(this, 1)
                .append("Chose instance type ")
                .append(best.name)
                .newline();
        return best;
    }
}
