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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves platform asset URLs (dx://...) used as docker images
 * to direct asset references.
 */
public class AssetResolver implements IModule {
    public static final String PLATFORM_SCHEME = "dx://";
    /**
     * An asset that is already referenced by project and record ids.
     */
    static final Pattern DIRECT_REFERENCE =
            Pattern.compile("^dx://project-[A-Za-z0-9]+:record-[A-Za-z0-9]+$");

    /**
     * Maps asset URLs to direct references.
     */
    final Map<String, String> known;

    public static final AssetResolver EMPTY = new AssetResolver(new LinkedHashMap<>());

    public AssetResolver(LinkedHashMap<String, String> known) {
        this.known = Collections.unmodifiableMap(known);
    }

    /**
     * Load a JSON object that maps asset URLs to direct references.
     */
    public static AssetResolver load(Path file) throws IOException {
        JsonNode node = new ObjectMapper().readTree(Files.readAllBytes(file));
        if (!node.isObject())
            throw new IOException("Expected a JSON object mapping asset names to references");
        LinkedHashMap<String, String> known = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual())
                throw new IOException("Asset reference for " + field.getKey() + " is not a string");
            known.put(field.getKey(), field.getValue().asText());
        }
        return new AssetResolver(known);
    }

    public static boolean isPlatformUrl(String url) {
        return url.startsWith(PLATFORM_SCHEME);
    }

    /**
     * Resolve an asset URL.
     * @throws LoweringException UnresolvedPlatformAsset if the URL is unknown.
     */
    public String resolve(String url) {
        String result;
        if (DIRECT_REFERENCE.matcher(url).matches()) {
            result = url;
        } else {
            result = this.known.get(url);
            if (result == null)
                throw new LoweringException(LoweringException.Kind.UnresolvedPlatformAsset,
                        "Cannot resolve platform asset " + Utilities.singleQuote(url));
        }
        Logger.INSTANCE.from(this, 1)
                .append("Resolved asset ")
                .append(url)
                .append(" to ")
                .append(result)
                .newline();
        return result;
    }
}
