/*
 * Copyright 2023 VMware, Inc.
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

package org.qnorm.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jetbrains.annotations.Contract;
import org.qnorm.normalizer.errors.CompilationError;
import org.qnorm.normalizer.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class Utilities {
    private Utilities() {}

    /** Checks an internal invariant; unlike assert it cannot be disabled.
     * @param expression  When false, an {@link InternalCompilerError} carrying message is thrown. */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message);
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Just adds single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    /** Add double quotes around string and escape symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escapeDoubleQuotes(value) + "\"";
    }

    public static String escapeDoubleQuotes(String value) {
        StringBuilder builder = new StringBuilder();
        for (char c: value.toCharArray()) {
            if (c == '"' || c == '\\')
                builder.append('\\');
            builder.append(c);
        }
        return builder.toString();
    }

    /** Removes and returns the last element; lists used as stacks. */
    public static <T> T removeLast(List<T> data) {
        T result = last(data);
        data.remove(data.size() - 1);
        return result;
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Empty stack");
        return data.get(data.size() - 1);
    }

    public static String readStream(InputStream stream) throws IOException {
        return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }

    /** The JSON representation of a node, truncated at the specified depth. */
    public static String toDepth(JsonNode node, int depth) {
        if (depth <= 0 || !node.isContainerNode())
            return node.isContainerNode() ? "..." : node.toString();
        StringBuilder builder = new StringBuilder();
        if (node.isArray()) {
            builder.append("[");
            boolean first = true;
            for (JsonNode child: node) {
                if (!first)
                    builder.append(", ");
                first = false;
                builder.append(toDepth(child, depth - 1));
            }
            builder.append("]");
        } else {
            builder.append("{");
            boolean first = true;
            for (var it = node.fields(); it.hasNext(); ) {
                var field = it.next();
                if (!first)
                    builder.append(", ");
                first = false;
                builder.append(doubleQuote(field.getKey()))
                        .append(": ")
                        .append(toDepth(field.getValue(), depth - 1));
            }
            builder.append("}");
        }
        return builder.toString();
    }

    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null)
            throw new CompilationError("Node does not have property " + singleQuote(property) +
                    " " + toDepth(node, 1));
        return prop;
    }

    public static String getStringProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asText();
    }

    public static boolean getBooleanProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asBoolean();
    }
}
