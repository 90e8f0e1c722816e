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

package org.qnorm.normalizer.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.errors.CompilationError;
import org.qnorm.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Deserializes an AST written by {@link ToJsonVisitor}.
 * Each node class has a static method 'fromJson(JsonNode, JsonDecoder)'
 * which is located by reflection from the "class" property. */
public class JsonDecoder {
    static final String ROOT = "org.qnorm.normalizer.ast";
    static final List<String> PACKAGES = Arrays.asList(
            "", "query", "expression", "action");

    public JsonDecoder() {}

    /** Parse a JSON document and decode the AST it contains. */
    public static Ast fromJson(String json) {
        try {
            JsonNode node = Utilities.deterministicObjectMapper().readTree(json);
            return new JsonDecoder().decode(node);
        } catch (JsonProcessingException ex) {
            throw new CompilationError("Malformed JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    static Class<?> getClass(String simpleName) {
        for (String pack : PACKAGES) {
            String className = ROOT;
            if (!pack.isEmpty())
                className += "." + pack;
            className += "." + simpleName;
            try {
                Class<?> result = Class.forName(className);
                if (Ast.class.isAssignableFrom(result))
                    return result;
            } catch (ClassNotFoundException ignored) {
                // try the next package
            }
        }
        throw new CompilationError("Unknown AST class " + Utilities.singleQuote(simpleName));
    }

    public Ast decode(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object: " + Utilities.toDepth(node, 1));
        JsonNode cls = node.get("class");
        if (cls == null)
            throw new CompilationError("Node does not have 'class' field: " + Utilities.toDepth(node, 1));
        Class<?> clazz = getClass(cls.asText());
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            // Check if the method is static
            boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (!isStatic)
                throw new CompilationError(cls.asText() + ".fromJson is not static");
            return (Ast) method.invoke(null, node, this);
        } catch (NoSuchMethodException ex) {
            throw new CompilationError("Class " + Utilities.singleQuote(cls.asText()) +
                    " cannot be decoded", ex);
        } catch (IllegalAccessException ex) {
            throw new CompilationError("Cannot decode " + Utilities.singleQuote(cls.asText()), ex);
        } catch (InvocationTargetException ex) {
            if (ex.getCause() instanceof RuntimeException)
                throw (RuntimeException) ex.getCause();
            throw new CompilationError("Error decoding " + Utilities.singleQuote(cls.asText()), ex.getCause());
        }
    }

    public <T extends Ast> T decode(JsonNode node, Class<T> clazz) {
        Ast result = this.decode(node);
        T cast = result.as(clazz);
        if (cast == null)
            throw new CompilationError("Expected " + clazz.getSimpleName() + " but found " +
                    result.getClass().getSimpleName() + ": " + result);
        return cast;
    }

    public Ast decodeProperty(JsonNode node, String property) {
        return this.decode(Utilities.getProperty(node, property));
    }

    public <T extends Ast> T decodeProperty(JsonNode node, String property, Class<T> clazz) {
        return this.decode(Utilities.getProperty(node, property), clazz);
    }

    public <T extends Ast> List<T> decodeList(JsonNode node, String property, Class<T> clazz) {
        JsonNode array = Utilities.getProperty(node, property);
        if (!array.isArray())
            throw new CompilationError("Property " + Utilities.singleQuote(property) +
                    " is not an array: " + Utilities.toDepth(node, 1));
        List<T> result = new ArrayList<>();
        for (JsonNode element : array)
            result.add(this.decode(element, clazz));
        return result;
    }

    public <E extends Enum<E>> E decodeEnum(JsonNode node, String property, Class<E> clazz) {
        String name = Utilities.getStringProperty(node, property);
        try {
            return Enum.valueOf(clazz, name);
        } catch (IllegalArgumentException ex) {
            throw new CompilationError("Unknown " + clazz.getSimpleName() + " " +
                    Utilities.singleQuote(name), ex);
        }
    }

    /** The shape of the node; unknown if the node has no "quat" property. */
    public Quat decodeQuat(JsonNode node) {
        JsonNode quat = node.get("quat");
        if (quat == null)
            return Quat.UNKNOWN;
        return new Quat(quat.asText());
    }
}
