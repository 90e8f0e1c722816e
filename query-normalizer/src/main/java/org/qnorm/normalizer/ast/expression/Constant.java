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

package org.qnorm.normalizer.ast.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.errors.CompilationError;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;
import org.qnorm.util.Utilities;

/** A literal value: a String, a Long, a Double or a Boolean. */
public final class Constant extends Expression {
    public final Object value;

    public Constant(Object value) {
        Utilities.enforce(value instanceof String || value instanceof Long ||
                value instanceof Double || value instanceof Boolean,
                "Unsupported constant type " + value.getClass().getSimpleName());
        this.value = value;
    }

    public Constant(String value) {
        this((Object) value);
    }

    public Constant(long value) {
        this((Object) value);
    }

    public Constant(boolean value) {
        this((Object) value);
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        return this.equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.value.equals(((Constant) o).value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.value instanceof String)
            return builder.append(Utilities.doubleQuote((String) this.value));
        return builder.append(this.value.toString());
    }

    @SuppressWarnings("unused")
    public static Constant fromJson(JsonNode node, JsonDecoder decoder) {
        JsonNode value = Utilities.getProperty(node, "value");
        if (value.isTextual())
            return new Constant(value.asText());
        if (value.isBoolean())
            return new Constant(value.asBoolean());
        if (value.isIntegralNumber())
            return new Constant(value.asLong());
        if (value.isFloatingPointNumber())
            return new Constant((Object) value.asDouble());
        throw new CompilationError("Unsupported constant value " + Utilities.toDepth(value, 1));
    }
}
