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

package org.qnorm.normalizer.ast.query;

import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;
import org.qnorm.util.Linq;
import org.qnorm.util.Utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** An opaque literal fragment of the target language, with interpolated
 * parameters between its parts: part0 param0 part1 param1 ... partN.
 * As a query source it introduces no identifiers. */
public final class Infix extends Query {
    public final List<String> parts;
    public final List<Ast> params;
    /** True if evaluating the fragment has no side effects. */
    public final boolean pure;
    public final Quat quat;

    public Infix(List<String> parts, List<Ast> params, boolean pure, Quat quat) {
        Utilities.enforce(parts.size() == params.size() + 1,
                "Infix with " + parts.size() + " parts and " + params.size() + " parameters");
        this.parts = parts;
        this.params = params;
        this.pure = pure;
        this.quat = quat;
    }

    public Infix withParams(List<Ast> params) {
        return new Infix(this.parts, params, this.pure, this.quat);
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("params");
        int index = 0;
        for (Ast param: this.params) {
            visitor.propertyIndex(index++);
            param.accept(visitor);
        }
        visitor.endArrayProperty("params");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Infix o = other.as(Infix.class);
        if (o == null)
            return false;
        return this.parts.equals(o.parts) &&
                Linq.same(this.params, o.params) &&
                this.pure == o.pure &&
                this.quat.equals(o.quat);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Infix infix = (Infix) o;
        return this.pure == infix.pure &&
                this.parts.equals(infix.parts) &&
                this.params.equals(infix.params) &&
                this.quat.equals(infix.quat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.parts, this.params, this.pure, this.quat);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("sql\"");
        for (int i = 0; i < this.parts.size(); i++) {
            builder.append(this.parts.get(i));
            if (i < this.params.size())
                builder.append("${").append(this.params.get(i)).append("}");
        }
        return builder.append("\"");
    }

    @SuppressWarnings("unused")
    public static Infix fromJson(JsonNode node, JsonDecoder decoder) {
        List<String> parts = new ArrayList<>();
        for (JsonNode part: Utilities.getProperty(node, "parts"))
            parts.add(part.asText());
        List<Ast> params = decoder.decodeList(node, "params", Ast.class);
        boolean pure = Utilities.getBooleanProperty(node, "pure");
        Quat quat = decoder.decodeQuat(node);
        return new Infix(parts, params, pure, quat);
    }
}
