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
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;

import java.util.Objects;

/** Aggregates all rows of the source into a single value. */
public final class Aggregation extends Query {
    public final AggregationOperator operator;
    public final Ast query;

    public Aggregation(AggregationOperator operator, Ast query) {
        this.operator = operator;
        this.query = query;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("query");
        this.query.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Aggregation o = other.as(Aggregation.class);
        if (o == null)
            return false;
        return this.operator == o.operator && this.query == o.query;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Aggregation that = (Aggregation) o;
        return this.operator == that.operator && this.query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.operator, this.query);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.query)
                .append(".")
                .append(this.operator.text);
    }

    @SuppressWarnings("unused")
    public static Aggregation fromJson(JsonNode node, JsonDecoder decoder) {
        AggregationOperator operator = decoder.decodeEnum(node, "operator", AggregationOperator.class);
        Ast query = decoder.decodeProperty(node, "query");
        return new Aggregation(operator, query);
    }
}
