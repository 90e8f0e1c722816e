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

/** Skips the first n rows of the source. */
public final class Drop extends Query {
    public final Ast query;
    /** Number of rows; an arbitrary expression. */
    public final Ast n;

    public Drop(Ast query, Ast n) {
        this.query = query;
        this.n = n;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("query");
        this.query.accept(visitor);
        visitor.property("n");
        this.n.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Drop o = other.as(Drop.class);
        if (o == null)
            return false;
        return this.query == o.query && this.n == o.n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Drop that = (Drop) o;
        return this.query.equals(that.query) && this.n.equals(that.n);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Drop.class, this.query, this.n);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.query)
                .append(".drop(")
                .append(this.n)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static Drop fromJson(JsonNode node, JsonDecoder decoder) {
        Ast query = decoder.decodeProperty(node, "query");
        Ast n = decoder.decodeProperty(node, "n");
        return new Drop(query, n);
    }
}
