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
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;

import java.util.Objects;

/** Sorts the rows of the source by the value of the criteria expression
 * (the body), in the direction given by the ordering.  The ordering
 * contains no identifiers. */
public final class SortBy extends AliasedQuery {
    public final Ast ordering;

    public SortBy(Ast query, Ident alias, Ast criteria, Ast ordering) {
        super(query, alias, criteria);
        this.ordering = ordering;
    }

    @Override
    public SortBy with(Ast query, Ident alias, Ast body) {
        return new SortBy(query, alias, body, this.ordering);
    }

    @Override
    public String operation() {
        return "sortBy";
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("query");
        this.query.accept(visitor);
        visitor.property("alias");
        this.alias.accept(visitor);
        visitor.property("body");
        this.body.accept(visitor);
        visitor.property("ordering");
        this.ordering.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        SortBy o = other.as(SortBy.class);
        if (o == null)
            return false;
        return super.sameFields(other) && this.ordering == o.ordering;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        return this.ordering.equals(((SortBy) o).ordering);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), this.ordering);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return super.toString(builder)
                .append("(")
                .append(this.ordering)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static SortBy fromJson(JsonNode node, JsonDecoder decoder) {
        Ast query = decoder.decodeProperty(node, "query");
        Ident alias = decoder.decodeProperty(node, "alias", Ident.class);
        Ast body = decoder.decodeProperty(node, "body");
        Ast ordering = decoder.decodeProperty(node, "ordering");
        return new SortBy(query, alias, body, ordering);
    }
}
