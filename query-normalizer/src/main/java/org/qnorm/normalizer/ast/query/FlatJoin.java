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
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;

import java.util.Objects;

/** A join written inside a flatMap: only the joined source is named here,
 * the other side is the enclosing row.  The alias is in scope in 'on'. */
public final class FlatJoin extends Query {
    public final JoinType joinType;
    public final Ast query;
    public final Ident alias;
    public final Ast on;

    public FlatJoin(JoinType joinType, Ast query, Ident alias, Ast on) {
        this.joinType = joinType;
        this.query = query;
        this.alias = alias;
        this.on = on;
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
        visitor.property("on");
        this.on.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        FlatJoin o = other.as(FlatJoin.class);
        if (o == null)
            return false;
        return this.joinType == o.joinType &&
                this.query == o.query &&
                this.alias == o.alias &&
                this.on == o.on;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlatJoin that = (FlatJoin) o;
        return this.joinType == that.joinType &&
                this.query.equals(that.query) &&
                this.alias.equals(that.alias) &&
                this.on.equals(that.on);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.joinType, this.query, this.alias, this.on);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.joinType.operation)
                .append("(")
                .append(this.query)
                .append(").on(")
                .append(this.alias)
                .append(" => ")
                .append(this.on)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static FlatJoin fromJson(JsonNode node, JsonDecoder decoder) {
        JoinType joinType = decoder.decodeEnum(node, "joinType", JoinType.class);
        Ast query = decoder.decodeProperty(node, "query");
        Ident alias = decoder.decodeProperty(node, "alias", Ident.class);
        Ast on = decoder.decodeProperty(node, "on");
        return new FlatJoin(joinType, query, alias, on);
    }
}
