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

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.util.IIndentStream;

import java.util.Objects;

/** A query operator over a source which binds one alias in its body:
 * map, flatMap, concatMap, filter, groupBy, distinctOn, sortBy.
 * The alias is in scope only in the body, not in the source. */
public abstract class AliasedQuery extends Query {
    public final Ast query;
    public final Ident alias;
    public final Ast body;

    protected AliasedQuery(Ast query, Ident alias, Ast body) {
        this.query = query;
        this.alias = alias;
        this.body = body;
    }

    /** A node of the same kind with the specified source, alias and body;
     * any other fields are copied from this node. */
    public abstract AliasedQuery with(Ast query, Ident alias, Ast body);

    /** Name of the operation, used for printing. */
    public abstract String operation();

    protected void acceptChildren(AstVisitor visitor) {
        visitor.push(this);
        visitor.property("query");
        this.query.accept(visitor);
        visitor.property("alias");
        this.alias.accept(visitor);
        visitor.property("body");
        this.body.accept(visitor);
        visitor.pop(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        if (other.getClass() != this.getClass())
            return false;
        AliasedQuery o = other.to(AliasedQuery.class);
        return this.query == o.query &&
                this.alias == o.alias &&
                this.body == o.body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AliasedQuery that = (AliasedQuery) o;
        return this.query.equals(that.query) &&
                this.alias.equals(that.alias) &&
                this.body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.getClass(), this.query, this.alias, this.body);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.query)
                .append(".")
                .append(this.operation())
                .append("(")
                .append(this.alias)
                .append(" => ")
                .append(this.body)
                .append(")");
    }
}
