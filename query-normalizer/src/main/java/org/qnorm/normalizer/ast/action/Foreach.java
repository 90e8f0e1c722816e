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

package org.qnorm.normalizer.ast.action;

import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.ast.Action;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;

import java.util.Objects;

/** Runs the body action once for every row of the source.
 * The alias is in scope in the body. */
public final class Foreach extends Action {
    public final Ast query;
    public final Ident alias;
    public final Ast body;

    public Foreach(Ast query, Ident alias, Ast body) {
        this.query = query;
        this.alias = alias;
        this.body = body;
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
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Foreach o = other.as(Foreach.class);
        if (o == null)
            return false;
        return this.query == o.query && this.alias == o.alias && this.body == o.body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Foreach foreach = (Foreach) o;
        return this.query.equals(foreach.query) &&
                this.alias.equals(foreach.alias) &&
                this.body.equals(foreach.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.query, this.alias, this.body);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.query)
                .append(".foreach(")
                .append(this.alias)
                .append(" => ")
                .append(this.body)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static Foreach fromJson(JsonNode node, JsonDecoder decoder) {
        Ast query = decoder.decodeProperty(node, "query");
        Ident alias = decoder.decodeProperty(node, "alias", Ident.class);
        Ast body = decoder.decodeProperty(node, "body");
        return new Foreach(query, alias, body);
    }
}
