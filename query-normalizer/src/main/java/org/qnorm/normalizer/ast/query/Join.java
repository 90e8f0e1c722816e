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

/** Join of two sources.  Each source has its own alias;
 * both aliases are in scope in the join condition 'on'. */
public final class Join extends Query {
    public final JoinType joinType;
    public final Ast left;
    public final Ast right;
    public final Ident leftAlias;
    public final Ident rightAlias;
    public final Ast on;

    public Join(JoinType joinType, Ast left, Ast right, Ident leftAlias, Ident rightAlias, Ast on) {
        this.joinType = joinType;
        this.left = left;
        this.right = right;
        this.leftAlias = leftAlias;
        this.rightAlias = rightAlias;
        this.on = on;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("left");
        this.left.accept(visitor);
        visitor.property("right");
        this.right.accept(visitor);
        visitor.property("leftAlias");
        this.leftAlias.accept(visitor);
        visitor.property("rightAlias");
        this.rightAlias.accept(visitor);
        visitor.property("on");
        this.on.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Join o = other.as(Join.class);
        if (o == null)
            return false;
        return this.joinType == o.joinType &&
                this.left == o.left &&
                this.right == o.right &&
                this.leftAlias == o.leftAlias &&
                this.rightAlias == o.rightAlias &&
                this.on == o.on;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Join join = (Join) o;
        return this.joinType == join.joinType &&
                this.left.equals(join.left) &&
                this.right.equals(join.right) &&
                this.leftAlias.equals(join.leftAlias) &&
                this.rightAlias.equals(join.rightAlias) &&
                this.on.equals(join.on);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.joinType, this.left, this.right, this.leftAlias, this.rightAlias, this.on);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.left)
                .append(".")
                .append(this.joinType.operation)
                .append("(")
                .append(this.right)
                .append(").on((")
                .append(this.leftAlias)
                .append(", ")
                .append(this.rightAlias)
                .append(") => ")
                .append(this.on)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static Join fromJson(JsonNode node, JsonDecoder decoder) {
        JoinType joinType = decoder.decodeEnum(node, "joinType", JoinType.class);
        Ast left = decoder.decodeProperty(node, "left");
        Ast right = decoder.decodeProperty(node, "right");
        Ident leftAlias = decoder.decodeProperty(node, "leftAlias", Ident.class);
        Ident rightAlias = decoder.decodeProperty(node, "rightAlias", Ident.class);
        Ast on = decoder.decodeProperty(node, "on");
        return new Join(joinType, left, right, leftAlias, rightAlias, on);
    }
}
