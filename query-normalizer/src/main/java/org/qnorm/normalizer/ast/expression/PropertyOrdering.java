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
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;

public final class PropertyOrdering extends Ordering {
    public enum Direction {
        ASC("Ord.asc"),
        DESC("Ord.desc"),
        ASC_NULLS_FIRST("Ord.ascNullsFirst"),
        DESC_NULLS_FIRST("Ord.descNullsFirst"),
        ASC_NULLS_LAST("Ord.ascNullsLast"),
        DESC_NULLS_LAST("Ord.descNullsLast");

        public final String text;

        Direction(String text) {
            this.text = text;
        }
    }

    public final Direction direction;

    public static final PropertyOrdering ASC = new PropertyOrdering(Direction.ASC);
    public static final PropertyOrdering DESC = new PropertyOrdering(Direction.DESC);

    public PropertyOrdering(Direction direction) {
        this.direction = direction;
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
        return this.direction == ((PropertyOrdering) o).direction;
    }

    @Override
    public int hashCode() {
        return this.direction.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.direction.text);
    }

    @SuppressWarnings("unused")
    public static PropertyOrdering fromJson(JsonNode node, JsonDecoder decoder) {
        return new PropertyOrdering(decoder.decodeEnum(node, "direction", Direction.class));
    }
}
