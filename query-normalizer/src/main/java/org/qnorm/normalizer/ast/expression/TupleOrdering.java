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
import org.qnorm.util.Linq;

import java.util.List;

/** Orderings for the fields of a tuple-valued sort criteria. */
public final class TupleOrdering extends Ordering {
    public final List<Ordering> elements;

    public TupleOrdering(List<Ordering> elements) {
        this.elements = elements;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("elements");
        int index = 0;
        for (Ordering element: this.elements) {
            visitor.propertyIndex(index++);
            element.accept(visitor);
        }
        visitor.endArrayProperty("elements");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        TupleOrdering o = other.as(TupleOrdering.class);
        if (o == null)
            return false;
        return Linq.same(this.elements, o.elements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.elements.equals(((TupleOrdering) o).elements);
    }

    @Override
    public int hashCode() {
        return this.elements.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Ord(")
                .joinI(", ", this.elements)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static TupleOrdering fromJson(JsonNode node, JsonDecoder decoder) {
        return new TupleOrdering(decoder.decodeList(node, "elements", Ordering.class));
    }
}
