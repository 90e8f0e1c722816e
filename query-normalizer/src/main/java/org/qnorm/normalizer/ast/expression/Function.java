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
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;
import org.qnorm.util.Linq;

import java.util.List;
import java.util.Objects;

/** A lambda.  The parameters are in scope in the body. */
public final class Function extends Expression {
    public final List<Ident> params;
    public final Ast body;

    public Function(List<Ident> params, Ast body) {
        this.params = params;
        this.body = body;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("params");
        int index = 0;
        for (Ident param: this.params) {
            visitor.propertyIndex(index++);
            param.accept(visitor);
        }
        visitor.endArrayProperty("params");
        visitor.property("body");
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        Function o = other.as(Function.class);
        if (o == null)
            return false;
        return Linq.same(this.params, o.params) && this.body == o.body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Function function = (Function) o;
        return this.params.equals(function.params) && this.body.equals(function.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.params, this.body);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(", ", this.params)
                .append(") => ")
                .append(this.body);
    }

    @SuppressWarnings("unused")
    public static Function fromJson(JsonNode node, JsonDecoder decoder) {
        List<Ident> params = decoder.decodeList(node, "params", Ident.class);
        Ast body = decoder.decodeProperty(node, "body");
        return new Function(params, body);
    }
}
