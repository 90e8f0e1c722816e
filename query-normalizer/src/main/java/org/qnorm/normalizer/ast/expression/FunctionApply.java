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
import java.util.Objects;

public final class FunctionApply extends Expression {
    public final Ast function;
    public final List<Ast> args;

    public FunctionApply(Ast function, List<Ast> args) {
        this.function = function;
        this.args = args;
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("function");
        this.function.accept(visitor);
        visitor.startArrayProperty("args");
        int index = 0;
        for (Ast arg: this.args) {
            visitor.propertyIndex(index++);
            arg.accept(visitor);
        }
        visitor.endArrayProperty("args");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        FunctionApply o = other.as(FunctionApply.class);
        if (o == null)
            return false;
        return this.function == o.function && Linq.same(this.args, o.args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionApply that = (FunctionApply) o;
        return this.function.equals(that.function) && this.args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.function, this.args);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.function)
                .append(")(")
                .joinI(", ", this.args)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static FunctionApply fromJson(JsonNode node, JsonDecoder decoder) {
        Ast function = decoder.decodeProperty(node, "function");
        List<Ast> args = decoder.decodeList(node, "args", Ast.class);
        return new FunctionApply(function, args);
    }
}
