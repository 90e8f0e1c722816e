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

import java.util.Objects;

public final class BinaryOperation extends Expression {
    public final Ast left;
    public final BinaryOperator operator;
    public final Ast right;

    public BinaryOperation(Ast left, BinaryOperator operator, Ast right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
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
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(Ast other) {
        BinaryOperation o = other.as(BinaryOperation.class);
        if (o == null)
            return false;
        return this.left == o.left &&
                this.operator == o.operator &&
                this.right == o.right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinaryOperation that = (BinaryOperation) o;
        return this.operator == that.operator &&
                this.left.equals(that.left) &&
                this.right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.left, this.operator, this.right);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.operator.text)
                .append(" ")
                .append(this.right)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static BinaryOperation fromJson(JsonNode node, JsonDecoder decoder) {
        Ast left = decoder.decodeProperty(node, "left");
        BinaryOperator operator = decoder.decodeEnum(node, "operator", BinaryOperator.class);
        Ast right = decoder.decodeProperty(node, "right");
        return new BinaryOperation(left, operator, right);
    }
}
