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

package org.qnorm.normalizer.backend;

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.expression.BinaryOperation;
import org.qnorm.normalizer.ast.expression.Constant;
import org.qnorm.normalizer.ast.expression.Property;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.expression.UnaryOperation;
import org.qnorm.normalizer.ast.query.Aggregation;
import org.qnorm.normalizer.ast.query.Entity;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.Infix;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IndentStream;
import org.qnorm.util.JsonStream;

/** Serializes an AST as a JSON string.
 * Every node is an object whose "class" property is the simple name of the node class.
 * Since this visitor calls the visit methods for AstVisitor, it should generally
 * only handle fields which are not visited by AstVisitor, i.e., the ones which are not Ast objects. */
public class ToJsonVisitor extends AstVisitor {
    public final JsonStream stream;

    public ToJsonVisitor(JsonStream stream) {
        this.stream = stream;
    }

    public static String toJson(Ast ast) {
        JsonStream stream = new JsonStream(new IndentStream());
        ToJsonVisitor visitor = new ToJsonVisitor(stream);
        visitor.apply(ast);
        return stream.toString();
    }

    @Override
    public void startArrayProperty(String property) {
        this.stream.label(property).beginArray();
    }

    @Override
    public void endArrayProperty(String property) {
        this.stream.endArray();
    }

    @Override
    public void property(String name) {
        this.stream.label(name);
    }

    @Override
    public void push(Ast node) {
        this.stream.appendClass(node);
        super.push(node);
    }

    void quat(Quat quat) {
        this.property("quat");
        this.stream.append(quat.shape);
    }

    @Override
    public VisitDecision preorder(Ast node) {
        this.stream.beginObject();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(Ast node) {
        this.stream.endObject();
    }

    @Override
    public void postorder(Ident node) {
        this.property("name");
        this.stream.append(node.name);
        this.quat(node.quat);
        super.postorder(node);
    }

    @Override
    public void postorder(Entity node) {
        this.property("name");
        this.stream.append(node.name);
        this.quat(node.quat);
        super.postorder(node);
    }

    @Override
    public void postorder(Infix node) {
        this.property("parts");
        this.stream.beginArray();
        for (String part: node.parts)
            this.stream.append(part);
        this.stream.endArray();
        this.property("pure");
        this.stream.append(node.pure);
        this.quat(node.quat);
        super.postorder(node);
    }

    @Override
    public void postorder(Join node) {
        this.property("joinType");
        this.stream.append(node.joinType.name());
        super.postorder(node);
    }

    @Override
    public void postorder(FlatJoin node) {
        this.property("joinType");
        this.stream.append(node.joinType.name());
        super.postorder(node);
    }

    @Override
    public void postorder(Aggregation node) {
        this.property("operator");
        this.stream.append(node.operator.name());
        super.postorder(node);
    }

    @Override
    public void postorder(Property node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(BinaryOperation node) {
        this.property("operator");
        this.stream.append(node.operator.name());
        super.postorder(node);
    }

    @Override
    public void postorder(UnaryOperation node) {
        this.property("operator");
        this.stream.append(node.operator.name());
        super.postorder(node);
    }

    @Override
    public void postorder(Constant node) {
        this.property("value");
        if (node.value instanceof String)
            this.stream.append((String) node.value);
        else if (node.value instanceof Long)
            this.stream.append((long) (Long) node.value);
        else if (node.value instanceof Double)
            this.stream.append((double) (Double) node.value);
        else
            this.stream.append((boolean) (Boolean) node.value);
        super.postorder(node);
    }

    @Override
    public void postorder(PropertyOrdering node) {
        this.property("direction");
        this.stream.append(node.direction.name());
        super.postorder(node);
    }
}
