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

package org.qnorm.normalizer.visitors;

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.BinaryOperation;
import org.qnorm.normalizer.ast.expression.Constant;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.expression.FunctionApply;
import org.qnorm.normalizer.ast.expression.NullValue;
import org.qnorm.normalizer.ast.expression.Ordering;
import org.qnorm.normalizer.ast.expression.Property;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.expression.Tuple;
import org.qnorm.normalizer.ast.expression.TupleOrdering;
import org.qnorm.normalizer.ast.expression.UnaryOperation;
import org.qnorm.normalizer.ast.query.Aggregation;
import org.qnorm.normalizer.ast.query.AliasedQuery;
import org.qnorm.normalizer.ast.query.Distinct;
import org.qnorm.normalizer.ast.query.Drop;
import org.qnorm.normalizer.ast.query.Entity;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.Infix;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.ast.query.Nested;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.normalizer.ast.query.Take;
import org.qnorm.normalizer.ast.query.Union;
import org.qnorm.normalizer.ast.query.UnionAll;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.util.IWritesLogs;
import org.qnorm.util.Linq;
import org.qnorm.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Base class for visitors which rewrite ASTs.
 * This class recurses over the structure of the tree and if any fields
 * have changed builds a new version of the node.  Classes that extend this
 * should override the preorder methods and ignore the postorder methods.
 * Every concrete node class has a preorder method here; reaching the
 * generic preorder(Ast) is an internal error. */
public abstract class AstRewriteVisitor extends AstVisitor implements IWritesLogs {
    /** Result produced by the last preorder invocation. */
    @Nullable
    protected Ast lastResult;

    protected Ast getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public Ast apply(Ast node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /** Replace the 'old' node with the 'newNode' if any of its fields differs. */
    protected void map(Ast old, Ast newNode) {
        if (old == newNode || old.sameFields(newNode)) {
            // Ignore new node.
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newNode::toString)
                .newline();
        this.lastResult = newNode;
    }

    @Override
    public VisitDecision preorder(Ast node) {
        throw new InternalCompilerError(this + " does not handle " + node.getClass().getSimpleName(), node);
    }

    protected Ast transform(Ast ast) {
        ast.accept(this);
        return this.getResult();
    }

    protected List<Ast> transform(List<Ast> asts) {
        return Linq.map(asts, this::transform);
    }

    protected Ident transformIdent(Ident ident) {
        ident.accept(this);
        return this.getResult().to(Ident.class);
    }

    protected Ordering transformOrdering(Ordering ordering) {
        ordering.accept(this);
        return this.getResult().to(Ordering.class);
    }

    /////////////////////// Leaves ////////////////////////////////

    @Override
    public VisitDecision preorder(Ident node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Entity node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Constant node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(NullValue node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(PropertyOrdering node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    /////////////////////// Queries ////////////////////////////////

    @Override
    public VisitDecision preorder(AliasedQuery node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ident alias = this.transformIdent(node.alias);
        Ast body = this.transform(node.body);
        this.pop(node);
        Ast result = node.with(query, alias, body);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SortBy node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ident alias = this.transformIdent(node.alias);
        Ast criteria = this.transform(node.body);
        Ast ordering = this.transform(node.ordering);
        this.pop(node);
        Ast result = new SortBy(query, alias, criteria, ordering);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Infix node) {
        this.push(node);
        List<Ast> params = this.transform(node.params);
        this.pop(node);
        Ast result = node.withParams(params);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Join node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        Ident leftAlias = this.transformIdent(node.leftAlias);
        Ident rightAlias = this.transformIdent(node.rightAlias);
        Ast on = this.transform(node.on);
        this.pop(node);
        Ast result = new Join(node.joinType, left, right, leftAlias, rightAlias, on);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatJoin node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ident alias = this.transformIdent(node.alias);
        Ast on = this.transform(node.on);
        this.pop(node);
        Ast result = new FlatJoin(node.joinType, query, alias, on);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Nested node) {
        this.push(node);
        Ast query = this.transform(node.query);
        this.pop(node);
        this.map(node, new Nested(query));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Distinct node) {
        this.push(node);
        Ast query = this.transform(node.query);
        this.pop(node);
        this.map(node, new Distinct(query));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Take node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast n = this.transform(node.n);
        this.pop(node);
        this.map(node, new Take(query, n));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Drop node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast n = this.transform(node.n);
        this.pop(node);
        this.map(node, new Drop(query, n));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Aggregation node) {
        this.push(node);
        Ast query = this.transform(node.query);
        this.pop(node);
        this.map(node, new Aggregation(node.operator, query));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Union node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        this.pop(node);
        this.map(node, new Union(left, right));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(UnionAll node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        this.pop(node);
        this.map(node, new UnionAll(left, right));
        return VisitDecision.STOP;
    }

    /////////////////////// Expressions ////////////////////////////////

    @Override
    public VisitDecision preorder(Property node) {
        this.push(node);
        Ast ast = this.transform(node.ast);
        this.pop(node);
        this.map(node, new Property(ast, node.name));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(BinaryOperation node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        this.pop(node);
        this.map(node, new BinaryOperation(left, node.operator, right));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(UnaryOperation node) {
        this.push(node);
        Ast ast = this.transform(node.ast);
        this.pop(node);
        this.map(node, new UnaryOperation(node.operator, ast));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Tuple node) {
        this.push(node);
        List<Ast> values = this.transform(node.values);
        this.pop(node);
        this.map(node, new Tuple(values));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Function node) {
        this.push(node);
        List<Ident> params = Linq.map(node.params, this::transformIdent);
        Ast body = this.transform(node.body);
        this.pop(node);
        this.map(node, new Function(params, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FunctionApply node) {
        this.push(node);
        Ast function = this.transform(node.function);
        List<Ast> args = this.transform(node.args);
        this.pop(node);
        this.map(node, new FunctionApply(function, args));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(TupleOrdering node) {
        this.push(node);
        List<Ordering> elements = Linq.map(node.elements, this::transformOrdering);
        this.pop(node);
        this.map(node, new TupleOrdering(elements));
        return VisitDecision.STOP;
    }

    /////////////////////// Actions ////////////////////////////////

    @Override
    public VisitDecision preorder(Foreach node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ident alias = this.transformIdent(node.alias);
        Ast body = this.transform(node.body);
        this.pop(node);
        this.map(node, new Foreach(query, alias, body));
        return VisitDecision.STOP;
    }
}
