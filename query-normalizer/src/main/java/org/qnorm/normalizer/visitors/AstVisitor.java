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

import org.qnorm.normalizer.ast.Action;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.BinaryOperation;
import org.qnorm.normalizer.ast.expression.Constant;
import org.qnorm.normalizer.ast.expression.Expression;
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
import org.qnorm.normalizer.ast.query.ConcatMap;
import org.qnorm.normalizer.ast.query.Distinct;
import org.qnorm.normalizer.ast.query.DistinctOn;
import org.qnorm.normalizer.ast.query.Drop;
import org.qnorm.normalizer.ast.query.Entity;
import org.qnorm.normalizer.ast.query.Filter;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.FlatMap;
import org.qnorm.normalizer.ast.query.GroupBy;
import org.qnorm.normalizer.ast.query.Infix;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.ast.query.Nested;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.normalizer.ast.query.Take;
import org.qnorm.normalizer.ast.query.Union;
import org.qnorm.normalizer.ast.query.UnionAll;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.util.IWritesLogs;
import org.qnorm.util.Logger;
import org.qnorm.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an Ast hierarchy.
 * The default implementation visits every node and changes nothing;
 * 'apply' returns the input node. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class AstVisitor implements AstTransform, IWritesLogs {
    final long id;
    static long crtId = 0;
    protected final List<Ast> context;

    protected AstVisitor() {
        this.id = crtId++;
        this.context = new ArrayList<>();
    }

    public long getId() {
        return this.id;
    }

    public void push(Ast node) {
        this.context.add(node);
    }

    public void pop(Ast node) {
        Ast last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public Ast getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Called before visiting the child stored in the specified field of the current node. */
    public void property(String property) {}

    /** Called before visiting a list-valued field of the current node. */
    public void startArrayProperty(String property) {}

    /** Called after visiting a list-valued field of the current node. */
    public void endArrayProperty(String property) {}

    /** Called before visiting each element of a list-valued field. */
    public void propertyIndex(int index) {}

    /** Override to initialize before visiting any node. */
    public void startVisit(Ast node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    @Override
    public Ast apply(Ast node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "_" + this.id;
    }

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should not visit the children of the current node.
    public VisitDecision preorder(Ast ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Query node) {
        return this.preorder((Ast) node);
    }

    public VisitDecision preorder(Expression node) {
        return this.preorder((Ast) node);
    }

    public VisitDecision preorder(Ordering node) {
        return this.preorder((Ast) node);
    }

    public VisitDecision preorder(Action node) {
        return this.preorder((Ast) node);
    }

    public VisitDecision preorder(Ident node) {
        return this.preorder((Ast) node);
    }

    public VisitDecision preorder(AliasedQuery node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Map node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(FlatMap node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(ConcatMap node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(Filter node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(GroupBy node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(DistinctOn node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(SortBy node) {
        return this.preorder((AliasedQuery) node);
    }

    public VisitDecision preorder(Entity node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Infix node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Join node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(FlatJoin node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Nested node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Distinct node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Take node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Drop node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Aggregation node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Union node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(UnionAll node) {
        return this.preorder((Query) node);
    }

    public VisitDecision preorder(Property node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(BinaryOperation node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(UnaryOperation node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Constant node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(NullValue node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Tuple node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Function node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(FunctionApply node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(PropertyOrdering node) {
        return this.preorder((Ordering) node);
    }

    public VisitDecision preorder(TupleOrdering node) {
        return this.preorder((Ordering) node);
    }

    public VisitDecision preorder(Foreach node) {
        return this.preorder((Action) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(Ast ignored) {}

    public void postorder(Query node) {
        this.postorder((Ast) node);
    }

    public void postorder(Expression node) {
        this.postorder((Ast) node);
    }

    public void postorder(Ordering node) {
        this.postorder((Ast) node);
    }

    public void postorder(Action node) {
        this.postorder((Ast) node);
    }

    public void postorder(Ident node) {
        this.postorder((Ast) node);
    }

    public void postorder(AliasedQuery node) {
        this.postorder((Query) node);
    }

    public void postorder(Map node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(FlatMap node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(ConcatMap node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(Filter node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(GroupBy node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(DistinctOn node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(SortBy node) {
        this.postorder((AliasedQuery) node);
    }

    public void postorder(Entity node) {
        this.postorder((Query) node);
    }

    public void postorder(Infix node) {
        this.postorder((Query) node);
    }

    public void postorder(Join node) {
        this.postorder((Query) node);
    }

    public void postorder(FlatJoin node) {
        this.postorder((Query) node);
    }

    public void postorder(Nested node) {
        this.postorder((Query) node);
    }

    public void postorder(Distinct node) {
        this.postorder((Query) node);
    }

    public void postorder(Take node) {
        this.postorder((Query) node);
    }

    public void postorder(Drop node) {
        this.postorder((Query) node);
    }

    public void postorder(Aggregation node) {
        this.postorder((Query) node);
    }

    public void postorder(Union node) {
        this.postorder((Query) node);
    }

    public void postorder(UnionAll node) {
        this.postorder((Query) node);
    }

    public void postorder(Property node) {
        this.postorder((Expression) node);
    }

    public void postorder(BinaryOperation node) {
        this.postorder((Expression) node);
    }

    public void postorder(UnaryOperation node) {
        this.postorder((Expression) node);
    }

    public void postorder(Constant node) {
        this.postorder((Expression) node);
    }

    public void postorder(NullValue node) {
        this.postorder((Expression) node);
    }

    public void postorder(Tuple node) {
        this.postorder((Expression) node);
    }

    public void postorder(Function node) {
        this.postorder((Expression) node);
    }

    public void postorder(FunctionApply node) {
        this.postorder((Expression) node);
    }

    public void postorder(PropertyOrdering node) {
        this.postorder((Ordering) node);
    }

    public void postorder(TupleOrdering node) {
        this.postorder((Ordering) node);
    }

    public void postorder(Foreach node) {
        this.postorder((Action) node);
    }
}
