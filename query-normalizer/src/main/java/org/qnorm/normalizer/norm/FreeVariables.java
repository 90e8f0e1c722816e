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

package org.qnorm.normalizer.norm;

import com.google.common.collect.ImmutableSet;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.query.AliasedQuery;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.Linq;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Collects the names of the identifiers which appear free in a tree. */
public class FreeVariables extends AstVisitor {
    /** Binders in scope, innermost last.  A name may appear multiple times. */
    final List<IdentName> bound;
    final Set<IdentName> free;

    public FreeVariables() {
        this.bound = new ArrayList<>();
        this.free = new LinkedHashSet<>();
    }

    public static ImmutableSet<IdentName> of(Ast ast) {
        FreeVariables visitor = new FreeVariables();
        visitor.apply(ast);
        return visitor.getFree();
    }

    public ImmutableSet<IdentName> getFree() {
        return ImmutableSet.copyOf(this.free);
    }

    @Override
    public void startVisit(Ast node) {
        super.startVisit(node);
        this.bound.clear();
        this.free.clear();
    }

    void visitBound(Ast body, List<Ident> binders) {
        for (Ident binder: binders)
            this.bound.add(binder.idName());
        body.accept(this);
        for (int i = 0; i < binders.size(); i++)
            this.bound.remove(this.bound.size() - 1);
    }

    @Override
    public VisitDecision preorder(Ident node) {
        IdentName name = node.idName();
        if (!this.bound.contains(name))
            this.free.add(name);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(AliasedQuery node) {
        node.query.accept(this);
        this.visitBound(node.body, Linq.list(node.alias));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SortBy node) {
        node.query.accept(this);
        this.visitBound(node.body, Linq.list(node.alias));
        node.ordering.accept(this);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Join node) {
        node.left.accept(this);
        node.right.accept(this);
        this.visitBound(node.on, Linq.list(node.leftAlias, node.rightAlias));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatJoin node) {
        node.query.accept(this);
        this.visitBound(node.on, Linq.list(node.alias));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Function node) {
        this.visitBound(node.body, node.params);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Foreach node) {
        node.query.accept(this);
        this.visitBound(node.body, Linq.list(node.alias));
        return VisitDecision.STOP;
    }
}
