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

package org.qnorm.normalizer.norm.capture;

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.query.AliasedQuery;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.Linq;

import java.util.ArrayList;
import java.util.List;

/** Finds binders which reuse the name of a binder enclosing them. */
class BinderPaths extends AstVisitor {
    final List<IdentName> enclosing = new ArrayList<>();
    final List<String> duplicates = new ArrayList<>();

    static List<String> duplicates(Ast ast) {
        BinderPaths visitor = new BinderPaths();
        visitor.apply(ast);
        return visitor.duplicates;
    }

    void bind(List<Ident> binders, Ast body) {
        for (Ident binder: binders) {
            if (this.enclosing.contains(binder.idName()))
                this.duplicates.add(binder.name);
            this.enclosing.add(binder.idName());
        }
        body.accept(this);
        for (int i = 0; i < binders.size(); i++)
            this.enclosing.remove(this.enclosing.size() - 1);
    }

    @Override
    public VisitDecision preorder(AliasedQuery node) {
        node.query.accept(this);
        this.bind(Linq.list(node.alias), node.body);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Join node) {
        node.left.accept(this);
        node.right.accept(this);
        this.bind(Linq.list(node.leftAlias, node.rightAlias), node.on);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatJoin node) {
        node.query.accept(this);
        this.bind(Linq.list(node.alias), node.on);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Function node) {
        this.bind(node.params, node.body);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Foreach node) {
        node.query.accept(this);
        this.bind(Linq.list(node.alias), node.body);
        return VisitDecision.STOP;
    }
}
