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

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.expression.FunctionApply;
import org.qnorm.normalizer.ast.query.AliasedQuery;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.normalizer.visitors.AstRewriteVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Substitutes identifiers with terms, and performs beta reduction:
 * an application of a function literal is replaced with the function
 * body with the arguments substituted for the parameters.
 *
 * <p>Only free occurrences are replaced: a binder with the same name as a
 * substituted identifier shadows the substitution in its scope.
 * Binders whose names collide with identifiers free in the replacements
 * are not renamed; callers must run the alias conflict resolver first,
 * so that such collisions cannot happen. */
public class BetaReduction extends AstRewriteVisitor {
    final java.util.Map<IdentName, Ast> initial;
    final Scopes<IdentName, Ast> scopes;

    /** @param substitution  Identifiers to replace, with their replacements.
     *                       All replacements are applied simultaneously. */
    public BetaReduction(java.util.Map<IdentName, Ast> substitution) {
        this.initial = substitution;
        this.scopes = new Scopes<>();
    }

    public BetaReduction() {
        this(new LinkedHashMap<>());
    }

    /** body[from := to] */
    public static Ast substitute(Ast body, Ident from, Ast to) {
        java.util.Map<IdentName, Ast> map = new LinkedHashMap<>();
        map.put(from.idName(), to);
        return new BetaReduction(map).apply(body);
    }

    /** body[fromA := toA, fromB := toB], both substitutions applied at once. */
    public static Ast substitute(Ast body, Ident fromA, Ast toA, Ident fromB, Ast toB) {
        java.util.Map<IdentName, Ast> map = new LinkedHashMap<>();
        map.put(fromA.idName(), toA);
        map.put(fromB.idName(), toB);
        return new BetaReduction(map).apply(body);
    }

    @Override
    public void startVisit(Ast node) {
        super.startVisit(node);
        this.scopes.mustBeEmpty();
        this.scopes.newContext();
        this.initial.forEach(this.scopes::substitute);
    }

    @Override
    public void endVisit() {
        this.scopes.popContext();
        this.scopes.mustBeEmpty();
        super.endVisit();
    }

    /** Transform 'body' in a new scope where the binders are not substituted. */
    Ast transformShadowed(Ast body, List<Ident> binders) {
        this.scopes.newContext();
        for (Ident binder: binders)
            this.scopes.shadow(binder.idName());
        Ast result = this.transform(body);
        this.scopes.popContext();
        return result;
    }

    @Override
    public VisitDecision preorder(Ident node) {
        Ast replacement = this.scopes.get(node.idName());
        if (replacement != null) {
            this.map(node, replacement);
        } else {
            // Map the identifier to itself - no replacement
            this.map(node, node);
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(AliasedQuery node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast body = this.transformShadowed(node.body, List.of(node.alias));
        this.pop(node);
        this.map(node, node.with(query, node.alias, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SortBy node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast criteria = this.transformShadowed(node.body, List.of(node.alias));
        this.pop(node);
        // Orderings contain no identifiers
        this.map(node, new SortBy(query, node.alias, criteria, node.ordering));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Join node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        Ast on = this.transformShadowed(node.on, List.of(node.leftAlias, node.rightAlias));
        this.pop(node);
        this.map(node, new Join(node.joinType, left, right, node.leftAlias, node.rightAlias, on));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatJoin node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast on = this.transformShadowed(node.on, List.of(node.alias));
        this.pop(node);
        this.map(node, new FlatJoin(node.joinType, query, node.alias, on));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Function node) {
        this.push(node);
        Ast body = this.transformShadowed(node.body, node.params);
        this.pop(node);
        this.map(node, new Function(node.params, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Foreach node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ast body = this.transformShadowed(node.body, List.of(node.alias));
        this.pop(node);
        this.map(node, new Foreach(query, node.alias, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FunctionApply node) {
        Function function = node.function.as(Function.class);
        if (function == null)
            return super.preorder(node);
        if (function.params.size() != node.args.size())
            throw new InternalCompilerError("Function with " + function.params.size() +
                    " parameters called with " + node.args.size() + " arguments", node);
        this.push(node);
        List<Ast> args = this.transform(node.args);
        this.scopes.newContext();
        for (int i = 0; i < function.params.size(); i++)
            this.scopes.substitute(function.params.get(i).idName(), args.get(i));
        Ast body = this.transform(function.body);
        this.scopes.popContext();
        this.pop(node);
        this.map(node, body);
        return VisitDecision.STOP;
    }

    @Override
    public String toString() {
        return super.toString() + this.initial;
    }
}
