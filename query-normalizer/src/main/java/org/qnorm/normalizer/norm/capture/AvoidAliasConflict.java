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
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
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
import org.qnorm.normalizer.norm.BetaReduction;
import org.qnorm.normalizer.norm.Normalize;
import org.qnorm.normalizer.visitors.Stateful;
import org.qnorm.normalizer.visitors.StatefulRewriteVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Makes the binder names unique along every path of the tree.
 * For example
 * <pre>
 *   FlatMap(A, a, Map(Filter(E, a, a.id == 1), b, (a, b)))
 * </pre>
 * is rewritten to
 * <pre>
 *   FlatMap(A, a, Map(Filter(E, a1, a1.id == 1), b, (a, b)))
 * </pre>
 * so that the generated SQL can tell the two aliases apart.
 *
 * <p>The names of all binders seen so far are carried in a {@link NamingState}
 * which is threaded through the traversal left to right; a binder is renamed
 * when its name is already in the state.  Sibling subtrees therefore also get
 * distinct names.
 *
 * <p>When 'permanentize' is set, temporary identifiers are given permanent names
 * of the form x, x1, x2...  This must happen only once, on the whole tree,
 * at the end of normalization: a pass running on a subtree does not know the
 * names bound by the enclosing scopes. */
public class AvoidAliasConflict extends StatefulRewriteVisitor<NamingState> {
    static final String PERMANENT_NAME = "x";

    final boolean permanentize;

    public AvoidAliasConflict(NamingState state, boolean permanentize) {
        super(state);
        this.permanentize = permanentize;
    }

    /** Resolve a whole query, starting with no names in use. */
    public static Query apply(Query query, boolean permanentize) {
        return apply((Ast) query, permanentize).to(Query.class);
    }

    /** Resolve an arbitrary tree, starting with no names in use. */
    public static Ast apply(Ast ast, boolean permanentize) {
        return new AvoidAliasConflict(NamingState.EMPTY, permanentize).apply(ast);
    }

    /**
     * Rename the parameters of a function so that they do not collide
     * with the dangerous names, and resolve the queries in the body.
     * Temporary identifiers are not made permanent. */
    public static Function sanitizeVariables(Function function, Set<IdentName> dangerous) {
        return new AvoidAliasConflict(new NamingState(dangerous), false).applyFunction(function);
    }

    /** Same as {@link #sanitizeVariables(Function, Set)} for the alias of a foreach. */
    public static Foreach sanitizeVariables(Foreach foreach, Set<IdentName> dangerous) {
        return new AvoidAliasConflict(new NamingState(dangerous), false).applyForeach(foreach);
    }

    /** Resolve the query avoiding the dangerous names, then normalize it again,
     * since the renaming may have changed which fusions apply. */
    public static Query sanitizeQuery(Query query, Set<IdentName> dangerous) {
        Ast resolved = new AvoidAliasConflict(new NamingState(dangerous), false).apply(query);
        return Normalize.normalize(resolved.to(Query.class));
    }

    /** True if the query introduces no identifiers: an entity or an infix,
     * possibly wrapped in operators which have no binders. */
    static boolean isAliasFree(Ast query) {
        if (query.is(Entity.class) || query.is(Infix.class))
            return true;
        Nested nested = query.as(Nested.class);
        if (nested != null)
            return nested.query.is(Query.class) && isAliasFree(nested.query);
        Take take = query.as(Take.class);
        if (take != null)
            return take.query.is(Query.class) && isAliasFree(take.query);
        Drop drop = query.as(Drop.class);
        if (drop != null)
            return drop.query.is(Query.class) && isAliasFree(drop.query);
        Aggregation aggregation = query.as(Aggregation.class);
        if (aggregation != null)
            return aggregation.query.is(Query.class) && isAliasFree(aggregation.query);
        Distinct distinct = query.as(Distinct.class);
        if (distinct != null)
            return distinct.query.is(Query.class) && isAliasFree(distinct.query);
        return false;
    }

    /** Join expansion builds identifiers from the aliases of a join which is the
     * direct source of an aliased query; such a join must keep its aliases
     * when resolved from its parent. */
    static boolean canRealias(Ast query) {
        return !query.is(Join.class);
    }

    Ident freshIdent(Ident ident, NamingState state) {
        Ident candidate = ident;
        if (this.permanentize && ident.isTemporary())
            candidate = new Ident(PERMANENT_NAME, ident.quat);
        Ident result = state.dedupe(candidate);
        if (!result.equals(ident))
            Logger.INSTANCE.belowLevel(this, 2)
                    .appendSupplier(this::toString)
                    .append(": rename ")
                    .append(ident)
                    .append(" -> ")
                    .append(result)
                    .newline();
        return result;
    }

    Ident freshIdent(Ident ident) {
        return this.freshIdent(ident, this.state);
    }

    /** Rename the alias, mark it as used, and resolve the body. */
    Ast renameAndResolve(Ident alias, Ident fresh, Ast body) {
        Ast renamed = BetaReduction.substitute(body, alias, fresh);
        this.state = this.state.with(fresh);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("State ")
                .appendSupplier(this.state::toString)
                .newline();
        return this.transform(renamed);
    }

    @Override
    public VisitDecision preorder(AliasedQuery node) {
        this.push(node);
        Ast query;
        Ident alias;
        Ast body;
        if (isAliasFree(node.query)) {
            // Nothing to resolve in the source
            query = node.query;
            alias = this.freshIdent(node.alias);
            body = this.renameAndResolve(node.alias, alias, node.body);
        } else if (canRealias(node.query)) {
            query = this.transform(node.query);
            alias = this.freshIdent(node.alias);
            body = this.renameAndResolve(node.alias, alias, node.body);
        } else {
            // The join is resolved, but this alias is kept
            query = this.transform(node.query);
            alias = node.alias;
            this.state = this.state.with(alias);
            body = this.transform(node.body);
        }
        this.pop(node);
        this.map(node, node.with(query, alias, body));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SortBy node) {
        // The ordering has no identifiers; 'with' preserves it.
        return this.preorder((AliasedQuery) node);
    }

    @Override
    public VisitDecision preorder(Join node) {
        this.push(node);
        Ast left = this.transform(node.left);
        Ast right = this.transform(node.right);
        Ident freshA = this.freshIdent(node.leftAlias);
        Ident freshB = this.freshIdent(node.rightAlias, this.state.with(freshA));
        Ast on = BetaReduction.substitute(node.on, node.leftAlias, freshA, node.rightAlias, freshB);
        this.state = this.state.with(freshA).with(freshB);
        on = this.transform(on);
        this.pop(node);
        this.map(node, new Join(node.joinType, left, right, freshA, freshB, on));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatJoin node) {
        this.push(node);
        Ast query = this.transform(node.query);
        Ident fresh = this.freshIdent(node.alias);
        Ast on = this.renameAndResolve(node.alias, fresh, node.on);
        this.pop(node);
        this.map(node, new FlatJoin(node.joinType, query, fresh, on));
        return VisitDecision.STOP;
    }

    /** Rename the function parameters which are in the state.
     * A parameter never takes the original name of a parameter after it,
     * so all renamings can be substituted at once. */
    Function applyFunction(Function function) {
        java.util.Map<IdentName, Ast> renames = new LinkedHashMap<>();
        List<Ident> params = new ArrayList<>();
        NamingState state = this.state;
        for (int i = 0; i < function.params.size(); i++) {
            Ident param = function.params.get(i);
            NamingState avoid = state;
            for (int j = i + 1; j < function.params.size(); j++)
                avoid = avoid.with(function.params.get(j));
            Ident fresh = this.freshIdent(param, avoid);
            state = state.with(fresh);
            params.add(fresh);
            if (!fresh.equals(param))
                renames.put(param.idName(), fresh);
        }
        Ast body = new BetaReduction(renames).apply(function.body);
        Stateful<NamingState> resolved = new AvoidAliasConflict(state, false).applyStateful(body);
        this.state = resolved.state();
        return new Function(params, resolved.node());
    }

    Foreach applyForeach(Foreach foreach) {
        Ident fresh = this.freshIdent(foreach.alias);
        Ast body = BetaReduction.substitute(foreach.body, foreach.alias, fresh);
        Stateful<NamingState> resolved = new AvoidAliasConflict(this.state.with(fresh), false)
                .applyStateful(body);
        this.state = resolved.state();
        return new Foreach(foreach.query, fresh, resolved.node());
    }

    @Override
    public String toString() {
        return super.toString() + (this.permanentize ? "(permanentize)" : "");
    }
}
