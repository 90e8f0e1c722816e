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

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Expression;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.JoinType;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.ast.query.Take;
import org.qnorm.normalizer.ast.query.Union;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.normalizer.norm.FreeVariables;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.Stateful;
import org.qnorm.util.IIndentStream;
import org.qnorm.util.Linq;

import static org.qnorm.normalizer.AstFactory.*;

public class AvoidAliasConflictTests {
    @Before
    public void resetTemporaries() {
        Ident.reset();
    }

    @After
    public void cleanup() {
        Ident.reset();
    }

    static Ast resolve(Ast ast, String... used) {
        return new AvoidAliasConflict(new NamingState(names(used)), false).apply(ast);
    }

    @Test
    public void innerAliasOverAliasFreeSource() {
        Query query = flatMap(entity("A"), "a",
                filter(entity("E"), "a", eq(prop(id("a"), "id"), prop(id("a"), "fk"))));
        Query expected = flatMap(entity("A"), "a",
                filter(entity("E"), "a1", eq(prop(id("a1"), "id"), prop(id("a1"), "fk"))));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, false));
    }

    @Test
    public void outerReferenceIsKept() {
        Query query = flatMap(entity("A"), "a",
                filter(entity("E"), "b", eq(prop(id("a"), "id"), prop(id("b"), "fk"))));
        Assert.assertEquals(query, AvoidAliasConflict.apply(query, false));
    }

    @Test
    public void wrappedEntityIsNotVisited() {
        Take source = new Take(entity("A"), num(10));
        Map query = map(source, "a", prop(id("a"), "id"));
        Map result = resolve(query, "a").to(Map.class);
        Assert.assertEquals(map(source, "a1", prop(id("a1"), "id")), result);
        Assert.assertSame(source, result.query);
    }

    @Test
    public void sourceIsResolvedBeforeAlias() {
        Query query = map(filter(entity("A"), "a", prop(id("a"), "ok")), "a", prop(id("a"), "id"));
        Query expected = map(filter(entity("A"), "a", prop(id("a"), "ok")), "a1", prop(id("a1"), "id"));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, false));
    }

    @Test
    public void siblingsShareState() {
        Query query = new Union(map(entity("A"), "a", prop(id("a"), "id")),
                map(entity("B"), "a", prop(id("a"), "id")));
        Query expected = new Union(map(entity("A"), "a", prop(id("a"), "id")),
                map(entity("B"), "a1", prop(id("a1"), "id")));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, false));
    }

    @Test
    public void stateIsReturned() {
        Query query = new Union(map(entity("A"), "a", id("a")), map(entity("B"), "a", id("a")));
        Stateful<NamingState> result = new AvoidAliasConflict(NamingState.EMPTY, false).applyStateful(query);
        Assert.assertEquals(new NamingState(names("a", "a1")), result.state());
    }

    @Test
    public void joinRenamesCollidingAlias() {
        Ast query = join(entity("A"), entity("B"), "a", "b", eq(prop(id("a"), "id"), prop(id("b"), "fk")));
        Ast expected = join(entity("A"), entity("B"), "a1", "b", eq(prop(id("a1"), "id"), prop(id("b"), "fk")));
        Assert.assertEquals(expected, resolve(query, "a"));
    }

    @Test
    public void joinAliasesAreRenamedTogether() {
        // The right alias is the fresh name of the left one
        Ast query = join(entity("A"), entity("B"), "a", "a1", eq(prop(id("a"), "id"), prop(id("a1"), "fk")));
        Ast expected = join(entity("A"), entity("B"), "a1", "a11",
                eq(prop(id("a1"), "id"), prop(id("a11"), "fk")));
        Assert.assertEquals(expected, resolve(query, "a"));
    }

    @Test
    public void joinSourceKeepsAlias() {
        Ast joined = join(entity("A"), entity("B"), "a", "b", eq(prop(id("a"), "id"), prop(id("b"), "id")));
        Ast query = map(joined, "x", id("x"));
        Assert.assertEquals(query, resolve(query, "x"));

        Ast filtered = map(filter(entity("A"), "a", prop(id("a"), "ok")), "x", id("x"));
        Ast expected = map(filter(entity("A"), "a", prop(id("a"), "ok")), "x1", id("x1"));
        Assert.assertEquals(expected, resolve(filtered, "x"));
    }

    @Test
    public void sortByKeepsOrdering() {
        Ast query = sortBy(entity("A"), "a", prop(id("a"), "id"), PropertyOrdering.DESC);
        Ast expected = sortBy(entity("A"), "a1", prop(id("a1"), "id"), PropertyOrdering.DESC);
        Assert.assertEquals(expected, resolve(query, "a"));
    }

    @Test
    public void flatJoinAlias() {
        Query query = flatMap(entity("A"), "a",
                new FlatJoin(JoinType.LEFT, entity("B"), id("a"), eq(prop(id("a"), "id"), num(1))));
        Query expected = flatMap(entity("A"), "a",
                new FlatJoin(JoinType.LEFT, entity("B"), id("a1"), eq(prop(id("a1"), "id"), num(1))));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, false));
    }

    @Test
    public void temporaryBecomesPermanent() {
        Ident temporary = Ident.temporary(Quat.VALUE);
        Query query = new Map(entity("E"), temporary, prop(temporary, "x"));
        Ident permanent = new Ident("x", Quat.VALUE);
        Assert.assertEquals(new Map(entity("E"), permanent, prop(permanent, "x")),
                AvoidAliasConflict.apply(query, true));
    }

    @Test
    public void permanentNameAvoidsUsedNames() {
        Ident temporary = Ident.temporary(Quat.VALUE);
        Query query = map(entity("E"), "x", new Map(entity("F"), temporary, tuple(id("x"), temporary)));
        Ident permanent = new Ident("x1", Quat.VALUE);
        Query expected = map(entity("E"), "x", new Map(entity("F"), permanent, tuple(id("x"), permanent)));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, true));
    }

    @Test
    public void siblingTemporariesGetDistinctNames() {
        Ident first = Ident.temporary(Quat.VALUE);
        Ident second = Ident.temporary(Quat.VALUE);
        Query query = new Union(new Map(entity("A"), first, first), new Map(entity("B"), second, second));
        Ident x = new Ident("x", Quat.VALUE);
        Ident x1 = new Ident("x1", Quat.VALUE);
        Query expected = new Union(new Map(entity("A"), x, x), new Map(entity("B"), x1, x1));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(query, true));
    }

    @Test
    public void temporariesKeptWithoutPermanentize() {
        Ident temporary = Ident.temporary(Quat.VALUE);
        Query query = new Map(entity("E"), temporary, prop(temporary, "x"));
        Query result = AvoidAliasConflict.apply(query, false);
        Assert.assertEquals(query, result);
        Assert.assertTrue(result.to(Map.class).alias.isTemporary());
    }

    static Query nested() {
        return flatMap(filter(entity("A"), "a", eq(prop(id("a"), "id"), num(1))), "a",
                join(map(entity("B"), "a", prop(id("a"), "v")),
                        filter(entity("C"), "a", eq(prop(id("a"), "k"), num(2))),
                        "a", "b", eq(prop(id("a"), "v"), prop(id("b"), "k"))));
    }

    @Test
    public void everyBinderIsRenamed() {
        Query expected = flatMap(filter(entity("A"), "a", eq(prop(id("a"), "id"), num(1))), "a1",
                join(map(entity("B"), "a2", prop(id("a2"), "v")),
                        filter(entity("C"), "a3", eq(prop(id("a3"), "k"), num(2))),
                        "a4", "b", eq(prop(id("a4"), "v"), prop(id("b"), "k"))));
        Assert.assertEquals(expected, AvoidAliasConflict.apply(nested(), false));
    }

    @Test
    public void resultIsHygienic() {
        Query query = nested();
        Assert.assertFalse(BinderPaths.duplicates(query).isEmpty());
        Query result = AvoidAliasConflict.apply(query, false);
        Assert.assertEquals(Linq.list(), BinderPaths.duplicates(result));
    }

    @Test
    public void resolutionIsIdempotent() {
        Query once = AvoidAliasConflict.apply(nested(), false);
        Assert.assertEquals(once, AvoidAliasConflict.apply(once, false));
    }

    /** An aliased query reading a join directly keeps its alias, even when an
     * enclosing binder has the same name.  This is the only repeated binder
     * the resolver leaves behind. */
    @Test
    public void aliasOverJoinMayRepeatEnclosingName() {
        Query query = flatMap(entity("A"), "x",
                map(join(entity("B"), entity("C"), "b", "c", id("b")), "x", id("x")));
        Query result = AvoidAliasConflict.apply(query, false);
        Assert.assertEquals(query, result);
        Assert.assertEquals(Linq.list("x"), BinderPaths.duplicates(result));
    }

    @Test
    public void dangerousFreeNamesAreNotCaptured() {
        Query query = flatMap(entity("A"), "a", filter(entity("B"), "a", eq(prop(id("a"), "id"), prop(id("a1"), "id"))));
        Ast result = new AvoidAliasConflict(new NamingState(FreeVariables.of(query)), false).apply(query);
        Query expected = flatMap(entity("A"), "a",
                filter(entity("B"), "a2", eq(prop(id("a2"), "id"), prop(id("a1"), "id"))));
        Assert.assertEquals(expected, result);
        Assert.assertEquals(FreeVariables.of(query), FreeVariables.of(result));
    }

    @Test
    public void sanitizeFunction() {
        Function function = new Function(Linq.list(id("v")),
                filter(entity("E"), "x", eq(prop(id("x"), "id"), prop(id("v"), "id"))));
        Function expected = new Function(Linq.list(id("v1")),
                filter(entity("E"), "x", eq(prop(id("x"), "id"), prop(id("v1"), "id"))));
        Assert.assertEquals(expected, AvoidAliasConflict.sanitizeVariables(function, names("v")));
    }

    @Test
    public void sanitizeFunctionDoesNotCaptureLaterParameter() {
        Function function = new Function(Linq.list(id("a"), id("a1")), tuple(id("a"), id("a1")));
        Function expected = new Function(Linq.list(id("a2"), id("a1")), tuple(id("a2"), id("a1")));
        Assert.assertEquals(expected, AvoidAliasConflict.sanitizeVariables(function, names("a")));
    }

    @Test
    public void sanitizeForeach() {
        Foreach foreach = new Foreach(entity("E"), id("v"),
                filter(entity("F"), "x", eq(prop(id("x"), "id"), prop(id("v"), "id"))));
        Foreach expected = new Foreach(entity("E"), id("v1"),
                filter(entity("F"), "x", eq(prop(id("x"), "id"), prop(id("v1"), "id"))));
        Assert.assertEquals(expected, AvoidAliasConflict.sanitizeVariables(foreach, names("v")));
    }

    @Test
    public void sanitizeQueryNormalizes() {
        Query query = map(map(entity("E"), "v", prop(id("v"), "name")), "n", tuple(id("n")));
        Query expected = map(entity("E"), "v1", tuple(prop(id("v1"), "name")));
        Assert.assertEquals(expected, AvoidAliasConflict.sanitizeQuery(query, names("v")));
    }

    /** A node kind no visitor knows about. */
    static final class Opaque extends Expression {
        @Override
        public void accept(AstVisitor visitor) {
            visitor.preorder(this);
        }

        @Override
        public boolean sameFields(Ast other) {
            return this == other;
        }

        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append("opaque");
        }
    }

    @Test
    public void unknownNodeFails() {
        Query query = map(entity("E"), "a", new Opaque());
        Assert.assertThrows(InternalCompilerError.class, () -> AvoidAliasConflict.apply(query, false));
    }
}
