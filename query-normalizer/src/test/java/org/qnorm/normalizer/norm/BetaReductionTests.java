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

import org.junit.Assert;
import org.junit.Test;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.expression.FunctionApply;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.query.FlatJoin;
import org.qnorm.normalizer.ast.query.JoinType;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.util.Linq;

import java.util.LinkedHashMap;

import static org.qnorm.normalizer.AstFactory.*;

public class BetaReductionTests {
    @Test
    public void replaceFreeOccurrences() {
        Ast body = eq(prop(id("a"), "id"), prop(id("b"), "id"));
        Ast result = BetaReduction.substitute(body, id("a"), id("c"));
        Assert.assertEquals(eq(prop(id("c"), "id"), prop(id("b"), "id")), result);
    }

    @Test
    public void replaceWithExpression() {
        Ast body = concat(id("n"), str("!"));
        Ast result = BetaReduction.substitute(body, id("n"), prop(id("p"), "name"));
        Assert.assertEquals(concat(prop(id("p"), "name"), str("!")), result);
    }

    @Test
    public void unchangedTreeIsReused() {
        Ast body = tuple(id("c"), prop(id("d"), "x"));
        Assert.assertSame(body, BetaReduction.substitute(body, id("a"), id("b")));
    }

    @Test
    public void aliasShadowsInBody() {
        Ast query = map(entity("E"), "a", prop(id("a"), "id"));
        Assert.assertSame(query, BetaReduction.substitute(query, id("a"), id("c")));
    }

    @Test
    public void sourceIsOutsideAliasScope() {
        Ast query = map(id("a"), "a", prop(id("a"), "id"));
        Ast result = BetaReduction.substitute(query, id("a"), entity("E"));
        Assert.assertEquals(map(entity("E"), "a", prop(id("a"), "id")), result);
    }

    @Test
    public void sortByShadowsCriteria() {
        Ast query = sortBy(id("s"), "a", tuple(id("a"), id("b")), PropertyOrdering.ASC);
        Ast result = BetaReduction.substitute(query, id("a"), id("z"), id("b"), id("y"));
        Assert.assertEquals(sortBy(id("s"), "a", tuple(id("a"), id("y")), PropertyOrdering.ASC), result);
    }

    @Test
    public void joinShadowsBothAliases() {
        Ast query = join(entity("A"), entity("B"), "a", "b",
                eq(prop(id("a"), "id"), prop(id("c"), "id")));
        Ast result = BetaReduction.substitute(query, id("c"), id("d"));
        Assert.assertEquals(join(entity("A"), entity("B"), "a", "b",
                eq(prop(id("a"), "id"), prop(id("d"), "id"))), result);
        Assert.assertSame(query, BetaReduction.substitute(query, id("a"), id("d")));
        Assert.assertSame(query, BetaReduction.substitute(query, id("b"), id("d")));
    }

    @Test
    public void flatJoinAndForeachShadow() {
        Ast flatJoin = new FlatJoin(JoinType.LEFT, id("q"), id("a"), eq(id("a"), id("q")));
        Ast result = BetaReduction.substitute(flatJoin, id("a"), id("z"), id("q"), entity("B"));
        Assert.assertEquals(new FlatJoin(JoinType.LEFT, entity("B"), id("a"), eq(id("a"), entity("B"))), result);

        Ast foreach = new Foreach(id("q"), id("v"), tuple(id("v"), id("w")));
        result = BetaReduction.substitute(foreach, id("v"), id("z"), id("w"), id("y"));
        Assert.assertEquals(new Foreach(id("q"), id("v"), tuple(id("v"), id("y"))), result);
    }

    @Test
    public void functionParametersShadow() {
        Ast function = new Function(Linq.list(id("a")), tuple(id("a"), id("b")));
        Ast result = BetaReduction.substitute(function, id("a"), id("x"), id("b"), id("y"));
        Assert.assertEquals(new Function(Linq.list(id("a")), tuple(id("a"), id("y"))), result);
    }

    @Test
    public void substitutionIsSimultaneous() {
        Ast body = tuple(id("a"), id("b"));
        Ast result = BetaReduction.substitute(body, id("a"), id("b"), id("b"), id("a"));
        Assert.assertEquals(tuple(id("b"), id("a")), result);
    }

    @Test
    public void replacementIsNotRewritten() {
        java.util.Map<IdentName, Ast> substitution = new LinkedHashMap<>();
        substitution.put(new IdentName("a"), id("b"));
        substitution.put(new IdentName("b"), id("c"));
        Ast result = new BetaReduction(substitution).apply(tuple(id("a"), id("b")));
        Assert.assertEquals(tuple(id("b"), id("c")), result);
    }

    @Test
    public void applyFunctionLiteral() {
        Function function = new Function(Linq.list(id("x"), id("y")), plus(id("x"), id("y")));
        Ast apply = new FunctionApply(function, Linq.<Ast>list(num(1), num(2)));
        Ast result = new BetaReduction().apply(apply);
        Assert.assertEquals(plus(num(1), num(2)), result);
    }

    @Test
    public void applyNestedInQuery() {
        Function function = new Function(Linq.list(id("x")), prop(id("x"), "name"));
        Ast query = map(entity("Person"), "p", new FunctionApply(function, Linq.<Ast>list(id("p"))));
        Ast result = new BetaReduction().apply(query);
        Assert.assertEquals(map(entity("Person"), "p", prop(id("p"), "name")), result);
    }

    @Test
    public void applyUnknownFunctionIsKept() {
        Ast apply = new FunctionApply(id("f"), Linq.<Ast>list(id("a")));
        Ast result = BetaReduction.substitute(apply, id("a"), num(3));
        Assert.assertEquals(new FunctionApply(id("f"), Linq.<Ast>list(num(3))), result);
    }

    @Test
    public void arityMismatch() {
        Function function = new Function(Linq.list(id("x"), id("y")), plus(id("x"), id("y")));
        Ast apply = new FunctionApply(function, Linq.<Ast>list(num(1)));
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class,
                () -> new BetaReduction().apply(apply));
        Assert.assertTrue(error.getMessage().contains("called with 1 arguments"));
    }
}
