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

package org.qnorm.normalizer.ast;

import org.junit.Assert;
import org.junit.Test;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.query.Infix;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.util.Linq;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.qnorm.normalizer.AstFactory.*;

public class AstTests {
    @Test
    public void structuralEquality() {
        Map left = map(entity("Person"), "p", prop(id("p"), "name"));
        Map right = map(entity("Person"), "p", prop(id("p"), "name"));
        Assert.assertNotSame(left, right);
        Assert.assertEquals(left, right);
        Assert.assertEquals(left.hashCode(), right.hashCode());
        Assert.assertNotEquals(left, filter(entity("Person"), "p", prop(id("p"), "name")));
        Assert.assertNotEquals(left, map(entity("Person"), "q", prop(id("p"), "name")));
    }

    @Test
    public void identQuatIsOpaque() {
        Ident untyped = new Ident("a");
        Ident typed = new Ident("a", new Quat("Person"));
        Assert.assertEquals(untyped, typed);
        Assert.assertEquals(untyped.hashCode(), typed.hashCode());
        Assert.assertFalse(untyped.sameFields(typed));
        Assert.assertNotEquals(untyped, new Ident("b", new Quat("Person")));
        Assert.assertEquals(untyped.idName(), typed.idName());
        Assert.assertSame(typed, typed.withName("a"));
        Assert.assertEquals(typed.quat, typed.withName("b").quat);
    }

    @Test
    public void temporariesAreUniqueAcrossThreads() throws InterruptedException {
        Set<String> names = ConcurrentHashMap.newKeySet();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread thread = new Thread(() -> {
                for (int j = 0; j < 1000; j++)
                    names.add(Ident.temporary(Quat.VALUE).name);
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread: threads)
            thread.join();
        Assert.assertEquals(4000, names.size());
    }

    @Test
    public void temporaryIdentifiers() {
        Ident.reset();
        Ident first = Ident.temporary(Quat.VALUE);
        Ident second = Ident.temporary(Quat.VALUE);
        Assert.assertTrue(first.isTemporary());
        Assert.assertTrue(second.isTemporary());
        Assert.assertNotEquals(first, second);
        Assert.assertFalse(id("x").isTemporary());
        Assert.assertEquals("[tmp_0]", first.name);
        Ident.reset();
    }

    @Test
    public void printing() {
        Ast query = map(entity("Person"), "p", prop(id("p"), "name"));
        Assert.assertEquals("query[Person].map(p => p.name)", query.toString());

        Ast sorted = sortBy(entity("A"), "a", prop(id("a"), "id"), PropertyOrdering.DESC);
        Assert.assertEquals("query[A].sortBy(a => a.id)(Ord.desc)", sorted.toString());

        Ast join = join(entity("A"), entity("B"), "a", "b",
                eq(prop(id("a"), "id"), prop(id("b"), "fk")));
        Assert.assertEquals("query[A].join(query[B]).on((a, b) => (a.id == b.fk))", join.toString());

        Ast literal = concat(str("Bob"), tuple(num(1), id("x")));
        Assert.assertEquals("(\"Bob\" +++ (1, x))", literal.toString());
    }

    @Test
    public void infixArity() {
        Infix infix = new Infix(Linq.list("SELECT * FROM t WHERE id = ", ""),
                Linq.<Ast>list(num(3)), false, Quat.UNKNOWN);
        Assert.assertEquals("sql\"SELECT * FROM t WHERE id = ${3}\"", infix.toString());
        Assert.assertThrows(InternalCompilerError.class,
                () -> new Infix(Linq.list("a", "b"), Linq.<Ast>list(), true, Quat.UNKNOWN));
    }

    @Test
    public void casts() {
        Ast query = map(entity("A"), "a", id("a"));
        Assert.assertTrue(query.is(Query.class));
        Assert.assertNull(query.as(Action.class));
        Assert.assertSame(query, query.to(Map.class));
    }
}
