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

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.query.Map;

import static org.qnorm.normalizer.AstFactory.*;

public class NormalizeTests {
    @Before
    public void resetTemporaries() {
        Ident.reset();
    }

    @After
    public void cleanup() {
        Ident.reset();
    }

    @Test
    public void mapOfMap() {
        Query query = map(map(entity("Person"), "p", prop(id("p"), "name")),
                "p2", concat(id("p2"), str("!")));
        Query result = Normalize.normalize(query);
        Assert.assertEquals("query[Person].map(p => (p.name +++ \"!\"))", result.toString());
    }

    @Test
    public void filterMovesBelowMap() {
        Query query = filter(map(entity("Person"), "p", prop(id("p"), "name")),
                "n", eq(id("n"), str("Bob")));
        Query expected = map(filter(entity("Person"), "p", eq(prop(id("p"), "name"), str("Bob"))),
                "p", prop(id("p"), "name"));
        Assert.assertEquals(expected, Normalize.normalize(query));
    }

    @Test
    public void chainIsFusedCompletely() {
        Query query = filter(map(map(entity("E"), "a", prop(id("a"), "x")), "b", prop(id("b"), "y")),
                "c", eq(id("c"), num(1)));
        Query expected = map(filter(entity("E"), "a", eq(prop(prop(id("a"), "x"), "y"), num(1))),
                "a", prop(prop(id("a"), "x"), "y"));
        Assert.assertEquals(expected, Normalize.normalize(query));
    }

    @Test
    public void fusionDoesNotCapture() {
        // The inner 'a' would capture the 'a' of 'a.x' substituted for 'b'
        Query query = map(map(entity("E"), "a", prop(id("a"), "x")),
                "b", map(entity("F"), "a", tuple(id("a"), id("b"))));
        Query result = Normalize.normalize(query);
        Query expected = map(entity("E"), "a",
                map(entity("F"), "a1", tuple(id("a1"), prop(id("a"), "x"))));
        Assert.assertEquals(expected, result);
        Assert.assertTrue(FreeVariables.of(result).isEmpty());
    }

    @Test
    public void groupByShapeIsPreserved() {
        Query query = map(map(groupBy(entity("E"), "g", prop(id("g"), "k")), "x", id("x")),
                "y", id("y"));
        Assert.assertEquals(query, Normalize.normalize(query));
    }

    @Test
    public void normalizeIsIdempotent() {
        Query query = flatMap(map(entity("A"), "a", prop(id("a"), "x")),
                "a", filter(map(entity("B"), "a", id("a")), "b", eq(id("b"), id("a"))));
        Query once = Normalize.normalize(query);
        Assert.assertEquals(once, Normalize.normalize(once));
    }

    @Test
    public void finalPassPermanentizes() {
        Ident temporary = Ident.temporary(Quat.VALUE);
        Query query = map(new Map(entity("E"), temporary, prop(temporary, "x")), "y", tuple(id("y")));

        Query normalized = Normalize.normalize(query);
        Assert.assertEquals(new Map(entity("E"), temporary, tuple(prop(temporary, "x"))), normalized);

        Ident permanent = new Ident("x", Quat.VALUE);
        Query result = Normalize.finalPass(query);
        Assert.assertEquals(new Map(entity("E"), permanent, tuple(prop(permanent, "x"))), result);
    }
}
