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
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.expression.PropertyOrdering;
import org.qnorm.normalizer.ast.query.ConcatMap;
import org.qnorm.normalizer.ast.query.GroupBy;
import org.qnorm.normalizer.ast.query.Map;

import static org.qnorm.normalizer.AstFactory.*;

public class ApplyIntermediateMapTests {
    static GroupBy grouped() {
        return groupBy(entity("E"), "g", prop(id("g"), "k"));
    }

    @Test
    public void identityMap() {
        Query query = map(entity("E"), "b", id("b"));
        Assert.assertEquals(entity("E"), ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void identityMapIgnoresShapes() {
        Query query = new Map(entity("E"), new Ident("b", Quat.VALUE), new Ident("b", Quat.UNKNOWN));
        Assert.assertEquals(entity("E"), ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void identityMapOverGroupByIsKept() {
        Query query = map(grouped(), "b", id("b"));
        Assert.assertNull(ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void identityMapOverNonQueryIsKept() {
        Query query = map(id("xs"), "b", id("b"));
        Assert.assertNull(ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void mapOfMap() {
        Query query = map(map(entity("Person"), "p", prop(id("p"), "name")),
                "p2", concat(id("p2"), str("!")));
        Query expected = map(entity("Person"), "p", concat(prop(id("p"), "name"), str("!")));
        Assert.assertEquals(expected, ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void flatMapOfMap() {
        Query query = flatMap(map(entity("A"), "a", prop(id("a"), "x")),
                "d", filter(entity("B"), "b", eq(prop(id("b"), "y"), id("d"))));
        Query expected = flatMap(entity("A"), "a",
                filter(entity("B"), "b", eq(prop(id("b"), "y"), prop(id("a"), "x"))));
        Assert.assertEquals(expected, ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void filterOfMap() {
        Query query = filter(map(entity("Person"), "p", prop(id("p"), "name")),
                "n", eq(id("n"), str("Bob")));
        Query expected = map(filter(entity("Person"), "p", eq(prop(id("p"), "name"), str("Bob"))),
                "p", prop(id("p"), "name"));
        Assert.assertEquals(expected, ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void sortByOfMap() {
        Query query = sortBy(map(entity("P"), "p", prop(id("p"), "age")), "x", id("x"), PropertyOrdering.DESC);
        Query expected = map(sortBy(entity("P"), "p", prop(id("p"), "age"), PropertyOrdering.DESC),
                "p", prop(id("p"), "age"));
        Assert.assertEquals(expected, ApplyIntermediateMap.simplify(query));
    }

    @Test
    public void mapOverGroupByIsNeverFused() {
        Map overGroup = map(grouped(), "t", tuple(prop(id("t"), "_1"), prop(id("t"), "_2")));
        Assert.assertNull(ApplyIntermediateMap.simplify(map(overGroup, "x", prop(id("x"), "_1"))));
        Assert.assertNull(ApplyIntermediateMap.simplify(flatMap(overGroup, "x", entity("B"))));
        Assert.assertNull(ApplyIntermediateMap.simplify(filter(overGroup, "x", prop(id("x"), "_1"))));
        Assert.assertNull(ApplyIntermediateMap.simplify(
                sortBy(overGroup, "x", prop(id("x"), "_1"), PropertyOrdering.ASC)));
        // The map itself has no intermediate map
        Assert.assertNull(ApplyIntermediateMap.simplify(overGroup));
    }

    @Test
    public void noRuleApplies() {
        Assert.assertNull(ApplyIntermediateMap.simplify(filter(entity("E"), "a", prop(id("a"), "ok"))));
        Assert.assertNull(ApplyIntermediateMap.simplify(entity("E")));
        Query concatMap = new ConcatMap(map(entity("E"), "a", prop(id("a"), "tags")), id("t"), id("t"));
        Assert.assertNull(ApplyIntermediateMap.simplify(concatMap));
    }

    @Test
    public void bottomUpSweepFusesChain() {
        Query query = map(map(map(entity("E"), "a", prop(id("a"), "x")), "b", prop(id("b"), "y")),
                "c", tuple(id("c")));
        Ast fused = IntermediateMapPass.fuse(query);
        Assert.assertEquals(map(entity("E"), "a", tuple(prop(prop(id("a"), "x"), "y"))), fused);
    }
}
