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
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.util.Linq;

import static org.qnorm.normalizer.AstFactory.*;

public class FreeVariablesTests {
    @Test
    public void aliasIsBoundInBody() {
        Ast query = map(entity("E"), "a", eq(prop(id("a"), "id"), prop(id("b"), "id")));
        Assert.assertEquals(names("b"), FreeVariables.of(query));
    }

    @Test
    public void aliasIsFreeInSource() {
        Ast query = filter(id("a"), "a", prop(id("a"), "ok"));
        Assert.assertEquals(names("a"), FreeVariables.of(query));
    }

    @Test
    public void joinBindsBothAliases() {
        Ast query = join(id("l"), id("r"), "a", "b",
                eq(prop(id("a"), "id"), tuple(id("b"), id("c"))));
        Assert.assertEquals(names("l", "r", "c"), FreeVariables.of(query));
    }

    @Test
    public void nestedScopes() {
        Ast query = flatMap(entity("A"), "a",
                map(entity("B"), "b", tuple(id("a"), id("b"), id("c"))));
        Assert.assertEquals(names("c"), FreeVariables.of(query));
        Assert.assertEquals(names("a", "c"),
                FreeVariables.of(map(entity("B"), "b", tuple(id("a"), id("b"), id("c")))));
    }

    @Test
    public void functionParameters() {
        Ast function = new Function(Linq.list(id("x"), id("y")), tuple(id("x"), id("y"), id("z")));
        Assert.assertEquals(names("z"), FreeVariables.of(function));
    }
}
