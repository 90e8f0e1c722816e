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

import org.junit.Assert;
import org.junit.Test;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.Quat;

import static org.qnorm.normalizer.AstFactory.*;

public class NamingStateTests {
    @Test
    public void dedupePicksSmallestSuffix() {
        NamingState state = new NamingState(names("a", "a1"));
        Assert.assertEquals(id("a2"), state.dedupe(id("a")));
        Assert.assertEquals(id("b1"), new NamingState(names("b", "a1")).dedupe(id("b")));
    }

    @Test
    public void freeNameIsKept() {
        Ident b = id("b");
        Assert.assertSame(b, new NamingState(names("a")).dedupe(b));
        Assert.assertSame(b, NamingState.EMPTY.dedupe(b));
    }

    @Test
    public void suffixIsAppendedToWholeName() {
        NamingState state = new NamingState(names("a", "a1"));
        Assert.assertEquals(id("a11"), state.dedupe(id("a1")));
    }

    @Test
    public void renamePreservesQuat() {
        Quat person = new Quat("Person");
        Ident renamed = new NamingState(names("p")).dedupe(new Ident("p", person));
        Assert.assertEquals(new Ident("p1", person), renamed);
        Assert.assertEquals(person, renamed.quat);
    }

    @Test
    public void stateIsImmutable() {
        NamingState state = new NamingState(names("a"));
        NamingState extended = state.with(id("b"));
        Assert.assertFalse(state.contains(new IdentName("b")));
        Assert.assertTrue(extended.contains(new IdentName("b")));
        Assert.assertSame(extended, extended.with(new IdentName("a")));
        Assert.assertEquals(new NamingState(names("b", "a")), extended);
    }
}
