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
import org.qnorm.normalizer.errors.InternalCompilerError;

public class ScopesTests {
    @Test
    public void innermostScopeWins() {
        Scopes<String, Integer> scopes = new Scopes<>();
        scopes.newContext();
        scopes.substitute("a", 1);
        scopes.substitute("b", 2);
        scopes.newContext();
        scopes.substitute("a", 3);
        scopes.shadow("b");
        Assert.assertEquals(Integer.valueOf(3), scopes.get("a"));
        Assert.assertNull(scopes.get("b"));
        Assert.assertNull(scopes.get("c"));
        scopes.popContext();
        Assert.assertEquals(Integer.valueOf(1), scopes.get("a"));
        Assert.assertEquals(Integer.valueOf(2), scopes.get("b"));
        scopes.popContext();
        scopes.mustBeEmpty();
    }

    @Test
    public void unbalancedContexts() {
        Scopes<String, Integer> scopes = new Scopes<>();
        Assert.assertThrows(InternalCompilerError.class, () -> scopes.substitute("a", 1));
        scopes.newContext();
        Assert.assertThrows(InternalCompilerError.class, scopes::mustBeEmpty);
    }
}
