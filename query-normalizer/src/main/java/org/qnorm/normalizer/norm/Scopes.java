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

import org.qnorm.normalizer.errors.InternalCompilerError;
import org.qnorm.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Nested scopes holding substitutions.  Each scope may substitute a key or
 * shadow it; the innermost scope mentioning a key decides.
 * A shadowed key is stored with a null value. */
public class Scopes<K, V> {
    protected final List<HashMap<K, V>> stack;

    public Scopes() {
        this.stack = new ArrayList<>();
    }

    public void newContext() {
        this.stack.add(new HashMap<>());
    }

    public void popContext() {
        Utilities.removeLast(this.stack);
    }

    HashMap<K, V> innermost() {
        if (this.stack.isEmpty())
            throw new InternalCompilerError("No scope is open");
        return Utilities.last(this.stack);
    }

    public void substitute(K key, V value) {
        this.innermost().put(key, value);
    }

    /** In the innermost scope 'key' is bound, so outer substitutions do not apply. */
    public void shadow(K key) {
        this.innermost().put(key, null);
    }

    public void mustBeEmpty() {
        if (!this.stack.isEmpty())
            throw new InternalCompilerError(this.stack.size() + " scopes still open");
    }

    /** The substitution for 'key', or null if there is none or it is shadowed. */
    @Nullable
    public V get(K key) {
        for (int i = this.stack.size() - 1; i >= 0; i--) {
            HashMap<K, V> scope = this.stack.get(i);
            if (scope.containsKey(key))
                return scope.get(key);
        }
        return null;
    }

    @Override
    public String toString() {
        return this.stack.toString();
    }
}
