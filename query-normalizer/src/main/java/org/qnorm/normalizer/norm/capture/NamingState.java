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

import com.google.common.collect.ImmutableSet;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.util.FreshName;
import org.qnorm.util.Linq;

import java.util.Set;

/** The names already used by binders in the visible scopes.
 * Immutable; 'with' returns a new state. */
public final class NamingState {
    public static final NamingState EMPTY = new NamingState(ImmutableSet.of());

    final ImmutableSet<IdentName> names;

    public NamingState(Set<IdentName> names) {
        this.names = ImmutableSet.copyOf(names);
    }

    public NamingState with(IdentName name) {
        if (this.names.contains(name))
            return this;
        return new NamingState(ImmutableSet.<IdentName>builder()
                .addAll(this.names)
                .add(name)
                .build());
    }

    public NamingState with(Ident ident) {
        return this.with(ident.idName());
    }

    public boolean contains(IdentName name) {
        return this.names.contains(name);
    }

    /** An identifier with the same shape as 'ident' whose name is not used.
     * Returns 'ident' itself if its name is free; otherwise the name is
     * suffixed with the smallest number which makes it unused. */
    public Ident dedupe(Ident ident) {
        if (!this.contains(ident.idName()))
            return ident;
        Set<String> used = ImmutableSet.copyOf(Linq.map(this.names.asList(), IdentName::name));
        String fresh = new FreshName(used).freshName(ident.name);
        return ident.withName(fresh);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.names.equals(((NamingState) o).names);
    }

    @Override
    public int hashCode() {
        return this.names.hashCode();
    }

    @Override
    public String toString() {
        return this.names.toString();
    }
}
