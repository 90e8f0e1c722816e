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

package org.qnorm.util;

import java.util.Set;

/** Generates a fresh name that does not appear in a set of used names.
 * If the candidate is not used it is returned unchanged; otherwise the
 * candidate is suffixed with 1, 2, 3, ... and the first unused name wins. */
public class FreshName {
    final Set<String> used;

    /** @param used Names that are already taken.  Never modified. */
    public FreshName(Set<String> used) {
        this.used = used;
    }

    /**
     * Generate a fresh name based on the specified candidate.
     *
     * @param candidate  Preferred name. */
    public String freshName(String candidate) {
        if (!this.used.contains(candidate))
            return candidate;
        long counter = 1;
        String name = candidate + counter;
        while (this.used.contains(name)) {
            counter++;
            name = candidate + counter;
        }
        return name;
    }
}
