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

import org.qnorm.normalizer.errors.InternalCompilerError;

import javax.annotation.Nullable;

/** Checked downcasts for AST nodes and transforms. */
public interface ICastable {
    default boolean is(Class<?> clazz) {
        return clazz.isInstance(this);
    }

    /** This object as a 'clazz', or null if it has another class. */
    @Nullable
    default <T> T as(Class<T> clazz) {
        return this.is(clazz) ? clazz.cast(this) : null;
    }

    /** This object as a 'clazz'; any other class is an internal error. */
    default <T> T to(Class<T> clazz) {
        if (!this.is(clazz))
            throw new InternalCompilerError(this + " is not a " + clazz.getSimpleName());
        return clazz.cast(this);
    }
}
