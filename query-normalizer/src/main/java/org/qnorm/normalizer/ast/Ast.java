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

import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.util.ICastable;
import org.qnorm.util.IndentStream;
import org.qnorm.util.ToIndentableString;

/** Base class for all nodes of the query AST.
 * Nodes are immutable; transformations always build new nodes.
 * Equality is structural. */
public abstract class Ast implements ICastable, ToIndentableString {
    /** Double dispatch: call the visitor's preorder/postorder methods
     * for this node class and visit all children, left to right. */
    public abstract void accept(AstVisitor visitor);

    /** True if all children of this node are the same objects as the
     * children of 'other' and all scalar fields are equal.
     * Used by rewriters to avoid allocating new nodes. */
    public abstract boolean sameFields(Ast other);

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
        IndentStream stream = new IndentStream();
        this.toString(stream);
        return stream.toString();
    }
}
