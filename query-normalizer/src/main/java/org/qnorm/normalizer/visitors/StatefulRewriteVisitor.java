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

package org.qnorm.normalizer.visitors;

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.util.Logger;

/**
 * A rewrite visitor which threads a state value through the traversal.
 * Children are transformed left to right by the same visitor, so the state
 * produced by one child is visible while transforming the next one.
 * Subclasses update 'state' in their preorder methods; nodes which are not
 * overridden are rebuilt generically and pass the state along unchanged.
 *
 * @param <S> Type of the state.  Should be immutable. */
public abstract class StatefulRewriteVisitor<S> extends AstRewriteVisitor {
    protected S state;

    protected StatefulRewriteVisitor(S state) {
        this.state = state;
    }

    /** Transform the node and return the result together with the final state. */
    public Stateful<S> applyStateful(Ast node) {
        Ast result = this.apply(node);
        Logger.INSTANCE.belowLevel(this, 3)
                .appendSupplier(this::toString)
                .append(" final state ")
                .appendSupplier(() -> String.valueOf(this.state))
                .newline();
        return new Stateful<>(result, this.state);
    }
}
