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
import org.qnorm.util.IWritesLogs;
import org.qnorm.util.Logger;

/** Repeats another transform until the tree stops changing.
 * Termination is detected with structural equality. */
public class AstRepeat implements IWritesLogs, AstTransform {
    protected final AstTransform visitor;

    public AstRepeat(AstTransform visitor) {
        this.visitor = visitor;
    }

    @Override
    public Ast apply(Ast node) {
        int iteration = 0;
        while (true) {
            Ast result = this.visitor.apply(node);
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Iteration ")
                    .append(iteration++)
                    .append(" after ")
                    .append(this.visitor.toString())
                    .newline()
                    .appendSupplier(result::toString)
                    .newline();
            if (result == node || result.equals(node))
                return result;
            node = result;
        }
    }

    @Override
    public String toString() {
        return "Repeat(" + this.visitor + ")";
    }
}
