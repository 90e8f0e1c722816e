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
import org.qnorm.util.Linq;
import org.qnorm.util.Logger;

import java.util.ArrayList;
import java.util.List;

/** Applies multiple transforms in sequence. */
public class AstPasses implements IWritesLogs, AstTransform {
    public final List<AstTransform> passes;

    public AstPasses(AstTransform... passes) {
        this(Linq.list(passes));
    }

    public AstPasses(List<AstTransform> passes) {
        this.passes = new ArrayList<>(passes);
    }

    public void add(AstTransform pass) {
        this.passes.add(pass);
    }

    @Override
    public Ast apply(Ast node) {
        for (AstTransform pass: this.passes) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Executing ")
                    .appendSupplier(pass::toString)
                    .newline();
            node = pass.apply(node);
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("After ")
                    .appendSupplier(pass::toString)
                    .newline()
                    .appendSupplier(node::toString)
                    .newline();
        }
        return node;
    }

    @Override
    public String toString() {
        return "Passes" + this.passes;
    }
}
