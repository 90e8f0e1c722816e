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

import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.norm.capture.AvoidAliasConflict;
import org.qnorm.normalizer.visitors.AstPasses;
import org.qnorm.normalizer.visitors.AstRepeat;
import org.qnorm.normalizer.visitors.AstTransform;

/**
 * Normalization pipeline: resolve alias conflicts, then fuse intermediate maps
 * until the tree stops changing.  The final pipeline resolves the aliases once
 * more at the end, making temporary identifiers permanent. */
public class Normalize implements AstTransform {
    final boolean finalPass;
    final AstPasses passes;

    /** Alias conflict resolution on the whole tree, as a pipeline stage. */
    static class ResolveAliases implements AstTransform {
        final boolean permanentize;

        ResolveAliases(boolean permanentize) {
            this.permanentize = permanentize;
        }

        @Override
        public Ast apply(Ast ast) {
            return AvoidAliasConflict.apply(ast, this.permanentize);
        }

        @Override
        public String toString() {
            return "ResolveAliases" + (this.permanentize ? "(permanentize)" : "");
        }
    }

    public Normalize(boolean finalPass) {
        this.finalPass = finalPass;
        this.passes = new AstPasses(
                new ResolveAliases(false),
                new AstRepeat(new IntermediateMapPass()));
        if (finalPass)
            this.passes.add(new ResolveAliases(true));
    }

    @Override
    public Ast apply(Ast ast) {
        return this.passes.apply(ast);
    }

    public static Query normalize(Query query) {
        return new Normalize(false).apply(query).to(Query.class);
    }

    /** Normalize a query at the end of the pipeline.  Must be called at most once
     * on a query, since it gives permanent names to temporary identifiers. */
    public static Query finalPass(Query query) {
        return new Normalize(true).apply(query).to(Query.class);
    }

    @Override
    public String toString() {
        return "Normalize" + (this.finalPass ? "(final)" : "");
    }
}
