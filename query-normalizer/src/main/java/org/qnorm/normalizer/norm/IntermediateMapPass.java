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
import org.qnorm.normalizer.ast.query.FlatMap;
import org.qnorm.normalizer.ast.query.Filter;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.normalizer.visitors.AstRewriteVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;

/** Applies {@link ApplyIntermediateMap} to every query in a tree, bottom-up.
 * Each node is simplified at most once per invocation. */
public class IntermediateMapPass extends AstRewriteVisitor {
    void simplifyResult(Query original) {
        Query rebuilt = this.getResult().to(Query.class);
        Query simplified = ApplyIntermediateMap.simplify(rebuilt);
        if (simplified != null)
            this.map(original, simplified);
    }

    @Override
    public VisitDecision preorder(Map node) {
        super.preorder(node);
        this.simplifyResult(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FlatMap node) {
        super.preorder(node);
        this.simplifyResult(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Filter node) {
        super.preorder(node);
        this.simplifyResult(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SortBy node) {
        super.preorder(node);
        this.simplifyResult(node);
        return VisitDecision.STOP;
    }

    /** Fuse the whole tree once. */
    public static Ast fuse(Ast ast) {
        return new IntermediateMapPass().apply(ast);
    }
}
