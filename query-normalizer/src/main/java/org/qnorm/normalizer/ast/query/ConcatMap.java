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

package org.qnorm.normalizer.ast.query;

import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;

/** Evaluates the body, a collection-valued expression, for every row of the source and flattens the results. */
public final class ConcatMap extends AliasedQuery {
    public ConcatMap(Ast query, Ident alias, Ast body) {
        super(query, alias, body);
    }

    @Override
    public ConcatMap with(Ast query, Ident alias, Ast body) {
        return new ConcatMap(query, alias, body);
    }

    @Override
    public String operation() {
        return "concatMap";
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        this.acceptChildren(visitor);
        visitor.postorder(this);
    }

    @SuppressWarnings("unused")
    public static ConcatMap fromJson(JsonNode node, JsonDecoder decoder) {
        Ast query = decoder.decodeProperty(node, "query");
        Ident alias = decoder.decodeProperty(node, "alias", Ident.class);
        Ast body = decoder.decodeProperty(node, "body");
        return new ConcatMap(query, alias, body);
    }
}
