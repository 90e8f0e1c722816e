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
import org.qnorm.normalizer.ast.query.GroupBy;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.ast.query.SortBy;

import javax.annotation.Nullable;

/**
 * Single-step fusion of a map with the operator which consumes it.
 * Never recurses; the caller decides where and how often to apply it.
 *
 * <pre>
 * a.map(b => b)                      =>  a
 * a.map(b => c).map(d => e)          =>  a.map(b => e[d := c])
 * a.map(b => c).flatMap(d => e)      =>  a.flatMap(b => e[d := c])
 * a.map(b => c).filter(d => e)       =>  a.filter(b => e[d := c]).map(b => c)
 * a.map(b => c).sortBy(d => e)(ord)  =>  a.sortBy(b => e[d := c])(ord).map(b => c)
 * </pre>
 * A map over a groupBy is never fused: the grouped (key, values) shape is structural. */
public class ApplyIntermediateMap {
    private ApplyIntermediateMap() {}

    /** The map reading the result of a groupBy directly, or null. */
    @Nullable
    static Map mapOverGroupBy(Ast source) {
        Map map = source.as(Map.class);
        if (map != null && map.query.is(GroupBy.class))
            return map;
        return null;
    }

    /** The source if it is a map, or null. */
    @Nullable
    static Map intermediateMap(Ast source) {
        return source.as(Map.class);
    }

    /** Simplify the query if one of the fusion rules applies.
     * @return The simplified query, or null if no rule applies. */
    @Nullable
    public static Query simplify(Query query) {
        Map map = query.as(Map.class);
        FlatMap flatMap = query.as(FlatMap.class);
        Filter filter = query.as(Filter.class);
        SortBy sortBy = query.as(SortBy.class);

        if (map != null && mapOverGroupBy(map.query) != null)
            return null;
        if (flatMap != null && mapOverGroupBy(flatMap.query) != null)
            return null;
        if (filter != null && mapOverGroupBy(filter.query) != null)
            return null;
        if (sortBy != null && mapOverGroupBy(sortBy.query) != null)
            return null;

        if (map != null && map.body.equals(map.alias)) {
            if (map.query.is(GroupBy.class))
                return null;
            // The identity map is only dropped over a query
            Query source = map.query.as(Query.class);
            if (source != null)
                return source;
        }

        if (map != null) {
            Map inner = intermediateMap(map.query);
            if (inner != null) {
                Ast body = BetaReduction.substitute(map.body, map.alias, inner.body);
                return new Map(inner.query, inner.alias, body);
            }
        }

        if (flatMap != null) {
            Map inner = intermediateMap(flatMap.query);
            if (inner != null) {
                Ast body = BetaReduction.substitute(flatMap.body, flatMap.alias, inner.body);
                return new FlatMap(inner.query, inner.alias, body);
            }
        }

        if (filter != null) {
            Map inner = intermediateMap(filter.query);
            if (inner != null) {
                Ast predicate = BetaReduction.substitute(filter.body, filter.alias, inner.body);
                return new Map(new Filter(inner.query, inner.alias, predicate), inner.alias, inner.body);
            }
        }

        if (sortBy != null) {
            Map inner = intermediateMap(sortBy.query);
            if (inner != null) {
                Ast criteria = BetaReduction.substitute(sortBy.body, sortBy.alias, inner.body);
                return new Map(new SortBy(inner.query, inner.alias, criteria, sortBy.ordering),
                        inner.alias, inner.body);
            }
        }
        return null;
    }
}
