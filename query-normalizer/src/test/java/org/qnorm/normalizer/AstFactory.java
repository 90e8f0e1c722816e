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

package org.qnorm.normalizer;

import com.google.common.collect.ImmutableSet;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.expression.BinaryOperation;
import org.qnorm.normalizer.ast.expression.BinaryOperator;
import org.qnorm.normalizer.ast.expression.Constant;
import org.qnorm.normalizer.ast.expression.Property;
import org.qnorm.normalizer.ast.expression.Tuple;
import org.qnorm.normalizer.ast.query.Entity;
import org.qnorm.normalizer.ast.query.Filter;
import org.qnorm.normalizer.ast.query.FlatMap;
import org.qnorm.normalizer.ast.query.GroupBy;
import org.qnorm.normalizer.ast.query.Join;
import org.qnorm.normalizer.ast.query.JoinType;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.ast.query.SortBy;
import org.qnorm.util.Linq;

/** Short constructors for the trees used in tests. */
public class AstFactory {
    private AstFactory() {}

    public static Ident id(String name) {
        return new Ident(name);
    }

    public static Entity entity(String name) {
        return new Entity(name);
    }

    public static Property prop(Ast ast, String name) {
        return new Property(ast, name);
    }

    public static BinaryOperation eq(Ast left, Ast right) {
        return new BinaryOperation(left, BinaryOperator.EQ, right);
    }

    public static BinaryOperation concat(Ast left, Ast right) {
        return new BinaryOperation(left, BinaryOperator.STRING_CONCAT, right);
    }

    public static BinaryOperation plus(Ast left, Ast right) {
        return new BinaryOperation(left, BinaryOperator.PLUS, right);
    }

    public static Constant str(String value) {
        return new Constant(value);
    }

    public static Constant num(long value) {
        return new Constant(value);
    }

    public static Tuple tuple(Ast... values) {
        return new Tuple(values);
    }

    public static Map map(Ast query, String alias, Ast body) {
        return new Map(query, id(alias), body);
    }

    public static FlatMap flatMap(Ast query, String alias, Ast body) {
        return new FlatMap(query, id(alias), body);
    }

    public static Filter filter(Ast query, String alias, Ast body) {
        return new Filter(query, id(alias), body);
    }

    public static GroupBy groupBy(Ast query, String alias, Ast body) {
        return new GroupBy(query, id(alias), body);
    }

    public static SortBy sortBy(Ast query, String alias, Ast criteria, Ast ordering) {
        return new SortBy(query, id(alias), criteria, ordering);
    }

    public static Join join(Ast left, Ast right, String leftAlias, String rightAlias, Ast on) {
        return new Join(JoinType.INNER, left, right, id(leftAlias), id(rightAlias), on);
    }

    public static ImmutableSet<IdentName> names(String... names) {
        return ImmutableSet.copyOf(Linq.map(Linq.list(names), IdentName::new));
    }
}
