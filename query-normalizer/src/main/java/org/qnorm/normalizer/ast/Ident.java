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

import com.fasterxml.jackson.databind.JsonNode;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.visitors.AstVisitor;
import org.qnorm.normalizer.visitors.VisitDecision;
import org.qnorm.util.IIndentStream;
import org.qnorm.util.Utilities;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/** A reference to a variable, or a binder when it appears in a binding position. */
public final class Ident extends Ast {
    public final String name;
    public final Quat quat;

    /** Shared by all threads allocating temporaries. */
    static final AtomicLong crtId = new AtomicLong();
    static final String TEMPORARY_PREFIX = "[tmp_";
    static final String TEMPORARY_SUFFIX = "]";

    public Ident(String name, Quat quat) {
        Utilities.enforce(!name.isEmpty(), "Empty identifier");
        this.name = name;
        this.quat = quat;
    }

    public Ident(String name) {
        this(name, Quat.UNKNOWN);
    }

    /** Allocate a placeholder identifier.  It will be given a permanent
     * name by the final alias conflict resolution pass. */
    public static Ident temporary(Quat quat) {
        return new Ident(TEMPORARY_PREFIX + crtId.getAndIncrement() + TEMPORARY_SUFFIX, quat);
    }

    // Do not call this method, it is only used for testing
    public static void reset() {
        crtId.set(0);
    }

    public boolean isTemporary() {
        return this.name.startsWith(TEMPORARY_PREFIX) && this.name.endsWith(TEMPORARY_SUFFIX);
    }

    public IdentName idName() {
        return new IdentName(this.name);
    }

    /** Same shape, different name. */
    public Ident withName(String name) {
        if (name.equals(this.name))
            return this;
        return new Ident(name, this.quat);
    }

    @Override
    public void accept(AstVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    /** Unlike equality this also compares the shapes, so a rewrite
     * which only changes the shape is not discarded. */
    @Override
    public boolean sameFields(Ast other) {
        Ident o = other.as(Ident.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.quat.equals(o.quat);
    }

    /** Identifiers are equal when their names are; the shape is opaque. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.name.equals(((Ident) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Ident.class, this.name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static Ident fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        Quat quat = decoder.decodeQuat(node);
        return new Ident(name, quat);
    }
}
