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

package org.qnorm.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.qnorm.normalizer.errors.InternalCompilerError;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** Writes a JSON document incrementally, checking that objects and arrays nest properly. */
public class JsonStream {
    /** An open array or object. */
    static final class Frame {
        final boolean isArray;
        int elements;
        /** Objects only: set after a label, cleared by the value that follows. */
        boolean labelled;

        Frame(boolean isArray) {
            this.isArray = isArray;
        }
    }

    private final List<Frame> open = new ArrayList<>();
    private final IIndentStream stream;

    public JsonStream(IIndentStream stream) {
        this.stream = stream;
    }

    /** Separator before the next element of the innermost array or object. */
    private void separate(Frame frame) {
        if (frame.elements == 0)
            this.stream.increase();
        else
            this.stream.append(",").newline();
        frame.elements++;
    }

    private void beforeValue() {
        if (this.open.isEmpty())
            return;
        Frame frame = Utilities.last(this.open);
        if (frame.isArray) {
            this.separate(frame);
        } else {
            if (!frame.labelled)
                throw new InternalCompilerError("JSON value without a label");
            frame.labelled = false;
        }
    }

    public JsonStream label(String label) {
        Utilities.enforce(!label.isEmpty(), "Empty JSON label");
        if (this.open.isEmpty() || Utilities.last(this.open).isArray)
            throw new InternalCompilerError("JSON label " + Utilities.singleQuote(label) + " outside of an object");
        Frame frame = Utilities.last(this.open);
        if (frame.labelled)
            throw new InternalCompilerError("Two consecutive JSON labels");
        this.separate(frame);
        frame.labelled = true;
        this.stream.appendJsonLabelAndColon(label);
        return this;
    }

    public JsonStream append(String string) {
        this.beforeValue();
        try {
            this.stream.append(Utilities.deterministicObjectMapper().writeValueAsString(string));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
        return this;
    }

    public JsonStream append(boolean b) {
        this.beforeValue();
        this.stream.append(b);
        return this;
    }

    public JsonStream append(long v) {
        this.beforeValue();
        this.stream.append(v);
        return this;
    }

    public JsonStream append(double v) {
        this.beforeValue();
        this.stream.append(Double.toString(v));
        return this;
    }

    /** Writes the "class" property of a node. */
    public JsonStream appendClass(Object data) {
        return this.label("class").append(data.getClass().getSimpleName());
    }

    private void begin(boolean isArray) {
        this.beforeValue();
        this.open.add(new Frame(isArray));
        this.stream.append(isArray ? "[" : "{");
    }

    private void end(boolean isArray) {
        if (this.open.isEmpty())
            throw new InternalCompilerError("Closing a JSON " + (isArray ? "array" : "object") + " that was never opened");
        Frame frame = Utilities.removeLast(this.open);
        Utilities.enforce(frame.isArray == isArray, "Mismatched JSON brackets");
        Utilities.enforce(!frame.labelled, "JSON label without a value");
        if (frame.elements != 0)
            this.stream.newline().decrease();
        this.stream.append(isArray ? "]" : "}");
    }

    public JsonStream beginArray() {
        this.begin(true);
        return this;
    }

    public JsonStream endArray() {
        this.end(true);
        return this;
    }

    public JsonStream beginObject() {
        this.begin(false);
        return this;
    }

    public JsonStream endObject() {
        this.end(false);
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
