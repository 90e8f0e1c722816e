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

import java.io.IOException;
import java.io.UncheckedIOException;

/** Indenting stream writing to an {@link Appendable}. */
public class IndentStream implements IIndentStream {
    static final int INDENT = 4;

    private Appendable output;
    int level = 0;
    boolean atLineStart = false;

    public IndentStream(Appendable output) {
        this.output = output;
    }

    /** A stream accumulating its output in memory; read it with toString(). */
    public IndentStream() {
        this(new StringBuilder());
    }

    /** Redirect the output.
     * @return The previous destination. */
    public Appendable setOutputStream(Appendable output) {
        Appendable previous = this.output;
        this.output = output;
        return previous;
    }

    void write(CharSequence text) {
        try {
            this.output.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    void appendLine(String line) {
        if (line.isEmpty())
            return;
        if (this.atLineStart) {
            this.write(" ".repeat(this.level * INDENT));
            this.atLineStart = false;
        }
        this.write(line);
    }

    @Override
    public IIndentStream append(String string) {
        int start = 0;
        int end = string.indexOf('\n');
        while (end >= 0) {
            this.appendLine(string.substring(start, end));
            this.newline();
            start = end + 1;
            end = string.indexOf('\n', start);
        }
        this.appendLine(string.substring(start));
        return this;
    }

    @Override
    public IIndentStream newline() {
        this.write("\n");
        this.atLineStart = true;
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.level > 0, "Negative indentation");
        this.level--;
        return this;
    }

    @Override
    public String toString() {
        return this.output.toString();
    }
}
