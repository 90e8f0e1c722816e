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

import java.util.Collection;
import java.util.function.Supplier;

/** A text sink which indents every line by the current indentation level.
 * Used both for pretty-printing trees and for log messages. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    /** Append text.  Each line after a newline starts at the current indentation. */
    IIndentStream append(String string);

    IIndentStream newline();

    /** Indent subsequent lines one more level and start a new line. */
    IIndentStream increase();

    IIndentStream decrease();

    default IIndentStream append(long value) {
        return this.append(Long.toString(value));
    }

    default IIndentStream append(boolean value) {
        return this.append(Boolean.toString(value));
    }

    default IIndentStream append(ToIndentableString value) {
        return value.toString(this);
    }

    /** The supplier is only invoked if the stream keeps its output. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }

    default IIndentStream join(String separator, Collection<String> data) {
        String prefix = "";
        for (String d: data) {
            this.append(prefix).append(d);
            prefix = separator;
        }
        return this;
    }

    default IIndentStream joinI(String separator, Collection<? extends ToIndentableString> data) {
        String prefix = "";
        for (ToIndentableString d: data) {
            this.append(prefix).append(d);
            prefix = separator;
        }
        return this;
    }

    default IIndentStream appendJsonLabelAndColon(String label) {
        return this.append(Utilities.doubleQuote(label)).append(": ");
    }
}
