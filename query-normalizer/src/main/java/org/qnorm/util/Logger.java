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

import org.qnorm.normalizer.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Debug logging with indentation.  Every class has a logging level, 0 by default;
 * a message of level L written by class C is printed only when the level of C is
 * at least L.  A class without its own level uses the level of its closest
 * superclass that has one.
 *
 * <p>Typical use:
 * <pre>
 * Logger.INSTANCE.belowLevel(this, 2).append("rename ").append(name).newline();
 * </pre>
 */
public class Logger {
    /** The only logger. */
    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels = new HashMap<>();
    private final IndentStream output = new IndentStream(System.err);
    private final IIndentStream discard = new Discard();

    /** Swallows everything; suppliers are not invoked. */
    static final class Discard implements IIndentStream {
        @Override
        public IIndentStream append(String string) {
            return this;
        }

        @Override
        public IIndentStream append(ToIndentableString value) {
            return this;
        }

        @Override
        public IIndentStream appendSupplier(Supplier<String> supplier) {
            return this;
        }

        @Override
        public IIndentStream newline() {
            return this;
        }

        @Override
        public IIndentStream increase() {
            return this;
        }

        @Override
        public IIndentStream decrease() {
            return this;
        }
    }

    private Logger() {}

    /** Root package of the classes that can be named on the command line. */
    static final String ROOT = "org.qnorm.normalizer";
    /** Sub-packages searched, in order. */
    static final String[] PACKAGES = { "", "visitors", "norm", "norm.capture", "backend" };

    /** The stream for a message of the given level written by 'clazz'. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.output : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    public int getLoggingLevel(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        return 0;
    }

    /** Sets the level of a class and of its subclasses that have none of their own.
     * @return The previous level of the class itself. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Like {@link #setLoggingLevel(Class, int)}, for a class given by its simple name. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        return this.setLoggingLevel(this.locateClass(className), level);
    }

    Class<?> locateClass(String className) {
        for (String pack: PACKAGES) {
            String name = (pack.isEmpty() ? ROOT : ROOT + "." + pack) + "." + className;
            try {
                return Class.forName(name);
            } catch (ClassNotFoundException e) {
                // not in this package
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(className) +
                " not found for setting up logging");
    }

    /** Turns all logging off. */
    public void reset() {
        this.levels.clear();
    }

    /** Redirects the output; the current indentation is kept.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable destination) {
        return this.output.setOutputStream(destination);
    }
}
