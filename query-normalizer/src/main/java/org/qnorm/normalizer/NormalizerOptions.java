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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.util.Linq;
import org.qnorm.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Command-line options for the normalizer */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class NormalizerOptions {
    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @Parameter(description = "Input file containing a JSON AST; stdin if not specified")
    @Nullable
    public String inputFile = null;
    @Parameter(names = "-o", description = "Output file; stdout if not specified")
    public String outputFile = "";
    @Parameter(names = "--final",
            description = "Final normalization: give permanent names to temporary identifiers")
    public boolean finalPass = false;
    @Parameter(names = "--hygiene-only", description = "Only resolve alias conflicts, do not fuse maps")
    public boolean hygieneOnly = false;
    @Parameter(names = "--dangerous",
            description = "Name which must not be used by binders (can be repeated)")
    public List<String> dangerous = new ArrayList<>();
    @Parameter(names = "--json", description = "Emit the result as JSON instead of text")
    public boolean emitJson = false;
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = "-v", description = "Output verbosity")
    public int verbosity = 0;

    public Set<IdentName> dangerousNames() {
        return new LinkedHashSet<>(Linq.map(this.dangerous, IdentName::new));
    }

    @Override
    public String toString() {
        return "NormalizerOptions{" +
                "\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                ",\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                ",\n\tfinalPass=" + this.finalPass +
                ",\n\thygieneOnly=" + this.hygieneOnly +
                ",\n\tdangerous=" + this.dangerous +
                ",\n\temitJson=" + this.emitJson +
                ",\n\tloggingLevel=" + this.loggingLevel +
                ",\n\tverbosity=" + this.verbosity +
                '}';
    }
}
