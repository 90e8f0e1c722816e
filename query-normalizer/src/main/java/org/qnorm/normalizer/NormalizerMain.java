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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.IdentName;
import org.qnorm.normalizer.ast.Query;
import org.qnorm.normalizer.ast.action.Foreach;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.backend.ToJsonVisitor;
import org.qnorm.normalizer.errors.BaseCompilerException;
import org.qnorm.normalizer.errors.CompilationError;
import org.qnorm.normalizer.norm.Normalize;
import org.qnorm.normalizer.norm.capture.AvoidAliasConflict;
import org.qnorm.util.Logger;
import org.qnorm.util.Utilities;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

/** Main entry point of the normalizer: reads a JSON AST, normalizes it, prints the result. */
public class NormalizerMain {
    final NormalizerOptions options;
    final PrintStream out;
    final PrintStream err;

    NormalizerMain(PrintStream out, PrintStream err) {
        this.options = new NormalizerOptions();
        this.out = out;
        this.err = err;
    }

    void usage(JCommander commander) {
        StringBuilder builder = new StringBuilder();
        commander.getUsageFormatter().usage(builder);
        this.err.print(builder);
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("query-normalizer");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            this.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                this.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (BaseCompilerException ex) {
                this.err.println(ex.toReport());
                return 1;
            }
        }
        return 0;
    }

    String readInput() throws IOException {
        if (this.options.inputFile == null)
            return Utilities.readStream(System.in);
        try (InputStream stream = Files.newInputStream(Paths.get(this.options.inputFile))) {
            return Utilities.readStream(stream);
        }
    }

    /** Run the pipeline selected by the options on the tree. */
    Ast normalize(Ast ast) {
        Set<IdentName> dangerous = this.options.dangerousNames();
        Ast result;
        if (!dangerous.isEmpty()) {
            if (ast.is(Function.class))
                result = AvoidAliasConflict.sanitizeVariables(ast.to(Function.class), dangerous);
            else if (ast.is(Foreach.class))
                result = AvoidAliasConflict.sanitizeVariables(ast.to(Foreach.class), dangerous);
            else if (ast.is(Query.class))
                result = AvoidAliasConflict.sanitizeQuery(ast.to(Query.class), dangerous);
            else
                throw new CompilationError("--dangerous requires a function, a foreach or a query, not " +
                        ast.getClass().getSimpleName());
            if (this.options.finalPass)
                result = AvoidAliasConflict.apply(result, true);
        } else if (this.options.hygieneOnly) {
            result = AvoidAliasConflict.apply(ast, this.options.finalPass);
        } else {
            result = new Normalize(this.options.finalPass).apply(ast);
        }
        return result;
    }

    int run() {
        try {
            String json = this.readInput();
            Ast ast = JsonDecoder.fromJson(json);
            if (this.options.verbosity > 0)
                this.err.println("Input: " + ast);
            Ast result = this.normalize(ast);
            String output = this.options.emitJson ? ToJsonVisitor.toJson(result) : result.toString();
            if (this.options.outputFile.isEmpty()) {
                this.out.println(output);
            } else {
                Path path = Paths.get(this.options.outputFile);
                Files.writeString(path, output + System.lineSeparator(), StandardCharsets.UTF_8);
            }
            return 0;
        } catch (IOException ex) {
            this.err.println("Error reading or writing file: " + ex.getMessage());
            return 1;
        } catch (BaseCompilerException ex) {
            this.err.println(ex.toReport());
            return 1;
        }
    }

    public static int execute(PrintStream out, PrintStream err, String... argv) {
        NormalizerMain main = new NormalizerMain(out, err);
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0)
            return exitCode;
        return main.run();
    }

    public static void main(String[] argv) {
        int exitCode = execute(System.out, System.err, argv);
        System.exit(exitCode);
    }
}
