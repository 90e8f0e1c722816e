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
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.qnorm.normalizer.ast.Ast;
import org.qnorm.normalizer.ast.Ident;
import org.qnorm.normalizer.ast.Quat;
import org.qnorm.normalizer.ast.expression.Function;
import org.qnorm.normalizer.ast.query.Map;
import org.qnorm.normalizer.backend.JsonDecoder;
import org.qnorm.normalizer.backend.ToJsonVisitor;
import org.qnorm.util.Linq;
import org.qnorm.util.Logger;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.qnorm.normalizer.AstFactory.*;

public class NormalizerMainTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @Before
    public void resetTemporaries() {
        Ident.reset();
    }

    @After
    public void cleanup() {
        Logger.INSTANCE.reset();
        Ident.reset();
    }

    int run(String... argv) {
        PrintStream out = new PrintStream(this.outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(this.errBytes, true, StandardCharsets.UTF_8);
        return NormalizerMain.execute(out, err, argv);
    }

    String out() {
        return this.outBytes.toString(StandardCharsets.UTF_8).trim();
    }

    String err() {
        return this.errBytes.toString(StandardCharsets.UTF_8);
    }

    String write(Ast ast) throws IOException {
        return this.write(ToJsonVisitor.toJson(ast));
    }

    String write(String json) throws IOException {
        File file = this.folder.newFile();
        Files.writeString(file.toPath(), json, StandardCharsets.UTF_8);
        return file.getPath();
    }

    @Test
    public void parseOptions() {
        NormalizerOptions options = new NormalizerOptions();
        JCommander.newBuilder().addObject(options).build().parse(
                "--final", "--dangerous", "v", "--dangerous", "w", "-TNormalize=2", "-o", "out.txt", "in.json");
        Assert.assertTrue(options.finalPass);
        Assert.assertFalse(options.hygieneOnly);
        Assert.assertEquals("in.json", options.inputFile);
        Assert.assertEquals("out.txt", options.outputFile);
        Assert.assertEquals("2", options.loggingLevel.get("Normalize"));
        Assert.assertEquals(names("v", "w"), options.dangerousNames());
    }

    @Test
    public void normalizeFile() throws IOException {
        Ast query = map(map(entity("Person"), "p", prop(id("p"), "name")), "p2", concat(id("p2"), str("!")));
        int exitCode = this.run(this.write(query));
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("query[Person].map(p => (p.name +++ \"!\"))", this.out());
    }

    @Test
    public void normalizeResource() throws URISyntaxException {
        URL url = NormalizerMainTests.class.getResource("/person.json");
        Assert.assertNotNull(url);
        int exitCode = this.run(Paths.get(url.toURI()).toString());
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("query[Person].map(p => (p.name, 1))", this.out());
    }

    @Test
    public void hygieneOnly() throws IOException {
        Ast query = flatMap(entity("A"), "a", filter(entity("E"), "a", eq(prop(id("a"), "id"), prop(id("a"), "fk"))));
        int exitCode = this.run("--hygiene-only", this.write(query));
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("query[A].flatMap(a => query[E].filter(a1 => (a1.id == a1.fk)))", this.out());
    }

    @Test
    public void jsonOutputFile() throws IOException {
        Ast query = filter(map(entity("Person"), "p", prop(id("p"), "name")), "n", eq(id("n"), str("Bob")));
        File output = new File(this.folder.getRoot(), "result.json");
        int exitCode = this.run("--json", "-o", output.getPath(), this.write(query));
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("", this.out());
        Ast result = JsonDecoder.fromJson(Files.readString(output.toPath(), StandardCharsets.UTF_8));
        Ast expected = map(filter(entity("Person"), "p", eq(prop(id("p"), "name"), str("Bob"))),
                "p", prop(id("p"), "name"));
        Assert.assertEquals(expected, result);
    }

    @Test
    public void finalPass() throws IOException {
        Ident temporary = Ident.temporary(Quat.VALUE);
        Ast query = new Map(entity("E"), temporary, prop(temporary, "name"));
        int exitCode = this.run("--final", this.write(query));
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("query[E].map(x => x.name)", this.out());
    }

    @Test
    public void dangerousFunction() throws IOException {
        Ast function = new Function(Linq.list(id("v")),
                filter(entity("E"), "x", eq(prop(id("x"), "id"), prop(id("v"), "id"))));
        int exitCode = this.run("--dangerous", "v", this.write(function));
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertEquals("(v1) => query[E].filter(x => (x.id == v1.id))", this.out());
    }

    @Test
    public void dangerousNeedsBinderRoot() throws IOException {
        int exitCode = this.run("--dangerous", "v", this.write(num(3)));
        Assert.assertEquals(1, exitCode);
        Assert.assertTrue(this.err(), this.err().startsWith("Error in input: --dangerous requires"));
    }

    @Test
    public void loggingOption() throws IOException {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        Ast query = flatMap(entity("A"), "a", filter(entity("E"), "a", prop(id("a"), "ok")));
        int exitCode = this.run("-TAvoidAliasConflict=2", "--hygiene-only", this.write(query));
        Logger.INSTANCE.setDebugStream(save);
        Assert.assertEquals(this.err(), 0, exitCode);
        Assert.assertTrue(builder.toString(), builder.toString().contains(": rename a -> a1"));
    }

    @Test
    public void badLoggingOptions() {
        Assert.assertEquals(1, this.run("-TNoSuchClass=2"));
        Assert.assertTrue(this.err(), this.err().contains("Error in input: Class 'NoSuchClass' not found"));
        Assert.assertEquals(1, this.run("-TNormalize=high"));
        Assert.assertTrue(this.err(), this.err().contains("-T option must be followed by 'class=number'"));
    }

    @Test
    public void badInput() throws IOException {
        String missing = new File(this.folder.getRoot(), "missing.json").getPath();
        Assert.assertEquals(1, this.run(missing));
        Assert.assertTrue(this.err(), this.err().contains("Error reading or writing file"));
        Assert.assertEquals(1, this.run(this.write("{ \"class\": ")));
        Assert.assertTrue(this.err(), this.err().contains("Error in input: Malformed JSON"));
    }

    @Test
    public void help() {
        Assert.assertEquals(1, this.run("--help"));
        Assert.assertTrue(this.err(), this.err().contains("Usage: query-normalizer"));
        Assert.assertTrue(this.err(), this.err().contains("--hygiene-only"));
    }

    @Test
    public void missingOptionValue() {
        Assert.assertEquals(1, this.run("-o"));
        Assert.assertFalse(this.err().isEmpty());
    }
}
