/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.safeshell.transpiler.command.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.command.CommandCompiler;
import org.safeshell.transpiler.command.CommandMode;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.command.VariableAssignmentCompiler;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.context.TranspilerOptions;
import org.safeshell.transpiler.redirect.RedirectionApplier;
import org.safeshell.transpiler.word.BasicExpansionTranslator;
import org.safeshell.transpiler.word.WordCompiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.safeshell.transpiler.AstFixtures.cmd;
import static org.safeshell.transpiler.AstFixtures.var;
import static org.safeshell.transpiler.AstFixtures.word;

class FluentCommandStrategyTest {

    private static final CommandMode DOWNSTREAM = new CommandMode(true, true, false);

    private static final CommandMode UPSTREAM = new CommandMode(true, false, false);

    private CommandCompiler compiler;

    @BeforeEach
    void setUp() {
        TranspilerContext context = new TranspilerContext(TranspilerOptions.defaults());
        WordCompiler words = new WordCompiler(context, new BasicExpansionTranslator(), body -> "$.cmd(\"true\")");
        VariableAssignmentCompiler assignments = new VariableAssignmentCompiler(context, words);
        compiler = new CommandCompiler(
            CommandCompiler.defaultStrategies(context, CommandCatalog.loadDefault(), assignments),
            words, assignments, new RedirectionApplier(words));
    }

    @Test
    void catFilesProduceStream() {
        CompiledExpression expression = compile(cmd("cat", "a.txt", "b.txt"), UPSTREAM);
        assertEquals("$.cat(\"a.txt\", \"b.txt\")", expression.getCode());
        assertTrue(expression.isStreamProducer());
    }

    @Test
    void catWithFlagRunsAsProcess() {
        assertEquals("$.cmd(\"cat\", \"-n\", \"a.txt\")", compile(cmd("cat", "-n", "a.txt"), UPSTREAM).getCode());
    }

    @Test
    void bareCatDownstreamRunsAsProcess() {
        assertEquals("$.cmd(\"cat\")", compile(cmd("cat"), DOWNSTREAM).getCode());
    }

    @Test
    void headAsTransform() {
        CompiledExpression expression = compile(cmd("head", "-5"), DOWNSTREAM);
        assertEquals("$.head(5)", expression.getCode());
        assertTrue(expression.isTransform());
        assertEquals("$.tail(10)", compile(cmd("tail"), DOWNSTREAM).getCode());
        assertEquals("$.tail(3)", compile(cmd("tail", "-n", "3"), DOWNSTREAM).getCode());
    }

    @Test
    void headWithFileReadsLines() {
        CompiledExpression expression = compile(cmd("head", "-n", "3", "file.txt"), CommandMode.STANDALONE);
        assertEquals("$.cat(\"file.txt\").lines().pipe($.head(3))", expression.getCode());
        assertTrue(expression.isLineStream());
    }

    @Test
    void transformWithoutUpstreamRunsAsProcess() {
        assertEquals("$.cmd(\"head\", \"-5\")", compile(cmd("head", "-5"), CommandMode.STANDALONE).getCode());
        assertEquals("$.cmd(\"sort\")", compile(cmd("sort"), UPSTREAM).getCode());
    }

    @Test
    void grepAsTransform() {
        assertEquals("$.grep(/foo/i)", compile(cmd("grep", "-i", "foo"), DOWNSTREAM).getCode());
        assertEquals("$.grep(/p/, { invert: true, lineNumber: true })",
            compile(cmd("grep", "-vn", "p"), DOWNSTREAM).getCode());
        assertEquals("$.grep(/a\\/b/)", compile(cmd("grep", "a/b"), DOWNSTREAM).getCode());
    }

    @Test
    void grepFileForms() {
        assertEquals("$.cat(\"file.txt\").grep(/err/)",
            compile(cmd("grep", "err", "file.txt"), CommandMode.STANDALONE).getCode());
        assertEquals("$.cat(\"file.txt\").lines().filter(line => !/pattern/.test(line))",
            compile(cmd("grep", "-v", "pattern", "file.txt"), CommandMode.STANDALONE).getCode());
        assertEquals("$.cat(\"f\").grep(/x/).map(m => `${m.line}:${m.content}`)",
            compile(cmd("grep", "-n", "x", "f"), CommandMode.STANDALONE).getCode());
        assertEquals("$.cat(\"f\").lines().map((line, i) => ({ line: i + 1, content: line }))"
                + ".filter(m => !/x/.test(m.content)).map(m => `${m.line}:${m.content}`)",
            compile(cmd("grep", "-vn", "x", "f"), CommandMode.STANDALONE).getCode());
    }

    @Test
    void grepDoubleDashEndsOptions() {
        assertEquals("$.cat(\"f\").grep(/-v/)",
            compile(cmd("grep", "--", "-v", "f"), CommandMode.STANDALONE).getCode());
    }

    @Test
    void grepWithUnknownFlagRunsAsProcess() {
        assertEquals("$.cmd(\"grep\", \"-r\", \"x\", \".\")",
            compile(cmd("grep", "-r", "x", "."), CommandMode.STANDALONE).getCode());
        assertEquals("$.cmd(\"grep\", \"--color\", \"x\")", compile(cmd("grep", "--color", "x"), DOWNSTREAM).getCode());
    }

    @Test
    void flaggedTransforms() {
        assertEquals("$.sort({ reverse: true, numeric: true })", compile(cmd("sort", "-rn"), DOWNSTREAM).getCode());
        assertEquals("$.uniq({ count: true })", compile(cmd("uniq", "-c"), DOWNSTREAM).getCode());
        assertEquals("$.cat(\"f\").lines().pipe($.wc({ lines: true }))",
            compile(cmd("wc", "-l", "f"), CommandMode.STANDALONE).getCode());
        assertEquals("$.cmd(\"uniq\", \"-d\")", compile(cmd("uniq", "-d"), DOWNSTREAM).getCode());
    }

    @Test
    void teeWritesFile() {
        assertEquals("$.tee(\"out.log\", { append: true })",
            compile(cmd("tee", "-a", "out.log"), DOWNSTREAM).getCode());
        assertEquals("$.tee(\"-\")", compile(cmd("tee"), DOWNSTREAM).getCode());
    }

    @Test
    void dynamicArgumentRunsAsProcess() {
        Command command = cmd(word("grep"), var("PATTERN"), word("f"));
        assertEquals("$.cmd(\"grep\", `${$.ENV.PATTERN}`, \"f\")",
            compile(command, CommandMode.STANDALONE).getCode());
    }

    private CompiledExpression compile(Command command, CommandMode mode) {
        return compiler.compile(command, mode);
    }
}
