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

package org.safeshell.transpiler;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.safeshell.transpiler.ast.FunctionDeclaration;
import org.safeshell.transpiler.ast.IfStatement;
import org.safeshell.transpiler.ast.NodeKind;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.PipelineOperator;
import org.safeshell.transpiler.ast.Program;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.ast.RedirectionOperator;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.ast.Subshell;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.context.Severity;
import org.safeshell.transpiler.context.TranspilerOptions;
import org.safeshell.transpiler.handler.StatementHandler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.safeshell.transpiler.AstFixtures.and;
import static org.safeshell.transpiler.AstFixtures.assign;
import static org.safeshell.transpiler.AstFixtures.assignmentsOnly;
import static org.safeshell.transpiler.AstFixtures.background;
import static org.safeshell.transpiler.AstFixtures.cmd;
import static org.safeshell.transpiler.AstFixtures.export;
import static org.safeshell.transpiler.AstFixtures.or;
import static org.safeshell.transpiler.AstFixtures.pipe;
import static org.safeshell.transpiler.AstFixtures.program;
import static org.safeshell.transpiler.AstFixtures.substitution;
import static org.safeshell.transpiler.AstFixtures.var;
import static org.safeshell.transpiler.AstFixtures.withEnv;
import static org.safeshell.transpiler.AstFixtures.withRedirects;
import static org.safeshell.transpiler.AstFixtures.word;

class ShellTranspilerTest {

    private ShellTranspiler transpiler;

    @BeforeEach
    void setUp() {
        transpiler = new ShellTranspiler();
    }

    @Test
    void wrapsProgramInEntryPoint() {
        String code = transpiler.transpile(program(cmd("cd", "/tmp"))).code();

        assertEquals("\"use strict\";\n"
            + "import { $ } from \"./mod.ts\";\n"
            + "\n"
            + "(async () => {\n"
            + "  const __ctx = $.createExecutionContext();\n"
            + "  const __printCmd = $.printCmd;\n"
            + "  $.cd(\"/tmp\");\n"
            + "})();\n", code);
    }

    @Test
    void honorsOutputOptions() {
        TranspilerOptions options = TranspilerOptions.builder()
            .strict(false)
            .imports(false)
            .indent("\t")
            .build();
        String code = new ShellTranspiler(options).transpile(program(cmd("cd", "/tmp"))).code();

        assertTrue(code.startsWith("(async () => {\n"), "Should omit directive and import");
        assertTrue(code.contains("\n\t$.cd(\"/tmp\");\n"), "Should indent with tabs");
    }

    @Test
    void emptyProgramStillRuns() {
        TranspileResult result = transpiler.transpile(program());
        assertTrue(result.code().endsWith("  const __printCmd = $.printCmd;\n})();\n"));
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void printsPwdOutput() {
        String code = transpiler.transpile(program(cmd("pwd"))).code();
        assertTrue(code.contains("  console.log($.pwd().toString());\n"), "Should print output builtin");
    }

    @Test
    void pipesCatIntoHead() {
        String code = transpiler.transpile(program(pipe(cmd("cat", "file.txt"), cmd("head", "-5")))).code();
        assertTrue(code.contains("for await (const __line0 of $.cat(\"file.txt\").lines().pipe($.head(5))) "
            + "{ console.log(__line0); }"), "Should stream lines through the fluent head");
    }

    @Test
    void invertedGrepOnFile() {
        String code = transpiler.transpile(program(cmd("grep", "-v", "pattern", "file.txt"))).code();
        assertTrue(code.contains("$.cat(\"file.txt\").lines().filter(line => !/pattern/.test(line))"),
            "Should filter lines without the pattern");
    }

    @Test
    void assignmentIsVisibleAfterAnd() {
        TranspileResult result = transpiler.transpile(program(
            and(assignmentsOnly(assign("VAR", "1")), cmd(word("echo"), var("VAR")))));

        assertTrue(result.code().contains("  let VAR = \"1\";\n"), "Should declare VAR");
        assertTrue(result.code().contains("  $.echo(`${VAR}`);\n"), "Should reference the declared binding");
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void timeoutBecomesOption() {
        String code = transpiler.transpile(program(cmd("timeout", "5m", "mycmd", "--flag"))).code();
        assertTrue(code.contains("await __printCmd($.cmd({ timeout: 300000 }, \"mycmd\", \"--flag\"));"),
            "Should convert the duration to milliseconds");
    }

    @Test
    void assignmentChainStaysFlatAndDropsUnreachableOr() {
        TranspileResult result = transpiler.transpile(program(
            or(and(assignmentsOnly(assign("A", "1")), assignmentsOnly(assign("B", "2"))),
                assignmentsOnly(assign("C", "3"))),
            cmd(word("echo"), var("C"))));

        String code = result.code();
        assertTrue(code.contains("  let A = \"1\";\n  let B = \"2\";\n"), "Should declare in order");
        assertFalse(code.contains("let C"), "Should never compile the unreachable assignment");
        assertFalse(code.contains("try {"), "Should not need a recovery block");
        assertEquals(1, code.split("async \\(\\) =>", -1).length - 1, "Should only have the entry point closure");
        assertTrue(code.contains("$.echo(`${$.ENV.C}`);"), "Should treat C as undeclared");
        assertEquals(1, result.diagnostics().size());
        assertEquals(Severity.INFO, result.diagnostics().get(0).getSeverity());
        assertFalse(result.hasErrors());
    }

    @Test
    void assignmentFromSubstitutionKeepsOrFallback() {
        TranspileResult result = transpiler.transpile(program(
            or(assignmentsOnly(new VariableAssignment("X", substitution(cmd("false")), false)),
                cmd("echo", "failed"))));

        String code = result.code();
        assertTrue(code.contains("  let X;\n"), "Should declare X ahead of the recovery block");
        assertTrue(code.contains("try { X = `${"), "Should assign X inside the attempt");
        assertTrue(code.contains("catch { $.echo(\"failed\"); }"), "Should keep the fallback");
        assertFalse(code.contains("let X ="), "Should not declare X inside a block");
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void assignmentInRecoveryStaysVisibleAfterwards() {
        TranspileResult result = transpiler.transpile(program(
            or(cmd("false"), assignmentsOnly(assign("X", "default"))),
            cmd(word("mycmd"), var("X"))));

        String code = result.code();
        assertTrue(code.contains("  let X;\n"), "Should hoist the declaration");
        assertTrue(code.contains("catch { X = \"default\"; return "), "Should assign without declaring");
        assertFalse(code.contains("let X ="), "Should not declare X inside the catch block");
        assertTrue(code.indexOf("let X;") < code.indexOf("try {"), "Should declare before the block");
        assertTrue(code.contains("$.cmd(\"mycmd\", `${X}`)"), "Should read the hoisted binding");
    }

    @Test
    void substitutionAssignmentsStayInsideIt() {
        String code = transpiler.transpile(program(
            cmd(word("echo"), substitution(assignmentsOnly(assign("Y", "1")))),
            cmd(word("echo"), var("Y")))).code();

        assertTrue(code.contains("let Y = \"1\";"), "Should declare Y inside the substitution");
        assertTrue(code.contains("$.echo(`${$.ENV.Y}`);"), "Should not read the substitution's binding outside");
    }

    @Test
    void genericCommandCarriesEnvironment() {
        String code = transpiler.transpile(program(withEnv(cmd("make", "build"), assign("FOO", "bar")))).code();
        assertTrue(code.contains("await __printCmd($.cmd({ env: { FOO: \"bar\" } }, \"make\", \"build\"));"),
            "Should pass the assignment as env option");
    }

    @Test
    void mergesStderrIntoStdout() {
        String code = transpiler.transpile(program(withRedirects(cmd("make"),
            Redirection.toDescriptor(RedirectionOperator.DUP_OUTPUT, 2, 1)))).code();
        assertTrue(code.contains("$.cmd({ mergeStreams: true }, \"make\")"), "Should fold 2>&1 into options");
        assertFalse(code.contains(".stderr("), "Should not also apply it as a redirection");
    }

    @Test
    void exportedAssignmentUpdatesEnvironment() {
        String code = transpiler.transpile(program(export("TARGET", "prod"))).code();
        assertTrue(code.contains("  let TARGET = \"prod\"; $.ENV[\"TARGET\"] = TARGET;\n"));
    }

    @Test
    void capturesCommandSubstitution() {
        String code = transpiler.transpile(program(cmd(word("echo"), substitution(cmd("date"))))).code();
        assertTrue(code.contains("$.echo(`${(await $.capture($.cmd(\"date\")))}`);"),
            "Should capture the inner command");
    }

    @Test
    void runsBackgroundJob() {
        String code = transpiler.transpile(program(background(cmd("sleep", "5")))).code();
        assertTrue(code.contains("(async () => { const __bg0 = $.cmd(\"sleep\", \"5\"); "
            + "__ctx.lastBackgroundPid = __bg0.spawnBackground().pid; })(); // background"));
    }

    @Test
    void negatesExitStatus() {
        Pipeline negated = new Pipeline(List.of(cmd("grep", "-q", "x", "f")), PipelineOperator.NONE, false, true);
        String code = transpiler.transpile(program(negated)).code();
        assertTrue(code.contains("await __printCmd($.cmd(\"grep\", \"-q\", \"x\", \"f\").negate());"));
    }

    @Test
    void declaresAndCallsFunctions() {
        String code = transpiler.transpile(program(
            new FunctionDeclaration("greet-user", List.of(cmd("echo", "hi"))),
            cmd("greet-user", "bob"))).code();

        assertTrue(code.contains("  async function greet_user(...args) {\n    $.echo(\"hi\");\n  }\n"),
            "Should emit an async function");
        assertTrue(code.contains("  await greet_user(\"bob\");\n"), "Should await the call without printing it");
    }

    @Test
    void runsSubshellInClosure() {
        String code = transpiler.transpile(program(new Subshell(List.of(cmd("cd", "/var"))))).code();
        assertTrue(code.contains("  await (async () => {\n    $.cd(\"/var\");\n  })();\n"));
    }

    @Test
    void reportsUnsupportedStatementAndContinues() {
        TranspileResult result = transpiler.transpile(program(
            new IfStatement(cmd("true"), List.of(cmd("cd", "/")), List.of()), cmd("pwd")));

        assertTrue(result.code().contains("  // unsupported: IfStatement\n"));
        assertTrue(result.code().contains("console.log($.pwd().toString());"), "Should keep compiling");
        assertTrue(result.hasErrors());
    }

    @Test
    void usesRegisteredHandler() {
        StatementHandler<IfStatement> ifHandler = (statement, driver) -> {
            driver.emit("if ((await " + driver.buildPipelineExpression(statement.getTest(), false) + ").success) {");
            driver.visitBlock(statement.getConsequent());
            driver.emit("}");
        };
        TranspileResult result = transpiler.withHandler(NodeKind.IF_STATEMENT, ifHandler).transpile(program(
            new IfStatement(cmd("make", "check"), List.of(cmd("cd", "dist")), List.of())));

        assertTrue(result.code().contains("  if ((await $.cmd(\"make\", \"check\")).success) {\n"
            + "    $.cd(\"dist\");\n  }\n"));
        assertFalse(result.hasErrors());
    }

    @Test
    void rejectsHandlerForDriverKinds() {
        StatementHandler<Statement> handler = (statement, driver) -> { };
        assertThrows(IllegalArgumentException.class, () -> transpiler.withHandler(NodeKind.PIPELINE, handler));
        assertThrows(IllegalArgumentException.class, () -> transpiler.withHandler(NodeKind.WORD, handler));
    }

    @Test
    void brokenTreeAborts() {
        Statement broken = mock(Statement.class);
        when(broken.getKind()).thenReturn(NodeKind.REDIRECTION);
        assertThrows(UnsupportedOperationException.class, () -> transpiler.transpile(new Program(List.of(broken))));
    }

    @Test
    void transpilesRepeatablyWithFreshState() {
        Program program = program(assignmentsOnly(assign("X", "1")), pipe(cmd("cat", "a"), cmd("sort")));
        TranspileResult first = transpiler.transpile(program);
        TranspileResult second = transpiler.transpile(program);

        assertEquals(first.code(), second.code());
        assertTrue(second.code().contains("let X = \"1\";"), "Should not see X from the previous run");
        assertTrue(second.code().contains("__line0"), "Should restart temp numbering");
    }
}
