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

package org.safeshell.transpiler.ast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.safeshell.transpiler.ast.ArithmeticCommand;
import org.safeshell.transpiler.ast.ArithmeticExpansion;
import org.safeshell.transpiler.ast.ArrayLiteral;
import org.safeshell.transpiler.ast.AssignmentValue;
import org.safeshell.transpiler.ast.BraceGroup;
import org.safeshell.transpiler.ast.BreakStatement;
import org.safeshell.transpiler.ast.CStyleForStatement;
import org.safeshell.transpiler.ast.CaseClause;
import org.safeshell.transpiler.ast.CaseStatement;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.CommandSubstitution;
import org.safeshell.transpiler.ast.ContinueStatement;
import org.safeshell.transpiler.ast.ForStatement;
import org.safeshell.transpiler.ast.FunctionDeclaration;
import org.safeshell.transpiler.ast.GlobPattern;
import org.safeshell.transpiler.ast.IfStatement;
import org.safeshell.transpiler.ast.LiteralPart;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.PipelineOperator;
import org.safeshell.transpiler.ast.ProcessSubstitution;
import org.safeshell.transpiler.ast.Program;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.ast.RedirectionOperator;
import org.safeshell.transpiler.ast.ReturnStatement;
import org.safeshell.transpiler.ast.SourceLocation;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.ast.Subshell;
import org.safeshell.transpiler.ast.TestCommand;
import org.safeshell.transpiler.ast.UntilStatement;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.ast.WhileStatement;
import org.safeshell.transpiler.ast.Word;
import org.safeshell.transpiler.ast.WordPart;

/**
 * Reads the parser's JSON statement tree into {@link Program}.
 *
 * <p>Every node is an object tagged with {@code "type"}. Arithmetic and test
 * expressions are flattened to normalized source text since their translation
 * happens outside this tree. Bare {@code ParameterExpansion} or
 * {@code CommandSubstitution} nodes in word positions are wrapped into a
 * single-part {@link Word}.
 */
public class AstJsonReader {

    private final ObjectMapper mapper;

    public AstJsonReader() {
        this(new ObjectMapper());
    }

    public AstJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Program read(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        }
    }

    public Program read(InputStream is) throws IOException {
        return readProgram(mapper.readTree(is));
    }

    public Program read(String json) throws IOException {
        return readProgram(mapper.readTree(json));
    }

    Program readProgram(JsonNode node) {
        String type = typeOf(node);
        if (!"Program".equals(type)) {
            throw new IllegalArgumentException("Expected Program at the root, got: " + type);
        }
        return new Program(statements(node.get("body")));
    }

    // ---- Statements ----

    Statement statement(JsonNode node) {
        String type = typeOf(node);
        switch (type) {
            case "Command":
                return command(node);
            case "Pipeline":
                return pipeline(node);
            case "VariableAssignment":
                return assignment(node);
            case "FunctionDeclaration":
                return new FunctionDeclaration(text(node, "name"), statements(node.get("body")));
            case "IfStatement":
                return ifStatement(node);
            case "ForStatement":
                return new ForStatement(text(node, "variable"), words(node.get("iterable")),
                    statements(node.get("body")));
            case "CStyleForStatement":
                return new CStyleForStatement(arithmeticOrNull(node.get("init")),
                    arithmeticOrNull(node.get("test")), arithmeticOrNull(node.get("update")),
                    statements(node.get("body")));
            case "WhileStatement":
                return new WhileStatement(statement(node.get("test")), statements(node.get("body")));
            case "UntilStatement":
                return new UntilStatement(statement(node.get("test")), statements(node.get("body")));
            case "CaseStatement":
                return caseStatement(node);
            case "Subshell":
                return new Subshell(statements(node.get("body")));
            case "BraceGroup":
                return new BraceGroup(statements(node.get("body")));
            case "TestCommand":
                return new TestCommand(testCondition(node.path("expression").path("expression")));
            case "ArithmeticCommand":
                return new ArithmeticCommand(arithmetic(node.get("expression")));
            case "ReturnStatement":
                return new ReturnStatement(arithmeticOrNull(node.get("value")));
            case "BreakStatement":
                return new BreakStatement(node.path("count").asInt(1));
            case "ContinueStatement":
                return new ContinueStatement(node.path("count").asInt(1));
            default:
                throw new IllegalArgumentException("Unsupported statement type: " + type);
        }
    }

    private List<Statement> statements(JsonNode array) {
        List<Statement> result = new ArrayList<>();
        if (array == null || array.isNull()) {
            return result;
        }
        for (JsonNode element : array) {
            result.add(statement(element));
        }
        return result;
    }

    private Command command(JsonNode node) {
        List<VariableAssignment> assignments = new ArrayList<>();
        for (JsonNode element : node.path("assignments")) {
            assignments.add(assignment(element));
        }
        List<Redirection> redirects = new ArrayList<>();
        for (JsonNode element : node.path("redirects")) {
            redirects.add(redirection(element));
        }
        JsonNode name = node.get("name");
        return new Command(name == null || name.isNull() ? Word.literal("") : word(name),
            words(node.get("args")), assignments, redirects, location(node));
    }

    private Pipeline pipeline(JsonNode node) {
        String symbol = node.path("operator").isNull() ? null : node.path("operator").asText(null);
        boolean background = node.path("background").asBoolean(false);
        PipelineOperator operator;
        if ("&".equals(symbol)) {
            operator = PipelineOperator.SEQUENCE;
            background = true;
        } else {
            operator = PipelineOperator.fromSymbol(symbol);
        }
        return new Pipeline(statements(node.get("commands")), operator, background,
            node.path("negated").asBoolean(false));
    }

    private VariableAssignment assignment(JsonNode node) {
        JsonNode value = node.get("value");
        AssignmentValue converted;
        if (value == null || value.isNull()) {
            converted = Word.literal("");
        } else if ("ArrayLiteral".equals(typeOf(value))) {
            converted = new ArrayLiteral(words(value.get("elements")));
        } else {
            converted = word(value);
        }
        return new VariableAssignment(text(node, "name"), converted, node.path("exported").asBoolean(false));
    }

    private IfStatement ifStatement(JsonNode node) {
        JsonNode alternate = node.get("alternate");
        List<Statement> alternates;
        if (alternate == null || alternate.isNull()) {
            alternates = List.of();
        } else if (alternate.isArray()) {
            alternates = statements(alternate);
        } else {
            alternates = List.of(statement(alternate));
        }
        return new IfStatement(statement(node.get("test")), statements(node.get("consequent")), alternates);
    }

    private CaseStatement caseStatement(JsonNode node) {
        List<CaseClause> clauses = new ArrayList<>();
        for (JsonNode clause : node.path("cases")) {
            clauses.add(new CaseClause(words(clause.get("patterns")), statements(clause.get("body"))));
        }
        return new CaseStatement(word(node.get("word")), clauses);
    }

    private Redirection redirection(JsonNode node) {
        RedirectionOperator operator = RedirectionOperator.fromSymbol(text(node, "operator"));
        Integer fd = node.hasNonNull("fd") ? node.get("fd").asInt() : null;
        JsonNode target = node.get("target");
        if (target != null && target.isNumber()) {
            return new Redirection(operator, fd, null, target.asInt());
        }
        return new Redirection(operator, fd, word(target), null);
    }

    // ---- Words ----

    private List<Word> words(JsonNode array) {
        List<Word> result = new ArrayList<>();
        if (array == null || array.isNull()) {
            return result;
        }
        for (JsonNode element : array) {
            result.add(word(element));
        }
        return result;
    }

    Word word(JsonNode node) {
        String type = typeOf(node);
        if (!"Word".equals(type)) {
            WordPart part = wordPart(node);
            return new Word(node.path("value").asText(""), false, false, List.of(part));
        }
        List<WordPart> parts = new ArrayList<>();
        for (JsonNode part : node.path("parts")) {
            parts.add(wordPart(part));
        }
        String value = node.path("value").asText("");
        if (parts.isEmpty() && !value.isEmpty()) {
            parts.add(new LiteralPart(value));
        }
        return new Word(value, node.path("quoted").asBoolean(false),
            node.path("singleQuoted").asBoolean(false), parts);
    }

    private WordPart wordPart(JsonNode node) {
        String type = typeOf(node);
        switch (type) {
            case "LiteralPart":
                return new LiteralPart(node.path("value").asText(""));
            case "GlobPattern":
                return new GlobPattern(node.path("pattern").asText(""));
            case "ParameterExpansion":
                return new ParameterExpansion(text(node, "parameter"),
                    node.hasNonNull("modifier") ? node.get("modifier").asText() : null,
                    node.hasNonNull("modifierArg") ? word(node.get("modifierArg")) : null,
                    node.hasNonNull("subscript") ? node.get("subscript").asText() : null);
            case "CommandSubstitution":
                return new CommandSubstitution(statements(node.get("command")),
                    node.path("backtick").asBoolean(false));
            case "ArithmeticExpansion":
                return new ArithmeticExpansion(arithmetic(node.get("expression")));
            case "ProcessSubstitution":
                return new ProcessSubstitution(text(node, "operator"), statements(node.get("command")));
            case "Word":
                return word(node);
            default:
                throw new IllegalArgumentException("Unsupported word part type: " + type);
        }
    }

    // ---- Expression text ----

    private String arithmeticOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : arithmetic(node);
    }

    String arithmetic(JsonNode node) {
        String type = typeOf(node);
        switch (type) {
            case "NumberLiteral":
                return node.get("value").asText();
            case "VariableReference":
                return text(node, "name");
            case "ParameterExpansion":
                return "$" + text(node, "parameter");
            case "BinaryArithmeticExpression":
                return arithmetic(node.get("left")) + " " + text(node, "operator") + " "
                    + arithmetic(node.get("right"));
            case "UnaryArithmeticExpression":
                String operand = arithmetic(node.get("argument"));
                String operator = text(node, "operator");
                return node.path("prefix").asBoolean(true) ? operator + operand : operand + operator;
            case "ConditionalArithmeticExpression":
                return arithmetic(node.get("test")) + " ? " + arithmetic(node.get("consequent")) + " : "
                    + arithmetic(node.get("alternate"));
            case "AssignmentExpression":
                return arithmetic(node.get("left")) + " " + text(node, "operator") + " "
                    + arithmetic(node.get("right"));
            case "GroupedArithmeticExpression":
                return "(" + arithmetic(node.get("expression")) + ")";
            default:
                throw new IllegalArgumentException("Unsupported arithmetic node: " + type);
        }
    }

    String testCondition(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        String type = typeOf(node);
        switch (type) {
            case "UnaryTest":
                return text(node, "operator") + " " + word(node.get("argument")).getValue();
            case "BinaryTest":
                return word(node.get("left")).getValue() + " " + text(node, "operator") + " "
                    + word(node.get("right")).getValue();
            case "LogicalTest":
                String right = testCondition(node.get("right"));
                if (!node.hasNonNull("left")) {
                    return text(node, "operator") + " " + right;
                }
                return testCondition(node.get("left")) + " " + text(node, "operator") + " " + right;
            case "StringTest":
                return word(node.get("value")).getValue();
            default:
                throw new IllegalArgumentException("Unsupported test condition: " + type);
        }
    }

    // ---- Helpers ----

    private static SourceLocation location(JsonNode node) {
        JsonNode start = node.path("loc").path("start");
        if (start.isMissingNode() || !start.has("line")) {
            return null;
        }
        return new SourceLocation(start.path("line").asInt(), start.path("column").asInt());
    }

    private static String typeOf(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull("type")) {
            throw new IllegalArgumentException("Expected a typed node, got: " + node);
        }
        return node.get("type").asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "' in " + typeOf(node));
        }
        return value.asText();
    }
}
