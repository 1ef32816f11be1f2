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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.safeshell.transpiler.ast.ArithmeticCommand;
import org.safeshell.transpiler.ast.ArrayLiteral;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.CommandSubstitution;
import org.safeshell.transpiler.ast.IfStatement;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.PipelineOperator;
import org.safeshell.transpiler.ast.Program;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.ast.RedirectionOperator;
import org.safeshell.transpiler.ast.TestCommand;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.ast.Word;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstJsonReaderTest {

    private AstJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
    }

    @Test
    void readsSimpleCommand() throws IOException {
        Program program = reader.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Command\","
            + "\"name\":{\"type\":\"Word\",\"value\":\"cd\",\"quoted\":false,\"singleQuoted\":false,"
            + "\"parts\":[{\"type\":\"LiteralPart\",\"value\":\"cd\"}]},"
            + "\"args\":[{\"type\":\"Word\",\"value\":\"/tmp\",\"quoted\":false,\"singleQuoted\":false,\"parts\":[]}],"
            + "\"redirects\":[],\"assignments\":[],\"loc\":{\"start\":{\"line\":3,\"column\":1,\"offset\":0}}}]}");

        assertEquals(1, program.getBody().size());
        Command command = (Command) program.getBody().get(0);
        assertEquals("cd", command.getName().getValue());
        assertEquals("/tmp", command.getArgs().get(0).getValue());
        assertEquals(1, command.getArgs().get(0).getParts().size(),
            "Word without parts should get its value as a literal part");
        assertEquals(3, command.getLocation().line());
    }

    @Test
    void wrapsBareExpansionInWord() throws IOException {
        Program program = reader.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Command\","
            + "\"name\":{\"type\":\"Word\",\"value\":\"echo\",\"parts\":[]},"
            + "\"args\":[{\"type\":\"ParameterExpansion\",\"parameter\":\"HOME\"}],"
            + "\"redirects\":[],\"assignments\":[]}]}");

        Command command = (Command) program.getBody().get(0);
        assertTrue(command.getArgs().get(0).getParts().get(0) instanceof ParameterExpansion);
    }

    @Test
    void readsPipelineWithBackgroundOperator() throws IOException {
        String cmd = "{\"type\":\"Command\",\"name\":{\"type\":\"Word\",\"value\":\"sleep\",\"parts\":[]},"
            + "\"args\":[],\"redirects\":[],\"assignments\":[]}";
        Program program = reader.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Pipeline\","
            + "\"commands\":[" + cmd + "],\"operator\":\"&\",\"background\":false}]}");

        Pipeline pipeline = (Pipeline) program.getBody().get(0);
        assertEquals(PipelineOperator.SEQUENCE, pipeline.getOperator());
        assertTrue(pipeline.isBackground());
        assertFalse(pipeline.isNegated());
    }

    @Test
    void readsRedirectionToDescriptor() throws IOException {
        Program program = reader.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Command\","
            + "\"name\":{\"type\":\"Word\",\"value\":\"make\",\"parts\":[]},\"args\":[],"
            + "\"redirects\":[{\"type\":\"Redirection\",\"operator\":\">&\",\"fd\":2,\"target\":1}],"
            + "\"assignments\":[]}]}");

        Redirection redirection = ((Command) program.getBody().get(0)).getRedirects().get(0);
        assertEquals(RedirectionOperator.DUP_OUTPUT, redirection.getOperator());
        assertEquals(2, redirection.getFd());
        assertEquals(1, redirection.getTargetFd());
        assertNull(redirection.getTarget());
    }

    @Test
    void readsAssignmentsAndSubstitution() throws IOException {
        Program program = reader.read("{\"type\":\"Program\",\"body\":["
            + "{\"type\":\"VariableAssignment\",\"name\":\"LIST\",\"value\":{\"type\":\"ArrayLiteral\","
            + "\"elements\":[{\"type\":\"Word\",\"value\":\"a\",\"parts\":[]}]}},"
            + "{\"type\":\"VariableAssignment\",\"name\":\"NOW\",\"exported\":true,"
            + "\"value\":{\"type\":\"CommandSubstitution\",\"backtick\":false,\"command\":["
            + "{\"type\":\"Command\",\"name\":{\"type\":\"Word\",\"value\":\"date\",\"parts\":[]},"
            + "\"args\":[],\"redirects\":[],\"assignments\":[]}]}}]}");

        VariableAssignment list = (VariableAssignment) program.getBody().get(0);
        assertTrue(list.getValue() instanceof ArrayLiteral);
        VariableAssignment now = (VariableAssignment) program.getBody().get(1);
        assertTrue(now.isExported());
        assertTrue(((Word) now.getValue()).getParts().get(0)
            instanceof CommandSubstitution);
    }

    @Test
    void flattensArithmeticAndTestExpressions() throws IOException {
        Program program = reader.read("{\"type\":\"Program\",\"body\":["
            + "{\"type\":\"ArithmeticCommand\",\"expression\":{\"type\":\"BinaryArithmeticExpression\","
            + "\"operator\":\"+\",\"left\":{\"type\":\"VariableReference\",\"name\":\"i\"},"
            + "\"right\":{\"type\":\"NumberLiteral\",\"value\":1}}},"
            + "{\"type\":\"IfStatement\",\"test\":{\"type\":\"TestCommand\",\"expression\":{"
            + "\"type\":\"TestExpression\",\"expression\":{\"type\":\"UnaryTest\",\"operator\":\"-f\","
            + "\"argument\":{\"type\":\"Word\",\"value\":\"x.txt\",\"parts\":[]}}}},"
            + "\"consequent\":[],\"alternate\":null}]}");

        assertEquals("i + 1", ((ArithmeticCommand) program.getBody().get(0)).getExpression());
        IfStatement ifStatement = (IfStatement) program.getBody().get(1);
        assertEquals("-f x.txt", ((TestCommand) ifStatement.getTest()).getExpression());
        assertTrue(ifStatement.getAlternate().isEmpty());
    }

    @Test
    void rejectsUnknownStatementType() {
        assertThrows(IllegalArgumentException.class,
            () -> reader.read("{\"type\":\"Program\",\"body\":[{\"type\":\"Coproc\"}]}"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"type\":\"Command\"}"),
            "Root must be a Program");
    }

    @Test
    void readsFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("ast.json");
        Files.writeString(file, "{\"type\":\"Program\",\"body\":[]}");
        assertTrue(reader.read(file).getBody().isEmpty());
    }
}
