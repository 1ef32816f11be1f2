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

package org.safeshell.transpiler.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Every node kind the parser can hand over. Only kinds flagged as statements may
 * appear in a statement position; the rest live inside words, redirections and
 * assignments.
 */
@Getter
@RequiredArgsConstructor
public enum NodeKind {
    PROGRAM("Program", false),
    PIPELINE("Pipeline", true),
    COMMAND("Command", true),
    VARIABLE_ASSIGNMENT("VariableAssignment", true),
    FUNCTION_DECLARATION("FunctionDeclaration", true),
    IF_STATEMENT("IfStatement", true),
    FOR_STATEMENT("ForStatement", true),
    C_STYLE_FOR_STATEMENT("CStyleForStatement", true),
    WHILE_STATEMENT("WhileStatement", true),
    UNTIL_STATEMENT("UntilStatement", true),
    CASE_STATEMENT("CaseStatement", true),
    SUBSHELL("Subshell", true),
    BRACE_GROUP("BraceGroup", true),
    TEST_COMMAND("TestCommand", true),
    ARITHMETIC_COMMAND("ArithmeticCommand", true),
    RETURN_STATEMENT("ReturnStatement", true),
    BREAK_STATEMENT("BreakStatement", true),
    CONTINUE_STATEMENT("ContinueStatement", true),

    WORD("Word", false),
    LITERAL_PART("LiteralPart", false),
    GLOB_PATTERN("GlobPattern", false),
    PARAMETER_EXPANSION("ParameterExpansion", false),
    COMMAND_SUBSTITUTION("CommandSubstitution", false),
    ARITHMETIC_EXPANSION("ArithmeticExpansion", false),
    PROCESS_SUBSTITUTION("ProcessSubstitution", false),
    ARRAY_LITERAL("ArrayLiteral", false),
    REDIRECTION("Redirection", false),
    CASE_CLAUSE("CaseClause", false);

    /** The {@code type} tag used by the parser's JSON output. */
    private final String typeName;

    private final boolean statement;

    public static NodeKind fromTypeName(String typeName) {
        for (NodeKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + typeName);
    }
}
