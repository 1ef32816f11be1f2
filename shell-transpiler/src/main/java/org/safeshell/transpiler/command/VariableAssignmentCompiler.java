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

package org.safeshell.transpiler.command;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.safeshell.transpiler.ast.ArrayLiteral;
import org.safeshell.transpiler.ast.AssignmentValue;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.ast.Word;
import org.safeshell.transpiler.ast.WordPart;
import org.safeshell.transpiler.context.DeclarationKind;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.escape.EscapeUtils;
import org.safeshell.transpiler.word.CompiledWord;
import org.safeshell.transpiler.word.WordCompiler;

/**
 * Compiles shell variable assignments into declarations or reassignments,
 * tracking what each scope has declared.
 */
public class VariableAssignmentCompiler {

    private final TranspilerContext context;
    private final WordCompiler words;

    public VariableAssignmentCompiler(TranspilerContext context, WordCompiler words) {
        this.context = context;
        this.words = words;
    }

    /**
     * One assignment as a statement: {@code let X = v} the first time a name is
     * seen, {@code X = v} after that. The block form never declares, so a nested
     * block can assign a name its enclosing scope declares.
     */
    public CompiledExpression compile(VariableAssignment assignment) {
        String value = compileValue(assignment.getValue());
        List<String> declarations = new ArrayList<>(1);
        String code = statement(assignment, value, declarations);
        return CompiledExpression.assignment(code, assign(assignment, value), declarations,
            runsNoCommand(assignment.getValue()));
    }

    /**
     * Several assignments as one statement. Fresh, non-exported names collapse
     * into a single {@code let A = .., B = ..} declaration.
     */
    public CompiledExpression compileAll(List<VariableAssignment> assignments) {
        List<String> values = new ArrayList<>(assignments.size());
        Set<String> seen = new HashSet<>();
        boolean allFresh = true;
        boolean infallible = true;
        for (VariableAssignment assignment : assignments) {
            values.add(compileValue(assignment.getValue()));
            infallible &= runsNoCommand(assignment.getValue());
            if (assignment.isExported() || context.isDeclared(assignment.getName())
                || !seen.add(assignment.getName())) {
                allFresh = false;
            }
        }

        List<String> declarations = new ArrayList<>(assignments.size());
        StringJoiner blockStatements = new StringJoiner("; ");
        if (allFresh) {
            StringJoiner declaration = new StringJoiner(", ", "let ", "");
            for (int i = 0; i < assignments.size(); i++) {
                String name = assignments.get(i).getName();
                context.declareVariable(name, DeclarationKind.LET, true);
                declarations.add(EscapeUtils.sanitizeVarName(name));
                declaration.add(EscapeUtils.sanitizeVarName(name) + " = " + values.get(i));
                blockStatements.add(assign(assignments.get(i), values.get(i)));
            }
            return CompiledExpression.assignment(declaration.toString(), blockStatements.toString(), declarations,
                infallible);
        }

        StringJoiner statements = new StringJoiner("; ");
        for (int i = 0; i < assignments.size(); i++) {
            statements.add(statement(assignments.get(i), values.get(i), declarations));
            blockStatements.add(assign(assignments.get(i), values.get(i)));
        }
        return CompiledExpression.assignment(statements.toString(), blockStatements.toString(), declarations,
            infallible);
    }

    /** A value compiled for the {@code env} option of a process invocation. */
    public String compileEnvValue(AssignmentValue value) {
        if (value instanceof ArrayLiteral) {
            return compileValue(value) + ".join(\" \")";
        }
        return compileValue(value);
    }

    private String statement(VariableAssignment assignment, String value, List<String> declarations) {
        if (context.isDeclared(assignment.getName())) {
            return assign(assignment, value);
        }
        context.declareVariable(assignment.getName(), DeclarationKind.LET, true);
        declarations.add(EscapeUtils.sanitizeVarName(assignment.getName()));
        return "let " + assign(assignment, value);
    }

    private static String assign(VariableAssignment assignment, String value) {
        String name = EscapeUtils.sanitizeVarName(assignment.getName());
        String code = name + " = " + value;
        if (assignment.isExported()) {
            code += "; $.ENV[\"" + EscapeUtils.escapeForQuotes(assignment.getName()) + "\"] = " + name;
        }
        return code;
    }

    /**
     * Whether evaluating a value can run a command. Substitutions carry the exit status
     * of what they run, so only values without them make an assignment unable to fail.
     */
    static boolean runsNoCommand(AssignmentValue value) {
        if (value instanceof ArrayLiteral) {
            return ((ArrayLiteral) value).getElements().stream().allMatch(VariableAssignmentCompiler::runsNoCommand);
        }
        if (value instanceof Word) {
            return ((Word) value).getParts().stream().allMatch(VariableAssignmentCompiler::partRunsNoCommand);
        }
        return true;
    }

    private static boolean partRunsNoCommand(WordPart part) {
        switch (part.getKind()) {
            case COMMAND_SUBSTITUTION:
            case ARITHMETIC_EXPANSION:
            case PROCESS_SUBSTITUTION:
                return false;
            case WORD:
                return runsNoCommand((Word) part);
            case PARAMETER_EXPANSION:
                Word argument = ((ParameterExpansion) part).getModifierArg();
                return argument == null || runsNoCommand(argument);
            default:
                return true;
        }
    }

    private String compileValue(AssignmentValue value) {
        if (value instanceof ArrayLiteral) {
            StringJoiner elements = new StringJoiner(", ", "[", "]");
            for (CompiledWord element : words.compileAll(((ArrayLiteral) value).getElements())) {
                elements.add(element.toJs());
            }
            return elements.toString();
        }
        if (value instanceof Word) {
            return words.compile((Word) value).toJs();
        }
        throw new IllegalStateException("Unsupported assignment value: " + value.getKind());
    }
}
