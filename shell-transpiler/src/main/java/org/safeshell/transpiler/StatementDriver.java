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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.FunctionDeclaration;
import org.safeshell.transpiler.ast.NodeKind;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.ast.Word;
import org.safeshell.transpiler.command.CommandCompiler;
import org.safeshell.transpiler.command.CommandMode;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.command.VariableAssignmentCompiler;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.handler.StatementHandler;
import org.safeshell.transpiler.handler.UnsupportedStatementHandler;
import org.safeshell.transpiler.pipeline.AssembledPipeline;
import org.safeshell.transpiler.pipeline.FlatPipeline;
import org.safeshell.transpiler.pipeline.OperandCompiler;
import org.safeshell.transpiler.pipeline.PipelineAssembler;
import org.safeshell.transpiler.pipeline.PipelineFlattener;
import org.safeshell.transpiler.pipeline.PipelineValue;
import org.safeshell.transpiler.pipeline.StatementFragment;
import org.safeshell.transpiler.redirect.RedirectionApplier;
import org.safeshell.transpiler.word.CompiledWord;
import org.safeshell.transpiler.word.ExpansionTranslator;
import org.safeshell.transpiler.word.SubstitutionCompiler;
import org.safeshell.transpiler.word.WordCompiler;

/**
 * Walks statements for one compilation and collects the generated lines.
 *
 * <p>Commands, pipelines and assignments are compiled here. Every other statement
 * kind goes to its registered {@link StatementHandler}; kinds without one are
 * reported as errors. A node kind that cannot appear in statement position at
 * all means the input tree is broken and aborts the compilation.
 */
@Slf4j
public class StatementDriver implements OperandCompiler, SubstitutionCompiler {

    @Getter
    private final TranspilerContext context;

    private final Map<NodeKind, StatementHandler<?>> handlers;
    private final WordCompiler words;
    private final VariableAssignmentCompiler assignments;
    private final CommandCompiler commands;
    private final PipelineFlattener flattener;
    private final PipelineAssembler assembler;

    private List<String> output = new ArrayList<>();

    public StatementDriver(TranspilerContext context, CommandCatalog catalog, ExpansionTranslator translator,
                           Map<NodeKind, StatementHandler<?>> handlers) {
        this.context = context;
        this.handlers = handlers;
        this.words = new WordCompiler(context, translator, this);
        this.assignments = new VariableAssignmentCompiler(context, words);
        this.commands = new CommandCompiler(CommandCompiler.defaultStrategies(context, catalog, assignments),
            words, assignments, new RedirectionApplier(words));
        this.flattener = new PipelineFlattener(this);
        this.assembler = new PipelineAssembler(context);
    }

    /** Lines emitted so far, each already indented. */
    public List<String> getOutput() {
        return List.copyOf(output);
    }

    public void emit(String code) {
        output.add(context.getIndent() + code);
    }

    public void visitStatements(List<Statement> statements) {
        for (Statement statement : statements) {
            visitStatement(statement);
        }
    }

    /** Visit a nested body one level deeper, in its own scope. */
    public void visitBlock(List<Statement> statements) {
        context.pushScope();
        context.indent();
        try {
            visitStatements(statements);
        } finally {
            context.dedent();
            context.popScope();
        }
    }

    public void visitStatement(Statement statement) {
        NodeKind kind = statement == null ? null : statement.getKind();
        if (kind == null || !kind.isStatement()) {
            throw new UnsupportedOperationException("Unsupported statement: " + kind);
        }
        switch (kind) {
            case PIPELINE:
                visitPipeline((Pipeline) statement);
                break;
            case COMMAND:
                visitCommand((Command) statement);
                break;
            case VARIABLE_ASSIGNMENT:
                emit(assignments.compile((VariableAssignment) statement).getCode() + ";");
                break;
            case FUNCTION_DECLARATION:
                context.declareFunction(((FunctionDeclaration) statement).getName());
                delegate(statement);
                break;
            default:
                delegate(statement);
        }
    }

    private void visitPipeline(Pipeline pipeline) {
        if (pipeline.isBackground()) {
            // a background job runs in a subshell, its assignments stay inside it
            context.pushScope();
            try {
                emit(assembler.toBackground(
                    assembler.assemble(flattener.flatten(pipeline, false), pipeline.isNegated())));
            } finally {
                context.popScope();
            }
            return;
        }
        AssembledPipeline assembled = assembler.assemble(flattener.flatten(pipeline, false), pipeline.isNegated());
        assembler.toStatements(assembled).forEach(this::emit);
    }

    private void visitCommand(Command command) {
        AssembledPipeline assembled = assembler.assemble(flattener.flatten(command, false), false);
        assembler.toStatements(assembled).forEach(this::emit);
    }

    @SuppressWarnings("unchecked")
    private void delegate(Statement statement) {
        StatementHandler<Statement> handler = (StatementHandler<Statement>) handlers.get(statement.getKind());
        if (handler == null) {
            handler = UnsupportedStatementHandler.INSTANCE;
        }
        handler.handle(statement, this);
    }

    // ---- Building blocks for handlers ----

    /** A single command as an expression, without statement emission. */
    public CompiledExpression buildCommandExpression(Command command, CommandMode mode) {
        return commands.compile(command, mode);
    }

    /**
     * A command or pipeline as one expression, e.g. for a loop or if condition. Names it
     * assigns are declared by a statement emitted ahead of the caller's own line.
     */
    public String buildPipelineExpression(Statement statement, boolean capture) {
        boolean negated = statement instanceof Pipeline && ((Pipeline) statement).isNegated();
        StatementFragment expression = assembler.toExpression(
            assembler.assemble(flattener.flatten(statement, capture), negated), capture);
        if (!expression.declarations().isEmpty()) {
            emit(StatementFragment.declare(expression.declarations()));
        }
        return expression.code();
    }

    public CompiledWord compileWord(Word word) {
        return words.compile(word);
    }

    // ---- OperandCompiler ----

    @Override
    public CompiledExpression compileCommand(Command command, CommandMode mode) {
        return commands.compile(command, mode);
    }

    @Override
    public CompiledExpression compileAssignment(VariableAssignment assignment) {
        return assignments.compile(assignment);
    }

    @Override
    public CompiledExpression compileNested(Pipeline pipeline, boolean capture) {
        FlatPipeline flat = flattener.flatten(pipeline, capture);
        AssembledPipeline assembled = assembler.assemble(flat, pipeline.isNegated());
        PipelineValue value = assembled.value();
        StatementFragment expression = assembler.toExpression(assembled, capture);
        String code = expression.code();
        CompiledExpression compiled;
        if (assembled.prelude().isEmpty() && value.isStream() && !value.isPending()) {
            compiled = CompiledExpression.builder()
                .code(code)
                .async(true)
                .streamProducer(true)
                .lineStream(value.getKind() == PipelineValue.Kind.LINE_STREAM)
                .build();
        } else if (value.isStatement() || !value.isPrintable()) {
            compiled = CompiledExpression.call(code);
        } else {
            compiled = CompiledExpression.async(code);
        }
        return compiled.toBuilder().declarations(expression.declarations()).build();
    }

    @Override
    public CompiledExpression compileClosure(Statement statement) {
        List<String> saved = output;
        output = new ArrayList<>();
        String indent = context.getIndent();
        context.pushScope();
        context.indent();
        List<String> body;
        try {
            visitStatement(statement);
            emit("return " + PipelineAssembler.SUCCESS + ";");
            body = output;
        } finally {
            context.dedent();
            context.popScope();
            output = saved;
        }
        return CompiledExpression.call("(async () => {\n" + String.join("\n", body) + "\n" + indent + "})()");
    }

    // ---- SubstitutionCompiler ----

    @Override
    public String compileCaptured(List<Statement> body) {
        List<String> expressions = new ArrayList<>(body.size());
        // a substitution runs in a subshell, its assignments stay inside it
        context.pushScope();
        try {
            for (Statement statement : body) {
                if (statement instanceof Pipeline || statement instanceof Command) {
                    expressions.add(buildPipelineExpression(statement, true));
                } else {
                    expressions.add(compileClosure(statement).getCode());
                }
            }
        } finally {
            context.popScope();
        }
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        StringJoiner all = new StringJoiner(", ", "[", "]");
        expressions.forEach(all::add);
        return all.toString();
    }
}
