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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.ast.RedirectionOperator;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.command.strategy.AssignmentOnlyStrategy;
import org.safeshell.transpiler.command.strategy.BuiltinStrategy;
import org.safeshell.transpiler.command.strategy.FluentCommandStrategy;
import org.safeshell.transpiler.command.strategy.GenericCommandStrategy;
import org.safeshell.transpiler.command.strategy.SpecializedWrapperStrategy;
import org.safeshell.transpiler.command.strategy.TimeoutStrategy;
import org.safeshell.transpiler.command.strategy.UserFunctionStrategy;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.redirect.RedirectionApplier;
import org.safeshell.transpiler.word.CompiledWord;
import org.safeshell.transpiler.word.WordCompiler;

/**
 * Compiles one {@link Command} into a {@link CompiledExpression}.
 *
 * <p>The strategies form one ordered table. The first entry that applies and
 * does not decline builds the call; the generic process invocation at the end
 * always succeeds. Redirections are appended afterwards in source order, except
 * a {@code 2>&1} that was folded into the call's {@code mergeStreams} option.
 */
@Slf4j
public class CommandCompiler {

    private final List<CommandStrategy> strategies;
    private final WordCompiler words;
    private final VariableAssignmentCompiler assignments;
    private final RedirectionApplier redirections;

    public CommandCompiler(List<CommandStrategy> strategies, WordCompiler words,
                           VariableAssignmentCompiler assignments, RedirectionApplier redirections) {
        this.strategies = ImmutableList.copyOf(strategies);
        this.words = words;
        this.assignments = assignments;
        this.redirections = redirections;
    }

    /**
     * The standard table: assignment-only, user function, builtin, timeout,
     * fluent, specialized wrapper, generic.
     */
    public static List<CommandStrategy> defaultStrategies(TranspilerContext context, CommandCatalog catalog,
                                                          VariableAssignmentCompiler assignments) {
        return ImmutableList.of(
            new AssignmentOnlyStrategy(assignments),
            new UserFunctionStrategy(context),
            new BuiltinStrategy(catalog),
            new TimeoutStrategy(),
            new FluentCommandStrategy(),
            new SpecializedWrapperStrategy(catalog),
            new GenericCommandStrategy()
        );
    }

    public CompiledExpression compile(Command command, CommandMode mode) {
        CommandAnalysis analysis = analyze(command, mode);
        for (CommandStrategy strategy : strategies) {
            if (!strategy.applies(analysis)) {
                continue;
            }
            Optional<CompiledExpression> built = strategy.build(analysis);
            if (built.isPresent()) {
                log.debug("{} compiled by {}", analysis.staticName(), strategy.getClass().getSimpleName());
                return applyRedirections(built.get(), analysis, strategy.consumesMergedStreams());
            }
        }
        throw new IllegalStateException("No command strategy accepted " + command.getName().getValue());
    }

    CommandAnalysis analyze(Command command, CommandMode mode) {
        Redirection merged = null;
        List<Redirection> remaining = new ArrayList<>();
        for (Redirection redirection : command.getRedirects()) {
            if (merged == null && isMergeStderrIntoStdout(redirection)) {
                merged = redirection;
            } else {
                remaining.add(redirection);
            }
        }

        CompiledWord name = words.compile(command.getName());
        List<CompiledWord> args = words.compileAll(command.getArgs());

        // without a name the assignments are the statement itself, not an environment
        Map<String, String> env = new LinkedHashMap<>();
        if (!name.getSegments().isEmpty()) {
            for (VariableAssignment assignment : command.getAssignments()) {
                env.put(assignment.getName(), assignments.compileEnvValue(assignment.getValue()));
            }
        }

        return CommandAnalysis.builder()
            .command(command)
            .name(name)
            .args(args)
            .env(env)
            .inPipeline(mode.inPipeline())
            .pipeInput(mode.pipeInput())
            .capture(mode.capture())
            .mergedStreams(merged)
            .redirects(remaining)
            .build();
    }

    private CompiledExpression applyRedirections(CompiledExpression expression, CommandAnalysis analysis,
                                                 boolean mergedConsumed) {
        List<Redirection> pending = mergedConsumed ? analysis.getRedirects() : analysis.getCommand().getRedirects();
        if (pending.isEmpty()) {
            return expression;
        }
        if (expression.isStatement()) {
            log.debug("Redirections on an assignment-only command have no effect");
            return expression;
        }
        return expression.withCode(redirections.applyAll(expression.getCode(), pending));
    }

    /** {@code 2>&1}: the only descriptor duplication folded into the process options. */
    static boolean isMergeStderrIntoStdout(Redirection redirection) {
        return redirection.getOperator() == RedirectionOperator.DUP_OUTPUT
            && redirection.getFd() != null && redirection.getFd() == 2
            && redirection.getTargetFd() != null && redirection.getTargetFd() == 1;
    }
}
