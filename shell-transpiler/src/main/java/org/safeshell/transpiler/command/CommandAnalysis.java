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

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * Everything the strategies need to know about a command, computed once before selection.
 */
@Getter
@Builder
public final class CommandAnalysis {

    private final Command command;

    private final CompiledWord name;

    private final List<CompiledWord> args;

    /** Compiled values of the command's environment assignments, in source order. */
    private final Map<String, String> env;

    /** Operand of a {@code |} chain, on either side. */
    private final boolean inPipeline;

    /** Reads the output of the previous {@code |} operand. */
    private final boolean pipeInput;

    /** Compiled for a command substitution; output must be captured, not printed. */
    private final boolean capture;

    /** The {@code 2>&1} redirection folded into a {@code mergeStreams} option, or null. */
    private final Redirection mergedStreams;

    /** Redirections still to apply after the strategy has built the call. */
    private final List<Redirection> redirects;

    public boolean hasAssignments() {
        return !command.getAssignments().isEmpty();
    }

    public boolean hasRedirects() {
        return !command.getRedirects().isEmpty();
    }

    public boolean hasName() {
        return !name.getSegments().isEmpty();
    }

    /** The command name when it is known at compile time, or null. */
    public String staticName() {
        return name.isStatic() ? name.literalValue() : null;
    }

    public boolean hasDynamicArgs() {
        for (CompiledWord arg : args) {
            if (!arg.isStatic()) {
                return true;
            }
        }
        return false;
    }

    /** Raw argument values; only valid when {@link #hasDynamicArgs()} is false. */
    public List<String> literalArgs() {
        return args.stream().map(CompiledWord::literalValue).collect(Collectors.toList());
    }
}
