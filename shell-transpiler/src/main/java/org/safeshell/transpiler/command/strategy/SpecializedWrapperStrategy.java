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

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import org.safeshell.transpiler.command.CommandAnalysis;
import org.safeshell.transpiler.command.CommandStrategy;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * Tools with a dedicated builder in the runtime: {@code git status} becomes
 * {@code $.git("status")}. For tmux, {@code send-keys -t T TEXT Enter} is first
 * matched as a text submission.
 */
@RequiredArgsConstructor
public class SpecializedWrapperStrategy implements CommandStrategy {

    private final CommandCatalog catalog;

    @Override
    public boolean applies(CommandAnalysis analysis) {
        String name = analysis.staticName();
        return name != null && catalog.getWrapper(name) != null && !analysis.hasAssignments();
    }

    @Override
    public Optional<CompiledExpression> build(CommandAnalysis analysis) {
        if ("tmux".equals(analysis.staticName())) {
            Optional<CompiledExpression> submit = tmuxSubmit(analysis.getArgs());
            if (submit.isPresent()) {
                return submit;
            }
        }
        StringJoiner call = new StringJoiner(", ", catalog.getWrapper(analysis.staticName()) + "(", ")");
        for (CompiledWord arg : analysis.getArgs()) {
            call.add(arg.toJs());
        }
        return Optional.of(CompiledExpression.async(call.toString()));
    }

    /**
     * {@code tmux send-keys -t TARGET [-c CLIENT] TEXT Enter|C-m}. The key name must
     * be the last argument and TEXT the only other operand.
     */
    Optional<CompiledExpression> tmuxSubmit(List<CompiledWord> args) {
        if (catalog.getTmuxSubmit() == null || args.size() < 5 || !isLiteral(args.get(0), "send-keys")) {
            return Optional.empty();
        }
        CompiledWord last = args.get(args.size() - 1);
        if (!isLiteral(last, "Enter") && !isLiteral(last, "C-m")) {
            return Optional.empty();
        }
        CompiledWord target = null;
        CompiledWord client = null;
        CompiledWord text = null;
        for (int i = 1; i < args.size() - 1; i++) {
            CompiledWord arg = args.get(i);
            if (isLiteral(arg, "-t") && target == null && i + 1 < args.size() - 1) {
                target = args.get(++i);
            } else if (isLiteral(arg, "-c") && client == null && i + 1 < args.size() - 1) {
                client = args.get(++i);
            } else if (text == null && !(arg.isStatic() && arg.literalValue().startsWith("-"))) {
                text = arg;
            } else {
                return Optional.empty();
            }
        }
        if (target == null || text == null) {
            return Optional.empty();
        }
        StringJoiner call = new StringJoiner(", ", catalog.getTmuxSubmit() + "(", ")");
        call.add(target.toJs()).add(text.toJs());
        if (client != null) {
            call.add(client.toJs());
        }
        return Optional.of(CompiledExpression.async(call.toString()));
    }

    private static boolean isLiteral(CompiledWord word, String value) {
        return word.isStatic() && value.equals(word.literalValue());
    }
}
