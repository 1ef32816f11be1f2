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

import java.util.Optional;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import org.safeshell.transpiler.command.CommandAnalysis;
import org.safeshell.transpiler.command.CommandStrategy;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.config.BuiltinConfig;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * Builtins run in-process. They cannot take environment assignments or
 * redirections, and their output cannot be piped or captured, so any of those
 * sends the command to a later strategy.
 */
@RequiredArgsConstructor
public class BuiltinStrategy implements CommandStrategy {

    private final CommandCatalog catalog;

    @Override
    public boolean applies(CommandAnalysis analysis) {
        String name = analysis.staticName();
        return name != null && catalog.isBuiltin(name)
            && !analysis.hasAssignments()
            && !analysis.hasRedirects()
            && !analysis.isInPipeline()
            && !analysis.isCapture();
    }

    @Override
    public Optional<CompiledExpression> build(CommandAnalysis analysis) {
        BuiltinConfig builtin = catalog.getBuiltin(analysis.staticName());
        StringJoiner call = new StringJoiner(", ", builtin.fn() + "(", ")");
        for (CompiledWord arg : analysis.getArgs()) {
            call.add(arg.toJs());
        }
        switch (builtin.category()) {
            case OUTPUT:
                return Optional.of(CompiledExpression.sync("console.log(" + call + ".toString())"));
            case ASYNC:
                return Optional.of(CompiledExpression.async(call.toString()));
            case SILENT:
            case PRINTS:
            default:
                return Optional.of(CompiledExpression.sync(call.toString()));
        }
    }
}
