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
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.escape.EscapeUtils;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * A call to a shell function declared earlier in the program.
 */
@RequiredArgsConstructor
public class UserFunctionStrategy implements CommandStrategy {

    private final TranspilerContext context;

    @Override
    public boolean applies(CommandAnalysis analysis) {
        String name = analysis.staticName();
        return name != null && context.isFunction(name);
    }

    @Override
    public Optional<CompiledExpression> build(CommandAnalysis analysis) {
        StringJoiner call = new StringJoiner(", ",
            EscapeUtils.sanitizeFunctionName(analysis.staticName()) + "(", ")");
        for (CompiledWord arg : analysis.getArgs()) {
            call.add(arg.toJs());
        }
        return Optional.of(CompiledExpression.call(call.toString()));
    }
}
