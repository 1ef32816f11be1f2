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

package org.safeshell.transpiler.pipeline;

import java.util.function.Supplier;
import org.safeshell.transpiler.command.CompiledExpression;

/**
 * One operand of a flattened pipeline. The operand is compiled on first use, so
 * an operand the fold proves unreachable is never compiled and leaves no trace
 * in the scope or temp-variable numbering.
 */
public final class PipelinePart {

    private final Supplier<CompiledExpression> compiler;

    private CompiledExpression compiled;

    public PipelinePart(Supplier<CompiledExpression> compiler) {
        this.compiler = compiler;
    }

    public static PipelinePart of(CompiledExpression expression) {
        PipelinePart part = new PipelinePart(() -> expression);
        part.compiled = expression;
        return part;
    }

    public CompiledExpression expression() {
        if (compiled == null) {
            compiled = compiler.get();
        }
        return compiled;
    }

    public boolean isPrintable() {
        return expression().isPrintable();
    }

    public boolean isCompiled() {
        return compiled != null;
    }
}
