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
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Generated code for one command or pipeline operand, plus the metadata that
 * composition decides on. Composition never inspects {@code code}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class CompiledExpression {

    private final String code;

    /**
     * The same statement without declaring keywords, for use inside a nested block.
     * Null when {@code code} is already usable there.
     */
    private final String blockCode;

    /** Names that must be declared in the enclosing scope before the block form runs. */
    @Builder.Default
    private final List<String> declarations = List.of();

    /** Evaluates to a promise or awaitable command. */
    private final boolean async;

    /** A call into a shell function defined in the same program, or a generated closure. */
    private final boolean userFunctionCall;

    /** A line transform that needs an upstream, e.g. {@code $.head(5)}. */
    private final boolean transform;

    /** Produces a byte stream without an upstream, e.g. {@code $.cat("f")}. */
    private final boolean streamProducer;

    /** Already produces a stream of lines. */
    private final boolean lineStream;

    /** A statement, not usable as an expression. */
    private final boolean statement;

    /** Cannot fail: assignments of values that run no command. */
    private final boolean infallible;

    public static CompiledExpression sync(String code) {
        return builder().code(code).build();
    }

    public static CompiledExpression async(String code) {
        return builder().code(code).async(true).build();
    }

    public static CompiledExpression transform(String code) {
        return builder().code(code).transform(true).build();
    }

    public static CompiledExpression streamProducer(String code) {
        return builder().code(code).async(true).streamProducer(true).build();
    }

    public static CompiledExpression assignment(String code) {
        return builder().code(code).statement(true).infallible(true).build();
    }

    /**
     * An assignment statement that declares {@code declarations} itself in {@code code}
     * and leaves them to the enclosing scope in {@code blockCode}.
     */
    public static CompiledExpression assignment(String code, String blockCode, List<String> declarations,
                                                boolean infallible) {
        return builder().code(code).blockCode(blockCode).declarations(List.copyOf(declarations))
            .statement(true).infallible(infallible).build();
    }

    /**
     * A generated async closure or user function call. Its output is surfaced inside the
     * callee, so the caller never prints its result.
     */
    public static CompiledExpression call(String code) {
        return builder().code(code).async(true).userFunctionCall(true).build();
    }

    public boolean isPrintable() {
        return async && !userFunctionCall;
    }

    public CompiledExpression withCode(String newCode) {
        return toBuilder().code(newCode).build();
    }
}
