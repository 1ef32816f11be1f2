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

import java.util.List;
import lombok.Getter;
import org.safeshell.transpiler.command.CompiledExpression;

/**
 * The running value while a pipeline is folded.
 *
 * <ul>
 *   <li>{@link Kind#VALUE}: a command, call or composed expression. It is printable,
 *       async, a statement (not usable as an expression) or infallible.</li>
 *   <li>{@link Kind#STREAM}: a byte stream such as {@code $.cat("f")}.</li>
 *   <li>{@link Kind#LINE_STREAM}: a stream already split into lines.</li>
 *   <li>{@link Kind#PENDING}: a promise that resolves to a VALUE or STREAM and must be
 *       awaited before it can be piped or printed.</li>
 * </ul>
 */
@Getter
public final class PipelineValue {

    public enum Kind {
        VALUE,
        STREAM,
        LINE_STREAM,
        PENDING
    }

    private final Kind kind;
    private final String code;
    private final boolean printable;
    private final boolean async;
    private final boolean statement;
    private final boolean infallible;

    /** For {@link Kind#PENDING}: what the promise resolves to. */
    private final Kind resolvedKind;

    /** For statements: the form to use inside a nested block, or null if {@code code} serves. */
    private final String blockCode;

    /** For statements: names the block form leaves to the enclosing scope. */
    private final List<String> declarations;

    private PipelineValue(Kind kind, String code, boolean printable, boolean async, boolean statement,
                          boolean infallible, Kind resolvedKind) {
        this(kind, code, printable, async, statement, infallible, resolvedKind, null, List.of());
    }

    private PipelineValue(Kind kind, String code, boolean printable, boolean async, boolean statement,
                          boolean infallible, Kind resolvedKind, String blockCode, List<String> declarations) {
        this.kind = kind;
        this.code = code;
        this.printable = printable;
        this.async = async;
        this.statement = statement;
        this.infallible = infallible;
        this.resolvedKind = resolvedKind;
        this.blockCode = blockCode;
        this.declarations = List.copyOf(declarations);
    }

    public static PipelineValue of(CompiledExpression expression) {
        if (expression.isStatement()) {
            return new PipelineValue(Kind.VALUE, expression.getCode(), false, false, true,
                expression.isInfallible(), null, expression.getBlockCode(), expression.getDeclarations());
        }
        if (expression.isLineStream()) {
            return lineStream(expression.getCode());
        }
        if (expression.isStreamProducer()) {
            return stream(expression.getCode());
        }
        return value(expression.getCode(), expression.isPrintable(), expression.isAsync());
    }

    public static PipelineValue value(String code, boolean printable, boolean async) {
        return new PipelineValue(Kind.VALUE, code, printable, async, false, false, null);
    }

    public static PipelineValue statement(String code, boolean infallible) {
        return new PipelineValue(Kind.VALUE, code, false, false, true, infallible, null);
    }

    public static PipelineValue stream(String code) {
        return new PipelineValue(Kind.STREAM, code, true, true, false, false, null);
    }

    public static PipelineValue lineStream(String code) {
        return new PipelineValue(Kind.LINE_STREAM, code, true, true, false, false, null);
    }

    public static PipelineValue pending(String code, Kind resolvedKind, boolean printable) {
        return new PipelineValue(Kind.PENDING, code, printable, true, false, false, resolvedKind);
    }

    public boolean isPending() {
        return kind == Kind.PENDING;
    }

    /** A stream now, or once awaited. */
    public boolean isStream() {
        Kind effective = isPending() ? resolvedKind : kind;
        return effective == Kind.STREAM || effective == Kind.LINE_STREAM;
    }

    /** Await a pending value; anything else is returned unchanged. */
    public PipelineValue resolve() {
        if (!isPending()) {
            return this;
        }
        return new PipelineValue(resolvedKind, "(await " + code + ")", printable, false, false, false, null);
    }

    /** The expression to hand to a consumer that awaits it: pending values are awaited first. */
    public String operand() {
        return isPending() ? "await " + code : code;
    }

    /** The expression evaluated to completion. */
    public String awaited() {
        return isPending() || async ? "await " + code : code;
    }

    public PipelineValue withCode(String newCode) {
        return new PipelineValue(kind, newCode, printable, async, statement, infallible, resolvedKind,
            null, declarations);
    }

    @Override
    public String toString() {
        return kind + (isPending() ? "(" + resolvedKind + ")" : "") + ": " + code;
    }
}
