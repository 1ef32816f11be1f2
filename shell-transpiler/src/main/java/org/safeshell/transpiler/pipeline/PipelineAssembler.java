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

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.PipelineOperator;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.context.Severity;
import org.safeshell.transpiler.context.TranspilerContext;

/**
 * Second phase of pipeline compilation: fold a {@link FlatPipeline} left to right
 * into prelude statements plus one {@link PipelineValue}, then render that as
 * statements, as an expression or as a detached background job.
 *
 * <p>Surfacing rule: a printable left operand has its output printed through
 * {@code __printCmd} before the right operand runs, so output is never lost when
 * the left operand is folded into a larger expression.
 */
@Slf4j
public class PipelineAssembler {

    /** Result record of a command that succeeded with no output. */
    public static final String SUCCESS = "{ code: 0, stdout: '', stderr: '', success: true }";

    private final TranspilerContext context;

    public PipelineAssembler(TranspilerContext context) {
        this.context = context;
    }

    public AssembledPipeline assemble(FlatPipeline flat, boolean negated) {
        List<StatementFragment> prelude = new ArrayList<>();
        List<PipelinePart> parts = flat.parts();
        List<PipelineOperator> operators = flat.operators();

        PipelineValue current = PipelineValue.of(take(prelude, parts.get(0)));
        for (int i = 1; i < parts.size(); i++) {
            PipelineOperator operator = operators.get(i - 1);
            PipelinePart part = parts.get(i);
            switch (operator) {
                case AND:
                    current = and(prelude, current, part, pipeFollows(operators, i));
                    break;
                case OR:
                    current = or(prelude, current, part);
                    break;
                case PIPE:
                    current = pipe(prelude, current, part);
                    break;
                case SEQUENCE:
                    current = sequence(prelude, current, part, pipeFollows(operators, i));
                    break;
                default:
                    throw new IllegalStateException("Unexpected operator between pipeline operands: " + operator);
            }
        }
        if (negated) {
            current = negate(current);
        }
        return new AssembledPipeline(prelude, current);
    }

    /**
     * Whether a {@code |} comes after operand {@code index} before the next
     * {@code &&}, {@code ||} or {@code ;}.
     */
    static boolean pipeFollows(List<PipelineOperator> operators, int index) {
        for (int j = index; j < operators.size(); j++) {
            PipelineOperator operator = operators.get(j);
            if (operator == PipelineOperator.PIPE) {
                return true;
            }
            if (operator != PipelineOperator.NONE) {
                return false;
            }
        }
        return false;
    }

    /**
     * Compile the next operand. An expression whose code assigns names inside a closure
     * has their declarations hoisted ahead of it.
     */
    private static CompiledExpression take(List<StatementFragment> prelude, PipelinePart part) {
        CompiledExpression expression = part.expression();
        if (!expression.isStatement() && !expression.getDeclarations().isEmpty()) {
            prelude.add(StatementFragment.declaration(expression.getDeclarations()));
        }
        return expression;
    }

    /** Use {@code fragment} inside a nested block: its declarations move to the prelude. */
    private static String inBlock(List<StatementFragment> prelude, StatementFragment fragment) {
        if (!fragment.declarations().isEmpty()) {
            prelude.add(StatementFragment.declaration(fragment.declarations()));
        }
        return fragment.inBlock();
    }

    // ---- Operators ----

    private PipelineValue and(List<StatementFragment> prelude, PipelineValue left, PipelinePart part,
                              boolean pipeFollows) {
        CompiledExpression right = take(prelude, part);
        if (left.isStatement() || right.isStatement() || left.isStream()
            || (!left.isPrintable() && !right.isPrintable())) {
            prelude.add(fragment(left));
            return PipelineValue.of(right);
        }
        return chain(left, right, pipeFollows);
    }

    /**
     * The right side runs only when the left one fails, so both end up inside a
     * {@code try}/{@code catch}. An assignment that runs no command cannot fail,
     * which makes the right side unreachable.
     */
    private PipelineValue or(List<StatementFragment> prelude, PipelineValue left, PipelinePart part) {
        if (left.isInfallible()) {
            context.addDiagnostic(Severity.INFO,
                "Command after '||' can never run because the left side is an assignment; it was dropped");
            return left;
        }
        CompiledExpression right = take(prelude, part);
        String attempt = inBlock(prelude, fragment(left));
        if (!left.isPrintable() && !right.isPrintable()) {
            String recovery = inBlock(prelude, fragment(PipelineValue.of(right)));
            return PipelineValue.statement("try { " + attempt + " } catch { " + recovery + " }", false);
        }
        String fallback = right.isStatement()
            ? inBlock(prelude, fragment(PipelineValue.of(right))) + " return " + SUCCESS + ";"
            : "return " + right.getCode() + ";";
        String code = "(async () => { try { " + attempt + " return " + SUCCESS + "; } catch { " + fallback + " } })()";
        return PipelineValue.pending(code, PipelineValue.Kind.VALUE, right.isPrintable());
    }

    private PipelineValue pipe(List<StatementFragment> prelude, PipelineValue left, PipelinePart part) {
        CompiledExpression right = take(prelude, part);
        PipelineValue source = left.resolve();
        if (source.isStatement()) {
            prelude.add(fragment(source));
            return PipelineValue.of(right);
        }
        if (right.isTransform()) {
            String code;
            switch (source.getKind()) {
                case STREAM:
                    code = source.getCode() + ".lines().pipe(" + right.getCode() + ")";
                    break;
                case LINE_STREAM:
                    code = source.getCode() + ".pipe(" + right.getCode() + ")";
                    break;
                default:
                    code = source.getCode() + ".stdout().lines().pipe(" + right.getCode() + ")";
            }
            return PipelineValue.lineStream(code);
        }
        if (right.isStreamProducer()) {
            String code = source.getCode() + ".pipe(" + right.getCode() + ")";
            return right.isLineStream() ? PipelineValue.lineStream(code) : PipelineValue.stream(code);
        }
        String code = source.isStream()
            ? source.getCode() + ".pipe($.toCmdLines(" + right.getCode() + "))"
            : source.getCode() + ".pipe(" + right.getCode() + ")";
        return PipelineValue.value(code, true, true);
    }

    private PipelineValue sequence(List<StatementFragment> prelude, PipelineValue left, PipelinePart part,
                                   boolean pipeFollows) {
        CompiledExpression right = take(prelude, part);
        if (left.isStatement() || right.isStatement() || left.isStream()
            || (!left.isPrintable() && !right.isPrintable())) {
            prelude.add(fragment(left));
            return PipelineValue.of(right);
        }
        return chain(left, right, pipeFollows);
    }

    /**
     * Run {@code left}, surfacing its output when printable, then evaluate to {@code right}.
     * Ahead of a {@code |} this is a comma expression so the pipe receives the
     * command itself rather than the awaited result.
     */
    private PipelineValue chain(PipelineValue left, CompiledExpression right, boolean pipeFollows) {
        String run = left.isPrintable() ? "await __printCmd(" + left.operand() + ")" : left.awaited();
        if (pipeFollows) {
            return PipelineValue.of(right.withCode("(" + run + ", " + right.getCode() + ")"));
        }
        String code = "(async () => { " + run + "; return " + right.getCode() + "; })()";
        PipelineValue.Kind resolved = right.isLineStream()
            ? PipelineValue.Kind.LINE_STREAM
            : right.isStreamProducer() ? PipelineValue.Kind.STREAM : PipelineValue.Kind.VALUE;
        return PipelineValue.pending(code, resolved, right.isPrintable() || right.isStreamProducer());
    }

    private PipelineValue negate(PipelineValue value) {
        if (value.isStatement() || value.isStream()) {
            context.addDiagnostic(Severity.WARNING, "Negation ignored: the pipeline does not produce an exit status");
            return value;
        }
        PipelineValue resolved = value.resolve();
        return PipelineValue.value(resolved.getCode() + ".negate()", true, true);
    }

    // ---- Emission ----

    /** The pipeline as statements, printing whatever the final value produces. */
    public List<String> toStatements(AssembledPipeline assembled) {
        List<String> lines = new ArrayList<>();
        for (StatementFragment fragment : assembled.prelude()) {
            lines.addAll(fragment.topLevel());
        }
        lines.addAll(fragment(assembled.value()).topLevel());
        return lines;
    }

    /**
     * The pipeline as one expression. A non-empty prelude is folded into an async
     * closure. A self-contained closure keeps its declarations to itself, as a
     * subshell does; otherwise names it assigns are returned as declarations for the
     * enclosing scope.
     */
    public StatementFragment toExpression(AssembledPipeline assembled, boolean selfContained) {
        PipelineValue value = assembled.value();
        List<String> body = new ArrayList<>();
        List<String> declarations = new ArrayList<>();
        for (StatementFragment fragment : assembled.prelude()) {
            collect(fragment, selfContained, body, declarations);
        }
        if (value.isStatement()) {
            collect(fragment(value), selfContained, body, declarations);
            body.add("return " + SUCCESS + ";");
        } else if (body.isEmpty()) {
            return new StatementFragment(value.getCode(), null, declarations);
        } else {
            body.add("return " + value.getCode() + ";");
        }
        return new StatementFragment("(async () => { " + String.join(" ", body) + " })()", null, declarations);
    }

    private static void collect(StatementFragment fragment, boolean selfContained, List<String> body,
                                List<String> declarations) {
        if (selfContained) {
            body.addAll(fragment.topLevel());
            return;
        }
        if (fragment.inBlock() != null) {
            body.add(fragment.inBlock());
        }
        declarations.addAll(fragment.declarations());
    }

    /**
     * The pipeline as a detached job. A process value is spawned in the background and
     * its pid recorded on the execution context; anything else just runs unawaited.
     */
    public String toBackground(AssembledPipeline assembled) {
        PipelineValue value = assembled.value();
        StringBuilder sb = new StringBuilder("(async () => { ");
        for (StatementFragment fragment : assembled.prelude()) {
            for (String line : fragment.topLevel()) {
                sb.append(line).append(' ');
            }
        }
        if (!value.isStatement() && !value.isStream() && (value.isPending() || value.isPrintable())) {
            String job = context.getTempVar("__bg");
            sb.append("const ").append(job).append(" = ").append(value.operand()).append("; ")
                .append("__ctx.lastBackgroundPid = ").append(job).append(".spawnBackground().pid;");
        } else {
            sb.append(String.join(" ", fragment(value).topLevel()));
        }
        return sb.append(" })(); // background").toString();
    }

    /** {@link #statement} in both scope forms. */
    StatementFragment fragment(PipelineValue value) {
        if (value.isStatement()) {
            String blockCode = value.getBlockCode() == null ? null : terminate(value.getBlockCode());
            return new StatementFragment(terminate(value.getCode()), blockCode, value.getDeclarations());
        }
        return StatementFragment.of(statement(value));
    }

    /** One statement that runs {@code value} to completion and prints what it produces. */
    String statement(PipelineValue value) {
        if (value.isStatement()) {
            return terminate(value.getCode());
        }
        if (value.isStream()) {
            String source = value.isPending() ? "(await " + value.getCode() + ")" : value.getCode();
            PipelineValue.Kind kind = value.isPending() ? value.getResolvedKind() : value.getKind();
            String lines = kind == PipelineValue.Kind.STREAM ? source + ".lines()" : source;
            String line = context.getTempVar("__line");
            return "for await (const " + line + " of " + lines + ") { console.log(" + line + "); }";
        }
        if (!value.isPrintable()) {
            return value.awaited() + ";";
        }
        return "await __printCmd(" + value.operand() + ");";
    }

    private static String terminate(String code) {
        return code.endsWith("}") || code.endsWith(";") ? code : code + ";";
    }
}
