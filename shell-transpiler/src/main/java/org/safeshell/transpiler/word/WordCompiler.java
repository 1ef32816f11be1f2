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

package org.safeshell.transpiler.word;

import java.util.ArrayList;
import java.util.List;
import org.safeshell.transpiler.ast.ArithmeticExpansion;
import org.safeshell.transpiler.ast.CommandSubstitution;
import org.safeshell.transpiler.ast.GlobPattern;
import org.safeshell.transpiler.ast.LiteralPart;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.ast.ProcessSubstitution;
import org.safeshell.transpiler.ast.Word;
import org.safeshell.transpiler.ast.WordPart;
import org.safeshell.transpiler.context.Severity;
import org.safeshell.transpiler.context.TranspilerContext;

/**
 * Turns {@link Word}s into {@link CompiledWord}s.
 */
public class WordCompiler {

    private final TranspilerContext context;
    private final ExpansionTranslator translator;
    private final SubstitutionCompiler substitutions;

    public WordCompiler(TranspilerContext context, ExpansionTranslator translator,
                        SubstitutionCompiler substitutions) {
        this.context = context;
        this.translator = translator;
        this.substitutions = substitutions;
    }

    public CompiledWord compile(Word word) {
        if (word.getParts().isEmpty()) {
            return CompiledWord.literal(word.getValue());
        }
        List<CompiledWord.Segment> segments = new ArrayList<>();
        for (WordPart part : word.getParts()) {
            appendPart(part, segments);
        }
        return CompiledWord.of(segments);
    }

    public List<CompiledWord> compileAll(List<Word> words) {
        List<CompiledWord> compiled = new ArrayList<>(words.size());
        for (Word word : words) {
            compiled.add(compile(word));
        }
        return compiled;
    }

    private void appendPart(WordPart part, List<CompiledWord.Segment> segments) {
        if (part instanceof LiteralPart) {
            segments.add(CompiledWord.Segment.literal(((LiteralPart) part).getValue()));
        } else if (part instanceof GlobPattern) {
            segments.add(CompiledWord.Segment.literal(((GlobPattern) part).getPattern()));
        } else if (part instanceof ParameterExpansion) {
            segments.add(CompiledWord.Segment.expression(
                translator.translateParameter((ParameterExpansion) part, context)));
        } else if (part instanceof ArithmeticExpansion) {
            segments.add(CompiledWord.Segment.expression(
                translator.translateArithmetic((ArithmeticExpansion) part, context)));
        } else if (part instanceof CommandSubstitution) {
            String inner = substitutions.compileCaptured(((CommandSubstitution) part).getBody());
            segments.add(CompiledWord.Segment.expression("(await $.capture(" + inner + "))"));
        } else if (part instanceof ProcessSubstitution) {
            segments.add(CompiledWord.Segment.expression(processSubstitution((ProcessSubstitution) part)));
        } else if (part instanceof Word) {
            segments.addAll(compile((Word) part).getSegments());
        } else {
            throw new IllegalStateException("Unsupported word part: " + part.getKind());
        }
    }

    private String processSubstitution(ProcessSubstitution substitution) {
        if ("<(".equals(substitution.getOperator())) {
            return "(await $.tempFileFrom(" + substitutions.compileCaptured(substitution.getBody()) + "))";
        }
        context.addDiagnostic(Severity.WARNING,
            "Output process substitution >(...) is not supported, using an empty temporary file");
        return "(await $.tempFile())";
    }
}
