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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.safeshell.transpiler.escape.EscapeUtils;

/**
 * A word split into literal text and interpolated host-language expressions.
 * Literal text stays raw until rendered, so it is escaped exactly once, for the
 * syntax it finally lands in.
 */
@EqualsAndHashCode
public final class CompiledWord {

    @Getter
    private final List<Segment> segments;

    private CompiledWord(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    public static CompiledWord literal(String text) {
        return new CompiledWord(text.isEmpty() ? List.of() : List.of(Segment.literal(text)));
    }

    public static CompiledWord of(List<Segment> segments) {
        List<Segment> merged = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.literal() && segment.text().isEmpty()) {
                continue;
            }
            int last = merged.size() - 1;
            if (segment.literal() && last >= 0 && merged.get(last).literal()) {
                merged.set(last, Segment.literal(merged.get(last).text() + segment.text()));
            } else {
                merged.add(segment);
            }
        }
        return new CompiledWord(merged);
    }

    /** True when the word has no interpolation and its value is known now. */
    public boolean isStatic() {
        for (Segment segment : segments) {
            if (!segment.literal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * The raw text of a static word.
     *
     * @throws IllegalStateException if the word is dynamic
     */
    public String literalValue() {
        if (!isStatic()) {
            throw new IllegalStateException("Word is not static: " + toJs());
        }
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            sb.append(segment.text());
        }
        return sb.toString();
    }

    /** A double-quoted string for static words, a template literal otherwise. */
    public String toJs() {
        return isStatic() ? toStringLiteral() : toTemplateLiteral();
    }

    public String toStringLiteral() {
        return "\"" + EscapeUtils.escapeForQuotes(literalValue()) + "\"";
    }

    public String toTemplateLiteral() {
        StringBuilder sb = new StringBuilder("`");
        for (Segment segment : segments) {
            if (segment.literal()) {
                sb.append(EscapeUtils.escapeForTemplate(segment.text()));
            } else {
                sb.append("${").append(segment.text()).append('}');
            }
        }
        return sb.append('`').toString();
    }

    @Override
    public String toString() {
        return toJs();
    }

    /**
     * Literal text, or a host-language expression when {@code literal} is false.
     */
    public record Segment(boolean literal, String text) {

        public static Segment literal(String text) {
            return new Segment(true, text);
        }

        public static Segment expression(String code) {
            return new Segment(false, code);
        }
    }
}
