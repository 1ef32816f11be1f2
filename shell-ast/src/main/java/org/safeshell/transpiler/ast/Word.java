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

package org.safeshell.transpiler.ast;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A shell word. {@code value} is the source text; {@code parts} carries the
 * literal and expansion pieces the word is made of. A word without parts is
 * treated as the literal {@code value}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Word implements WordPart, AssignmentValue {

    private final String value;
    private final boolean quoted;
    private final boolean singleQuoted;
    private final List<WordPart> parts;

    public Word(String value, boolean quoted, boolean singleQuoted, List<WordPart> parts) {
        this.value = value == null ? "" : value;
        this.quoted = quoted;
        this.singleQuoted = singleQuoted;
        this.parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static Word literal(String value) {
        return new Word(value, false, false, List.of(new LiteralPart(value)));
    }

    public static Word of(WordPart... parts) {
        StringBuilder text = new StringBuilder();
        for (WordPart part : parts) {
            if (part instanceof LiteralPart) {
                text.append(((LiteralPart) part).getValue());
            } else if (part instanceof ParameterExpansion) {
                text.append("${").append(((ParameterExpansion) part).getParameter()).append('}');
            }
        }
        return new Word(text.toString(), false, false, List.of(parts));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WORD;
    }
}
