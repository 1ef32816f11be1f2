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

package org.safeshell.transpiler.escape;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Escaping for every literal destination in generated code: double-quoted and
 * single-quoted strings, template literals and regex literals.
 *
 * <p>All functions are total. Each one is an exact inverse of the host language's
 * parsing of its destination syntax, so {@code unquote(escape(s)) == s}.
 * Escaping is not idempotent: escaping an already escaped string escapes it again.
 */
public final class EscapeUtils {

    /** Host-language reserved words that may not be used as binding names. */
    private static final Set<String> RESERVED_WORDS = ImmutableSet.of(
        "break", "case", "catch", "continue", "debugger", "default", "delete",
        "do", "else", "finally", "for", "function", "if", "in", "instanceof",
        "new", "return", "switch", "this", "throw", "try", "typeof", "var",
        "void", "while", "with",
        "class", "const", "enum", "export", "extends", "import", "super",
        "implements", "interface", "let", "package", "private", "protected",
        "public", "static", "yield",
        "await", "async"
    );

    private static final String REGEX_METACHARACTERS = ".*+?^${}()|[]\\/";

    private EscapeUtils() {
    }

    /**
     * Escape for the inside of a double-quoted string literal.
     */
    public static String escapeForQuotes(String s) {
        return escapeQuoted(s, '"');
    }

    /**
     * Escape for the inside of a single-quoted string literal.
     */
    public static String escapeForSingleQuotes(String s) {
        return escapeQuoted(s, '\'');
    }

    /**
     * Escape for the inside of a template literal. Backslash, backtick and every
     * {@code $} are escaped in one pass, so no {@code ${} can start an interpolation.
     * Control characters are written as escapes since a template literal normalizes
     * raw CR and CRLF to LF.
     */
    public static String escapeForTemplate(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '`':
                    sb.append("\\`");
                    break;
                case '$':
                    sb.append("\\$");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f || c == 0x2028 || c == 0x2029) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    /**
     * Escape arbitrary text so a regex literal matches it literally.
     */
    public static String escapeRegex(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\').append(c);
            } else {
                appendRegexChar(sb, c);
            }
        }
        return sb.toString();
    }

    /**
     * Prepare a user-supplied pattern for the body of a {@code /.../} literal. Regex
     * syntax is kept; an unescaped {@code /} and line terminators, which would end
     * the literal, are neutralized. A {@code [} that never closes is taken as a
     * literal bracket. An empty pattern becomes {@code (?:)} since {@code //} is a
     * comment.
     */
    public static String escapeForRegexLiteral(String pattern) {
        if (pattern.isEmpty()) {
            return "(?:)";
        }
        StringBuilder sb = new StringBuilder(pattern.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                if (i + 1 < pattern.length() && !isLineTerminator(pattern.charAt(i + 1))) {
                    sb.append(c).append(pattern.charAt(++i));
                } else {
                    // a trailing backslash would escape the closing delimiter
                    sb.append("\\\\");
                }
                continue;
            }
            if (c == '[' && !inClass) {
                if (closesClass(pattern, i + 1)) {
                    inClass = true;
                    sb.append(c);
                } else {
                    sb.append("\\[");
                }
                continue;
            }
            if (c == ']') {
                inClass = false;
            }
            if (c == '/' && !inClass) {
                sb.append("\\/");
            } else {
                appendRegexChar(sb, c);
            }
        }
        return sb.toString();
    }

    /**
     * Turn a shell variable name into a legal binding name.
     */
    public static String sanitizeVarName(String name) {
        return RESERVED_WORDS.contains(name) ? "__" + name : name;
    }

    /**
     * Turn a shell function name, which may contain {@code -}, {@code .} or
     * {@code :}, into a legal binding name.
     */
    public static String sanitizeFunctionName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean legal = c == '_' || c == '$' || Character.isLetter(c) || (i > 0 && Character.isDigit(c));
            sb.append(legal ? c : '_');
        }
        return sanitizeVarName(sb.toString());
    }

    public static boolean isReservedWord(String name) {
        return RESERVED_WORDS.contains(name);
    }

    private static String escapeQuoted(String s, char quote) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x7f || c == 0x2028 || c == 0x2029) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static void appendRegexChar(StringBuilder sb, char c) {
        if (c == '\n') {
            sb.append("\\n");
        } else if (c == '\r') {
            sb.append("\\r");
        } else if (c == 0x2028 || c == 0x2029) {
            sb.append(String.format("\\u%04x", (int) c));
        } else {
            sb.append(c);
        }
    }

    /**
     * Whether a character class opened just before {@code from} has a closing {@code ]}.
     */
    private static boolean closesClass(String pattern, int from) {
        for (int i = from; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == ']') {
                return true;
            }
        }
        return false;
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == 0x2028 || c == 0x2029;
    }
}
