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

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EscapeUtilsTest {

    static Stream<String> samples() {
        return Stream.of(
            "",
            "plain",
            "with \"double\" and 'single' quotes",
            "back\\slash and trailing \\",
            "line\nbreak\r\ttab",
            "ctrl \u0001 and del \u007f",
            "separators \u2028 and \u2029",
            "template `tick` ${not} $HOME $",
            "unicode café 日本"
        );
    }

    @ParameterizedTest
    @MethodSource("samples")
    void doubleQuotedRoundTrips(String input) {
        assertEquals(input, unquote(EscapeUtils.escapeForQuotes(input), '"'));
    }

    @ParameterizedTest
    @MethodSource("samples")
    void singleQuotedRoundTrips(String input) {
        assertEquals(input, unquote(EscapeUtils.escapeForSingleQuotes(input), '\''));
    }

    @ParameterizedTest
    @MethodSource("samples")
    void templateRoundTripsWithoutInterpolation(String input) {
        String escaped = EscapeUtils.escapeForTemplate(input);
        assertFalse(hasUnescaped(escaped, "${"), "Should never leave an interpolation opener: " + escaped);
        assertFalse(hasUnescaped(escaped, "`"), "Should never leave a bare backtick: " + escaped);
        assertEquals(input, unquote(escaped, '`'));
    }

    @Test
    void escapesEveryDollarInTemplates() {
        assertEquals("\\$\\${x}", EscapeUtils.escapeForTemplate("$${x}"));
        assertEquals("a\\\\\\`b", EscapeUtils.escapeForTemplate("a\\`b"));
    }

    @Test
    void writesCarriageReturnsAsEscapesInTemplates() {
        assertEquals("a\\rb\\r\\nc", EscapeUtils.escapeForTemplate("a\rb\r\nc"));
        assertEquals("\\u0001\\t\\u007f", EscapeUtils.escapeForTemplate("\u0001\t\u007f"));
        assertFalse(EscapeUtils.escapeForTemplate("x\r\ny").contains("\r"), "Should leave no raw CR in a template");
    }

    @Test
    void escapesQuoteOnlyForItsOwnDelimiter() {
        assertEquals("it's \\\"x\\\"", EscapeUtils.escapeForQuotes("it's \"x\""));
        assertEquals("it\\'s \"x\"", EscapeUtils.escapeForSingleQuotes("it's \"x\""));
    }

    @Test
    void escapesRegexMetacharacters() {
        assertEquals("a\\.b\\*c\\/d\\[e\\]", EscapeUtils.escapeRegex("a.b*c/d[e]"));
        assertEquals("\\$\\{x\\}\\(\\)\\|\\?\\+\\^", EscapeUtils.escapeRegex("${x}()|?+^"));
        assertEquals("a\\nb", EscapeUtils.escapeRegex("a\nb"));
    }

    @Test
    void keepsRegexSyntaxInLiteralBodies() {
        assertEquals("^foo.*bar$", EscapeUtils.escapeForRegexLiteral("^foo.*bar$"));
        assertEquals("a\\/b", EscapeUtils.escapeForRegexLiteral("a/b"));
        assertEquals("a\\/b", EscapeUtils.escapeForRegexLiteral("a\\/b"));
        assertEquals("[/]x\\/", EscapeUtils.escapeForRegexLiteral("[/]x/"));
    }

    @Test
    void treatsUnclosedBracketAsLiteral() {
        assertEquals("\\[\\/", EscapeUtils.escapeForRegexLiteral("[/"));
        assertEquals("a\\[b\\/c\\/", EscapeUtils.escapeForRegexLiteral("a[b/c/"));
        assertEquals("[\\]/]\\/", EscapeUtils.escapeForRegexLiteral("[\\]/]/"));
    }

    @Test
    void neutralizesLiteralTerminators() {
        assertEquals("(?:)", EscapeUtils.escapeForRegexLiteral(""));
        assertEquals("abc\\\\", EscapeUtils.escapeForRegexLiteral("abc\\"));
        assertEquals("a\\nb", EscapeUtils.escapeForRegexLiteral("a\nb"));
        assertEquals("a\\\\\\nb", EscapeUtils.escapeForRegexLiteral("a\\\nb"));
    }

    @Test
    void prefixesReservedWords() {
        assertEquals("__class", EscapeUtils.sanitizeVarName("class"));
        assertEquals("__await", EscapeUtils.sanitizeVarName("await"));
        assertEquals("PATH", EscapeUtils.sanitizeVarName("PATH"));
        assertTrue(EscapeUtils.isReservedWord("let"));
        assertFalse(EscapeUtils.isReservedWord("value"));
    }

    @Test
    void sanitizesFunctionNames() {
        assertEquals("my_func", EscapeUtils.sanitizeFunctionName("my-func"));
        assertEquals("lib_util_run", EscapeUtils.sanitizeFunctionName("lib.util:run"));
        assertEquals("_lives", EscapeUtils.sanitizeFunctionName("9lives"));
        assertEquals("__delete", EscapeUtils.sanitizeFunctionName("delete"));
    }

    /**
     * Decodes the escape sequences the host language accepts inside a quoted literal.
     * Inside a template literal a raw CR or CRLF reads as LF.
     */
    private static String unquote(String body, char quote) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == quote) {
                throw new IllegalArgumentException("Unescaped delimiter at " + i + " in " + body);
            }
            if (quote == '`' && c == '\r') {
                sb.append('\n');
                if (i + 1 < body.length() && body.charAt(i + 1) == '\n') {
                    i++;
                }
                continue;
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'u':
                    sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                    i += 4;
                    break;
                default:
                    sb.append(next);
            }
        }
        return sb.toString();
    }

    private static boolean hasUnescaped(String body, String token) {
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '\\') {
                i++;
            } else if (body.startsWith(token, i)) {
                return true;
            }
        }
        return false;
    }
}
