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

import java.math.BigInteger;
import java.util.regex.Pattern;
import org.safeshell.transpiler.ast.ArithmeticExpansion;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.context.Severity;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.escape.EscapeUtils;

/**
 * Default expansion translation: plain names, special parameters, array
 * subscripts and the defaulting modifiers. Other modifiers fall back to the plain
 * value with a warning.
 */
public class BasicExpansionTranslator implements ExpansionTranslator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern POSITIONAL = Pattern.compile("[1-9][0-9]*");

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private static final Pattern OCTAL = Pattern.compile("0[0-7]+");

    /** Operator characters that may pass through into an arithmetic expression. */
    private static final String ARITHMETIC_OPERATORS = "+-*/%()<>=!&|^~?:,";

    @Override
    public String translateParameter(ParameterExpansion expansion, TranspilerContext context) {
        String base = reference(expansion.getParameter(), context);
        if (base == null) {
            context.addDiagnostic(Severity.WARNING,
                "Unsupported parameter name: " + expansion.getParameter());
            return "\"\"";
        }
        if (expansion.getSubscript() != null) {
            base = subscript(base, expansion.getSubscript(), context);
        }
        String modifier = expansion.getModifier();
        if (modifier == null) {
            return base;
        }
        String arg = expansion.getModifierArg() == null
            ? "\"\""
            : "\"" + EscapeUtils.escapeForQuotes(expansion.getModifierArg().getValue()) + "\"";
        switch (modifier) {
            case "length":
                return "String(" + base + " ?? \"\").length";
            case ":-":
                return "(" + base + " || " + arg + ")";
            case "-":
                return "(" + base + " ?? " + arg + ")";
            case ":+":
                return "(" + base + " ? " + arg + " : \"\")";
            default:
                context.addDiagnostic(Severity.WARNING,
                    "Unsupported parameter modifier '" + modifier + "' on " + expansion.getParameter()
                        + ", using the plain value");
                return base;
        }
    }

    @Override
    public String translateArithmetic(ArithmeticExpansion expansion, TranspilerContext context) {
        String expression = arithmetic(expansion.getExpression(), context);
        if (expression == null) {
            context.addDiagnostic(Severity.WARNING,
                "Unsupported arithmetic expression: " + expansion.getExpression());
            return "0";
        }
        return "(" + expression + ")";
    }

    /**
     * Rebuild an arithmetic expression token by token. Numbers and operators pass
     * through; names become numeric reads of a binding or the environment. Returns
     * null for anything else, including calls, assignments and increments.
     */
    private static String arithmetic(String expression, TranspilerContext context) {
        StringBuilder sb = new StringBuilder(expression.length() + 16);
        int depth = 0;
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                sb.append(' ');
                i++;
            } else if (isAsciiDigit(c)) {
                int end = i;
                while (end < expression.length() && isWordChar(expression.charAt(end))) {
                    end++;
                }
                String number = number(expression.substring(i, end));
                if (number == null) {
                    return null;
                }
                sb.append(number);
                i = end;
            } else if (c == '$' || isIdentifierStart(c)) {
                int start = c == '$' ? i + 1 : i;
                int end = start;
                while (end < expression.length() && isWordChar(expression.charAt(end))) {
                    end++;
                }
                String name = expression.substring(start, end);
                String operand;
                if (POSITIONAL.matcher(name).matches() && c == '$') {
                    operand = "Number(" + positional(name) + " ?? 0)";
                } else if (IDENTIFIER.matcher(name).matches() && !followedByCall(expression, end)) {
                    operand = context.isDeclared(name)
                        ? "Number(" + EscapeUtils.sanitizeVarName(name) + ")"
                        : "Number($.ENV." + name + " ?? 0)";
                } else {
                    return null;
                }
                sb.append(operand);
                i = end;
            } else if (ARITHMETIC_OPERATORS.indexOf(c) >= 0) {
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth < 0) {
                    return null;
                }
                sb.append(c);
                i++;
            } else {
                return null;
            }
        }
        String result = sb.toString().trim();
        if (depth != 0 || result.isEmpty() || result.contains("++") || result.contains("--")
            || hasAssignment(result)) {
            return null;
        }
        return result;
    }

    /** Decimal form of a shell integer literal; leading-zero octal and hex are converted. */
    private static String number(String literal) {
        if (HEX.matcher(literal).matches()) {
            return new BigInteger(literal.substring(2), 16).toString();
        }
        if (OCTAL.matcher(literal).matches()) {
            return new BigInteger(literal.substring(1), 8).toString();
        }
        if (DIGITS.matcher(literal).matches() && (literal.length() == 1 || literal.charAt(0) != '0')) {
            return literal;
        }
        return null;
    }

    private static boolean followedByCall(String expression, int from) {
        int i = from;
        while (i < expression.length() && Character.isWhitespace(expression.charAt(i))) {
            i++;
        }
        return i < expression.length() && expression.charAt(i) == '(';
    }

    /** An {@code =} that is not part of {@code ==}, {@code !=}, {@code <=} or {@code >=}. */
    private static boolean hasAssignment(String expression) {
        for (int i = 0; i < expression.length(); i++) {
            if (expression.charAt(i) != '=') {
                continue;
            }
            if (i + 1 < expression.length() && expression.charAt(i + 1) == '=') {
                i++;
                while (i + 1 < expression.length() && expression.charAt(i + 1) == '=') {
                    i++;
                }
                continue;
            }
            char previous = i > 0 ? expression.charAt(i - 1) : ' ';
            boolean shift = i > 1 && expression.charAt(i - 2) == previous;
            if ((previous == '!' || previous == '<' || previous == '>') && !shift) {
                continue;
            }
            return true;
        }
        return false;
    }

    private static String positional(String digits) {
        return "$.args[" + new BigInteger(digits).subtract(BigInteger.ONE) + "]";
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isWordChar(char c) {
        return isIdentifierStart(c) || isAsciiDigit(c);
    }

    private static String reference(String parameter, TranspilerContext context) {
        switch (parameter) {
            case "?":
                return "__ctx.lastExitCode";
            case "!":
                return "__ctx.lastBackgroundPid";
            case "$":
                return "$.pid";
            case "#":
                return "$.args.length";
            case "@":
            case "*":
                return "$.args.join(\" \")";
            case "0":
                return "$.scriptName";
            default:
                break;
        }
        if (POSITIONAL.matcher(parameter).matches()) {
            return positional(parameter);
        }
        if (!IDENTIFIER.matcher(parameter).matches()) {
            return null;
        }
        if (context.isDeclared(parameter)) {
            return EscapeUtils.sanitizeVarName(parameter);
        }
        return "$.ENV." + parameter;
    }

    private static String subscript(String base, String subscript, TranspilerContext context) {
        if ("@".equals(subscript) || "*".equals(subscript)) {
            return base + ".join(\" \")";
        }
        if (DIGITS.matcher(subscript).matches()) {
            return base + "[" + new BigInteger(subscript) + "]";
        }
        if (IDENTIFIER.matcher(subscript).matches()) {
            String index = context.isDeclared(subscript) ? EscapeUtils.sanitizeVarName(subscript) : "0";
            return base + "[" + index + "]";
        }
        context.addDiagnostic(Severity.WARNING, "Unsupported array subscript: " + subscript);
        return base;
    }
}
