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

package org.safeshell.transpiler.command.strategy;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.command.CommandAnalysis;
import org.safeshell.transpiler.command.CommandStrategy;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.escape.EscapeUtils;

/**
 * Text utilities with an in-process streaming equivalent: cat, grep, head, tail,
 * sort, uniq, wc and tee.
 *
 * <p>Only commands whose arguments are all known at compile time qualify, and
 * only without environment assignments or redirections. A flag the fluent API
 * has no equivalent for, or more than one file operand, declines so the command
 * runs as a process instead. A line transform without an upstream operand
 * declines too, since it would have nothing to read.
 */
@Slf4j
public class FluentCommandStrategy implements CommandStrategy {

    static final int DEFAULT_LINE_COUNT = 10;

    private static final Set<String> COMMANDS = ImmutableSet.of(
        "cat", "grep", "head", "tail", "sort", "uniq", "wc", "tee");

    private static final Map<Character, String> SORT_FLAGS = ImmutableMap.of(
        'n', "numeric", 'r', "reverse", 'u', "unique");

    private static final Map<Character, String> UNIQ_FLAGS = ImmutableMap.of(
        'c', "count", 'i', "ignoreCase");

    private static final Map<Character, String> WC_FLAGS = ImmutableMap.of(
        'l', "lines", 'w', "words", 'c', "bytes", 'm', "chars");

    @Override
    public boolean applies(CommandAnalysis analysis) {
        String name = analysis.staticName();
        return name != null && COMMANDS.contains(name)
            && !analysis.hasDynamicArgs()
            && !analysis.hasAssignments()
            && !analysis.hasRedirects();
    }

    @Override
    public Optional<CompiledExpression> build(CommandAnalysis analysis) {
        List<String> args = analysis.literalArgs();
        Optional<CompiledExpression> result;
        switch (analysis.staticName()) {
            case "cat":
                result = cat(args, analysis.isPipeInput());
                break;
            case "grep":
                result = grep(args);
                break;
            case "head":
            case "tail":
                result = headOrTail(analysis.staticName(), args);
                break;
            case "sort":
                result = flagged("sort", args, SORT_FLAGS);
                break;
            case "uniq":
                result = flagged("uniq", args, UNIQ_FLAGS);
                break;
            case "wc":
                result = flagged("wc", args, WC_FLAGS);
                break;
            case "tee":
                result = tee(args);
                break;
            default:
                result = Optional.empty();
        }
        if (result.isPresent() && result.get().isTransform() && !analysis.isPipeInput()) {
            return Optional.empty();
        }
        if (result.isEmpty()) {
            log.debug("{} {} has no fluent form, running it as a process", analysis.staticName(), args);
        }
        return result;
    }

    // ---- cat ----

    Optional<CompiledExpression> cat(List<String> args, boolean pipeInput) {
        if (args.isEmpty()) {
            // reading stdin is only meaningful without an upstream operand to replace it
            return pipeInput ? Optional.empty() : Optional.of(CompiledExpression.streamProducer("$.cat(\"-\")"));
        }
        StringJoiner call = new StringJoiner(", ", "$.cat(", ")");
        for (String arg : args) {
            if (isFlag(arg)) {
                return Optional.empty();
            }
            call.add(quote(arg));
        }
        return Optional.of(CompiledExpression.streamProducer(call.toString()));
    }

    // ---- grep ----

    Optional<CompiledExpression> grep(List<String> args) {
        boolean invert = false;
        boolean ignoreCase = false;
        boolean lineNumber = false;
        boolean optionsEnded = false;
        List<String> operands = new ArrayList<>();
        for (String arg : args) {
            if (!optionsEnded && "--".equals(arg)) {
                optionsEnded = true;
            } else if (!optionsEnded && isFlag(arg)) {
                if (arg.startsWith("--")) {
                    return Optional.empty();
                }
                for (char flag : arg.substring(1).toCharArray()) {
                    switch (flag) {
                        case 'v':
                            invert = true;
                            break;
                        case 'i':
                            ignoreCase = true;
                            break;
                        case 'n':
                            lineNumber = true;
                            break;
                        default:
                            // -r/-R and everything else need the real grep
                            return Optional.empty();
                    }
                }
            } else {
                operands.add(arg);
            }
        }
        if (operands.isEmpty() || operands.size() > 2) {
            return Optional.empty();
        }

        String regex = "/" + EscapeUtils.escapeForRegexLiteral(operands.get(0)) + "/" + (ignoreCase ? "i" : "");
        if (operands.size() == 1) {
            Map<String, Boolean> options = new LinkedHashMap<>();
            if (invert) {
                options.put("invert", true);
            }
            if (lineNumber) {
                options.put("lineNumber", true);
            }
            String call = options.isEmpty()
                ? "$.grep(" + regex + ")"
                : "$.grep(" + regex + ", " + object(options) + ")";
            return Optional.of(CompiledExpression.transform(call));
        }

        String source = "$.cat(" + quote(operands.get(1)) + ")";
        String code;
        if (!invert) {
            code = source + ".grep(" + regex + ")"
                + (lineNumber ? ".map(m => `${m.line}:${m.content}`)" : "");
        } else if (!lineNumber) {
            code = source + ".lines().filter(line => !" + regex + ".test(line))";
        } else {
            code = source + ".lines().map((line, i) => ({ line: i + 1, content: line }))"
                + ".filter(m => !" + regex + ".test(m.content))"
                + ".map(m => `${m.line}:${m.content}`)";
        }
        return Optional.of(lineStream(code));
    }

    // ---- head / tail ----

    Optional<CompiledExpression> headOrTail(String name, List<String> args) {
        Integer count = null;
        List<String> files = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-n".equals(arg)) {
                if (i + 1 >= args.size()) {
                    return Optional.empty();
                }
                String value = args.get(++i);
                if (count == null) {
                    count = parseCount(value);
                }
            } else if (arg.startsWith("-n")) {
                if (count == null) {
                    count = parseCount(arg.substring(2));
                }
            } else if (isFlag(arg)) {
                String digits = arg.substring(1);
                if (!isNumber(digits)) {
                    return Optional.empty();
                }
                if (count == null) {
                    count = Integer.parseInt(digits);
                }
            } else {
                files.add(arg);
            }
        }
        if (files.size() > 1) {
            return Optional.empty();
        }
        String transform = "$." + name + "(" + (count == null ? DEFAULT_LINE_COUNT : count) + ")";
        return Optional.of(withOptionalFile(transform, files));
    }

    // ---- sort / uniq / wc ----

    Optional<CompiledExpression> flagged(String name, List<String> args, Map<Character, String> table) {
        Map<String, Boolean> options = new LinkedHashMap<>();
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            if (!isFlag(arg)) {
                files.add(arg);
                continue;
            }
            if (arg.startsWith("--")) {
                return Optional.empty();
            }
            for (char flag : arg.substring(1).toCharArray()) {
                String option = table.get(flag);
                if (option == null) {
                    return Optional.empty();
                }
                options.put(option, true);
            }
        }
        if (files.size() > 1) {
            return Optional.empty();
        }
        String transform = "$." + name + "(" + (options.isEmpty() ? "" : object(options)) + ")";
        return Optional.of(withOptionalFile(transform, files));
    }

    // ---- tee ----

    Optional<CompiledExpression> tee(List<String> args) {
        boolean append = false;
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            if ("-a".equals(arg)) {
                append = true;
            } else if (isFlag(arg)) {
                return Optional.empty();
            } else {
                files.add(arg);
            }
        }
        if (files.size() > 1) {
            return Optional.empty();
        }
        String file = quote(files.isEmpty() ? "-" : files.get(0));
        return Optional.of(CompiledExpression.transform(
            "$.tee(" + file + (append ? ", { append: true }" : "") + ")"));
    }

    // ---- Helpers ----

    /** With a file operand, read it as lines and apply the transform; otherwise the bare transform. */
    private static CompiledExpression withOptionalFile(String transform, List<String> files) {
        if (files.isEmpty()) {
            return CompiledExpression.transform(transform);
        }
        return lineStream("$.cat(" + quote(files.get(0)) + ").lines().pipe(" + transform + ")");
    }

    private static CompiledExpression lineStream(String code) {
        return CompiledExpression.builder().code(code).async(true).streamProducer(true).lineStream(true).build();
    }

    private static Integer parseCount(String value) {
        return isNumber(value) ? Integer.valueOf(value) : DEFAULT_LINE_COUNT;
    }

    private static boolean isNumber(String value) {
        return !value.isEmpty() && value.length() < 10 && value.chars().allMatch(Character::isDigit);
    }

    private static boolean isFlag(String arg) {
        return arg.length() > 1 && arg.charAt(0) == '-';
    }

    private static String quote(String value) {
        return "\"" + EscapeUtils.escapeForQuotes(value) + "\"";
    }

    private static String object(Map<String, Boolean> options) {
        StringJoiner object = new StringJoiner(", ", "{ ", " }");
        options.forEach((key, value) -> object.add(key + ": " + value));
        return object.toString();
    }
}
