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

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.safeshell.transpiler.command.CommandAnalysis;
import org.safeshell.transpiler.command.CommandStrategy;
import org.safeshell.transpiler.command.CompiledExpression;
import org.safeshell.transpiler.command.ProcessInvocation;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * {@code timeout DURATION CMD ARGS...} becomes the inner command with a
 * {@code timeout} option in milliseconds. Declines on option-style or dynamic
 * durations and on a missing inner command.
 */
public class TimeoutStrategy implements CommandStrategy {

    private static final Pattern DURATION = Pattern.compile("^(\\d+(?:\\.\\d+)?|\\.\\d+)([smhd]?)$");

    private static final BigDecimal SECOND = BigDecimal.valueOf(1000);
    private static final BigDecimal MINUTE = BigDecimal.valueOf(60_000);
    private static final BigDecimal HOUR = BigDecimal.valueOf(3_600_000);
    private static final BigDecimal DAY = BigDecimal.valueOf(86_400_000);

    @Override
    public boolean consumesMergedStreams() {
        return true;
    }

    @Override
    public boolean applies(CommandAnalysis analysis) {
        return "timeout".equals(analysis.staticName()) && analysis.getArgs().size() >= 2;
    }

    @Override
    public Optional<CompiledExpression> build(CommandAnalysis analysis) {
        CompiledWord duration = analysis.getArgs().get(0);
        if (!duration.isStatic()) {
            return Optional.empty();
        }
        Optional<String> millis = parseDurationMillis(duration.literalValue());
        if (millis.isEmpty()) {
            return Optional.empty();
        }
        List<CompiledWord> rest = analysis.getArgs().subList(1, analysis.getArgs().size());
        CompiledWord inner = rest.get(0);
        if (inner.getSegments().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CompiledExpression.async(
            ProcessInvocation.render(analysis, inner, rest.subList(1, rest.size()), millis.get())));
    }

    /**
     * Parse a coreutils duration ({@code 5}, {@code 1.5s}, {@code 5m}, {@code 2h},
     * {@code 1d}) into milliseconds, rendered without exponent or trailing zeros.
     */
    static Optional<String> parseDurationMillis(String text) {
        Matcher matcher = DURATION.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(matcher.group(1));
        BigDecimal unit;
        switch (matcher.group(2)) {
            case "m":
                unit = MINUTE;
                break;
            case "h":
                unit = HOUR;
                break;
            case "d":
                unit = DAY;
                break;
            default:
                unit = SECOND;
        }
        BigDecimal millis = value.multiply(unit).stripTrailingZeros();
        return Optional.of(millis.signum() == 0 ? "0" : millis.toPlainString());
    }
}
