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

package org.safeshell.transpiler.command;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import org.safeshell.transpiler.escape.EscapeUtils;
import org.safeshell.transpiler.word.CompiledWord;

/**
 * Renders the generic process call {@code $.cmd([{ options }, ]name, args...)}.
 * Options appear only when set: {@code env}, then {@code timeout}, then
 * {@code mergeStreams}.
 */
public final class ProcessInvocation {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ProcessInvocation() {
    }

    public static String render(CommandAnalysis analysis, CompiledWord name, List<CompiledWord> args,
                                String timeoutMillis) {
        StringJoiner call = new StringJoiner(", ", "$.cmd(", ")");
        String options = options(analysis, timeoutMillis);
        if (options != null) {
            call.add(options);
        }
        call.add(name.getSegments().isEmpty() ? "\"true\"" : name.toJs());
        for (CompiledWord arg : args) {
            call.add(arg.toJs());
        }
        return call.toString();
    }

    private static String options(CommandAnalysis analysis, String timeoutMillis) {
        StringJoiner options = new StringJoiner(", ", "{ ", " }");
        options.setEmptyValue("");
        Map<String, String> env = analysis.getEnv();
        if (env != null && !env.isEmpty()) {
            StringJoiner entries = new StringJoiner(", ", "{ ", " }");
            env.forEach((key, value) -> entries.add(propertyKey(key) + ": " + value));
            options.add("env: " + entries);
        }
        if (timeoutMillis != null) {
            options.add("timeout: " + timeoutMillis);
        }
        if (analysis.getMergedStreams() != null) {
            options.add("mergeStreams: true");
        }
        String rendered = options.toString();
        return rendered.isEmpty() ? null : rendered;
    }

    static String propertyKey(String key) {
        return IDENTIFIER.matcher(key).matches() ? key : "\"" + EscapeUtils.escapeForQuotes(key) + "\"";
    }
}
