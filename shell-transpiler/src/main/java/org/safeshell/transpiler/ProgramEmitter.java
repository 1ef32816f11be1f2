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

package org.safeshell.transpiler;

import java.util.List;
import org.safeshell.transpiler.context.TranspilerOptions;

/**
 * Wraps compiled statements into a runnable program: strict-mode directive, the
 * runtime import and an async entry point that creates the per-run execution context.
 */
public class ProgramEmitter {

    /** Lines opening the entry point body, emitted one level deep. */
    static final List<String> PROLOGUE = List.of(
        "const __ctx = $.createExecutionContext();",
        "const __printCmd = $.printCmd;"
    );

    public String emit(List<String> body, TranspilerOptions options) {
        StringBuilder sb = new StringBuilder();
        if (options.isStrict()) {
            sb.append("\"use strict\";\n");
        }
        if (options.isImports()) {
            sb.append("import { $ } from \"").append(options.getImportPath()).append("\";\n");
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append("(async () => {\n");
        for (String line : PROLOGUE) {
            sb.append(options.getIndent()).append(line).append('\n');
        }
        for (String line : body) {
            sb.append(line).append('\n');
        }
        sb.append("})();\n");
        return sb.toString();
    }
}
