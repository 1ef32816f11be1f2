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

package org.safeshell.transpiler.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * One rendered statement of a pipeline, in the two forms its position can need.
 *
 * <p>{@code code} runs in the statement's own scope and declares what it assigns.
 * {@code blockCode}, when present, runs inside a nested block and leaves
 * {@code declarations} to the enclosing scope. A fragment without code only
 * carries declarations.
 *
 * @param code         form for the statement's own scope, or null
 * @param blockCode    form for a nested block, or null if {@code code} serves there too
 * @param declarations names the block form needs declared outside the block
 */
public record StatementFragment(String code, String blockCode, List<String> declarations) {

    public StatementFragment {
        declarations = List.copyOf(declarations);
    }

    public static StatementFragment of(String code) {
        return new StatementFragment(code, null, List.of());
    }

    public static StatementFragment declaration(List<String> names) {
        return new StatementFragment(null, null, names);
    }

    /** {@code let a, b;} */
    public static String declare(List<String> names) {
        return "let " + String.join(", ", names) + ";";
    }

    /** Lines for the statement's own scope. */
    public List<String> topLevel() {
        List<String> lines = new ArrayList<>(2);
        if (blockCode == null && !declarations.isEmpty()) {
            lines.add(declare(declarations));
        }
        if (code != null) {
            lines.add(code);
        }
        return lines;
    }

    /** The form for a nested block, or null for a pure declaration. */
    public String inBlock() {
        return blockCode != null ? blockCode : code;
    }
}
