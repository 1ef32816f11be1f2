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

package org.safeshell.transpiler.context;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Output options for one transpiler instance.
 */
@Getter
@Builder
@ToString
public class TranspilerOptions {

    /** One indentation unit. */
    @Builder.Default
    private final String indent = "  ";

    /** Emit a strict-mode directive. */
    @Builder.Default
    private final boolean strict = true;

    /** Emit the runtime import line. */
    @Builder.Default
    private final boolean imports = true;

    @Builder.Default
    private final String importPath = "./mod.ts";

    public static TranspilerOptions defaults() {
        return TranspilerOptions.builder().build();
    }
}
