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

import java.util.Optional;

/**
 * One entry of the ordered strategy table. {@link #applies} is the cheap shape
 * check; {@link #build} may still decline, in which case the next entry is tried.
 */
public interface CommandStrategy {

    boolean applies(CommandAnalysis analysis);

    Optional<CompiledExpression> build(CommandAnalysis analysis);

    /**
     * Whether the built call already carries a {@code 2>&1} as its {@code mergeStreams}
     * option. Otherwise that redirection is appended like any other.
     */
    default boolean consumesMergedStreams() {
        return false;
    }
}
