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

import java.util.List;
import org.safeshell.transpiler.ast.PipelineOperator;

/**
 * Operands in source order and the operator in each gap: {@code operators.get(i)}
 * joins {@code parts.get(i)} and {@code parts.get(i + 1)}.
 */
public record FlatPipeline(List<PipelinePart> parts, List<PipelineOperator> operators) {

    public FlatPipeline {
        if (parts.isEmpty() || operators.size() != parts.size() - 1) {
            throw new IllegalArgumentException(
                "Expected one operator between each of " + parts.size() + " parts, got " + operators.size());
        }
        parts = List.copyOf(parts);
        operators = List.copyOf(operators);
    }
}
