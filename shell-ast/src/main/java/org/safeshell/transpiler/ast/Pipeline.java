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

package org.safeshell.transpiler.ast;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Operands joined by one operator. Mixed chains such as {@code a && b | c} arrive
 * as nested pipelines.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Pipeline implements Statement {

    private final List<Statement> commands;
    private final PipelineOperator operator;
    private final boolean background;
    private final boolean negated;

    public Pipeline(List<Statement> commands, PipelineOperator operator, boolean background, boolean negated) {
        this.commands = List.copyOf(commands);
        this.operator = operator == null ? PipelineOperator.NONE : operator;
        this.background = background;
        this.negated = negated;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PIPELINE;
    }
}
