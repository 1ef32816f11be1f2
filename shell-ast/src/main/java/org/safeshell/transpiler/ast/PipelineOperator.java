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

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PipelineOperator {
    NONE(""),
    AND("&&"),
    OR("||"),
    PIPE("|"),
    SEQUENCE(";");

    private final String symbol;

    /**
     * Resolve a parser operator token; null means {@link #NONE}. The parser's
     * {@code &} is a sequence whose pipeline runs in the background and is mapped
     * by the reader, not here.
     */
    public static PipelineOperator fromSymbol(String symbol) {
        if (symbol == null) {
            return NONE;
        }
        for (PipelineOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline operator: " + symbol);
    }
}
