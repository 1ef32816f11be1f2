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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * {@code $name} or {@code ${name<modifier><arg>}}. {@code modifier} is the raw
 * modifier token ({@code :-}, {@code #}, {@code //}, {@code length}, ...) or null.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class ParameterExpansion implements WordPart {

    private final String parameter;
    private final String modifier;
    private final Word modifierArg;
    private final String subscript;

    public static ParameterExpansion simple(String parameter) {
        return new ParameterExpansion(parameter, null, null, null);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARAMETER_EXPANSION;
    }
}
