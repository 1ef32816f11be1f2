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
 * A redirection. Exactly one of {@code target} (a path or here-document body) and
 * {@code targetFd} (a descriptor, as in {@code 2>&1}) is set. {@code fd} is the
 * explicit source descriptor or null when the operator's default applies.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class Redirection implements Node {

    private final RedirectionOperator operator;
    private final Integer fd;
    private final Word target;
    private final Integer targetFd;

    public static Redirection toFile(RedirectionOperator operator, Integer fd, String path) {
        return new Redirection(operator, fd, Word.literal(path), null);
    }

    public static Redirection toDescriptor(RedirectionOperator operator, Integer fd, int targetFd) {
        return new Redirection(operator, fd, null, targetFd);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.REDIRECTION;
    }
}
