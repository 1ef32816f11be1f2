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
 * A simple command. The name may be the empty word, in which case the command
 * only carries assignments ({@code A=1 B=2}).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Command implements Statement {

    private final Word name;
    private final List<Word> args;
    private final List<VariableAssignment> assignments;
    private final List<Redirection> redirects;
    private final SourceLocation location;

    public Command(Word name, List<Word> args, List<VariableAssignment> assignments,
                   List<Redirection> redirects, SourceLocation location) {
        this.name = name == null ? Word.literal("") : name;
        this.args = List.copyOf(args);
        this.assignments = List.copyOf(assignments);
        this.redirects = List.copyOf(redirects);
        this.location = location;
    }

    public Command(Word name, List<Word> args, List<VariableAssignment> assignments, List<Redirection> redirects) {
        this(name, args, assignments, redirects, null);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMMAND;
    }
}
