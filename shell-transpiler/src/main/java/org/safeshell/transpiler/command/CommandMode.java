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

/**
 * Where a command sits: inside a {@code |} chain, downstream of another operand,
 * or inside a command substitution.
 */
public record CommandMode(boolean inPipeline, boolean pipeInput, boolean capture) {

    public static final CommandMode STANDALONE = new CommandMode(false, false, false);

    public static final CommandMode CAPTURE = new CommandMode(false, false, true);

    public CommandMode withCapture(boolean value) {
        return new CommandMode(inPipeline, pipeInput, value);
    }
}
