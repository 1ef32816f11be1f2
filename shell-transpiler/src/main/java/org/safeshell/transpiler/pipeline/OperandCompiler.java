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

import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.command.CommandMode;
import org.safeshell.transpiler.command.CompiledExpression;

/**
 * Compiles each kind of pipeline operand.
 */
public interface OperandCompiler {

    CompiledExpression compileCommand(Command command, CommandMode mode);

    CompiledExpression compileAssignment(VariableAssignment assignment);

    /** A nested pipeline compiled on its own into a single expression. */
    CompiledExpression compileNested(Pipeline pipeline, boolean capture);

    /** Any other statement, wrapped so it can be used as an operand. */
    CompiledExpression compileClosure(Statement statement);
}
