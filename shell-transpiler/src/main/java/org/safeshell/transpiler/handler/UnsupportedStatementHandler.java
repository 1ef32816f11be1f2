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

package org.safeshell.transpiler.handler;

import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.StatementDriver;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.context.Severity;

/**
 * Used for statement kinds with no registered handler: records an error and
 * leaves a marker comment so the rest of the program still compiles.
 */
@Slf4j
public class UnsupportedStatementHandler implements StatementHandler<Statement> {

    public static final UnsupportedStatementHandler INSTANCE = new UnsupportedStatementHandler();

    @Override
    public void handle(Statement statement, StatementDriver driver) {
        String typeName = statement.getKind().getTypeName();
        log.debug("No handler registered for {}", typeName);
        driver.getContext().addDiagnostic(Severity.ERROR, "Unsupported statement: " + typeName);
        driver.emit("// unsupported: " + typeName);
    }
}
