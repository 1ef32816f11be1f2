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

import org.safeshell.transpiler.StatementDriver;
import org.safeshell.transpiler.ast.FunctionDeclaration;
import org.safeshell.transpiler.escape.EscapeUtils;

/**
 * Emits a shell function as an async function. The driver registers the name
 * before this runs, so recursive calls inside the body resolve as function calls.
 */
public class FunctionDeclarationHandler implements StatementHandler<FunctionDeclaration> {

    @Override
    public void handle(FunctionDeclaration function, StatementDriver driver) {
        driver.emit("async function " + EscapeUtils.sanitizeFunctionName(function.getName()) + "(...args) {");
        driver.visitBlock(function.getBody());
        driver.emit("}");
    }
}
