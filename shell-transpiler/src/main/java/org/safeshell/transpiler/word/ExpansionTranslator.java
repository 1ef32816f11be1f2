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

package org.safeshell.transpiler.word;

import org.safeshell.transpiler.ast.ArithmeticExpansion;
import org.safeshell.transpiler.ast.ParameterExpansion;
import org.safeshell.transpiler.context.TranspilerContext;

/**
 * Translates parameter and arithmetic expansions into host-language expressions.
 * Implementations report what they cannot translate as diagnostics and return a
 * safe fallback expression instead of throwing.
 */
public interface ExpansionTranslator {

    String translateParameter(ParameterExpansion expansion, TranspilerContext context);

    String translateArithmetic(ArithmeticExpansion expansion, TranspilerContext context);
}
