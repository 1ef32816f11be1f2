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

package org.safeshell.transpiler.redirect;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.ast.RedirectionOperator;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.context.TranspilerOptions;
import org.safeshell.transpiler.word.BasicExpansionTranslator;
import org.safeshell.transpiler.word.WordCompiler;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RedirectionApplierTest {

    private static final String CMD = "$.cmd(\"x\")";

    private RedirectionApplier applier;

    @BeforeEach
    void setUp() {
        TranspilerContext context = new TranspilerContext(TranspilerOptions.defaults());
        applier = new RedirectionApplier(
            new WordCompiler(context, new BasicExpansionTranslator(), body -> "$.cmd(\"true\")"));
    }

    @Test
    void mapsOutputOperators() {
        assertEquals(CMD + ".stdout(\"out\")", apply(RedirectionOperator.OUTPUT, null, "out"));
        assertEquals(CMD + ".stderr(\"err\")", apply(RedirectionOperator.OUTPUT, 2, "err"));
        assertEquals(CMD + ".stdout(\"log\", { append: true })", apply(RedirectionOperator.APPEND, null, "log"));
        assertEquals(CMD + ".stderr(\"log\", { append: true })", apply(RedirectionOperator.APPEND, 2, "log"));
        assertEquals(CMD + ".stdout(\"f\", { force: true })", apply(RedirectionOperator.CLOBBER, null, "f"));
        assertEquals(CMD + ".stdout(\"all\").stderr(\"all\")", apply(RedirectionOperator.ALL_OUTPUT, null, "all"));
        assertEquals(CMD + ".stdout(\"all\", { append: true }).stderr(\"all\", { append: true })",
            apply(RedirectionOperator.ALL_APPEND, null, "all"));
    }

    @Test
    void mapsInputOperators() {
        assertEquals(CMD + ".stdin(\"in\")", apply(RedirectionOperator.INPUT, null, "in"));
        assertEquals(CMD + ".stdin(\"body\\n\")", apply(RedirectionOperator.HEREDOC, null, "body\n"));
        assertEquals(CMD + ".stdin(\"body\", { stripTabs: true })",
            apply(RedirectionOperator.HEREDOC_STRIP_TABS, null, "body"));
        assertEquals(CMD + ".stdin(\"text\")", apply(RedirectionOperator.HERESTRING, null, "text"));
        assertEquals(CMD + ".stdin(\"rw\").stdout(\"rw\")", apply(RedirectionOperator.READ_WRITE, null, "rw"));
    }

    @Test
    void rendersDescriptorTargetsAsNumbers() {
        assertEquals(CMD + ".stderr(2)",
            applier.apply(CMD, Redirection.toDescriptor(RedirectionOperator.DUP_OUTPUT, 1, 2)));
        assertEquals(CMD + ".stderr(0)",
            applier.apply(CMD, Redirection.toDescriptor(RedirectionOperator.DUP_INPUT, null, 0)));
    }

    @Test
    void appliesInSourceOrder() {
        List<Redirection> redirections = List.of(
            Redirection.toFile(RedirectionOperator.INPUT, null, "in"),
            Redirection.toFile(RedirectionOperator.OUTPUT, null, "out"),
            Redirection.toFile(RedirectionOperator.OUTPUT, 2, "err"));
        assertEquals(CMD + ".stdin(\"in\").stdout(\"out\").stderr(\"err\")", applier.applyAll(CMD, redirections));
        assertEquals(CMD, applier.applyAll(CMD, List.of()));
    }

    private String apply(RedirectionOperator operator, Integer fd, String target) {
        return applier.apply(CMD, Redirection.toFile(operator, fd, target));
    }
}
