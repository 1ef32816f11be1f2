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

package org.safeshell.transpiler.config;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandCatalogTest {

    @Test
    void loadsDefaultCatalog() {
        CommandCatalog catalog = CommandCatalog.loadDefault();

        assertEquals(BuiltinCategory.SILENT, catalog.getBuiltin("cd").category());
        assertEquals("$.cd", catalog.getBuiltin("cd").fn());
        assertEquals(BuiltinCategory.PRINTS, catalog.getBuiltin("echo").category());
        assertEquals(BuiltinCategory.OUTPUT, catalog.getBuiltin("pwd").category());
        assertEquals(BuiltinCategory.ASYNC, catalog.getBuiltin("mkdir").category());
        assertTrue(catalog.isBuiltin("touch"));
        assertFalse(catalog.isBuiltin("grep"), "Should leave text utilities to the fluent forms");

        assertEquals("$.git", catalog.getWrapper("git"));
        assertEquals("$.docker", catalog.getWrapper("docker"));
        assertNull(catalog.getWrapper("kubectl"));
        assertEquals("$.tmuxSubmit", catalog.getTmuxSubmit());
    }

    @Test
    void parsesCustomCatalog() {
        CommandCatalog catalog = parse(
            "builtins:\n"
                + "  say: { fn: \"$.say\", category: prints }\n"
                + "wrappers:\n"
                + "  kubectl: \"$.kubectl\"\n");

        assertEquals(1, catalog.getBuiltins().size());
        assertEquals(BuiltinCategory.PRINTS, catalog.getBuiltin("say").category());
        assertEquals("$.kubectl", catalog.getWrapper("kubectl"));
        assertNull(catalog.getTmuxSubmit(), "Should disable the tmux pattern when not configured");
    }

    @Test
    void rejectsIncompleteBuiltin() {
        assertThrows(IllegalStateException.class, () -> parse("builtins:\n  say: { fn: \"$.say\" }\n"));
    }

    @Test
    void rejectsUnknownCategory() {
        assertThrows(IllegalArgumentException.class,
            () -> parse("builtins:\n  say: { fn: \"$.say\", category: loud }\n"));
    }

    @Test
    void rejectsEmptyOrMissingCatalog() {
        assertThrows(IllegalStateException.class, () -> parse(""));
        assertThrows(IllegalStateException.class, () -> CommandCatalog.load("no-such-catalog.yml"));
    }

    private static CommandCatalog parse(String yaml) {
        return CommandCatalog.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
