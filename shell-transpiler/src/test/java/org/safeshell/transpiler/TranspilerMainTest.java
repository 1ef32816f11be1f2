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

package org.safeshell.transpiler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranspilerMainTest {

    private static final String CD_TMP = "{\"type\":\"Command\","
        + "\"name\":{\"type\":\"Word\",\"value\":\"cd\",\"parts\":[]},"
        + "\"args\":[{\"type\":\"Word\",\"value\":\"/tmp\",\"parts\":[]}],"
        + "\"redirects\":[],\"assignments\":[]}";

    @TempDir
    Path tempDir;

    @Test
    void writesCompiledProgram() throws Exception {
        Path input = write("script.json", "{\"type\":\"Program\",\"body\":[" + CD_TMP + "]}");
        Path output = tempDir.resolve("script.ts");

        int status = TranspilerMain.run(new String[] {input.toString(), output.toString()});

        assertEquals(0, status);
        String code = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(code.contains("  $.cd(\"/tmp\");\n"), "Should write the compiled statement");
        assertTrue(code.startsWith("\"use strict\";"));
    }

    @Test
    void failsOnErrorDiagnostics() throws Exception {
        Path input = write("loop.json", "{\"type\":\"Program\",\"body\":["
            + "{\"type\":\"WhileStatement\",\"test\":" + CD_TMP + ",\"body\":[]}]}");
        Path output = tempDir.resolve("loop.ts");

        assertEquals(1, TranspilerMain.run(new String[] {input.toString(), output.toString()}));
        assertTrue(Files.readString(output).contains("// unsupported: WhileStatement"),
            "Should still write the partial program");
    }

    @Test
    void rejectsBadUsage() throws Exception {
        assertEquals(2, TranspilerMain.run(new String[0]));
        assertEquals(2, TranspilerMain.run(new String[] {"a", "b", "c"}));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
