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
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.Program;
import org.safeshell.transpiler.ast.json.AstJsonReader;
import org.safeshell.transpiler.context.Diagnostic;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code TranspilerMain <ast.json> [output-file]}. The input is the
 * parser's JSON statement tree. The program is written to the output file, or to
 * stdout when none is given. Exits with 1 when an error diagnostic was recorded.
 */
@Slf4j
public class TranspilerMain {

    public static void main(String[] args) throws Exception {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) throws Exception {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: TranspilerMain <ast.json> [output-file]");
            return 2;
        }
        Path input = Path.of(args[0]);
        Program program = new AstJsonReader().read(input);
        TranspileResult result = new ShellTranspiler().transpile(program);

        for (Diagnostic diagnostic : result.diagnostics()) {
            switch (diagnostic.getSeverity()) {
                case ERROR:
                    log.error("{}: {}", input.getFileName(), diagnostic);
                    break;
                case WARNING:
                    log.warn("{}: {}", input.getFileName(), diagnostic);
                    break;
                default:
                    log.info("{}: {}", input.getFileName(), diagnostic);
            }
        }

        if (args.length == 2) {
            Path output = Path.of(args[1]);
            Files.writeString(output, result.code(), StandardCharsets.UTF_8);
            log.info("Compiled {} statements from {} into {}", program.getBody().size(), input, output);
        } else {
            System.out.print(result.code());
        }
        return result.hasErrors() ? 1 : 0;
    }
}
