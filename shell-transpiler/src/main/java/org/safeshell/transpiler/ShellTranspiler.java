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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.NodeKind;
import org.safeshell.transpiler.ast.Program;
import org.safeshell.transpiler.config.CommandCatalog;
import org.safeshell.transpiler.context.TranspilerContext;
import org.safeshell.transpiler.context.TranspilerOptions;
import org.safeshell.transpiler.handler.BraceGroupHandler;
import org.safeshell.transpiler.handler.FunctionDeclarationHandler;
import org.safeshell.transpiler.handler.StatementHandler;
import org.safeshell.transpiler.handler.SubshellHandler;
import org.safeshell.transpiler.word.BasicExpansionTranslator;
import org.safeshell.transpiler.word.ExpansionTranslator;

/**
 * Compiles shell programs into asynchronous host-language programs.
 *
 * <p>An instance holds only configuration and can be reused and shared; each
 * call to {@link #transpile} runs with a fresh {@link TranspilerContext}.
 * Control-flow statements are compiled by handlers registered with
 * {@link #withHandler}; without one they are reported as errors.
 */
@Slf4j
public class ShellTranspiler {

    @Getter
    private final TranspilerOptions options;

    private final CommandCatalog catalog;

    private final ExpansionTranslator translator;

    private final Map<NodeKind, StatementHandler<?>> handlers;

    private final ProgramEmitter emitter = new ProgramEmitter();

    public ShellTranspiler() {
        this(TranspilerOptions.defaults());
    }

    public ShellTranspiler(TranspilerOptions options) {
        this(options, CommandCatalog.loadDefault(), new BasicExpansionTranslator(), defaultHandlers());
    }

    public ShellTranspiler(TranspilerOptions options, CommandCatalog catalog, ExpansionTranslator translator,
                           Map<NodeKind, StatementHandler<?>> handlers) {
        this.options = options;
        this.catalog = catalog;
        this.translator = translator;
        this.handlers = ImmutableMap.copyOf(handlers);
    }

    public static Map<NodeKind, StatementHandler<?>> defaultHandlers() {
        return ImmutableMap.of(
            NodeKind.SUBSHELL, new SubshellHandler(),
            NodeKind.BRACE_GROUP, new BraceGroupHandler(),
            NodeKind.FUNCTION_DECLARATION, new FunctionDeclarationHandler()
        );
    }

    /**
     * A copy of this transpiler with {@code handler} registered for {@code kind},
     * replacing any previous handler.
     */
    public ShellTranspiler withHandler(NodeKind kind, StatementHandler<?> handler) {
        Preconditions.checkArgument(kind.isStatement(), "%s is not a statement kind", kind);
        Preconditions.checkArgument(kind != NodeKind.PIPELINE && kind != NodeKind.COMMAND
            && kind != NodeKind.VARIABLE_ASSIGNMENT, "%s is compiled by the driver itself", kind);
        Map<NodeKind, StatementHandler<?>> merged = new HashMap<>(handlers);
        merged.put(kind, handler);
        return new ShellTranspiler(options, catalog, translator, merged);
    }

    public TranspileResult transpile(Program program) {
        TranspilerContext context = new TranspilerContext(options);
        StatementDriver driver = new StatementDriver(context, catalog, translator, handlers);
        context.indent();
        driver.visitStatements(program.getBody());
        context.dedent();

        String code = emitter.emit(driver.getOutput(), options);
        TranspileResult result = new TranspileResult(code, context.getDiagnostics());
        log.debug("Compiled {} statements with {} diagnostics", program.getBody().size(), result.diagnostics().size());
        return result;
    }
}
