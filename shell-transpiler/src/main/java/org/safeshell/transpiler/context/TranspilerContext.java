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

package org.safeshell.transpiler.context;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import org.safeshell.transpiler.ast.SourceLocation;

/**
 * Mutable state of one compilation: indentation, the scope chain, temp-variable
 * numbering, known user functions and collected diagnostics.
 *
 * <p>Nothing here throws. Popping the root scope is a no-op and dedenting below
 * zero stays at zero.
 */
public class TranspilerContext {

    private static final String DEFAULT_TEMP_PREFIX = "_tmp";

    @Getter
    private final TranspilerOptions options;

    @Getter
    private int indentLevel;

    private Scope scope = new Scope(null);

    private int tempVarCounter;

    private final Set<String> functions = new HashSet<>();

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public TranspilerContext(TranspilerOptions options) {
        this.options = options;
    }

    // ---- Indentation ----

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public String getIndent() {
        return Strings.repeat(options.getIndent(), indentLevel);
    }

    // ---- Scopes ----

    public void pushScope() {
        scope = new Scope(scope);
    }

    public void popScope() {
        if (!scope.isRoot()) {
            scope = scope.getParent();
        }
    }

    public Scope getCurrentScope() {
        return scope;
    }

    public void declareVariable(String name, DeclarationKind kind, boolean initialized) {
        scope.declare(new VariableInfo(name, kind, initialized));
    }

    public void declareVariable(String name) {
        declareVariable(name, DeclarationKind.LET, true);
    }

    /** Whether {@code name} is visible from the current scope. */
    public boolean isDeclared(String name) {
        return scope.lookup(name) != null;
    }

    /** The nearest declaration of {@code name}, or null. */
    public VariableInfo getVariable(String name) {
        return scope.lookup(name);
    }

    public boolean isInCurrentScope(String name) {
        return scope.getLocal(name) != null;
    }

    // ---- Temp variables ----

    public String getTempVar(String prefix) {
        return (prefix == null ? DEFAULT_TEMP_PREFIX : prefix) + tempVarCounter++;
    }

    public String getTempVar() {
        return getTempVar(DEFAULT_TEMP_PREFIX);
    }

    public void resetTempVars() {
        tempVarCounter = 0;
    }

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(indentLevel, tempVarCounter);
    }

    public void restore(ContextSnapshot snapshot) {
        indentLevel = Math.max(0, snapshot.indentLevel());
        tempVarCounter = snapshot.tempVarCounter();
    }

    // ---- Functions ----

    public void declareFunction(String name) {
        functions.add(name);
    }

    public boolean isFunction(String name) {
        return functions.contains(name);
    }

    // ---- Diagnostics ----

    public void addDiagnostic(Severity severity, String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(severity, message, location));
    }

    public void addDiagnostic(Severity severity, String message) {
        addDiagnostic(severity, message, null);
    }

    public List<Diagnostic> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }

    public void clearDiagnostics() {
        diagnostics.clear();
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getSeverity() == Severity.ERROR) {
                return true;
            }
        }
        return false;
    }
}
