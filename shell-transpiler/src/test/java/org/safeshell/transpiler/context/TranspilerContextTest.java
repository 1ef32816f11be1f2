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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.safeshell.transpiler.ast.SourceLocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranspilerContextTest {

    private TranspilerContext context;

    @BeforeEach
    void setUp() {
        context = new TranspilerContext(TranspilerOptions.defaults());
    }

    @Test
    void indentsWithConfiguredUnitAndClampsAtZero() {
        context.indent();
        context.indent();
        assertEquals("    ", context.getIndent());
        context.dedent();
        context.dedent();
        context.dedent();
        assertEquals(0, context.getIndentLevel());
        assertEquals("", context.getIndent());

        TranspilerContext tabs = new TranspilerContext(TranspilerOptions.builder().indent("\t").build());
        tabs.indent();
        assertEquals("\t", tabs.getIndent());
    }

    @Test
    void innerScopeSeesOuterDeclarations() {
        context.declareVariable("OUTER");
        context.pushScope();
        context.declareVariable("INNER", DeclarationKind.CONST, true);

        assertTrue(context.isDeclared("OUTER"));
        assertFalse(context.isInCurrentScope("OUTER"), "Should only see OUTER through the chain");
        assertTrue(context.isInCurrentScope("INNER"));
        assertEquals(DeclarationKind.CONST, context.getVariable("INNER").kind());

        context.popScope();
        assertFalse(context.isDeclared("INNER"));
        assertNull(context.getVariable("INNER"));
    }

    @Test
    void poppingRootScopeIsNoOp() {
        Scope root = context.getCurrentScope();
        context.declareVariable("X");
        context.popScope();
        context.popScope();
        assertSame(root, context.getCurrentScope());
        assertTrue(root.isRoot());
        assertTrue(context.isDeclared("X"));
    }

    @Test
    void tempVarsAreNumberedAcrossPrefixes() {
        assertEquals("_tmp0", context.getTempVar());
        assertEquals("__line1", context.getTempVar("__line"));
        assertEquals("_tmp2", context.getTempVar(null));
        context.resetTempVars();
        assertEquals("__bg0", context.getTempVar("__bg"));
    }

    @Test
    void restoresSnapshot() {
        context.indent();
        context.getTempVar();
        ContextSnapshot snapshot = context.snapshot();

        context.indent();
        context.getTempVar();
        context.getTempVar();
        context.restore(snapshot);

        assertEquals(1, context.getIndentLevel());
        assertEquals("_tmp1", context.getTempVar());
    }

    @Test
    void tracksFunctions() {
        assertFalse(context.isFunction("deploy"));
        context.declareFunction("deploy");
        assertTrue(context.isFunction("deploy"));
    }

    @Test
    void collectsDiagnosticsInOrder() {
        context.addDiagnostic(Severity.INFO, "first");
        context.addDiagnostic(Severity.WARNING, "second", new SourceLocation(3, 7));
        assertFalse(context.hasErrors());

        context.addDiagnostic(Severity.ERROR, "third");
        assertTrue(context.hasErrors());
        assertEquals(3, context.getDiagnostics().size());
        assertEquals("second", context.getDiagnostics().get(1).getMessage());
        assertEquals(3, context.getDiagnostics().get(1).getLocation().line());
        assertThrows(UnsupportedOperationException.class,
            () -> context.getDiagnostics().add(new Diagnostic(Severity.INFO, "x")));

        context.clearDiagnostics();
        assertTrue(context.getDiagnostics().isEmpty());
        assertFalse(context.hasErrors());
    }
}
