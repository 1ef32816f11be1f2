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

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * One lexical scope of generated code. Scopes form a chain that ends at a single root.
 */
public final class Scope {

    @Getter
    private final Scope parent;

    private final Map<String, VariableInfo> variables = new LinkedHashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    void declare(VariableInfo info) {
        variables.put(info.name(), info);
    }

    VariableInfo getLocal(String name) {
        return variables.get(name);
    }

    VariableInfo lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            VariableInfo info = scope.variables.get(name);
            if (info != null) {
                return info;
            }
        }
        return null;
    }
}
