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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.safeshell.transpiler.ast.SourceLocation;

/**
 * An advisory message recorded during compilation. {@code location} may be null.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class Diagnostic {

    private final Severity severity;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(Severity severity, String message) {
        this(severity, message, null);
    }

    @Override
    public String toString() {
        return location == null
            ? severity + ": " + message
            : severity + " at " + location + ": " + message;
    }
}
