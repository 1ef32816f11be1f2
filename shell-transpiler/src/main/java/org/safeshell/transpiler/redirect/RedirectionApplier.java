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
import lombok.extern.slf4j.Slf4j;
import org.safeshell.transpiler.ast.Redirection;
import org.safeshell.transpiler.word.WordCompiler;

/**
 * Appends redirection method calls to compiled command code, one redirection at
 * a time, in source order.
 */
@Slf4j
public class RedirectionApplier {

    private static final String APPEND_OPTION = "{ append: true }";

    private final WordCompiler words;

    public RedirectionApplier(WordCompiler words) {
        this.words = words;
    }

    public String applyAll(String code, List<Redirection> redirections) {
        String result = code;
        for (Redirection redirection : redirections) {
            result = apply(result, redirection);
        }
        return result;
    }

    public String apply(String code, Redirection redirection) {
        String target = target(redirection);
        boolean stderr = redirection.getFd() != null && redirection.getFd() == 2;
        switch (redirection.getOperator()) {
            case INPUT:
            case HEREDOC:
            case HERESTRING:
                return code + ".stdin(" + target + ")";
            case HEREDOC_STRIP_TABS:
                return code + ".stdin(" + target + ", { stripTabs: true })";
            case OUTPUT:
                return code + (stderr ? ".stderr(" : ".stdout(") + target + ")";
            case APPEND:
                return code + (stderr ? ".stderr(" : ".stdout(") + target + ", " + APPEND_OPTION + ")";
            case CLOBBER:
                return code + (stderr ? ".stderr(" : ".stdout(") + target + ", { force: true })";
            case READ_WRITE:
                return code + ".stdin(" + target + ").stdout(" + target + ")";
            case DUP_OUTPUT:
            case DUP_INPUT:
                return code + ".stderr(" + target + ")";
            case ALL_OUTPUT:
                return code + ".stdout(" + target + ").stderr(" + target + ")";
            case ALL_APPEND:
                return code + ".stdout(" + target + ", " + APPEND_OPTION + ")"
                    + ".stderr(" + target + ", " + APPEND_OPTION + ")";
            default:
                log.debug("Ignoring redirection {}", redirection.getOperator().getSymbol());
                return code;
        }
    }

    private String target(Redirection redirection) {
        if (redirection.getTargetFd() != null) {
            return String.valueOf(redirection.getTargetFd());
        }
        if (redirection.getTarget() == null) {
            return "\"\"";
        }
        return words.compile(redirection.getTarget()).toJs();
    }
}
