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

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

/**
 * Names the compiler maps to dedicated runtime calls instead of a generic process
 * invocation: builtins with their call category, and specialized wrappers for
 * tools such as git.
 *
 * <p>Loaded from {@code shell-commands.yml} on the classpath:
 * <pre>
 * builtins:
 *   cd: { fn: $.cd, category: silent }
 * wrappers:
 *   git: $.git
 * tmux-submit: $.tmuxSubmit
 * </pre>
 */
@Slf4j
public class CommandCatalog {

    public static final String DEFAULT_RESOURCE = "shell-commands.yml";

    @Getter
    private final Map<String, BuiltinConfig> builtins;

    @Getter
    private final Map<String, String> wrappers;

    /** Call target for the {@code tmux send-keys ... Enter} pattern, or null when disabled. */
    @Getter
    private final String tmuxSubmit;

    public CommandCatalog(Map<String, BuiltinConfig> builtins, Map<String, String> wrappers, String tmuxSubmit) {
        this.builtins = ImmutableMap.copyOf(builtins);
        this.wrappers = ImmutableMap.copyOf(wrappers);
        this.tmuxSubmit = tmuxSubmit;
    }

    public static CommandCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static CommandCatalog load(String resource) {
        try (InputStream is = CommandCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Command catalog not found on classpath: " + resource);
            }
            CommandCatalog catalog = parse(is);
            log.debug("Loaded {} builtins and {} wrappers from {}",
                catalog.builtins.size(), catalog.wrappers.size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load command catalog: " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    static CommandCatalog parse(InputStream is) {
        Map<String, Object> config = new Yaml().load(is);
        if (config == null) {
            throw new IllegalStateException("Command catalog is empty");
        }

        ImmutableMap.Builder<String, BuiltinConfig> builtins = ImmutableMap.builder();
        Map<String, Map<String, String>> builtinSection =
            (Map<String, Map<String, String>>) config.getOrDefault("builtins", Map.of());
        builtinSection.forEach((name, entry) -> {
            String fn = entry.get("fn");
            String category = entry.get("category");
            if (fn == null || category == null) {
                throw new IllegalStateException("Builtin '" + name + "' needs both fn and category");
            }
            builtins.put(name, new BuiltinConfig(name, fn, BuiltinCategory.parse(category)));
        });

        Map<String, String> wrappers = (Map<String, String>) config.getOrDefault("wrappers", Map.of());
        return new CommandCatalog(builtins.build(), wrappers, (String) config.get("tmux-submit"));
    }

    public BuiltinConfig getBuiltin(String name) {
        return builtins.get(name);
    }

    public boolean isBuiltin(String name) {
        return builtins.containsKey(name);
    }

    public String getWrapper(String name) {
        return wrappers.get(name);
    }
}
