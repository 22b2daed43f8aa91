/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codetree.core;

/**
 * Build configuration.
 *
 * <p>{@code strict} selects how classification gaps are handled: strict builds fail on the
 * first parser construct or trivia run the tables do not know, lenient builds classify it
 * as {@code UNKNOWN} and continue.
 *
 * <p>Defaults are read from system properties first, then from the environment:
 * <ul>
 *   <li>{@code codetree.strict} / {@code CODETREE_STRICT}</li>
 *   <li>{@code codetree.debug} / {@code CODETREE_DEBUG} - diagnostics on stderr</li>
 * </ul>
 */
public final class CodeTreeConfig {

    public static final String STRICT_PROPERTY = "codetree.strict";
    public static final String STRICT_ENV = "CODETREE_STRICT";
    public static final String DEBUG_PROPERTY = "codetree.debug";
    public static final String DEBUG_ENV = "CODETREE_DEBUG";

    private static final CodeTreeConfig LENIENT = new CodeTreeConfig(false, false);
    private static final CodeTreeConfig STRICT = new CodeTreeConfig(true, false);

    private final boolean strict;
    private final boolean debug;

    private CodeTreeConfig(boolean strict, boolean debug) {
        this.strict = strict;
        this.debug = debug;
    }

    /**
     * Configuration taken from system properties and environment variables.
     */
    public static CodeTreeConfig defaults() {
        return new CodeTreeConfig(flag(STRICT_PROPERTY, STRICT_ENV), flag(DEBUG_PROPERTY, DEBUG_ENV));
    }

    public static CodeTreeConfig lenient() {
        return LENIENT;
    }

    public static CodeTreeConfig strict() {
        return STRICT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isDebug() {
        return debug;
    }

    public Builder toBuilder() {
        return new Builder().strict(strict).debug(debug);
    }

    /**
     * Writes a diagnostic line to stderr when debug output is enabled.
     */
    public void debug(String message) {
        if (debug) {
            System.err.println("[codetree] " + message);
        }
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return "true".equalsIgnoreCase(value != null ? value.trim() : null);
    }

    @Override
    public String toString() {
        return "CodeTreeConfig{strict=" + strict + ", debug=" + debug + "}";
    }

    public static final class Builder {
        private boolean strict;
        private boolean debug;

        private Builder() {}

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public CodeTreeConfig build() {
            return new CodeTreeConfig(strict, debug);
        }
    }
}
