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
package ru.nts.tools.codetree.tree;

/**
 * Closed set of non-semantic source runs that can be attached to a {@link Node}.
 */
public enum TriviaKind {
    UNKNOWN,
    LINE_COMMENT,
    BLOCK_COMMENT,
    DOCUMENTATION_COMMENT,
    REGION_DIRECTIVE,
    END_REGION_DIRECTIVE,
    IF_DIRECTIVE,
    ELIF_DIRECTIVE,
    ELSE_DIRECTIVE,
    END_IF_DIRECTIVE,
    DISABLED_TEXT,
    PRAGMA_DIRECTIVE,
    LINE_DIRECTIVE,
    DEFINE_DIRECTIVE,
    UNDEF_DIRECTIVE,
    NULLABLE_DIRECTIVE,
    ERROR_DIRECTIVE,
    WARNING_DIRECTIVE
}
