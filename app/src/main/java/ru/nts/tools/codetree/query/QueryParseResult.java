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
package ru.nts.tools.codetree.query;

import java.util.List;

/**
 * Outcome of parsing a structural query.
 *
 * @param segments parsed segments, empty on failure
 * @param success whether the query was well formed
 * @param error reason of the failure, {@code null} on success
 * @param position offset in the query where the failure was detected, -1 on success
 */
public record QueryParseResult(List<SearchSegment> segments, boolean success, String error, int position) {

    public QueryParseResult {
        segments = List.copyOf(segments);
    }

    static QueryParseResult ok(List<SearchSegment> segments) {
        return new QueryParseResult(segments, true, null, -1);
    }

    static QueryParseResult failure(String error, int position) {
        return new QueryParseResult(List.of(), false, error, position);
    }
}
