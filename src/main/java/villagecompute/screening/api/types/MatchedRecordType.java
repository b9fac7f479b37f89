/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One dataset cell that scored at or above the search threshold.
 *
 * @param queryName
 *            the query exactly as submitted
 * @param confidence
 *            similarity score in [0, 100]
 * @param matchedColumn
 *            column the value was read from
 * @param matchedValue
 *            raw cell value that matched
 * @param entityRef
 *            value of the configured entity reference column, {@code null} when the row has none
 * @param fullRecord
 *            snapshot of the whole row at search time
 */
public record MatchedRecordType(@JsonProperty("query_name") String queryName,
        @JsonProperty("confidence") double confidence, @JsonProperty("matched_column") String matchedColumn,
        @JsonProperty("matched_value") String matchedValue, @JsonProperty("entity_ref") String entityRef,
        @JsonProperty("full_record") Map<String, String> fullRecord) {
}
