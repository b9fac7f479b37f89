/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of one query row of an advanced search.
 *
 * @param queryNo
 *            the row's {@code no} value, 0 when absent or not numeric
 * @param queryName
 *            non-empty search terms of the row joined with a space
 * @param columnResults
 *            per-column hit counts keyed by column name, in request order
 */
public record AdvancedQueryResultType(@JsonProperty("query_no") int queryNo,
        @JsonProperty("query_name") String queryName,
        @JsonProperty("column_results") Map<String, ColumnResultType> columnResults) {

    public boolean anyFound() {
        return columnResults.values().stream().anyMatch(ColumnResultType::found);
    }
}
