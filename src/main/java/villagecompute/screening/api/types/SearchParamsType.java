/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parameters of a search job.
 *
 * <p>
 * Single searches use the first entry of {@code queryNames}; bulk searches use all of them. Advanced searches ignore
 * {@code queryNames} and {@code threshold} and read {@code queryRows} with {@code columnOptions} instead.
 *
 * @param taskRef
 *            ingestion task whose dataset is searched
 * @param columns
 *            dataset columns to compare against
 * @param threshold
 *            minimum confidence in [0, 100]
 * @param queryNames
 *            names to screen
 * @param watchlistRef
 *            optional watchlist the names came from
 * @param columnOptions
 *            advanced mode options keyed by column
 * @param queryRows
 *            advanced mode query rows, column name to search term
 */
public record SearchParamsType(@JsonProperty("task_ref") UUID taskRef,
        @JsonProperty("columns") List<String> columns, @JsonProperty("threshold") int threshold,
        @JsonProperty("query_names") List<String> queryNames, @JsonProperty("watchlist_ref") String watchlistRef,
        @JsonProperty("column_options") Map<String, ColumnOptionsType> columnOptions,
        @JsonProperty("query_rows") List<Map<String, String>> queryRows) {

    public SearchParamsType {
        columns = columns == null ? List.of() : List.copyOf(columns);
        queryNames = queryNames == null ? List.of() : List.copyOf(queryNames);
        columnOptions = columnOptions == null ? Map.of() : Map.copyOf(columnOptions);
        queryRows = queryRows == null ? List.of() : List.copyOf(queryRows);
    }

    public static SearchParamsType single(UUID taskRef, String name, List<String> columns, int threshold) {
        return new SearchParamsType(taskRef, columns, threshold, List.of(name), null, null, null);
    }

    public static SearchParamsType bulk(UUID taskRef, List<String> names, List<String> columns, int threshold,
            String watchlistRef) {
        return new SearchParamsType(taskRef, columns, threshold, names, watchlistRef, null, null);
    }

    public static SearchParamsType advanced(UUID taskRef, List<String> columns,
            Map<String, ColumnOptionsType> columnOptions, List<Map<String, String>> queryRows) {
        return new SearchParamsType(taskRef, columns, 0, null, null, columnOptions, queryRows);
    }
}
