/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Columns of an ingested dataset and the ones suggested for name screening.
 *
 * @param taskId
 *            ingestion task
 * @param availableColumns
 *            every column of the dataset, in header order
 * @param recommendedColumns
 *            name columns present in the dataset
 * @param totalRecords
 *            number of dataset rows
 */
public record ColumnsOverviewType(@JsonProperty("task_id") UUID taskId,
        @JsonProperty("available_columns") List<String> availableColumns,
        @JsonProperty("recommended_columns") List<String> recommendedColumns,
        @JsonProperty("total_records") long totalRecords) {
}
