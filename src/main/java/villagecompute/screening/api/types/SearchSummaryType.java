/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate statistics written with a completed search.
 *
 * <p>
 * For single searches {@code totalSearched} is 1. For advanced searches the confidence fields are 0 and
 * {@code totalFound} counts queries with at least one column hit.
 *
 * @param totalSearched
 *            number of query names (or query rows) processed
 * @param totalFound
 *            queries with at least one match
 * @param totalAboveThreshold
 *            queries whose best confidence reached the threshold
 * @param maxConfidence
 *            highest confidence seen across all queries
 * @param averageConfidence
 *            mean of the per-query best confidence, 0 for an empty query list
 * @param thresholdUsed
 *            threshold the search ran with
 */
public record SearchSummaryType(@JsonProperty("total_searched") int totalSearched,
        @JsonProperty("total_found") int totalFound, @JsonProperty("total_above_threshold") int totalAboveThreshold,
        @JsonProperty("max_confidence") double maxConfidence,
        @JsonProperty("average_confidence") double averageConfidence,
        @JsonProperty("threshold_used") int thresholdUsed) {
}
