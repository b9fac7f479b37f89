/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import java.util.List;

/**
 * Output of a bulk fuzzy search: one result per query, in query order, plus the summary.
 */
public record BulkSearchResultType(List<BulkMatchResultType> results, SearchSummaryType summary) {
}
