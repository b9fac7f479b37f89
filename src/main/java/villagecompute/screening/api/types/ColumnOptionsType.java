/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-column matching options of an advanced search.
 *
 * @param wholeWord
 *            the cell must equal the search term instead of merely containing it
 * @param matchCase
 *            comparison is case sensitive
 */
public record ColumnOptionsType(@JsonProperty("whole_word") boolean wholeWord,
        @JsonProperty("match_case") boolean matchCase) {

    public static final ColumnOptionsType DEFAULTS = new ColumnOptionsType(false, false);
}
