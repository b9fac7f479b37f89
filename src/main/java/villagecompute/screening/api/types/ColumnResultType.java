/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hit count of one search term in one column.
 *
 * @param found
 *            whether {@code count} is positive
 * @param count
 *            number of dataset rows whose column matched
 * @param searchTerm
 *            the term taken from the query row, empty when the row had none
 */
public record ColumnResultType(@JsonProperty("found") boolean found, @JsonProperty("count") int count,
        @JsonProperty("search_term") String searchTerm) {

    public static ColumnResultType empty() {
        return new ColumnResultType(false, 0, "");
    }
}
