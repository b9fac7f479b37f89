/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best match for one query of a bulk search.
 *
 * @param name
 *            the query name
 * @param matched
 *            best confidence, {@code 0.0} when nothing reached the threshold
 * @param found
 *            whether at least one match reached the threshold
 * @param bestMatch
 *            highest scoring match, {@code null} when {@code found} is false
 */
public record BulkMatchResultType(@JsonProperty("name") String name, @JsonProperty("matched") double matched,
        @JsonProperty("found") boolean found, @JsonProperty("best_match") MatchedRecordType bestMatch) {

    public static BulkMatchResultType notFound(String name) {
        return new BulkMatchResultType(name, 0.0, false, null);
    }
}
