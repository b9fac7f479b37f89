/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.screening.api.types;

import java.time.Instant;

/**
 * Metadata of an uploaded source.
 *
 * @param sourceRef
 *            reference the source is stored under
 * @param sizeBytes
 *            size of the artifact
 * @param lastModified
 *            last modification time of the artifact
 */
public record SourceDescriptorType(String sourceRef, long sizeBytes, Instant lastModified) {
}
