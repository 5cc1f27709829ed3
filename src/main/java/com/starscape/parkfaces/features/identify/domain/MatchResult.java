package com.starscape.parkfaces.features.identify.domain;

import com.starscape.parkfaces.features.extraction.domain.BoundingBox;

/**
 * One stored face that resembles the probe. Computed per query, never persisted.
 */
public record MatchResult(
    long descriptorId,
    String photoId,
    double similarity,
    BoundingBox box
) {}
