package com.starscape.parkfaces.features.closing.api.dto;

import java.time.Instant;

/**
 * lastClosing is null until the first closing has been recorded.
 */
public record LastClosingResponse(
    Instant lastClosing
) {}
