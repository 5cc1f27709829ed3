package com.starscape.parkfaces.features.closing.api.dto;

import java.time.Instant;

public record ClosingResponse(
    String closingId,
    Instant closedAt
) {}
