package com.starscape.parkfaces.features.closing.app;

import java.time.Instant;

public record ClosingPurgeOutcome(
    String closingId,
    Instant closedAt,
    int purgedDescriptors
) {}
