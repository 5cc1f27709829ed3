package com.starscape.parkfaces.features.closing.domain;

import java.time.Instant;

/**
 * Identity of a closing written by a {@link ClosingWriter}.
 */
public record ClosingRecord(String closingId, Instant closedAt) {}
