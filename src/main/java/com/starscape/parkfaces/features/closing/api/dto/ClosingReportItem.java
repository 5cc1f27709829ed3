package com.starscape.parkfaces.features.closing.api.dto;

import com.starscape.parkfaces.features.closing.domain.ClosingReport;

import java.time.Instant;

public record ClosingReportItem(
    String closingId,
    Instant closedAt,
    String closingUser,
    String notes
) {
    public static ClosingReportItem from(ClosingReport report) {
        return new ClosingReportItem(
            report.getClosingId(),
            report.getClosedAt(),
            report.getClosingUser(),
            report.getNotes()
        );
    }
}
