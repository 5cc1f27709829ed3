package com.starscape.parkfaces.features.closing.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * End-of-day closing record. Every face descriptor captured before it has been destroyed.
 */
@Entity
@Table(name = "closing_reports")
public class ClosingReport {
    
    @Id
    @Column(name = "closing_id")
    private String closingId;
    
    @Column(name = "closed_at", nullable = false, updatable = false)
    private Instant closedAt;
    
    @Column(name = "closing_user", nullable = false)
    private String closingUser;
    
    @Column(length = 1000)
    private String notes;
    
    protected ClosingReport() {
        // JPA constructor
    }
    
    public ClosingReport(String closingId, String closingUser, String notes) {
        if (closingId == null || closingId.isBlank()) {
            throw new IllegalArgumentException("Closing ID cannot be blank");
        }
        if (closingUser == null || closingUser.isBlank()) {
            throw new IllegalArgumentException("Closing user cannot be blank");
        }
        this.closingId = closingId;
        this.closingUser = closingUser;
        this.notes = notes;
        this.closedAt = Instant.now();
    }
    
    public ClosingRecord toRecord() {
        return new ClosingRecord(closingId, closedAt);
    }
    
    // Getters
    public String getClosingId() { return closingId; }
    public Instant getClosedAt() { return closedAt; }
    public String getClosingUser() { return closingUser; }
    public String getNotes() { return notes; }
}
