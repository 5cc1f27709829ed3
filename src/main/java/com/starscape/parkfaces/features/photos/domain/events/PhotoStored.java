package com.starscape.parkfaces.features.photos.domain.events;

import com.starscape.parkfaces.common.domain.DomainEvent;
import java.time.Instant;

/**
 * Domain event published by the upload subsystem once a photo file is saved
 * and its row committed. Triggers face ingestion for that photo.
 */
public record PhotoStored(
    String photoId,
    String fileReference,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "PhotoStored";
    }
    
    @Override
    public String getAggregateId() {
        return photoId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
