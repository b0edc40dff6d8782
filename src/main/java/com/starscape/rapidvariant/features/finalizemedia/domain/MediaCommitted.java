package com.starscape.rapidvariant.features.finalizemedia.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.starscape.rapidvariant.common.domain.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Domain event published when a media record is committed with all of its variants.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaCommitted(
    String recordId,
    String uploadId,
    String name,
    List<String> variantNames,
    Instant occurredOn
) implements DomainEvent {
    
    public static final String EVENT_TYPE = "MediaCommitted";
    
    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
    
    @Override
    public String getAggregateId() {
        return recordId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
