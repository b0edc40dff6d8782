package com.starscape.rapidvariant.common.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Event row written in the same transaction as the aggregate that raised it,
 * relayed afterwards and then marked processed.
 */
@Entity
@Table(name = "outbox_events")
public class OutboxEvent {
    
    @Id
    @Column(name = "event_id")
    private String eventId;
    
    @Column(name = "aggregate_type", nullable = false)
    private String aggregateType;
    
    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;
    
    @Column(name = "event_type", nullable = false)
    private String eventType;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String payload;
    
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;
    
    @Column(name = "processed_at")
    private Instant processedAt;
    
    protected OutboxEvent() {
        // JPA constructor
    }
    
    public OutboxEvent(String eventId, String aggregateType, String aggregateId,
                       String eventType, String payload, Instant occurredAt) {
        this.eventId = eventId;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.occurredAt = occurredAt;
    }
    
    public String getEventId() { return eventId; }
    public String getAggregateType() { return aggregateType; }
    public String getAggregateId() { return aggregateId; }
    public String getEventType() { return eventType; }
    public String getPayload() { return payload; }
    public Instant getOccurredAt() { return occurredAt; }
    public Instant getProcessedAt() { return processedAt; }
    
    public void markProcessed(Instant at) {
        this.processedAt = at;
    }
    
    public boolean isProcessed() {
        return processedAt != null;
    }
}
