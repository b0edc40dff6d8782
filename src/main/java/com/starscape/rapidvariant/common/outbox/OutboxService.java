package com.starscape.rapidvariant.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.rapidvariant.common.domain.DomainEvent;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class OutboxService {
    
    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public OutboxService(OutboxEventRepository outboxRepository, ObjectMapper objectMapper, Clock clock) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }
    
    /**
     * Append an event. Joins the caller's transaction so the event commits or rolls back with the aggregate.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(DomainEvent event, String aggregateType) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.getEventType(), e);
        }
        String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        outboxRepository.save(new OutboxEvent(
            eventId,
            aggregateType,
            event.getAggregateId(),
            event.getEventType(),
            payload,
            event.getOccurredOn()
        ));
    }
    
    @Transactional(readOnly = true)
    public List<OutboxEvent> pending(String eventType, int limit) {
        return outboxRepository.findUnprocessedByType(eventType, PageRequest.of(0, limit));
    }
    
    @Transactional
    public void markProcessed(String eventId) {
        outboxRepository.findById(eventId).ifPresent(event -> {
            event.markProcessed(clock.instant());
            outboxRepository.save(event);
        });
    }
}
