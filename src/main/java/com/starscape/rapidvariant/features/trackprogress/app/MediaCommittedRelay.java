package com.starscape.rapidvariant.features.trackprogress.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.rapidvariant.common.outbox.OutboxEvent;
import com.starscape.rapidvariant.common.outbox.OutboxService;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaCommitted;
import com.starscape.rapidvariant.features.trackprogress.api.dto.MediaCommittedUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Relays {@code MediaCommitted} outbox events to {@code /topic/media} and marks them processed.
 * An event whose payload cannot be read is marked processed too, so it does not block the queue.
 */
@Service
public class MediaCommittedRelay {
    
    private static final Logger log = LoggerFactory.getLogger(MediaCommittedRelay.class);
    private static final int BATCH_SIZE = 100;
    
    private final OutboxService outboxService;
    private final ProgressBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    
    public MediaCommittedRelay(OutboxService outboxService, ProgressBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.outboxService = outboxService;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }
    
    @Scheduled(fixedDelayString = "${app.outbox.relay-interval-ms:2000}")
    public void relay() {
        List<OutboxEvent> events = outboxService.pending(MediaCommitted.EVENT_TYPE, BATCH_SIZE);
        for (OutboxEvent event : events) {
            try {
                MediaCommitted committed = objectMapper.readValue(event.getPayload(), MediaCommitted.class);
                broadcaster.broadcastMediaCommitted(new MediaCommittedUpdate(
                    committed.recordId(),
                    committed.uploadId(),
                    committed.name(),
                    committed.variantNames(),
                    committed.occurredOn()
                ));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable outbox event {}", event.getEventId(), e);
            }
            outboxService.markProcessed(event.getEventId());
        }
        if (!events.isEmpty()) {
            log.debug("Relayed {} committed media events", events.size());
        }
    }
}
