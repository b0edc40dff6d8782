package com.starscape.rapidvariant.features.trackprogress.app;

import com.starscape.rapidvariant.features.trackprogress.api.dto.MediaCommittedUpdate;
import com.starscape.rapidvariant.features.trackprogress.api.dto.PipelineProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for broadcasting run progress and committed media via WebSocket.
 */
@Service
public class ProgressBroadcaster {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    
    static final String RUN_TOPIC_PREFIX = "/topic/media-uploads/";
    static final String MEDIA_TOPIC = "/topic/media";
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    public void broadcastProgress(PipelineProgressUpdate update) {
        String destination = RUN_TOPIC_PREFIX + update.runId();
        messagingTemplate.convertAndSend(destination, update);
        log.debug("Broadcasted progress to {}: state={}, overall={}",
            destination, update.state(), update.overall());
    }
    
    public void broadcastMediaCommitted(MediaCommittedUpdate update) {
        messagingTemplate.convertAndSend(MEDIA_TOPIC, update);
        log.info("Broadcasted committed media {} (upload {})", update.recordId(), update.uploadId());
    }
}
