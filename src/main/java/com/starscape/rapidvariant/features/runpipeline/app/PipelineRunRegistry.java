package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.common.config.PipelineProperties;
import com.starscape.rapidvariant.common.exception.NotFoundException;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of runs by run ID. Settled runs are kept for the configured retention
 * so their result can still be queried, then evicted.
 */
@Component
public class PipelineRunRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineRunRegistry.class);
    
    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;
    
    public PipelineRunRegistry(PipelineProperties properties, Clock clock) {
        this.retention = properties.getRunRetention();
        this.clock = clock;
    }
    
    public void register(PipelineRun run) {
        if (runs.putIfAbsent(run.getRunId(), run) != null) {
            throw new IllegalStateException("Run already registered: " + run.getRunId());
        }
    }
    
    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }
    
    public PipelineRun require(String runId) {
        return find(runId).orElseThrow(() -> new NotFoundException("Upload run not found: " + runId));
    }
    
    public void remove(String runId) {
        runs.remove(runId);
    }
    
    public int size() {
        return runs.size();
    }
    
    @Scheduled(fixedDelayString = "${app.pipeline.eviction-interval-ms:60000}")
    public void evictSettled() {
        Instant cutoff = clock.instant().minus(retention);
        int before = runs.size();
        runs.values().removeIf(run -> run.isSettled()
            && run.getSettledAt().map(at -> at.isBefore(cutoff)).orElse(false));
        int evicted = before - runs.size();
        if (evicted > 0) {
            log.info("Evicted {} settled upload runs", evicted);
        }
    }
    
    /**
     * Cancel whatever is still running when the application stops.
     */
    @PreDestroy
    public void cancelActive() {
        long cancelled = runs.values().stream().filter(PipelineRun::cancel).count();
        if (cancelled > 0) {
            log.info("Cancelled {} active upload runs on shutdown", cancelled);
        }
    }
}
