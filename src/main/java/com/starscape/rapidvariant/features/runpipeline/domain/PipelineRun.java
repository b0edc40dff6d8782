package com.starscape.rapidvariant.features.runpipeline.domain;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.domain.AggregateRoot;
import com.starscape.rapidvariant.common.lifecycle.ResourceTracker;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitRequest;
import com.starscape.rapidvariant.features.finalizemedia.domain.DescriptiveFields;
import com.starscape.rapidvariant.features.generatevariants.domain.CropSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One single-use execution of the pipeline for one source image. Owns the cancellation
 * token, the resource tracker and the progress of the run; state changes are checked
 * against {@link PipelineState#canTransitionTo(PipelineState)}.
 */
public class PipelineRun extends AggregateRoot<String> {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);
    
    private final String runId;
    private final String uploadId;
    private final String baseName;
    private final CropSpec cropSpec;
    private final VariantPlan plan;
    private final DescriptiveFields fields;
    private final Instant createdAt;
    
    private final CancellationToken token = new CancellationToken();
    private final ResourceTracker resources;
    private final ProgressTracker progress;
    private final List<PipelineRunListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    
    private volatile SourceImage source;
    private volatile PipelineState state = PipelineState.IDLE;
    private volatile PipelineResult result;
    private volatile CommitRequest pendingCommit;
    private volatile Instant settledAt;
    
    public PipelineRun(String runId, String uploadId, String baseName, SourceImage source,
                       CropSpec cropSpec, VariantPlan plan, DescriptiveFields fields, Instant createdAt) {
        super(runId);
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload ID cannot be blank");
        }
        if (source == null || plan == null || fields == null) {
            throw new IllegalArgumentException("Source, plan and fields are required");
        }
        this.runId = runId;
        this.uploadId = uploadId;
        this.baseName = baseName;
        this.source = source;
        this.cropSpec = cropSpec != null ? cropSpec : CropSpec.none();
        this.plan = plan;
        this.fields = fields;
        this.createdAt = createdAt;
        this.resources = new ResourceTracker("run " + runId);
        this.progress = new ProgressTracker(snapshot -> notifyListeners(l -> l.onProgress(this, snapshot)));
    }
    
    /**
     * Claim the run for execution.
     *
     * @throws IllegalStateException if the run was already started
     */
    public void begin() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Run " + runId + " has already been started");
        }
    }
    
    public void addListener(PipelineRunListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }
    
    public synchronized void transitionTo(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + next);
        }
        if (next == PipelineState.FINALIZING && state == PipelineState.FAILED && pendingCommit == null) {
            throw new IllegalStateException("Run " + runId + " has no pending commit to retry");
        }
        log.debug("Run {}: {} -> {}", runId, state, next);
        state = next;
        notifyState(next);
    }
    
    public void complete(PipelineResult.Success success) {
        settle(PipelineState.COMPLETE, success, null);
    }
    
    /**
     * @param retryableCommit the commit request to keep for a later commit retry, or null
     */
    public void fail(PipelineResult.Failed failure, CommitRequest retryableCommit) {
        settle(PipelineState.FAILED, failure, retryableCommit);
    }
    
    public void abort() {
        settle(PipelineState.ABORTED, new PipelineResult.Aborted(), null);
    }
    
    /**
     * Request cancellation. No effect once the run has settled.
     *
     * @return true if this call cancelled the run
     */
    public boolean cancel() {
        if (state.isTerminal()) {
            return false;
        }
        boolean cancelled = token.cancel();
        if (cancelled) {
            log.info("Cancellation requested for run {} in state {}", runId, state);
        }
        return cancelled;
    }
    
    /**
     * Re-enter FINALIZING for a run whose commit failed, handing back the kept request.
     *
     * @throws IllegalStateException if the run is not a failed run with a pending commit
     */
    public synchronized CommitRequest beginCommitRetry() {
        if (state != PipelineState.FAILED || pendingCommit == null) {
            throw new IllegalStateException("Run " + runId + " has no failed commit to retry");
        }
        CommitRequest request = pendingCommit;
        transitionTo(PipelineState.FINALIZING);
        result = null;
        settledAt = null;
        return request;
    }
    
    private void settle(PipelineState terminal, PipelineResult outcome, CommitRequest retryableCommit) {
        synchronized (this) {
            transitionTo(terminal);
            result = outcome;
            pendingCommit = retryableCommit;
            settledAt = Instant.now();
            // settled runs stay registered for status queries; only a failed commit needs state kept
            source = null;
        }
        notifyListeners(l -> l.onSettled(this, outcome));
    }
    
    private void notifyState(PipelineState next) {
        notifyListeners(l -> l.onStateChanged(this, next));
    }
    
    private void notifyListeners(Consumer<PipelineRunListener> callback) {
        for (PipelineRunListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed for run {}", listener.getClass().getSimpleName(), runId, e);
            }
        }
    }
    
    @Override
    public String getId() {
        return runId;
    }
    
    public String getRunId() { return runId; }
    public String getUploadId() { return uploadId; }
    public String getBaseName() { return baseName; }
    
    /**
     * @throws IllegalStateException once the run has settled and dropped its source bytes
     */
    public SourceImage getSource() {
        SourceImage current = source;
        if (current == null) {
            throw new IllegalStateException("Run " + runId + " released its source when it settled");
        }
        return current;
    }
    
    public boolean isSourceReleased() {
        return source == null;
    }
    
    public CropSpec getCropSpec() { return cropSpec; }
    public VariantPlan getPlan() { return plan; }
    public DescriptiveFields getFields() { return fields; }
    public Instant getCreatedAt() { return createdAt; }
    public CancellationToken getToken() { return token; }
    public ResourceTracker getResources() { return resources; }
    public ProgressTracker getProgress() { return progress; }
    public PipelineState getState() { return state; }
    public Optional<PipelineResult> getResult() { return Optional.ofNullable(result); }
    public Optional<CommitRequest> getPendingCommit() { return Optional.ofNullable(pendingCommit); }
    public Optional<Instant> getSettledAt() { return Optional.ofNullable(settledAt); }
    
    public boolean isSettled() {
        return state.isTerminal();
    }
}
