package com.starscape.rapidvariant.features.runpipeline.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of one pipeline run. Stages advance strictly in order; any non-terminal
 * state may settle as FAILED or ABORTED.
 */
public enum PipelineState {
    IDLE,
    VALIDATING,
    TRANSFORMING,
    GENERATING,
    UPLOADING,
    FINALIZING,
    COMPLETE,
    FAILED,
    ABORTED;
    
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == ABORTED;
    }
    
    public boolean canTransitionTo(PipelineState next) {
        return allowedTransitions().contains(next);
    }
    
    private Set<PipelineState> allowedTransitions() {
        return switch (this) {
            case IDLE -> EnumSet.of(VALIDATING, FAILED, ABORTED);
            case VALIDATING -> EnumSet.of(TRANSFORMING, FAILED, ABORTED);
            case TRANSFORMING -> EnumSet.of(GENERATING, FAILED, ABORTED);
            case GENERATING -> EnumSet.of(UPLOADING, FAILED, ABORTED);
            case UPLOADING -> EnumSet.of(FINALIZING, FAILED, ABORTED);
            case FINALIZING -> EnumSet.of(COMPLETE, FAILED, ABORTED);
            // only a failed commit may go back to finalizing; PipelineRun enforces that
            case FAILED -> EnumSet.of(FINALIZING);
            case COMPLETE, ABORTED -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
