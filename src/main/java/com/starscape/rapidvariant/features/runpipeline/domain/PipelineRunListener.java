package com.starscape.rapidvariant.features.runpipeline.domain;

/**
 * Observer of run state and progress. Callbacks arrive on pipeline threads.
 */
public interface PipelineRunListener {
    
    default void onStateChanged(PipelineRun run, PipelineState state) {
    }
    
    default void onProgress(PipelineRun run, Progress progress) {
    }
    
    default void onSettled(PipelineRun run, PipelineResult result) {
    }
}
