package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadStatusResponse;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import org.springframework.stereotype.Service;

/**
 * Handler for retrying the commit of a run that stored every variant but failed to save the record.
 */
@Service
public class RetryCommitHandler {
    
    private final PipelineRunRegistry registry;
    private final VariantPipelineRunner runner;
    private final GetMediaUploadStatusHandler statusHandler;
    
    public RetryCommitHandler(
            PipelineRunRegistry registry,
            VariantPipelineRunner runner,
            GetMediaUploadStatusHandler statusHandler) {
        this.registry = registry;
        this.runner = runner;
        this.statusHandler = statusHandler;
    }
    
    public MediaUploadStatusResponse handle(String runId) {
        PipelineRun run = registry.require(runId);
        runner.retryCommit(run);
        return statusHandler.toResponse(run);
    }
}
