package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import org.springframework.stereotype.Service;

/**
 * Handler for cancelling a run. Idempotent; a settled run is left as it is.
 */
@Service
public class CancelMediaUploadHandler {
    
    private final PipelineRunRegistry registry;
    
    public CancelMediaUploadHandler(PipelineRunRegistry registry) {
        this.registry = registry;
    }
    
    /**
     * @return true if this request cancelled the run
     */
    public boolean handle(String runId) {
        PipelineRun run = registry.require(runId);
        return run.cancel();
    }
}
