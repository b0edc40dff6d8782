package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadStatusResponse;
import com.starscape.rapidvariant.features.runpipeline.api.dto.PipelineResultResponse;
import com.starscape.rapidvariant.features.runpipeline.api.dto.ProgressResponse;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import org.springframework.stereotype.Service;

@Service
public class GetMediaUploadStatusHandler {
    
    private final PipelineRunRegistry registry;
    
    public GetMediaUploadStatusHandler(PipelineRunRegistry registry) {
        this.registry = registry;
    }
    
    public MediaUploadStatusResponse handle(String runId) {
        return toResponse(registry.require(runId));
    }
    
    MediaUploadStatusResponse toResponse(PipelineRun run) {
        PipelineResultResponse result = run.getResult()
                .map(r -> PipelineResultResponse.from(r, run.getPendingCommit().isPresent()))
                .orElse(null);
        return new MediaUploadStatusResponse(
            run.getRunId(),
            run.getUploadId(),
            run.getState().name(),
            ProgressResponse.from(run.getProgress().snapshot()),
            result,
            run.getCreatedAt(),
            run.getSettledAt().orElse(null)
        );
    }
}
