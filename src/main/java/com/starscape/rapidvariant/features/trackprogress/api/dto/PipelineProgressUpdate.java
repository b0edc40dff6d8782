package com.starscape.rapidvariant.features.trackprogress.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.starscape.rapidvariant.features.runpipeline.api.dto.PipelineResultResponse;

import java.time.Instant;

/**
 * Progress update DTO for WebSocket broadcasts.
 * Sent on every progress change and state change of a run; {@code result} is set once the run settles.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineProgressUpdate(
    String runId,
    String uploadId,
    String state,
    int generating,
    int uploading,
    int finalizing,
    int overall,
    PipelineResultResponse result,
    Instant timestamp
) {}
