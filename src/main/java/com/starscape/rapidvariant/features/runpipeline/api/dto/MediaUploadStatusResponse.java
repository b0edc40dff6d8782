package com.starscape.rapidvariant.features.runpipeline.api.dto;

import java.time.Instant;

public record MediaUploadStatusResponse(
    String runId,
    String uploadId,
    String state,
    ProgressResponse progress,
    PipelineResultResponse result,
    Instant createdAt,
    Instant settledAt
) {}
