package com.starscape.rapidvariant.features.runpipeline.api.dto;

public record SubmitMediaUploadResponse(
    String runId,
    String uploadId,
    String state
) {}
