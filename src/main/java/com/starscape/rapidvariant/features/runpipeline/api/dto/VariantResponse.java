package com.starscape.rapidvariant.features.runpipeline.api.dto;

import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;

public record VariantResponse(
    String name,
    String key,
    int width,
    int height,
    long sizeBytes,
    String contentType
) {
    public static VariantResponse from(UploadResult result) {
        return new VariantResponse(result.name(), result.remoteKey(), result.width(), result.height(),
            result.sizeBytes(), result.contentType());
    }
}
