package com.starscape.rapidvariant.features.uploadvariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

public record UploadResult(
    String name,
    String remoteKey,
    int width,
    int height,
    long sizeBytes,
    String contentType
) implements ValueObject {
    
    public UploadResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variant name cannot be blank");
        }
        if (remoteKey == null || remoteKey.isBlank()) {
            throw new IllegalArgumentException("Remote key cannot be blank");
        }
    }
}
