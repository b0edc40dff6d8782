package com.starscape.rapidvariant.features.uploadvariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * Naming context shared by every variant of one upload.
 */
public record UploadTarget(
    String baseName,
    String uploadId
) implements ValueObject {
    
    public UploadTarget {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("Base name cannot be blank");
        }
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload ID cannot be blank");
        }
    }
}
