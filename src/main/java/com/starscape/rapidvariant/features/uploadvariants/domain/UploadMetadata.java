package com.starscape.rapidvariant.features.uploadvariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * What the storage capability needs to place one variant. Together {@code uploadId} and
 * {@code variantName} identify the logical object, so a retried upload lands on the same key.
 */
public record UploadMetadata(
    String baseName,
    String uploadId,
    String variantName,
    int width,
    int height,
    String contentType,
    String extension
) implements ValueObject {
    
    public UploadMetadata {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("Base name cannot be blank");
        }
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload ID cannot be blank");
        }
        if (variantName == null || variantName.isBlank()) {
            throw new IllegalArgumentException("Variant name cannot be blank");
        }
    }
}
