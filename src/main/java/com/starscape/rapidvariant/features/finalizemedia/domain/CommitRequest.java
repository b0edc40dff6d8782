package com.starscape.rapidvariant.features.finalizemedia.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;

import java.util.List;
import java.util.Set;

/**
 * Everything the committer needs to create the record for one upload.
 * Kept by a run that failed to commit so the commit alone can be retried.
 */
public record CommitRequest(
    String uploadId,
    String baseName,
    List<UploadResult> variants,
    Set<String> requiredVariants,
    String placeholderDataUri,
    String mimeType,
    DescriptiveFields fields
) implements ValueObject {
    
    public CommitRequest {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload ID cannot be blank");
        }
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("A commit needs at least one variant");
        }
        if (fields == null) {
            throw new IllegalArgumentException("Descriptive fields are required");
        }
        variants = List.copyOf(variants);
        requiredVariants = requiredVariants == null ? Set.of() : Set.copyOf(requiredVariants);
    }
}
