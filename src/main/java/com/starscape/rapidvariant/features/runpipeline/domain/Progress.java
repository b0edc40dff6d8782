package com.starscape.rapidvariant.features.runpipeline.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

public record Progress(
    int generating,
    int uploading,
    int finalizing,
    int overall
) implements ValueObject {
    
    public Progress {
        requirePercent("generating", generating);
        requirePercent("uploading", uploading);
        requirePercent("finalizing", finalizing);
        requirePercent("overall", overall);
    }
    
    public static Progress initial() {
        return new Progress(0, 0, 0, 0);
    }
    
    /**
     * Field-wise maximum, so no field ever moves backwards.
     */
    public Progress max(Progress other) {
        return new Progress(
            Math.max(generating, other.generating),
            Math.max(uploading, other.uploading),
            Math.max(finalizing, other.finalizing),
            Math.max(overall, other.overall)
        );
    }
    
    private static void requirePercent(String field, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("Progress " + field + " must be between 0 and 100");
        }
    }
}
