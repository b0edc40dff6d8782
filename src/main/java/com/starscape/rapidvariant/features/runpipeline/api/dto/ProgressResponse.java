package com.starscape.rapidvariant.features.runpipeline.api.dto;

import com.starscape.rapidvariant.features.runpipeline.domain.Progress;

public record ProgressResponse(
    int generating,
    int uploading,
    int finalizing,
    int overall
) {
    public static ProgressResponse from(Progress progress) {
        return new ProgressResponse(progress.generating(), progress.uploading(), progress.finalizing(), progress.overall());
    }
}
