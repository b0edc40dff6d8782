package com.starscape.rapidvariant.features.runpipeline.api.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Crop rectangle in pixels of the rotated source.
 */
public record CropRequest(
    @PositiveOrZero int x,
    @PositiveOrZero int y,
    @Positive int width,
    @Positive int height
) {}
