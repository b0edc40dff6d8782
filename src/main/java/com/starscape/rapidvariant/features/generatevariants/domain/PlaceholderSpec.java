package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

public record PlaceholderSpec(
    int width,
    ImageFormat format,
    int quality
) implements ValueObject {
    
    public PlaceholderSpec {
        if (width <= 0) {
            throw new IllegalArgumentException("Placeholder width must be positive");
        }
        if (format == null) {
            throw new IllegalArgumentException("Placeholder format cannot be null");
        }
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Placeholder quality must be between 0 and 100");
        }
    }
}
