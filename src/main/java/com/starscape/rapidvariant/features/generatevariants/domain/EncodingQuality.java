package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * Encoder quality per output format, on a 0-100 scale.
 */
public record EncodingQuality(
    int avif,
    int webp,
    int jpeg,
    int original
) implements ValueObject {
    
    public EncodingQuality {
        requireRange("avif", avif);
        requireRange("webp", webp);
        requireRange("jpeg", jpeg);
        requireRange("original", original);
    }
    
    public int forFormat(ImageFormat format) {
        return switch (format) {
            case AVIF -> avif;
            case WEBP -> webp;
            case JPEG -> jpeg;
            case PNG, GIF -> original;
        };
    }
    
    private static void requireRange(String name, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("Quality for " + name + " must be between 0 and 100");
        }
    }
}
