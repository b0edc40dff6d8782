package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * Crop rectangle in pixel space of the (rotated) source.
 */
public record CropRect(
    int x,
    int y,
    int width,
    int height
) implements ValueObject {
    
    public CropRect {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Crop origin cannot be negative");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Crop width and height must be positive");
        }
    }
    
    public boolean fitsWithin(int boundsWidth, int boundsHeight) {
        return (long) x + width <= boundsWidth && (long) y + height <= boundsHeight;
    }
}
