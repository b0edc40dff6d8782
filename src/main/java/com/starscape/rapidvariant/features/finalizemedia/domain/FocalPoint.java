package com.starscape.rapidvariant.features.finalizemedia.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * Point of interest as percentages of width and height.
 */
public record FocalPoint(double x, double y) implements ValueObject {
    
    public FocalPoint {
        if (x < 0 || x > 100 || y < 0 || y > 100) {
            throw new IllegalArgumentException("Focal point coordinates must be between 0 and 100");
        }
    }
    
    public static FocalPoint center() {
        return new FocalPoint(50, 50);
    }
}
