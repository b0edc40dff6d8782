package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

import java.util.Optional;

/**
 * Crop and rotation applied to the source before any variant is derived.
 * Rotation is normalised into [0, 360).
 */
public record CropSpec(
    CropRect rect,
    double rotation
) implements ValueObject {
    
    public CropSpec {
        if (Double.isNaN(rotation) || Double.isInfinite(rotation)) {
            throw new IllegalArgumentException("Rotation must be a finite number of degrees");
        }
        rotation = ((rotation % 360.0) + 360.0) % 360.0;
    }
    
    public static CropSpec none() {
        return new CropSpec(null, 0);
    }
    
    public static CropSpec of(CropRect rect) {
        return new CropSpec(rect, 0);
    }
    
    public Optional<CropRect> crop() {
        return Optional.ofNullable(rect);
    }
    
    public boolean isRotated() {
        return rotation != 0.0;
    }
}
