package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

public record VariantSpec(
    String name,
    int maxWidth
) implements ValueObject {
    
    public static final String ORIGINAL = "original";
    public static final String PLACEHOLDER = "placeholder";
    
    public VariantSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variant name cannot be blank");
        }
        if (ORIGINAL.equals(name) || PLACEHOLDER.equals(name)) {
            throw new IllegalArgumentException("Variant name is reserved: " + name);
        }
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("Variant width must be positive: " + name);
        }
    }
}
