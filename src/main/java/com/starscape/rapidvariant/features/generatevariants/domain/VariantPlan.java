package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated description of everything a run produces: the sized variants, the preferred
 * output format and its quality, the placeholder, and the constraints a source must meet.
 * The implicit "original" variant is not part of {@link #sizes()}.
 */
public record VariantPlan(
    List<VariantSpec> sizes,
    ImageFormat preferredFormat,
    EncodingQuality quality,
    PlaceholderSpec placeholder,
    FileConstraints constraints
) implements ValueObject {
    
    public VariantPlan {
        if (sizes == null || sizes.isEmpty()) {
            throw new IllegalArgumentException("A plan needs at least one sized variant");
        }
        if (preferredFormat == null || quality == null || placeholder == null || constraints == null) {
            throw new IllegalArgumentException("Plan format, quality, placeholder and constraints are required");
        }
        Set<String> names = new HashSet<>();
        Set<Integer> widths = new HashSet<>();
        for (VariantSpec spec : sizes) {
            if (!names.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate variant name: " + spec.name());
            }
            if (!widths.add(spec.maxWidth())) {
                throw new IllegalArgumentException("Duplicate variant width: " + spec.maxWidth());
            }
        }
        sizes = List.copyOf(sizes);
    }
    
    /**
     * Names every successful run must upload: the sized variants plus "original".
     */
    public Set<String> uploadedVariantNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(VariantSpec.ORIGINAL);
        sizes.forEach(spec -> names.add(spec.name()));
        return names;
    }
    
    public int qualityFor(ImageFormat format) {
        return quality.forFormat(format);
    }
    
    /**
     * Copy of this plan with different sized variants, keeping every other setting.
     */
    public VariantPlan withSizes(List<VariantSpec> newSizes) {
        return new VariantPlan(new ArrayList<>(newSizes), preferredFormat, quality, placeholder, constraints);
    }
}
