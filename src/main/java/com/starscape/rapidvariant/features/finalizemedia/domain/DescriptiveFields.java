package com.starscape.rapidvariant.features.finalizemedia.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * Human-supplied description stored with the record. Name and alt text are required,
 * which the pipeline checks during validation so a missing value fails the run early.
 */
public record DescriptiveFields(
    String name,
    String altText,
    String caption,
    String credit,
    String aspectRatio,
    FocalPoint focalPoint
) implements ValueObject {
    
    public DescriptiveFields {
        name = trimToNull(name);
        altText = trimToNull(altText);
        caption = trimToNull(caption);
        credit = trimToNull(credit);
        aspectRatio = trimToNull(aspectRatio);
        if (focalPoint == null) {
            focalPoint = FocalPoint.center();
        }
    }
    
    public static DescriptiveFields of(String name, String altText) {
        return new DescriptiveFields(name, altText, null, null, null, null);
    }
    
    public boolean hasRequiredFields() {
        return name != null && altText != null;
    }
    
    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
