package com.starscape.rapidvariant.features.generatevariants.domain;

/**
 * Instruction for one encode. A null {@code targetWidth} keeps the raster's own width.
 */
public record EncodeRequest(
    String variantName,
    Integer targetWidth,
    ImageFormat format,
    int quality
) {
    
    public EncodeRequest {
        if (variantName == null || variantName.isBlank()) {
            throw new IllegalArgumentException("Variant name cannot be blank");
        }
        if (targetWidth != null && targetWidth <= 0) {
            throw new IllegalArgumentException("Target width must be positive");
        }
        if (format == null) {
            throw new IllegalArgumentException("Format cannot be null");
        }
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Quality must be between 0 and 100");
        }
    }
    
    public static EncodeRequest sized(VariantSpec spec, ImageFormat format, int quality) {
        return new EncodeRequest(spec.name(), spec.maxWidth(), format, quality);
    }
    
    public static EncodeRequest original(ImageFormat format, int quality) {
        return new EncodeRequest(VariantSpec.ORIGINAL, null, format, quality);
    }
}
