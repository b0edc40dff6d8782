package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

/**
 * One encoded rendition. {@link #format()} is the format actually written, which may differ
 * from the one requested after a fallback.
 */
public record EncodedVariant(
    String name,
    byte[] bytes,
    int width,
    int height,
    ImageFormat format
) implements ValueObject {
    
    public EncodedVariant {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variant name cannot be blank");
        }
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Encoded bytes cannot be empty: " + name);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Variant dimensions must be positive: " + name);
        }
        if (format == null) {
            throw new IllegalArgumentException("Variant format cannot be null: " + name);
        }
        bytes = bytes.clone();
    }
    
    /**
     * @return a copy of the encoded payload
     */
    @Override
    public byte[] bytes() {
        return bytes.clone();
    }
    
    public String contentType() {
        return format.getMimeType();
    }
    
    public long sizeBytes() {
        return bytes.length;
    }
    
    @Override
    public String toString() {
        return "EncodedVariant[name=" + name + ", " + width + "x" + height
            + ", contentType=" + contentType() + ", sizeBytes=" + bytes.length + "]";
    }
}
