package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * Raw submitted file. The byte array is owned by this record and never handed out for mutation;
 * readers go through {@link #openStream()}.
 */
public record SourceImage(
    String filename,
    byte[] bytes,
    String mimeType,
    long sizeBytes
) implements ValueObject {
    
    public SourceImage {
        if (bytes == null) {
            throw new IllegalArgumentException("Image bytes cannot be null");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("MIME type cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        filename = filename == null || filename.isBlank() ? "image" : filename;
    }
    
    public static SourceImage of(String filename, byte[] bytes, String mimeType) {
        return new SourceImage(filename, bytes, mimeType, bytes.length);
    }
    
    public InputStream openStream() {
        return new ByteArrayInputStream(bytes);
    }
    
    @Override
    public String toString() {
        return "SourceImage[filename=" + filename + ", mimeType=" + mimeType + ", sizeBytes=" + sizeBytes + "]";
    }
}
