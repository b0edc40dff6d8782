package com.starscape.rapidvariant.features.generatevariants.domain;

import javax.imageio.ImageIO;
import java.util.Locale;

/**
 * Output formats the encoder can negotiate. Each modern format names the format it falls back to
 * when no ImageIO writer is registered for it or writing fails.
 */
public enum ImageFormat {
    JPEG("jpeg", "image/jpeg", "jpg", null),
    PNG("png", "image/png", "png", null),
    GIF("gif", "image/gif", "gif", null),
    WEBP("webp", "image/webp", "webp", JPEG),
    AVIF("avif", "image/avif", "avif", WEBP);
    
    private final String writerName;
    private final String mimeType;
    private final String extension;
    private final ImageFormat fallback;
    
    ImageFormat(String writerName, String mimeType, String extension, ImageFormat fallback) {
        this.writerName = writerName;
        this.mimeType = mimeType;
        this.extension = extension;
        this.fallback = fallback;
    }
    
    public String getWriterName() {
        return writerName;
    }
    
    public String getMimeType() {
        return mimeType;
    }
    
    public String getExtension() {
        return extension;
    }
    
    public ImageFormat getFallback() {
        return fallback;
    }
    
    public boolean hasWriter() {
        return ImageIO.getImageWritersByFormatName(writerName).hasNext();
    }
    
    /**
     * JPEG cannot carry an alpha channel; rasters are flattened to RGB before writing.
     */
    public boolean supportsAlpha() {
        return this != JPEG;
    }
    
    public static ImageFormat fromMimeType(String mimeType) {
        if (mimeType == null) {
            throw new IllegalArgumentException("MIME type cannot be null");
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT).trim();
        for (ImageFormat format : values()) {
            if (format.mimeType.equals(normalized)) {
                return format;
            }
        }
        if ("image/jpg".equals(normalized)) {
            return JPEG;
        }
        throw new IllegalArgumentException("Unsupported image MIME type: " + mimeType);
    }
    
    /**
     * Parse a configuration value such as {@code webp} or {@code jpg}.
     */
    public static ImageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Format name cannot be blank");
        }
        String normalized = name.toLowerCase(Locale.ROOT).trim();
        for (ImageFormat format : values()) {
            if (format.writerName.equals(normalized) || format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown image format: " + name);
    }
}
