package com.starscape.rapidvariant.features.generatevariants.domain;

import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decoded, cropped working buffer of one run. Read-only once produced and shared by every
 * encode of that run; released by the run's resource tracker.
 */
public class SourceRaster implements AutoCloseable {
    
    private final BufferedImage image;
    private final ImageFormat nativeFormat;
    private final AtomicBoolean released = new AtomicBoolean(false);
    
    public SourceRaster(BufferedImage image, ImageFormat nativeFormat) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        this.image = image;
        this.nativeFormat = nativeFormat;
    }
    
    public BufferedImage image() {
        if (released.get()) {
            throw new IllegalStateException("Source raster already released");
        }
        return image;
    }
    
    public int width() {
        return image.getWidth();
    }
    
    public int height() {
        return image.getHeight();
    }
    
    /**
     * Width divided by height.
     */
    public double aspectRatio() {
        return (double) image.getWidth() / image.getHeight();
    }
    
    /**
     * Format the source was submitted in; the "original" variant is written back in it.
     */
    public ImageFormat nativeFormat() {
        return nativeFormat;
    }
    
    public boolean isReleased() {
        return released.get();
    }
    
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            image.flush();
        }
    }
}
