package com.starscape.rapidvariant.features.generatevariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.common.lifecycle.ResourceTracker;
import com.starscape.rapidvariant.features.generatevariants.domain.CropRect;
import com.starscape.rapidvariant.features.generatevariants.domain.CropSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Turns submitted bytes into the run's working raster:
 * - Decodes the source
 * - Rotates it into the axis-aligned bounding box of the rotated image
 * - Crops the requested rectangle out of the rotated canvas
 */
@Component
public class ImageTransformer {
    
    private static final Logger log = LoggerFactory.getLogger(ImageTransformer.class);
    private static final String STAGE = "TRANSFORMING";
    private static final String PREFERRED_READER_PACKAGE = "com.twelvemonkeys.";
    
    // Trig results such as cos(90deg) are not exactly zero; ignore sub-pixel noise before ceil.
    private static final double BOUNDS_EPSILON = 1e-9;
    
    /**
     * Produce the source raster for a run and register it with the run's tracker.
     *
     * @throws PipelineException DECODE_FAILED or CROP_FAILED
     * @throws com.starscape.rapidvariant.common.exception.AbortedException if the run was cancelled
     */
    public SourceRaster transform(SourceImage source, CropSpec cropSpec,
                                  CancellationToken token, ResourceTracker resources) {
        token.throwIfCancelled("before decode");
        
        BufferedImage decoded = decode(source);
        ResourceTracker.Handle decodedHandle = resources.track("decoded:" + source.filename(), decoded::flush);
        token.throwIfCancelled("after decode");
        
        log.debug("Decoded {}: {}x{}, rotation={}, crop={}", source.filename(),
            decoded.getWidth(), decoded.getHeight(), cropSpec.rotation(), cropSpec.rect());
        
        BufferedImage working = cropSpec.isRotated() ? rotate(decoded, cropSpec.rotation()) : decoded;
        BufferedImage result;
        if (cropSpec.crop().isPresent()) {
            result = crop(working, cropSpec.crop().get());
        } else {
            result = copy(working, 0, 0, working.getWidth(), working.getHeight());
        }
        if (working != decoded) {
            working.flush();
        }
        decodedHandle.release();
        
        SourceRaster raster = new SourceRaster(result, nativeFormat(source.mimeType()));
        resources.track("source-raster", raster);
        log.info("Source raster ready: {}x{} from {}", raster.width(), raster.height(), source.filename());
        return raster;
    }
    
    /**
     * Bounding box of a {@code width x height} image rotated by {@code degrees}.
     *
     * @return {width, height}
     */
    public static int[] rotatedBounds(int width, int height, double degrees) {
        double radians = Math.toRadians(degrees);
        double cos = Math.abs(Math.cos(radians));
        double sin = Math.abs(Math.sin(radians));
        int boundsWidth = (int) Math.ceil(cos * width + sin * height - BOUNDS_EPSILON);
        int boundsHeight = (int) Math.ceil(sin * width + cos * height - BOUNDS_EPSILON);
        return new int[] { Math.max(1, boundsWidth), Math.max(1, boundsHeight) };
    }
    
    private BufferedImage decode(SourceImage source) {
        try (InputStream in = source.openStream();
             ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            ImageReader reader = iis != null ? selectReader(ImageIO.getImageReaders(iis)) : null;
            if (reader == null) {
                throw new PipelineException(ErrorKind.DECODE_FAILED, STAGE, null,
                    "No image reader accepted " + source.filename() + " (" + source.mimeType() + ")", null);
            }
            try {
                reader.setInput(iis, true, true);
                log.debug("Decoding {} with {}", source.filename(), reader.getClass().getSimpleName());
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (PipelineException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new PipelineException(ErrorKind.DECODE_FAILED, STAGE, null,
                "Failed to decode " + source.filename() + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * First TwelveMonkeys reader if one matches (pure Java, handles WebP), otherwise the first reader.
     */
    private ImageReader selectReader(Iterator<ImageReader> readers) {
        ImageReader fallback = null;
        while (readers.hasNext()) {
            ImageReader candidate = readers.next();
            if (candidate.getClass().getName().startsWith(PREFERRED_READER_PACKAGE)) {
                return candidate;
            }
            if (fallback == null) {
                fallback = candidate;
            }
        }
        return fallback;
    }
    
    private BufferedImage rotate(BufferedImage image, double degrees) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] bounds = rotatedBounds(width, height, degrees);
        
        BufferedImage canvas = new BufferedImage(bounds[0], bounds[1], BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.translate(bounds[0] / 2.0, bounds[1] / 2.0);
            g.rotate(Math.toRadians(degrees));
            g.translate(-width / 2.0, -height / 2.0);
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return canvas;
    }
    
    private BufferedImage crop(BufferedImage image, CropRect rect) {
        if (!rect.fitsWithin(image.getWidth(), image.getHeight())) {
            throw new PipelineException(ErrorKind.CROP_FAILED, STAGE, null,
                String.format("Crop %dx%d at (%d,%d) exceeds image bounds %dx%d",
                    rect.width(), rect.height(), rect.x(), rect.y(), image.getWidth(), image.getHeight()),
                null);
        }
        return copy(image, rect.x(), rect.y(), rect.width(), rect.height());
    }
    
    /**
     * Copy a region into a standalone INT_RGB/INT_ARGB buffer so the decoded image can be freed.
     */
    private BufferedImage copy(BufferedImage image, int x, int y, int width, int height) {
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage target = new BufferedImage(width, height, type);
        Graphics2D g = target.createGraphics();
        try {
            g.drawImage(image, 0, 0, width, height, x, y, x + width, y + height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
    
    private ImageFormat nativeFormat(String mimeType) {
        try {
            return ImageFormat.fromMimeType(mimeType);
        } catch (IllegalArgumentException e) {
            log.debug("No native format for {}; original will be written as JPEG", mimeType);
            return ImageFormat.JPEG;
        }
    }
}
