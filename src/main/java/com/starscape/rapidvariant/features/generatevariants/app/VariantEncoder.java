package com.starscape.rapidvariant.features.generatevariants.app;

import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodeRequest;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodedVariant;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.PlaceholderSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Resizes the source raster and encodes it.
 * - Never upscales; height follows the source aspect ratio
 * - Walks the format fallback chain (AVIF, WebP, JPEG) until a writer succeeds
 * - Reports the format actually written so content types match the bytes
 */
@Component
public class VariantEncoder {
    
    private static final Logger log = LoggerFactory.getLogger(VariantEncoder.class);
    private static final String STAGE = "GENERATING";
    private static final String LOSSY_COMPRESSION = "Lossy";
    
    /**
     * Encode one variant. The raster is only read.
     *
     * @throws PipelineException ENCODING_FAILED when no format in the chain could be written
     */
    public EncodedVariant encode(SourceRaster raster, EncodeRequest request) {
        int[] size = request.targetWidth() == null
            ? new int[] { raster.width(), raster.height() }
            : targetSize(raster.width(), raster.height(), request.targetWidth());
        
        BufferedImage image = resize(raster.image(), size[0], size[1], request.variantName());
        try {
            Encoded encoded = write(image, request.format(), request.quality(), request.variantName());
            log.debug("Encoded variant {}: {}x{} {} ({} bytes)", request.variantName(),
                size[0], size[1], encoded.format(), encoded.bytes().length);
            return new EncodedVariant(request.variantName(), encoded.bytes(), size[0], size[1], encoded.format());
        } finally {
            if (image != raster.image()) {
                image.flush();
            }
        }
    }
    
    /**
     * Tiny low-quality preview. Always resized to the placeholder width, whatever the source width.
     */
    public EncodedVariant encodePlaceholder(SourceRaster raster, PlaceholderSpec spec) {
        int width = spec.width();
        int height = Math.max(1, (int) Math.round(width / raster.aspectRatio()));
        BufferedImage image = resize(raster.image(), width, height, VariantSpec.PLACEHOLDER);
        try {
            Encoded encoded = write(image, spec.format(), spec.quality(), VariantSpec.PLACEHOLDER);
            return new EncodedVariant(VariantSpec.PLACEHOLDER, encoded.bytes(), width, height, encoded.format());
        } finally {
            image.flush();
        }
    }
    
    /**
     * Decide the output format for a whole run with a 1x1 probe encode. Formats without a
     * fallback are universally writable and are returned without probing.
     */
    public ImageFormat probeFormat(SourceRaster raster, ImageFormat preferred, int quality) {
        if (preferred.getFallback() == null) {
            return preferred;
        }
        BufferedImage probe = resize(raster.image(), 1, 1, "probe");
        try {
            ImageFormat actual = write(probe, preferred, quality, "probe").format();
            if (actual != preferred) {
                log.info("Preferred format {} unavailable, using {} for this run", preferred, actual);
            }
            return actual;
        } finally {
            probe.flush();
        }
    }
    
    /**
     * Target dimensions for a sized variant: {@code min(targetWidth, width)} wide,
     * {@code round(width / aspectRatio)} tall.
     *
     * @return {width, height}
     */
    public static int[] targetSize(int sourceWidth, int sourceHeight, int targetWidth) {
        int width = Math.min(targetWidth, sourceWidth);
        double aspectRatio = (double) sourceWidth / sourceHeight;
        int height = Math.max(1, (int) Math.round(width / aspectRatio));
        return new int[] { width, height };
    }
    
    private BufferedImage resize(BufferedImage source, int width, int height, String variantName) {
        if (source.getWidth() == width && source.getHeight() == height) {
            return source;
        }
        try {
            return Thumbnails.of(source)
                    .forceSize(width, height)
                    .asBufferedImage();
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.ENCODING_FAILED, STAGE, variantName,
                "Failed to resize to " + width + "x" + height + ": " + e.getMessage(), e);
        }
    }
    
    private Encoded write(BufferedImage image, ImageFormat requested, int quality, String variantName) {
        ImageFormat format = requested;
        Throwable lastFailure = null;
        while (format != null) {
            if (!format.hasWriter()) {
                log.debug("No ImageIO writer for {}; trying fallback {}", format, format.getFallback());
                format = format.getFallback();
                continue;
            }
            try {
                byte[] bytes = writeWith(image, format, quality);
                if (bytes.length > 0) {
                    return new Encoded(bytes, format);
                }
                lastFailure = new IOException(format + " writer produced no output");
            } catch (IOException | RuntimeException | LinkageError e) {
                // native codec plugins report a missing library as a LinkageError
                lastFailure = e;
            }
            log.warn("Encoding {} as {} failed, falling back to {}: {}",
                variantName, format, format.getFallback(), lastFailure.getMessage());
            format = format.getFallback();
        }
        throw new PipelineException(ErrorKind.ENCODING_FAILED, STAGE, variantName,
            "No encoder could write " + variantName + " as " + requested
                + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
    }
    
    private byte[] writeWith(BufferedImage image, ImageFormat format, int quality) throws IOException {
        BufferedImage prepared = format.supportsAlpha() ? image : flatten(image);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getWriterName());
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (isLossy(format) && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] types = param.getCompressionTypes();
                if (types != null && Arrays.asList(types).contains(LOSSY_COMPRESSION)) {
                    param.setCompressionType(LOSSY_COMPRESSION);
                } else if (types != null && types.length > 0 && param.getCompressionType() == null) {
                    param.setCompressionType(types[0]);
                }
                param.setCompressionQuality(quality / 100f);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(prepared, null, null), param);
            ios.flush();
            return baos.toByteArray();
        } finally {
            writer.dispose();
            if (prepared != image) {
                prepared.flush();
            }
        }
    }
    
    private boolean isLossy(ImageFormat format) {
        return format == ImageFormat.JPEG || format == ImageFormat.WEBP || format == ImageFormat.AVIF;
    }
    
    /**
     * Draw onto an opaque white RGB canvas; transparent areas (rotation corners, PNG alpha)
     * would otherwise turn black in JPEG.
     */
    private BufferedImage flatten(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
    
    private record Encoded(byte[] bytes, ImageFormat format) {
    }
}
