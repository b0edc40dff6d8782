package com.starscape.rapidvariant.features.generatevariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.common.lifecycle.ResourceTracker;
import com.starscape.rapidvariant.features.generatevariants.domain.CropRect;
import com.starscape.rapidvariant.features.generatevariants.domain.CropSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import com.starscape.rapidvariant.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ImageTransformerTest {
    
    private ImageTransformer transformer;
    private ResourceTracker resources;
    private CancellationToken token;
    
    @BeforeEach
    void setUp() {
        transformer = new ImageTransformer();
        resources = new ResourceTracker("test-run");
        token = new CancellationToken();
    }
    
    @Test
    void wholeImageWithoutCrop() {
        SourceRaster raster = transformer.transform(TestImages.jpegSource(640, 480), CropSpec.none(), token, resources);
        
        assertEquals(640, raster.width());
        assertEquals(480, raster.height());
        assertEquals(ImageFormat.JPEG, raster.nativeFormat());
    }
    
    @Test
    void decodesLosslessWebp() {
        SourceImage webp = SourceImage.of("pixel.webp", TestImages.webpLossless(), "image/webp");
        
        SourceRaster raster = transformer.transform(webp, CropSpec.none(), token, resources);
        
        assertEquals(1, raster.width());
        assertEquals(1, raster.height());
        assertEquals(ImageFormat.WEBP, raster.nativeFormat());
    }
    
    @Test
    void decodesLossyWebp() {
        SourceImage webp = SourceImage.of("pixel.webp", TestImages.webpLossy(), "image/webp");
        
        SourceRaster raster = transformer.transform(webp, CropSpec.none(), token, resources);
        
        assertEquals(1, raster.width());
        assertEquals(1, raster.height());
        assertEquals(1, resources.size());
    }
    
    @Test
    void cropsToRectangle() {
        CropSpec crop = CropSpec.of(new CropRect(100, 0, 300, 300));
        
        SourceRaster raster = transformer.transform(TestImages.jpegSource(640, 480), crop, token, resources);
        
        assertEquals(300, raster.width());
        assertEquals(300, raster.height());
    }
    
    @Test
    void rotationSwapsDimensionsAtNinetyDegrees() {
        SourceRaster raster = transformer.transform(TestImages.jpegSource(400, 200), new CropSpec(null, 90), token, resources);
        
        assertEquals(200, raster.width());
        assertEquals(400, raster.height());
    }
    
    @Test
    void cropAppliesInRotatedSpace() {
        // 400x200 rotated by 90 is 200x400; this rectangle only fits after rotation
        CropSpec crop = new CropSpec(new CropRect(0, 250, 200, 150), 90);
        
        SourceRaster raster = transformer.transform(TestImages.jpegSource(400, 200), crop, token, resources);
        
        assertEquals(200, raster.width());
        assertEquals(150, raster.height());
    }
    
    @Test
    void rotatedBoundsUseCeilingOfProjectedSize() {
        assertArrayEquals(new int[] {107, 107}, ImageTransformer.rotatedBounds(100, 50, 45));
        assertArrayEquals(new int[] {50, 100}, ImageTransformer.rotatedBounds(100, 50, 270));
        assertArrayEquals(new int[] {100, 50}, ImageTransformer.rotatedBounds(100, 50, 180));
    }
    
    @Test
    void negativeRotationIsNormalised() {
        assertEquals(270.0, new CropSpec(null, -90).rotation());
        assertEquals(0.0, new CropSpec(null, 720).rotation());
    }
    
    @Test
    void cropOutsideBoundsFailsWithCropFailed() {
        CropSpec crop = CropSpec.of(new CropRect(500, 0, 300, 300));
        
        PipelineException e = assertThrows(PipelineException.class,
            () -> transformer.transform(TestImages.jpegSource(640, 480), crop, token, resources));
        
        assertEquals(ErrorKind.CROP_FAILED, e.getKind());
    }
    
    @Test
    void undecodableBytesFailWithDecodeFailed() {
        SourceImage garbage = SourceImage.of("broken.jpg", "not an image".getBytes(StandardCharsets.UTF_8), "image/jpeg");
        
        PipelineException e = assertThrows(PipelineException.class,
            () -> transformer.transform(garbage, CropSpec.none(), token, resources));
        
        assertEquals(ErrorKind.DECODE_FAILED, e.getKind());
    }
    
    @Test
    void cancelledTokenAbortsBeforeDecoding() {
        token.cancel();
        
        assertThrows(AbortedException.class,
            () -> transformer.transform(TestImages.jpegSource(64, 64), CropSpec.none(), token, resources));
        assertEquals(0, resources.size());
    }
    
    @Test
    void rasterIsTrackedAndReleasedWithTheRun() {
        SourceRaster raster = transformer.transform(TestImages.jpegSource(64, 64), CropSpec.none(), token, resources);
        
        assertEquals(1, resources.size());
        resources.releaseAll();
        
        assertTrue(raster.isReleased());
        assertThrows(IllegalStateException.class, raster::image);
    }
}
