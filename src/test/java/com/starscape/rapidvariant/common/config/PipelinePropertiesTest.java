package com.starscape.rapidvariant.common.config;

import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePropertiesTest {
    
    @Test
    void defaultsBuildTheStandardPlan() {
        VariantPlan plan = new PipelineProperties().toVariantPlan();
        
        assertEquals(List.of("original", "lg", "md", "sm", "xs"), new ArrayList<>(plan.uploadedVariantNames()));
        assertEquals(ImageFormat.WEBP, plan.preferredFormat());
        assertEquals(82, plan.qualityFor(ImageFormat.WEBP));
        assertEquals(20, plan.placeholder().width());
        assertEquals(50, plan.constraints().maxSizeMegabytes());
        assertTrue(plan.constraints().isSupported("image/gif"));
    }
    
    @Test
    void defaultRetryPolicyMatchesUploadSettings() {
        RetryPolicy policy = new PipelineProperties().toRetryPolicy();
        
        assertEquals(3, policy.maxRetries());
        assertEquals(Duration.ofSeconds(1), policy.baseDelay());
        assertEquals(Duration.ofSeconds(4), policy.delayFor(2));
    }
    
    @Test
    void invalidConfigurationIsRejected() {
        PipelineProperties duplicateWidths = new PipelineProperties();
        duplicateWidths.setVariants(List.of(
            new PipelineProperties.Variant("lg", 1200),
            new PipelineProperties.Variant("md", 1200)));
        PipelineProperties unknownFormat = new PipelineProperties();
        unknownFormat.setPreferredFormat("bmp");
        
        assertThrows(IllegalArgumentException.class, duplicateWidths::toVariantPlan);
        assertThrows(IllegalArgumentException.class, unknownFormat::toVariantPlan);
    }
}
