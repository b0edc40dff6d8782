package com.starscape.rapidvariant.common.config;

import com.starscape.rapidvariant.features.generatevariants.domain.EncodingQuality;
import com.starscape.rapidvariant.features.generatevariants.domain.FileConstraints;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.PlaceholderSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Configuration properties for the variant pipeline.
 * Binds to app.pipeline.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {
    
    private List<Variant> variants = new ArrayList<>(List.of(
        new Variant("lg", 2048),
        new Variant("md", 1200),
        new Variant("sm", 720),
        new Variant("xs", 360)
    ));
    private String preferredFormat = "webp";
    private Quality quality = new Quality();
    private Placeholder placeholder = new Placeholder();
    private long maxFileSizeBytes = 50L * 1024 * 1024;
    private List<String> supportedFormats = new ArrayList<>(List.of(
        "image/jpeg", "image/png", "image/webp", "image/gif"
    ));
    private Upload upload = new Upload();
    private Offload offload = new Offload();
    private Duration runRetention = Duration.ofMinutes(30);
    
    /**
     * Build the validated plan. Throws {@link IllegalArgumentException} on an invalid configuration.
     */
    public VariantPlan toVariantPlan() {
        List<VariantSpec> sizes = variants.stream()
                .map(variant -> new VariantSpec(variant.getName(), variant.getMaxWidth()))
                .toList();
        return new VariantPlan(
            sizes,
            ImageFormat.fromName(preferredFormat),
            new EncodingQuality(quality.getAvif(), quality.getWebp(), quality.getJpeg(), quality.getOriginal()),
            new PlaceholderSpec(placeholder.getWidth(), ImageFormat.fromName(placeholder.getFormat()), placeholder.getQuality()),
            new FileConstraints(maxFileSizeBytes, new HashSet<>(supportedFormats))
        );
    }
    
    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(upload.getMaxRetries(), Duration.ofMillis(upload.getBaseDelayMs()));
    }
    
    public List<Variant> getVariants() {
        return variants;
    }
    
    public void setVariants(List<Variant> variants) {
        this.variants = variants;
    }
    
    public String getPreferredFormat() {
        return preferredFormat;
    }
    
    public void setPreferredFormat(String preferredFormat) {
        this.preferredFormat = preferredFormat;
    }
    
    public Quality getQuality() {
        return quality;
    }
    
    public void setQuality(Quality quality) {
        this.quality = quality;
    }
    
    public Placeholder getPlaceholder() {
        return placeholder;
    }
    
    public void setPlaceholder(Placeholder placeholder) {
        this.placeholder = placeholder;
    }
    
    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }
    
    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
    
    public List<String> getSupportedFormats() {
        return supportedFormats;
    }
    
    public void setSupportedFormats(List<String> supportedFormats) {
        this.supportedFormats = supportedFormats;
    }
    
    public Upload getUpload() {
        return upload;
    }
    
    public void setUpload(Upload upload) {
        this.upload = upload;
    }
    
    public Offload getOffload() {
        return offload;
    }
    
    public void setOffload(Offload offload) {
        this.offload = offload;
    }
    
    public Duration getRunRetention() {
        return runRetention;
    }
    
    public void setRunRetention(Duration runRetention) {
        this.runRetention = runRetention;
    }
    
    public static class Variant {
        private String name;
        private int maxWidth;
        
        public Variant() {
        }
        
        public Variant(String name, int maxWidth) {
            this.name = name;
            this.maxWidth = maxWidth;
        }
        
        public String getName() {
            return name;
        }
        
        public void setName(String name) {
            this.name = name;
        }
        
        public int getMaxWidth() {
            return maxWidth;
        }
        
        public void setMaxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
        }
    }
    
    public static class Quality {
        private int avif = 60;
        private int webp = 82;
        private int jpeg = 85;
        private int original = 92;
        
        public int getAvif() {
            return avif;
        }
        
        public void setAvif(int avif) {
            this.avif = avif;
        }
        
        public int getWebp() {
            return webp;
        }
        
        public void setWebp(int webp) {
            this.webp = webp;
        }
        
        public int getJpeg() {
            return jpeg;
        }
        
        public void setJpeg(int jpeg) {
            this.jpeg = jpeg;
        }
        
        public int getOriginal() {
            return original;
        }
        
        public void setOriginal(int original) {
            this.original = original;
        }
    }
    
    public static class Placeholder {
        private int width = 20;
        private String format = "jpeg";
        private int quality = 30;
        
        public int getWidth() {
            return width;
        }
        
        public void setWidth(int width) {
            this.width = width;
        }
        
        public String getFormat() {
            return format;
        }
        
        public void setFormat(String format) {
            this.format = format;
        }
        
        public int getQuality() {
            return quality;
        }
        
        public void setQuality(int quality) {
            this.quality = quality;
        }
    }
    
    public static class Upload {
        private int concurrency = 3;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private long baseDelayMs = RetryPolicy.DEFAULT_BASE_DELAY.toMillis();
        
        public int getConcurrency() {
            return concurrency;
        }
        
        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
        
        public int getMaxRetries() {
            return maxRetries;
        }
        
        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
        
        public long getBaseDelayMs() {
            return baseDelayMs;
        }
        
        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }
    }
    
    public static class Offload {
        private boolean enabled = true;
        /** 0 derives the count from available processors. */
        private int workers = 0;
        
        public boolean isEnabled() {
            return enabled;
        }
        
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
        
        public int getWorkers() {
            return workers;
        }
        
        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }
}
