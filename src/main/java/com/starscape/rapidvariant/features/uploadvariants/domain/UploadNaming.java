package com.starscape.rapidvariant.features.uploadvariants.domain;

import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Naming rules for stored objects.
 */
public final class UploadNaming {
    
    static final int MAX_BASE_NAME_LENGTH = 50;
    private static final String FALLBACK_BASE_NAME = "image";
    private static final char[] ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int ID_SUFFIX_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private UploadNaming() {
    }
    
    /**
     * Lower-case slug of the human-facing name: anything outside {@code [a-z0-9-]} becomes a hyphen,
     * runs of hyphens collapse, leading and trailing hyphens are dropped, and the result is capped.
     */
    public static String baseName(String displayName) {
        if (displayName == null) {
            return FALLBACK_BASE_NAME;
        }
        String slug = displayName.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9-]", "-")
            .replaceAll("-{2,}", "-")
            .replaceAll("^-|-$", "");
        if (slug.length() > MAX_BASE_NAME_LENGTH) {
            slug = slug.substring(0, MAX_BASE_NAME_LENGTH).replaceAll("-$", "");
        }
        return slug.isEmpty() ? FALLBACK_BASE_NAME : slug;
    }
    
    /**
     * {@code <epochMillis>-<8 random chars>}; unique enough to key one pipeline run.
     */
    public static String newUploadId(Clock clock) {
        StringBuilder id = new StringBuilder().append(clock.millis()).append('-');
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            id.append(ID_ALPHABET[RANDOM.nextInt(ID_ALPHABET.length)]);
        }
        return id.toString();
    }
    
    /**
     * {@code <prefix>/<baseName>[-<variant>]-<uploadId>.<ext>}, with no variant suffix for the original.
     */
    public static String objectKey(String prefix, UploadMetadata metadata) {
        StringBuilder key = new StringBuilder();
        if (prefix != null && !prefix.isBlank()) {
            key.append(prefix.replaceAll("/+$", "")).append('/');
        }
        key.append(metadata.baseName());
        if (!VariantSpec.ORIGINAL.equals(metadata.variantName())) {
            key.append('-').append(metadata.variantName());
        }
        key.append('-').append(metadata.uploadId());
        if (metadata.extension() != null && !metadata.extension().isBlank()) {
            key.append('.').append(metadata.extension());
        }
        return key.toString();
    }
}
