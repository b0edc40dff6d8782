package com.starscape.rapidvariant.features.generatevariants.domain;

import com.starscape.rapidvariant.common.domain.ValueObject;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record FileConstraints(
    long maxSizeBytes,
    Set<String> supportedTypes
) implements ValueObject {
    
    public FileConstraints {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("Maximum file size must be positive");
        }
        if (supportedTypes == null || supportedTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one supported type is required");
        }
        supportedTypes = supportedTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toUnmodifiableSet());
    }
    
    public boolean isSupported(String mimeType) {
        return mimeType != null && supportedTypes.contains(mimeType.toLowerCase(Locale.ROOT).trim());
    }
    
    public long maxSizeMegabytes() {
        return Math.round(maxSizeBytes / 1024.0 / 1024.0);
    }
}
