package com.starscape.rapidvariant.features.uploadvariants.domain;

public record StoredObject(String remoteKey) {
    
    public StoredObject {
        if (remoteKey == null || remoteKey.isBlank()) {
            throw new IllegalArgumentException("Remote key cannot be blank");
        }
    }
}
