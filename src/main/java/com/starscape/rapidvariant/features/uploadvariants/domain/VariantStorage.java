package com.starscape.rapidvariant.features.uploadvariants.domain;

/**
 * Object-store capability used by the upload stage. Implementations must tolerate the same
 * logical upload being repeated.
 */
@FunctionalInterface
public interface VariantStorage {
    
    /**
     * @throws StorageException or any runtime exception; the caller classifies it as transient or permanent
     */
    StoredObject upload(byte[] bytes, UploadMetadata metadata);
}
