package com.starscape.rapidvariant.features.finalizemedia.domain;

/**
 * Creates the metadata record once every variant is stored. Idempotent on upload ID.
 */
public interface MediaCommitter {
    
    CommitReceipt confirm(CommitRequest request);
}
