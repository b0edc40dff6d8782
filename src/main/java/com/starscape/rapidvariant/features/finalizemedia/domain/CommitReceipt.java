package com.starscape.rapidvariant.features.finalizemedia.domain;

/**
 * @param alreadyCommitted true when the upload ID had been committed before and the existing record was returned
 */
public record CommitReceipt(String recordId, boolean alreadyCommitted) {
}
