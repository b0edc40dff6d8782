package com.starscape.rapidvariant.features.trackprogress.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Broadcast to {@code /topic/media} when a media record has been committed.
 */
public record MediaCommittedUpdate(
    String recordId,
    String uploadId,
    String name,
    List<String> variantNames,
    Instant committedAt
) {}
