package com.starscape.rapidvariant.features.finalizemedia.domain;

import java.util.Optional;

public interface MediaRecordRepository {
    MediaRecord save(MediaRecord record);
    Optional<MediaRecord> findById(String recordId);
    Optional<MediaRecord> findByUploadId(String uploadId);
}
