package com.starscape.rapidvariant.features.finalizemedia.infra;

import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecord;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecordRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaMediaRecordRepository extends JpaRepository<MediaRecord, String>, MediaRecordRepository {
    
    @Override
    Optional<MediaRecord> findByUploadId(String uploadId);
}
