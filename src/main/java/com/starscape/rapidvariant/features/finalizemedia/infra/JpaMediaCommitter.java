package com.starscape.rapidvariant.features.finalizemedia.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.rapidvariant.common.domain.DomainEvent;
import com.starscape.rapidvariant.common.outbox.OutboxService;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitReceipt;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitRequest;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaCommitter;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecord;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecordRepository;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persists the media record and its {@code MediaCommitted} event in one transaction.
 */
@Service
public class JpaMediaCommitter implements MediaCommitter {
    
    private static final Logger log = LoggerFactory.getLogger(JpaMediaCommitter.class);
    private static final String AGGREGATE_TYPE = "MediaRecord";
    
    private final MediaRecordRepository recordRepository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String publicUrl;
    
    public JpaMediaCommitter(
            MediaRecordRepository recordRepository,
            OutboxService outboxService,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.storage.public-url:}") String publicUrl) {
        this.recordRepository = recordRepository;
        this.outboxService = outboxService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
    }
    
    /**
     * @throws IllegalArgumentException if a required variant is missing from the request
     */
    @Override
    @Transactional
    public CommitReceipt confirm(CommitRequest request) {
        Optional<MediaRecord> existing = recordRepository.findByUploadId(request.uploadId());
        if (existing.isPresent()) {
            log.info("Upload {} already committed as {}", request.uploadId(), existing.get().getRecordId());
            return new CommitReceipt(existing.get().getRecordId(), true);
        }
        
        requireVariants(request);
        
        String recordId = "med_" + UUID.randomUUID().toString().replace("-", "");
        MediaRecord record = new MediaRecord(
            recordId,
            request,
            toJson(variantEntries(request.variants())),
            toJson(request.fields().focalPoint()),
            clock.instant()
        );
        recordRepository.save(record);
        
        for (DomainEvent event : record.getDomainEvents()) {
            outboxService.publish(event, AGGREGATE_TYPE);
        }
        record.clearDomainEvents();
        
        log.info("Committed media record {} for upload {} with {} variants",
            recordId, request.uploadId(), request.variants().size());
        return new CommitReceipt(recordId, false);
    }
    
    private void requireVariants(CommitRequest request) {
        Set<String> present = request.variants().stream()
                .map(UploadResult::name)
                .collect(Collectors.toSet());
        Set<String> missing = new TreeSet<>(request.requiredVariants());
        missing.removeAll(present);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Commit for " + request.uploadId() + " is missing variants " + missing);
        }
    }
    
    private List<Map<String, Object>> variantEntries(List<UploadResult> variants) {
        return variants.stream().map(variant -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", variant.name());
            entry.put("key", variant.remoteKey());
            entry.put("url", publicUrl.isEmpty() ? variant.remoteKey() : publicUrl + "/" + variant.remoteKey());
            entry.put("width", variant.width());
            entry.put("height", variant.height());
            entry.put("sizeBytes", variant.sizeBytes());
            entry.put("contentType", variant.contentType());
            return entry;
        }).toList();
    }
    
    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize media record field", e);
        }
    }
}
