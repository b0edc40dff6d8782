package com.starscape.rapidvariant.features.finalizemedia.domain;

import com.starscape.rapidvariant.common.domain.AggregateRoot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "media_records")
public class MediaRecord extends AggregateRoot<String> {
    
    @Id
    @Column(name = "record_id")
    private String recordId;
    
    @Column(name = "upload_id", nullable = false, unique = true)
    private String uploadId;
    
    @Column(name = "base_name", nullable = false)
    private String baseName;
    
    @Column(nullable = false)
    private String name;
    
    @Column(name = "alt_text", nullable = false)
    private String altText;
    
    @Column(columnDefinition = "text")
    private String caption;
    
    private String credit;
    
    @Column(name = "aspect_ratio")
    private String aspectRatio;
    
    @Column(name = "mime_type", nullable = false)
    private String mimeType;
    
    @Column(columnDefinition = "text")
    private String placeholder;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "variants_json", nullable = false, columnDefinition = "jsonb")
    private String variantsJson;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "focal_point_json", nullable = false, columnDefinition = "jsonb")
    private String focalPointJson;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected MediaRecord() {
        // JPA constructor
    }
    
    public MediaRecord(String recordId, CommitRequest request, String variantsJson,
                       String focalPointJson, Instant createdAt) {
        super(recordId);
        if (variantsJson == null || variantsJson.isBlank()) {
            throw new IllegalArgumentException("Variants JSON cannot be blank");
        }
        DescriptiveFields fields = request.fields();
        if (!fields.hasRequiredFields()) {
            throw new IllegalArgumentException("Name and alt text are required");
        }
        
        this.recordId = recordId;
        this.uploadId = request.uploadId();
        this.baseName = request.baseName();
        this.name = fields.name();
        this.altText = fields.altText();
        this.caption = fields.caption();
        this.credit = fields.credit();
        this.aspectRatio = fields.aspectRatio();
        this.mimeType = request.mimeType();
        this.placeholder = request.placeholderDataUri();
        this.variantsJson = variantsJson;
        this.focalPointJson = focalPointJson;
        this.createdAt = createdAt;
        
        List<String> variantNames = request.variants().stream().map(v -> v.name()).toList();
        registerEvent(new MediaCommitted(recordId, uploadId, name, variantNames, createdAt));
    }
    
    @Override
    public String getId() {
        return recordId;
    }
    
    public String getRecordId() { return recordId; }
    public String getUploadId() { return uploadId; }
    public String getBaseName() { return baseName; }
    public String getName() { return name; }
    public String getAltText() { return altText; }
    public String getCaption() { return caption; }
    public String getCredit() { return credit; }
    public String getAspectRatio() { return aspectRatio; }
    public String getMimeType() { return mimeType; }
    public String getPlaceholder() { return placeholder; }
    public String getVariantsJson() { return variantsJson; }
    public String getFocalPointJson() { return focalPointJson; }
    public Instant getCreatedAt() { return createdAt; }
}
