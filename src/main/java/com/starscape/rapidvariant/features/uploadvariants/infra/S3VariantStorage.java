package com.starscape.rapidvariant.features.uploadvariants.infra;

import com.starscape.rapidvariant.features.uploadvariants.domain.StoredObject;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadMetadata;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadNaming;
import com.starscape.rapidvariant.features.uploadvariants.domain.VariantStorage;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Map;

/**
 * Stores variants in S3. Keys are derived from upload ID and variant name only, so a retried
 * upload overwrites the same object.
 * <p>
 * SDK exceptions are left to propagate; the caller classifies them for retry.
 */
@Service
public class S3VariantStorage implements VariantStorage {
    
    private static final Logger log = LoggerFactory.getLogger(S3VariantStorage.class);
    
    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    
    public S3VariantStorage(
            S3Client s3Client,
            @Value("${aws.s3.bucket}") String bucket,
            @Value("${aws.s3.prefix:media}") String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix;
    }
    
    @Override
    public StoredObject upload(byte[] data, UploadMetadata metadata) {
        String key = UploadNaming.objectKey(prefix, metadata);
        String checksum = DigestUtils.sha256Hex(data);
        
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(metadata.contentType())
                .contentLength((long) data.length)
                .checksumSHA256(Base64.encodeBase64String(DigestUtils.sha256(data)))
                .metadata(Map.of(
                    "upload-id", metadata.uploadId(),
                    "variant", metadata.variantName(),
                    "width", String.valueOf(metadata.width()),
                    "height", String.valueOf(metadata.height()),
                    "sha256", checksum))
                .build();
        
        s3Client.putObject(putRequest, RequestBody.fromBytes(data));
        log.debug("Stored variant {} ({} bytes) at s3://{}/{}", metadata.variantName(), data.length, bucket, key);
        
        return new StoredObject(key);
    }
}
