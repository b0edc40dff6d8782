package com.starscape.rapidvariant.features.uploadvariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodedVariant;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import com.starscape.rapidvariant.features.uploadvariants.domain.StoredObject;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadMetadata;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadTarget;
import com.starscape.rapidvariant.features.uploadvariants.domain.VariantStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.IntConsumer;

/**
 * Uploads a set of encoded variants in fixed-size batches.
 * <p>
 * Each batch is started together and fully settled before the next one begins. Cancellation is
 * checked before every batch; uploads already in flight are allowed to finish but their results
 * are discarded. A variant that still fails after its retries fails the whole call.
 */
@Service
public class UploadOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);
    private static final String STAGE = "UPLOADING";
    
    private final Executor uploadExecutor;
    private final RetryExecutor retryExecutor;
    private final FailureClassifier failureClassifier;
    
    public UploadOrchestrator(
            @Qualifier("variantUploadExecutor") Executor uploadExecutor,
            RetryExecutor retryExecutor,
            FailureClassifier failureClassifier) {
        this.uploadExecutor = uploadExecutor;
        this.retryExecutor = retryExecutor;
        this.failureClassifier = failureClassifier;
    }
    
    /**
     * @param progressListener receives the completed share in percent, rising only
     * @return one result per variant, keyed by variant name in input order
     * @throws AbortedException when the token is cancelled before or during the uploads
     * @throws PipelineException when a variant cannot be stored
     */
    public Map<String, UploadResult> uploadAll(
            List<EncodedVariant> variants,
            UploadTarget target,
            VariantStorage storage,
            int concurrency,
            RetryPolicy retryPolicy,
            CancellationToken token,
            IntConsumer progressListener) {
        
        if (concurrency < 1) {
            throw new IllegalArgumentException("Upload concurrency must be at least 1");
        }
        requireUniqueNames(variants);
        
        Map<String, UploadResult> results = new LinkedHashMap<>();
        int total = variants.size();
        int reported = 0;
        
        for (int start = 0; start < total; start += concurrency) {
            int batchNumber = start / concurrency + 1;
            token.throwIfCancelled("before upload batch " + batchNumber);
            
            List<EncodedVariant> batch = variants.subList(start, Math.min(start + concurrency, total));
            Map<String, CompletableFuture<UploadResult>> inFlight = new LinkedHashMap<>();
            for (EncodedVariant variant : batch) {
                inFlight.put(variant.name(), CompletableFuture.supplyAsync(
                    () -> uploadOne(variant, target, storage, retryPolicy, token), uploadExecutor));
            }
            
            awaitSettled(inFlight);
            
            if (token.isCancelled()) {
                throw new AbortedException("Cancelled during upload batch " + batchNumber + "; results discarded");
            }
            collect(inFlight, results);
            
            int percent = (int) Math.round(results.size() * 100.0 / total);
            if (percent > reported) {
                reported = percent;
                progressListener.accept(percent);
            }
            log.debug("Upload batch {} settled for {}: {}/{} variants stored",
                batchNumber, target.uploadId(), results.size(), total);
        }
        
        return Collections.unmodifiableMap(results);
    }
    
    private UploadResult uploadOne(EncodedVariant variant, UploadTarget target, VariantStorage storage,
                                   RetryPolicy retryPolicy, CancellationToken token) {
        UploadMetadata metadata = new UploadMetadata(
            target.baseName(),
            target.uploadId(),
            variant.name(),
            variant.width(),
            variant.height(),
            variant.contentType(),
            variant.format().getExtension()
        );
        
        StoredObject stored = retryExecutor.execute(
            "upload of " + variant.name(),
            () -> storage.upload(variant.bytes(), metadata),
            retryPolicy,
            failureClassifier::isRetryable,
            token
        );
        
        return new UploadResult(
            variant.name(),
            stored.remoteKey(),
            variant.width(),
            variant.height(),
            variant.sizeBytes(),
            variant.contentType()
        );
    }
    
    private void awaitSettled(Map<String, CompletableFuture<UploadResult>> inFlight) {
        // allOf settles only once every member has, failed or not
        CompletableFuture.allOf(inFlight.values().toArray(new CompletableFuture[0]))
            .handle((ignored, error) -> null)
            .join();
    }
    
    private void collect(Map<String, CompletableFuture<UploadResult>> inFlight, Map<String, UploadResult> results) {
        PipelineException failure = null;
        for (Map.Entry<String, CompletableFuture<UploadResult>> entry : inFlight.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof AbortedException aborted) {
                    throw aborted;
                }
                if (failure == null) {
                    failure = toPipelineException(entry.getKey(), cause);
                }
            }
        }
        if (failure != null) {
            log.error("Upload failed for variant {}: {}", failure.getVariantName(), failure.getMessage());
            throw failure;
        }
    }
    
    private PipelineException toPipelineException(String variantName, Throwable cause) {
        if (cause instanceof PipelineException pe) {
            return pe.withContext(STAGE, variantName);
        }
        FailureClassifier.Classification classification = failureClassifier.classify(cause);
        return new PipelineException(
            classification.kind(),
            STAGE,
            variantName,
            "Upload of variant " + variantName + " failed: " + cause.getMessage(),
            cause
        );
    }
    
    private void requireUniqueNames(List<EncodedVariant> variants) {
        Set<String> seen = new HashSet<>();
        for (EncodedVariant variant : variants) {
            if (!seen.add(variant.name())) {
                throw new IllegalArgumentException("Duplicate variant name: " + variant.name());
            }
        }
    }
}
