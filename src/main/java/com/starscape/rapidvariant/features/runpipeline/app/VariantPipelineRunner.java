package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.config.PipelineProperties;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.finalizemedia.app.MediaFinalizer;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitReceipt;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitRequest;
import com.starscape.rapidvariant.features.generatevariants.app.EncodingOffload;
import com.starscape.rapidvariant.features.generatevariants.app.ImageTransformer;
import com.starscape.rapidvariant.features.generatevariants.app.VariantEncoder;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodeRequest;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodedVariant;
import com.starscape.rapidvariant.features.generatevariants.domain.ImageFormat;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantSpec;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineResult;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRunListener;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineState;
import com.starscape.rapidvariant.features.runpipeline.domain.ProgressTracker;
import com.starscape.rapidvariant.features.uploadvariants.app.UploadOrchestrator;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadTarget;
import com.starscape.rapidvariant.features.uploadvariants.domain.VariantStorage;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one {@link PipelineRun} through
 * Validating, Transforming, Generating, Uploading and Finalizing.
 * <p>
 * Stages run strictly in order on the calling thread; only encoding and uploads fan out.
 * A run settles exactly once as Complete, Failed or Aborted, and its resources are released
 * on every exit path. Once cancellation has been requested, any failure is reported as an abort.
 * <p>
 * Overall progress: transforming 5-10, generating 10-35, uploading 35-85, finalizing 90, complete 100.
 */
@Service
public class VariantPipelineRunner {
    
    private static final Logger log = LoggerFactory.getLogger(VariantPipelineRunner.class);
    
    private final FileValidator fileValidator;
    private final ImageTransformer transformer;
    private final VariantEncoder encoder;
    private final EncodingOffload offload;
    private final UploadOrchestrator uploadOrchestrator;
    private final VariantStorage storage;
    private final MediaFinalizer finalizer;
    private final RetryPolicy retryPolicy;
    private final int uploadConcurrency;
    private final List<PipelineRunListener> listeners;
    
    public VariantPipelineRunner(
            FileValidator fileValidator,
            ImageTransformer transformer,
            VariantEncoder encoder,
            EncodingOffload offload,
            UploadOrchestrator uploadOrchestrator,
            VariantStorage storage,
            MediaFinalizer finalizer,
            RetryPolicy uploadRetryPolicy,
            PipelineProperties properties,
            List<PipelineRunListener> listeners) {
        this.fileValidator = fileValidator;
        this.transformer = transformer;
        this.encoder = encoder;
        this.offload = offload;
        this.uploadOrchestrator = uploadOrchestrator;
        this.storage = storage;
        this.finalizer = finalizer;
        this.retryPolicy = uploadRetryPolicy;
        this.uploadConcurrency = properties.getUpload().getConcurrency();
        this.listeners = List.copyOf(listeners);
    }
    
    /**
     * Execute a fresh run to completion.
     *
     * @return the settled result, never null
     * @throws IllegalStateException if the run was already started
     */
    public PipelineResult run(PipelineRun run) {
        listeners.forEach(run::addListener);
        run.begin();
        log.info("Starting run {} for {} (upload {})", run.getRunId(), run.getSource().filename(), run.getUploadId());
        
        try {
            execute(run);
        } catch (AbortedException e) {
            log.info("Run {} aborted: {}", run.getRunId(), e.getMessage());
            run.abort();
        } catch (PipelineException e) {
            settleFailure(run, e);
        } catch (RuntimeException e) {
            settleUnexpected(run, e);
        } finally {
            int released = run.getResources().releaseAll();
            log.debug("Run {} released {} resources", run.getRunId(), released);
        }
        
        PipelineResult result = run.getResult().orElseThrow();
        log.info("Run {} settled as {}", run.getRunId(), run.getState());
        return result;
    }
    
    /**
     * Retry only the commit of a run that failed with {@link ErrorKind#COMMIT_FAILED}.
     * Nothing is regenerated or re-uploaded.
     *
     * @throws IllegalStateException if the run has no failed commit to retry
     */
    public PipelineResult retryCommit(PipelineRun run) {
        listeners.forEach(run::addListener);
        CommitRequest request = run.beginCommitRetry();
        log.info("Retrying commit for run {} (upload {})", run.getRunId(), run.getUploadId());
        try {
            commit(run, request);
        } catch (AbortedException e) {
            run.abort();
        } catch (RuntimeException e) {
            settleUnexpected(run, e);
        }
        return run.getResult().orElseThrow();
    }
    
    private void execute(PipelineRun run) {
        CancellationToken token = run.getToken();
        ProgressTracker progress = run.getProgress();
        VariantPlan plan = run.getPlan();
        
        run.transitionTo(PipelineState.VALIDATING);
        token.throwIfCancelled("validating");
        fileValidator.validate(run.getSource(), run.getFields(), plan.constraints());
        
        run.transitionTo(PipelineState.TRANSFORMING);
        token.throwIfCancelled("transforming");
        progress.overall(5);
        SourceRaster raster = transformer.transform(run.getSource(), run.getCropSpec(), token, run.getResources());
        progress.overall(10);
        
        run.transitionTo(PipelineState.GENERATING);
        token.throwIfCancelled("generating");
        Generated generated = generate(run, raster);
        
        run.transitionTo(PipelineState.UPLOADING);
        token.throwIfCancelled("uploading");
        Map<String, UploadResult> uploaded = uploadOrchestrator.uploadAll(
            generated.variants(),
            new UploadTarget(run.getBaseName(), run.getUploadId()),
            storage,
            uploadConcurrency,
            retryPolicy,
            token,
            percent -> progress.uploading(percent, 35 + (int) Math.round(percent * 0.5))
        );
        
        List<UploadResult> ordered = new ArrayList<>();
        for (String name : plan.uploadedVariantNames()) {
            UploadResult result = uploaded.get(name);
            if (result == null) {
                throw new PipelineException(ErrorKind.UPLOAD_FAILED, "UPLOADING", name,
                    "Variant " + name + " missing from upload results", null);
            }
            ordered.add(result);
        }
        
        run.transitionTo(PipelineState.FINALIZING);
        token.throwIfCancelled("finalizing");
        CommitRequest request = new CommitRequest(
            run.getUploadId(),
            run.getBaseName(),
            ordered,
            plan.uploadedVariantNames(),
            generated.placeholderDataUri(),
            generated.outputFormat().getMimeType(),
            run.getFields()
        );
        commit(run, request);
    }
    
    private Generated generate(PipelineRun run, SourceRaster raster) {
        CancellationToken token = run.getToken();
        ProgressTracker progress = run.getProgress();
        VariantPlan plan = run.getPlan();
        
        ImageFormat format = encoder.probeFormat(raster, plan.preferredFormat(), plan.qualityFor(plan.preferredFormat()));
        int quality = plan.qualityFor(format);
        
        List<EncodeRequest> requests = new ArrayList<>();
        requests.add(EncodeRequest.original(raster.nativeFormat(), plan.quality().original()));
        plan.sizes().forEach(spec -> requests.add(EncodeRequest.sized(spec, format, quality)));
        
        int total = requests.size() + 1;
        AtomicInteger done = new AtomicInteger();
        Runnable onEncoded = () -> {
            int count = done.incrementAndGet();
            progress.generating((int) Math.round(count * 100.0 / total),
                10 + (int) Math.round(count * 25.0 / total));
        };
        
        List<CompletableFuture<EncodedVariant>> futures = new ArrayList<>();
        for (EncodeRequest request : requests) {
            futures.add(offload.submit(raster, request, token).whenComplete((variant, error) -> {
                if (error == null) {
                    onEncoded.run();
                }
            }));
        }
        
        // the placeholder is small enough to encode here while the workers run
        EncodedVariant placeholder = null;
        RuntimeException placeholderFailure = null;
        try {
            token.throwIfCancelled("encoding placeholder");
            placeholder = encoder.encodePlaceholder(raster, plan.placeholder());
            onEncoded.run();
        } catch (RuntimeException e) {
            placeholderFailure = e;
        }
        
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .handle((ignored, error) -> null)
            .join();
        token.throwIfCancelled("after encoding");
        
        List<EncodedVariant> variants = new ArrayList<>();
        PipelineException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                variants.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof AbortedException aborted) {
                    throw aborted;
                }
                if (failure == null) {
                    failure = encodingFailure(requests.get(i).variantName(), cause);
                }
            }
        }
        if (failure == null && placeholderFailure != null) {
            if (placeholderFailure instanceof AbortedException aborted) {
                throw aborted;
            }
            failure = encodingFailure(placeholderFailure instanceof PipelineException pe
                ? pe.getVariantName() : "placeholder", placeholderFailure);
        }
        if (failure != null) {
            throw failure;
        }
        
        // sized variants may have fallen back individually after the probe
        ImageFormat outputFormat = variants.stream()
            .filter(variant -> !VariantSpec.ORIGINAL.equals(variant.name()))
            .map(EncodedVariant::format)
            .findFirst()
            .orElse(format);
        String dataUri = "data:" + placeholder.contentType() + ";base64," + Base64.encodeBase64String(placeholder.bytes());
        log.debug("Run {} generated {} variants as {} plus a {}-byte placeholder",
            run.getRunId(), variants.size(), format, placeholder.sizeBytes());
        return new Generated(variants, dataUri, outputFormat);
    }
    
    private void commit(PipelineRun run, CommitRequest request) {
        CancellationToken token = run.getToken();
        run.getProgress().finalizing(0, 90);
        
        CommitReceipt receipt;
        try {
            receipt = finalizer.finalizeMedia(request, retryPolicy, token);
        } catch (PipelineException e) {
            if (token.isCancelled()) {
                log.info("Run {} commit failed after cancellation; reporting abort", run.getRunId());
                run.abort();
                return;
            }
            log.warn("Run {} commit failed; commit can be retried: {}", run.getRunId(), e.getMessage());
            run.fail(PipelineResult.Failed.from(e), request);
            return;
        }
        
        run.getProgress().finalizing(100, 100);
        Map<String, UploadResult> byName = new LinkedHashMap<>();
        request.variants().forEach(variant -> byName.put(variant.name(), variant));
        run.complete(new PipelineResult.Success(receipt.recordId(), byName, request.placeholderDataUri()));
    }
    
    private void settleFailure(PipelineRun run, PipelineException e) {
        if (run.getToken().isCancelled()) {
            log.info("Run {} failed in {} after cancellation; reporting abort", run.getRunId(), e.getStage());
            run.abort();
            return;
        }
        log.error("Run {} failed in {} ({}{}): {}", run.getRunId(), e.getStage(), e.getKind(),
            e.getVariantName() != null ? ", variant " + e.getVariantName() : "", e.getMessage());
        run.fail(PipelineResult.Failed.from(e), null);
    }
    
    private void settleUnexpected(PipelineRun run, RuntimeException e) {
        if (run.getToken().isCancelled()) {
            run.abort();
            return;
        }
        log.error("Run {} failed unexpectedly in {}", run.getRunId(), run.getState(), e);
        run.fail(PipelineResult.Failed.unknown(run.getState().name(), e), null);
    }
    
    private PipelineException encodingFailure(String variantName, Throwable cause) {
        if (cause instanceof PipelineException pe) {
            return pe.withContext("GENERATING", variantName);
        }
        return new PipelineException(ErrorKind.ENCODING_FAILED, "GENERATING", variantName,
            "Encoding of " + variantName + " failed: " + cause.getMessage(), cause);
    }
    
    private record Generated(List<EncodedVariant> variants, String placeholderDataUri, ImageFormat outputFormat) {
    }
}
