package com.starscape.rapidvariant.features.runpipeline.app;

import com.starscape.rapidvariant.common.exception.BusinessException;
import com.starscape.rapidvariant.features.finalizemedia.domain.DescriptiveFields;
import com.starscape.rapidvariant.features.finalizemedia.domain.FocalPoint;
import com.starscape.rapidvariant.features.generatevariants.domain.CropRect;
import com.starscape.rapidvariant.features.generatevariants.domain.CropSpec;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceImage;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadRequest;
import com.starscape.rapidvariant.features.runpipeline.api.dto.SubmitMediaUploadResponse;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineRun;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

/**
 * Handler for starting a media upload run.
 * Registers the run and executes it on the pipeline executor; the caller polls or subscribes for the outcome.
 */
@Service
public class SubmitMediaUploadHandler {
    
    private static final Logger log = LoggerFactory.getLogger(SubmitMediaUploadHandler.class);
    private static final String UNKNOWN_TYPE = "application/octet-stream";
    
    private final VariantPipelineRunner runner;
    private final PipelineRunRegistry registry;
    private final VariantPlan plan;
    private final TaskExecutor pipelineRunExecutor;
    private final Clock clock;
    
    public SubmitMediaUploadHandler(
            VariantPipelineRunner runner,
            PipelineRunRegistry registry,
            VariantPlan plan,
            @Qualifier("pipelineRunExecutor") TaskExecutor pipelineRunExecutor,
            Clock clock) {
        this.runner = runner;
        this.registry = registry;
        this.plan = plan;
        this.pipelineRunExecutor = pipelineRunExecutor;
        this.clock = clock;
    }
    
    public SubmitMediaUploadResponse handle(MultipartFile file, MediaUploadRequest request) {
        SourceImage source = toSourceImage(file);
        DescriptiveFields fields = toFields(request);
        CropSpec cropSpec = toCropSpec(request);
        
        String runId = "run_" + UUID.randomUUID().toString().replace("-", "");
        String uploadId = UploadNaming.newUploadId(clock);
        String baseName = UploadNaming.baseName(fields.name() != null ? fields.name() : source.filename());
        
        PipelineRun run = new PipelineRun(runId, uploadId, baseName, source, cropSpec, plan, fields, clock.instant());
        registry.register(run);
        
        try {
            pipelineRunExecutor.execute(() -> runner.run(run));
        } catch (TaskRejectedException e) {
            registry.remove(runId);
            throw new BusinessException("PIPELINE_BUSY", "Too many uploads in progress, try again shortly", e);
        }
        
        log.info("Accepted upload run {} for {} ({} bytes)", runId, source.filename(), source.sizeBytes());
        return new SubmitMediaUploadResponse(runId, uploadId, run.getState().name());
    }
    
    private SourceImage toSourceImage(MultipartFile file) {
        if (file == null) {
            throw new IllegalArgumentException("File part is required");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new BusinessException("FILE_READ_FAILED", "Could not read uploaded file", e);
        }
        String contentType = file.getContentType() != null && !file.getContentType().isBlank()
            ? file.getContentType() : UNKNOWN_TYPE;
        return new SourceImage(file.getOriginalFilename(), bytes, contentType, bytes.length);
    }
    
    private DescriptiveFields toFields(MediaUploadRequest request) {
        if (request == null) {
            return DescriptiveFields.of(null, null);
        }
        FocalPoint focalPoint = request.focalPoint() != null
            ? new FocalPoint(request.focalPoint().x(), request.focalPoint().y())
            : FocalPoint.center();
        return new DescriptiveFields(request.name(), request.altText(), request.caption(),
            request.credit(), request.aspectRatio(), focalPoint);
    }
    
    private CropSpec toCropSpec(MediaUploadRequest request) {
        if (request == null) {
            return CropSpec.none();
        }
        CropRect rect = request.crop() == null ? null : new CropRect(
            request.crop().x(), request.crop().y(), request.crop().width(), request.crop().height());
        double rotation = request.rotation() != null ? request.rotation() : 0;
        return new CropSpec(rect, rotation);
    }
}
