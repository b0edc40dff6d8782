package com.starscape.rapidvariant.features.runpipeline.api;

import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadRequest;
import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadStatusResponse;
import com.starscape.rapidvariant.features.runpipeline.api.dto.SubmitMediaUploadResponse;
import com.starscape.rapidvariant.features.runpipeline.app.CancelMediaUploadHandler;
import com.starscape.rapidvariant.features.runpipeline.app.RetryCommitHandler;
import com.starscape.rapidvariant.features.runpipeline.app.SubmitMediaUploadHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/commands/media-uploads")
public class MediaUploadController {
    
    private final SubmitMediaUploadHandler submitHandler;
    private final CancelMediaUploadHandler cancelHandler;
    private final RetryCommitHandler retryCommitHandler;
    
    public MediaUploadController(
            SubmitMediaUploadHandler submitHandler,
            CancelMediaUploadHandler cancelHandler,
            RetryCommitHandler retryCommitHandler) {
        this.submitHandler = submitHandler;
        this.cancelHandler = cancelHandler;
        this.retryCommitHandler = retryCommitHandler;
    }
    
    /**
     * Start a run for one image. Returns immediately; progress is pushed to
     * {@code /topic/media-uploads/{runId}} and can be polled under {@code /queries}.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmitMediaUploadResponse> submit(
            @RequestPart("file") MultipartFile file,
            @Valid @RequestPart(value = "request", required = false) MediaUploadRequest request) {
        
        SubmitMediaUploadResponse response = submitHandler.handle(file, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
    
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        cancelHandler.handle(runId);
        return ResponseEntity.accepted().build();
    }
    
    @PostMapping("/{runId}/commit")
    public ResponseEntity<MediaUploadStatusResponse> retryCommit(@PathVariable String runId) {
        return ResponseEntity.ok(retryCommitHandler.handle(runId));
    }
}
