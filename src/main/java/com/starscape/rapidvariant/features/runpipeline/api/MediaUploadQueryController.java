package com.starscape.rapidvariant.features.runpipeline.api;

import com.starscape.rapidvariant.features.runpipeline.api.dto.MediaUploadStatusResponse;
import com.starscape.rapidvariant.features.runpipeline.app.GetMediaUploadStatusHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of upload runs: state, progress and result.
 */
@RestController
@RequestMapping("/queries/media-uploads")
public class MediaUploadQueryController {
    
    private final GetMediaUploadStatusHandler statusHandler;
    
    public MediaUploadQueryController(GetMediaUploadStatusHandler statusHandler) {
        this.statusHandler = statusHandler;
    }
    
    @GetMapping("/{runId}")
    public ResponseEntity<MediaUploadStatusResponse> getStatus(@PathVariable String runId) {
        return ResponseEntity.ok(statusHandler.handle(runId));
    }
}
