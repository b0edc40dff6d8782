package com.starscape.rapidvariant.features.runpipeline.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

/**
 * JSON part of a media upload. Name and alt text are checked by the pipeline itself
 * so that a missing value settles the run as a validation failure.
 */
public record MediaUploadRequest(
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name,
    
    @Size(max = 500, message = "Alt text must be at most 500 characters")
    String altText,
    
    @Size(max = 2000, message = "Caption must be at most 2000 characters")
    String caption,
    
    @Size(max = 200, message = "Credit must be at most 200 characters")
    String credit,
    
    @Size(max = 20, message = "Aspect ratio label must be at most 20 characters")
    String aspectRatio,
    
    @Valid
    FocalPointRequest focalPoint,
    
    @Valid
    CropRequest crop,
    
    Double rotation
) {}
