package com.starscape.rapidvariant.features.runpipeline.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record FocalPointRequest(
    @DecimalMin(value = "0", message = "Focal point x must be between 0 and 100")
    @DecimalMax(value = "100", message = "Focal point x must be between 0 and 100")
    double x,
    
    @DecimalMin(value = "0", message = "Focal point y must be between 0 and 100")
    @DecimalMax(value = "100", message = "Focal point y must be between 0 and 100")
    double y
) {}
