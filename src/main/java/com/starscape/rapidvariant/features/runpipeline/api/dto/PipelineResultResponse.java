package com.starscape.rapidvariant.features.runpipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.starscape.rapidvariant.features.runpipeline.domain.PipelineResult;

import java.util.Comparator;
import java.util.List;

/**
 * Result shape returned to clients:
 * {@code {success:true, data}}, {@code {success:false, aborted:true}} or
 * {@code {success:false, error, errorType}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResultResponse(
    boolean success,
    Data data,
    Boolean aborted,
    String error,
    String errorType,
    String errorTitle,
    String stage,
    String variant,
    Boolean commitRetryable
) {
    
    public record Data(
        String recordId,
        List<VariantResponse> variants,
        String placeholder
    ) {}
    
    public static PipelineResultResponse from(PipelineResult result, boolean commitRetryable) {
        if (result instanceof PipelineResult.Success success) {
            List<VariantResponse> variants = success.variants().values().stream()
                    .map(VariantResponse::from)
                    .sorted(Comparator.comparingInt(VariantResponse::width).reversed())
                    .toList();
            return new PipelineResultResponse(true, new Data(success.recordId(), variants, success.placeholder()),
                null, null, null, null, null, null, null);
        }
        if (result instanceof PipelineResult.Failed failed) {
            return new PipelineResultResponse(false, null, null, failed.userMessage(), failed.kind().name(),
                failed.kind().getUserTitle(), failed.stage(), failed.variantName(), commitRetryable);
        }
        return new PipelineResultResponse(false, null, true, null, null, null, null, null, null);
    }
}
