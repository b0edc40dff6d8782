package com.starscape.rapidvariant.features.runpipeline.domain;

import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.uploadvariants.domain.UploadResult;

import java.util.Map;

/**
 * Outcome of a settled run: {@link Success}, {@link Aborted} or {@link Failed}.
 */
public interface PipelineResult {
    
    boolean isSuccess();
    
    record Success(
        String recordId,
        Map<String, UploadResult> variants,
        String placeholder
    ) implements PipelineResult {
        
        public Success {
            variants = Map.copyOf(variants);
        }
        
        @Override
        public boolean isSuccess() {
            return true;
        }
    }
    
    record Aborted() implements PipelineResult {
        
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
    
    record Failed(
        ErrorKind kind,
        String message,
        String userMessage,
        String stage,
        String variantName
    ) implements PipelineResult {
        
        public static Failed from(PipelineException e) {
            return new Failed(e.getKind(), e.getMessage(), e.getUserMessage(), e.getStage(), e.getVariantName());
        }
        
        public static Failed unknown(String stage, Throwable cause) {
            return new Failed(ErrorKind.UNKNOWN, cause.getMessage(), ErrorKind.UNKNOWN.getUserMessage(), stage, null);
        }
        
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
