package com.starscape.rapidvariant.common.exception;

/**
 * A stage-local failure of a pipeline run, classified by {@link ErrorKind}.
 * Carries the stage and, where one applies, the variant the failure belongs to.
 */
public class PipelineException extends BusinessException {
    
    private final ErrorKind kind;
    private final String stage;
    private final String variantName;
    private final String userMessage;
    
    public PipelineException(ErrorKind kind, String stage, String variantName, String message, Throwable cause) {
        this(kind, stage, variantName, message, null, cause);
    }
    
    public PipelineException(ErrorKind kind, String stage, String variantName,
                             String message, String userMessage, Throwable cause) {
        super(kind.name(), message, cause);
        this.kind = kind;
        this.stage = stage;
        this.variantName = variantName;
        this.userMessage = userMessage != null ? userMessage : kind.getUserMessage();
    }
    
    public static PipelineException validation(String message, String userMessage) {
        return new PipelineException(ErrorKind.VALIDATION_ERROR, "VALIDATING", null, message, userMessage, null);
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public String getStage() {
        return stage;
    }
    
    public String getVariantName() {
        return variantName;
    }
    
    public String getUserMessage() {
        return userMessage;
    }
    
    /**
     * Re-attributes this failure to a stage and variant without losing the original classification.
     */
    public PipelineException withContext(String stage, String variantName) {
        return new PipelineException(kind, stage, variantName != null ? variantName : this.variantName,
            getMessage(), userMessage, getCause() != null ? getCause() : this);
    }
}
