package com.starscape.rapidvariant.common.exception;

/**
 * Failure classification carried by a failed pipeline run, with the wording shown to the operator.
 */
public enum ErrorKind {
    VALIDATION_ERROR("Invalid file", "Please upload a JPEG, PNG, WebP, or GIF image within the size limit.", false),
    DECODE_FAILED("Unreadable image", "The file could not be read as an image. Try a different file.", false),
    CROP_FAILED("Crop failed", "Could not crop the image. Try adjusting the crop area.", false),
    ENCODING_FAILED("Processing error", "Failed to process the image. Try a different file.", false),
    NETWORK_ERROR("Connection problem", "Check your internet connection and try again.", true),
    TIMEOUT("Request timed out", "The upload took too long. Please try again with a smaller file.", true),
    UPLOAD_FAILED("Upload failed", "Could not upload the image. Please try again.", false),
    COMMIT_FAILED("Save failed", "The image was uploaded but could not be saved. Please try again.", false),
    UNKNOWN("Something went wrong", "An unexpected error occurred. Please try again.", false);
    
    private final String userTitle;
    private final String userMessage;
    private final boolean transientFailure;
    
    ErrorKind(String userTitle, String userMessage, boolean transientFailure) {
        this.userTitle = userTitle;
        this.userMessage = userMessage;
        this.transientFailure = transientFailure;
    }
    
    public String getUserTitle() {
        return userTitle;
    }
    
    public String getUserMessage() {
        return userMessage;
    }
    
    /**
     * Transient kinds are retried automatically before they surface.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
