package com.starscape.rapidvariant.common.exception;

/**
 * Raised when a run observes its cancellation token. Never a {@link BusinessException}:
 * a cancelled run must stay distinguishable from a failed one.
 */
public class AbortedException extends RuntimeException {
    
    public AbortedException(String message) {
        super(message);
    }
}
