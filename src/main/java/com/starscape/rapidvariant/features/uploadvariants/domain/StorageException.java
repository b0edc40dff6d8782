package com.starscape.rapidvariant.features.uploadvariants.domain;

/**
 * Failure reported by a storage adapter, classified by the adapter itself.
 */
public class StorageException extends RuntimeException {
    
    public enum Reason {
        NETWORK,
        TIMEOUT,
        REJECTED
    }
    
    private final Reason reason;
    private final int statusCode;
    
    public StorageException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }
    
    public static StorageException network(String message) {
        return new StorageException(Reason.NETWORK, 0, message, null);
    }
    
    public static StorageException timeout(String message) {
        return new StorageException(Reason.TIMEOUT, 0, message, null);
    }
    
    public static StorageException rejected(int statusCode, String message) {
        return new StorageException(Reason.REJECTED, statusCode, message, null);
    }
    
    public Reason getReason() {
        return reason;
    }
    
    /**
     * HTTP-style status when the store answered, 0 otherwise.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
