package com.starscape.rapidvariant.features.uploadvariants.app;

import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.uploadvariants.domain.StorageException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed remote call (object store or metadata database) is worth retrying
 * and how it is reported. Transient: network-class errors, timeouts, 5xx and 429 answers,
 * transient or connection-level data access failures.
 * Permanent: other rejections, aborts, anything unrecognised.
 */
@Component
public class FailureClassifier {
    
    public record Classification(ErrorKind kind, boolean retryable) {
    }
    
    private static final Classification PERMANENT = new Classification(ErrorKind.UPLOAD_FAILED, false);
    private static final Classification NETWORK = new Classification(ErrorKind.NETWORK_ERROR, true);
    private static final Classification TIMEOUT = new Classification(ErrorKind.TIMEOUT, true);
    
    public boolean isRetryable(Throwable error) {
        return classify(error).retryable();
    }
    
    public Classification classify(Throwable error) {
        Throwable cause = unwrap(error);
        
        if (cause instanceof AbortedException) {
            return PERMANENT;
        }
        if (cause instanceof PipelineException pe) {
            return new Classification(pe.getKind(), pe.getKind().isTransient());
        }
        if (cause instanceof StorageException se) {
            return switch (se.getReason()) {
                case NETWORK -> NETWORK;
                case TIMEOUT -> TIMEOUT;
                case REJECTED -> byStatus(se.getStatusCode());
            };
        }
        if (cause instanceof ApiCallTimeoutException || cause instanceof ApiCallAttemptTimeoutException) {
            return TIMEOUT;
        }
        if (cause instanceof SdkServiceException se) {
            return byStatus(se.statusCode());
        }
        if (cause instanceof SdkClientException) {
            // no response from the service: connection reset, DNS, refused
            return NETWORK;
        }
        if (cause instanceof TransientDataAccessException
                || cause instanceof RecoverableDataAccessException
                || cause instanceof DataAccessResourceFailureException) {
            return NETWORK;
        }
        if (cause instanceof TimeoutException || cause instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return NETWORK;
        }
        return PERMANENT;
    }
    
    private Classification byStatus(int status) {
        if (status == 429 || (status >= 500 && status < 600)) {
            return NETWORK;
        }
        return PERMANENT;
    }
    
    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
