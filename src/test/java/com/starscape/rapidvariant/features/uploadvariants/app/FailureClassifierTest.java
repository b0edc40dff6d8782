package com.starscape.rapidvariant.features.uploadvariants.app;

import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.uploadvariants.domain.StorageException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {
    
    private final FailureClassifier classifier = new FailureClassifier();
    
    @Test
    void storageFailuresByReason() {
        assertEquals(ErrorKind.NETWORK_ERROR, classifier.classify(StorageException.network("reset")).kind());
        assertEquals(ErrorKind.TIMEOUT, classifier.classify(StorageException.timeout("slow")).kind());
        assertTrue(classifier.isRetryable(StorageException.rejected(503, "unavailable")));
        assertTrue(classifier.isRetryable(StorageException.rejected(429, "slow down")));
        assertFalse(classifier.isRetryable(StorageException.rejected(403, "denied")));
        assertEquals(ErrorKind.UPLOAD_FAILED, classifier.classify(StorageException.rejected(400, "bad")).kind());
    }
    
    @Test
    void sdkFailures() {
        AwsServiceException serverError = AwsServiceException.builder().statusCode(500).message("internal").build();
        AwsServiceException forbidden = AwsServiceException.builder().statusCode(403).message("forbidden").build();
        
        assertTrue(classifier.isRetryable(serverError));
        assertFalse(classifier.isRetryable(forbidden));
        assertEquals(ErrorKind.NETWORK_ERROR, classifier.classify(SdkClientException.create("refused")).kind());
        assertEquals(ErrorKind.TIMEOUT, classifier.classify(ApiCallTimeoutException.create(30_000L)).kind());
    }
    
    @Test
    void dataAccessFailures() {
        assertTrue(classifier.isRetryable(new QueryTimeoutException("lock wait")));
        assertFalse(classifier.isRetryable(new DataIntegrityViolationException("duplicate key")));
    }
    
    @Test
    void unwrapsCompletionException() {
        FailureClassifier.Classification wrapped = classifier.classify(new CompletionException(new SocketTimeoutException("read timed out")));
        
        assertEquals(ErrorKind.TIMEOUT, wrapped.kind());
        assertTrue(wrapped.retryable());
    }
    
    @Test
    void pipelineExceptionKeepsItsKind() {
        PipelineException network = new PipelineException(ErrorKind.NETWORK_ERROR, "UPLOADING", "md", "reset", null);
        PipelineException encoding = new PipelineException(ErrorKind.ENCODING_FAILED, "GENERATING", "md", "bad", null);
        
        assertTrue(classifier.isRetryable(network));
        assertFalse(classifier.isRetryable(encoding));
        assertEquals(ErrorKind.ENCODING_FAILED, classifier.classify(encoding).kind());
    }
    
    @Test
    void abortsAndUnknownErrorsArePermanent() {
        assertFalse(classifier.isRetryable(new AbortedException("cancelled")));
        assertFalse(classifier.isRetryable(new IllegalStateException("bug")));
    }
}
