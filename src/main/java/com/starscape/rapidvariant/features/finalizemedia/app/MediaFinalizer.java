package com.starscape.rapidvariant.features.finalizemedia.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.common.exception.ErrorKind;
import com.starscape.rapidvariant.common.exception.PipelineException;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitReceipt;
import com.starscape.rapidvariant.features.finalizemedia.domain.CommitRequest;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaCommitter;
import com.starscape.rapidvariant.features.uploadvariants.app.FailureClassifier;
import com.starscape.rapidvariant.features.uploadvariants.app.RetryExecutor;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Invokes the committer, retrying transient failures with the upload retry policy.
 * Anything that still fails surfaces as {@link ErrorKind#COMMIT_FAILED}.
 */
@Service
public class MediaFinalizer {
    
    private static final Logger log = LoggerFactory.getLogger(MediaFinalizer.class);
    private static final String STAGE = "FINALIZING";
    
    private final MediaCommitter committer;
    private final RetryExecutor retryExecutor;
    private final FailureClassifier failureClassifier;
    
    public MediaFinalizer(MediaCommitter committer, RetryExecutor retryExecutor, FailureClassifier failureClassifier) {
        this.committer = committer;
        this.retryExecutor = retryExecutor;
        this.failureClassifier = failureClassifier;
    }
    
    public CommitReceipt finalizeMedia(CommitRequest request, RetryPolicy retryPolicy, CancellationToken token) {
        try {
            return retryExecutor.execute(
                "commit of " + request.uploadId(),
                () -> committer.confirm(request),
                retryPolicy,
                failureClassifier::isRetryable,
                token
            );
        } catch (AbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Commit failed for upload {}", request.uploadId(), e);
            throw new PipelineException(ErrorKind.COMMIT_FAILED, STAGE, null,
                "Commit of upload " + request.uploadId() + " failed: " + e.getMessage(), e);
        }
    }
}
