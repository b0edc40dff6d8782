package com.starscape.rapidvariant.features.generatevariants.app;

import com.starscape.rapidvariant.common.concurrent.CancellationToken;
import com.starscape.rapidvariant.common.exception.AbortedException;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodeRequest;
import com.starscape.rapidvariant.features.generatevariants.domain.EncodedVariant;
import com.starscape.rapidvariant.features.generatevariants.domain.SourceRaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs {@link VariantEncoder} work on a fixed pool of worker threads shared by every run.
 *
 * Each submission is a message tagged with a correlation id; the worker answers with a
 * success or failure reply carrying the same id, and replies are matched against the
 * pending table. Cancelling a run removes its pending entries and resolves their futures
 * as aborted; a reply arriving for an id that is no longer pending is dropped.
 *
 * The pool is created on first use and torn down on shutdown. When it is disabled or gone,
 * encoding runs synchronously on the caller with the same contract.
 */
public class EncodingOffload {
    
    private static final Logger log = LoggerFactory.getLogger(EncodingOffload.class);
    
    private final VariantEncoder encoder;
    private final int workerCount;
    private final boolean enabled;
    
    private final AtomicLong correlationIds = new AtomicLong();
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final Object poolLock = new Object();
    private volatile ExecutorService workers;
    private volatile boolean shutdown;
    
    /**
     * @param workerCount number of worker threads; 0 or less derives it from the CPU count
     * @param enabled false forces the synchronous path
     */
    public EncodingOffload(VariantEncoder encoder, int workerCount, boolean enabled) {
        this.encoder = encoder;
        this.workerCount = workerCount > 0
            ? workerCount
            : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        this.enabled = enabled;
    }
    
    /**
     * Encode off the calling thread. The future completes with the variant, with the encoder's
     * failure, or with {@link AbortedException} if {@code token} fires before the reply.
     */
    public CompletableFuture<EncodedVariant> submit(SourceRaster raster, EncodeRequest request,
                                                    CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(new AbortedException("Cancelled before encoding " + request.variantName()));
        }
        ExecutorService pool = pool();
        if (pool == null) {
            return encodeOnCaller(raster, request);
        }
        
        long id = correlationIds.incrementAndGet();
        PendingRequest entry = new PendingRequest(id, request.variantName());
        pending.put(id, entry);
        entry.registration = token.onCancel(() -> abort(id));
        
        try {
            pool.execute(() -> deliver(process(new WorkerMessage(id, raster, request))));
        } catch (RejectedExecutionException e) {
            if (pending.remove(id) != null) {
                entry.registration.close();
                log.warn("Encoding pool rejected {}; encoding on caller", request.variantName());
                return encodeOnCaller(raster, request);
            }
        }
        return entry.future;
    }
    
    public boolean isPoolAvailable() {
        return enabled && !shutdown;
    }
    
    public int pendingCount() {
        return pending.size();
    }
    
    public int getWorkerCount() {
        return workerCount;
    }
    
    /**
     * Stop the workers and resolve every outstanding request as aborted.
     */
    public void shutdown() {
        ExecutorService pool;
        synchronized (poolLock) {
            shutdown = true;
            pool = workers;
            workers = null;
        }
        List<PendingRequest> outstanding = new ArrayList<>(pending.values());
        outstanding.forEach(entry -> abort(entry.id));
        if (pool != null) {
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Encoding workers did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Encoding pool shut down ({} requests aborted)", outstanding.size());
        }
    }
    
    private ExecutorService pool() {
        if (!enabled || shutdown) {
            return null;
        }
        ExecutorService pool = workers;
        if (pool == null) {
            synchronized (poolLock) {
                if (shutdown) {
                    return null;
                }
                pool = workers;
                if (pool == null) {
                    pool = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
                    workers = pool;
                    log.info("Started encoding pool with {} workers", workerCount);
                }
            }
        }
        return pool;
    }
    
    private WorkerReply process(WorkerMessage message) {
        if (!pending.containsKey(message.id())) {
            return WorkerReply.skipped(message.id());
        }
        try {
            return WorkerReply.success(message.id(), encoder.encode(message.raster(), message.request()));
        } catch (RuntimeException e) {
            return WorkerReply.failure(message.id(), e);
        }
    }
    
    private void deliver(WorkerReply reply) {
        PendingRequest entry = pending.remove(reply.id());
        if (entry == null) {
            log.debug("Discarding reply for request {} (no longer pending)", reply.id());
            return;
        }
        entry.registration.close();
        if (reply.variant() != null) {
            entry.future.complete(reply.variant());
        } else {
            entry.future.completeExceptionally(reply.error());
        }
    }
    
    private void abort(long id) {
        PendingRequest entry = pending.remove(id);
        if (entry != null) {
            log.debug("Aborted encoding request {} ({})", id, entry.variantName);
            entry.future.completeExceptionally(new AbortedException("Encoding of " + entry.variantName + " cancelled"));
        }
    }
    
    private CompletableFuture<EncodedVariant> encodeOnCaller(SourceRaster raster, EncodeRequest request) {
        try {
            return CompletableFuture.completedFuture(encoder.encode(raster, request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
    
    private record WorkerMessage(long id, SourceRaster raster, EncodeRequest request) {
    }
    
    private record WorkerReply(long id, EncodedVariant variant, RuntimeException error) {
        
        static WorkerReply success(long id, EncodedVariant variant) {
            return new WorkerReply(id, variant, null);
        }
        
        static WorkerReply failure(long id, RuntimeException error) {
            return new WorkerReply(id, null, error);
        }
        
        static WorkerReply skipped(long id) {
            return new WorkerReply(id, null, new AbortedException("Request " + id + " cancelled before it started"));
        }
    }
    
    private static final class PendingRequest {
        
        private final long id;
        private final String variantName;
        private final CompletableFuture<EncodedVariant> future = new CompletableFuture<>();
        private volatile CancellationToken.Registration registration = () -> { };
        
        private PendingRequest(long id, String variantName) {
            this.id = id;
            this.variantName = variantName;
        }
    }
    
    private static final class WorkerThreadFactory implements ThreadFactory {
        
        private final AtomicInteger sequence = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "variant-encoder-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
