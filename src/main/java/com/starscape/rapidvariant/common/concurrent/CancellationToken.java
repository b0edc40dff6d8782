package com.starscape.rapidvariant.common.concurrent;

import com.starscape.rapidvariant.common.exception.AbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by every stage of one run.
 * Cancelling never interrupts work already issued; stages check the flag at safe points
 * and listeners get a chance to drop pending state.
 */
public class CancellationToken {
    
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    
    /**
     * Sets the flag and notifies listeners. Idempotent.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancelledLatch.countDown();
        // remove() claims a listener so a concurrent onCancel cannot run it twice
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runQuietly(listener);
            }
        }
        return true;
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    /**
     * Block for up to {@code timeout}, returning early when the token is cancelled.
     *
     * @return true if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelledLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    
    public void throwIfCancelled(String checkpoint) {
        if (cancelled.get()) {
            throw new AbortedException("Cancelled at " + checkpoint);
        }
    }
    
    /**
     * Registers a listener run once on cancellation. If the token is already cancelled
     * the listener runs immediately on the calling thread.
     *
     * @return a registration that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runQuietly(listener);
        }
        return () -> listeners.remove(listener);
    }
    
    private void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed", e);
        }
    }
    
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
