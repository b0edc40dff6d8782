package com.starscape.rapidvariant.features.runpipeline.domain;

import java.util.function.Consumer;

/**
 * Holds the progress of one run. Updates from any thread are merged field-wise with
 * {@link Progress#max(Progress)}; the listener hears only about actual changes, never
 * an older snapshot after a newer one.
 */
public class ProgressTracker {
    
    private final Consumer<Progress> listener;
    private Progress current = Progress.initial();
    
    public ProgressTracker(Consumer<Progress> listener) {
        this.listener = listener;
    }
    
    public synchronized Progress snapshot() {
        return current;
    }
    
    public void generating(int percent, int overall) {
        merge(new Progress(clamp(percent), 0, 0, clamp(overall)));
    }
    
    public void uploading(int percent, int overall) {
        merge(new Progress(100, clamp(percent), 0, clamp(overall)));
    }
    
    public void finalizing(int percent, int overall) {
        merge(new Progress(100, 100, clamp(percent), clamp(overall)));
    }
    
    public void overall(int overall) {
        merge(new Progress(0, 0, 0, clamp(overall)));
    }
    
    /**
     * The listener runs under the lock so snapshots reach it in the order they were merged.
     */
    private synchronized void merge(Progress update) {
        Progress next = current.max(update);
        if (next.equals(current)) {
            return;
        }
        current = next;
        listener.accept(next);
    }
    
    private static int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }
}
