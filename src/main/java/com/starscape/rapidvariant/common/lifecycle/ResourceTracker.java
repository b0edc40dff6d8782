package com.starscape.rapidvariant.common.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry of the transient handles one run allocates (decoded buffers, working rasters,
 * pending worker requests). {@link #releaseAll()} frees them newest first and is idempotent;
 * every handle is closed at most once whether released early or by the tracker.
 */
public class ResourceTracker {
    
    private static final Logger log = LoggerFactory.getLogger(ResourceTracker.class);
    
    private final String owner;
    private final Deque<Handle> handles = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean released = new AtomicBoolean(false);
    
    public ResourceTracker(String owner) {
        this.owner = owner;
    }
    
    /**
     * Register a resource. A resource tracked after {@link #releaseAll()} is released immediately.
     */
    public Handle track(String label, AutoCloseable resource) {
        if (resource == null) {
            throw new IllegalArgumentException("Resource cannot be null");
        }
        Handle handle = new Handle(label, resource);
        handles.push(handle);
        if (released.get() && handles.remove(handle)) {
            log.debug("Resource {} tracked after release of {}; releasing now", label, owner);
            handle.release();
        }
        return handle;
    }
    
    /**
     * Release every tracked resource. Only the first call does any work.
     *
     * @return number of handles closed by this call
     */
    public int releaseAll() {
        if (!released.compareAndSet(false, true)) {
            return 0;
        }
        int closed = 0;
        Iterator<Handle> it = handles.iterator();
        while (it.hasNext()) {
            Handle handle = it.next();
            it.remove();
            if (handle.release()) {
                closed++;
            }
        }
        log.debug("Released {} resources for {}", closed, owner);
        return closed;
    }
    
    public boolean isReleased() {
        return released.get();
    }
    
    /**
     * Number of handles still registered and not yet released.
     */
    public int size() {
        return (int) handles.stream().filter(h -> !h.isReleased()).count();
    }
    
    public static final class Handle {
        
        private final String label;
        private final AutoCloseable resource;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        
        private Handle(String label, AutoCloseable resource) {
            this.label = label;
            this.resource = resource;
        }
        
        public String label() {
            return label;
        }
        
        public boolean isReleased() {
            return closed.get();
        }
        
        /**
         * Close the resource now. Later calls, including the tracker's own, do nothing.
         *
         * @return true if this call closed the resource
         */
        public boolean release() {
            if (!closed.compareAndSet(false, true)) {
                return false;
            }
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to release resource {}", label, e);
            }
            return true;
        }
    }
}
