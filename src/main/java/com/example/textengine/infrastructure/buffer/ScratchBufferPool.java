package com.example.textengine.infrastructure.buffer;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pool of reusable {@link StringBuilder}s for text assembly under concurrent extraction.
 * <p>
 * Buffers are handed out as {@link Lease}s meant for try-with-resources, so they return to the pool on
 * every exit path. A returned buffer is emptied but keeps its capacity. Buffers that grew beyond
 * {@code maxRetainedCapacity} are dropped instead of pooled, and at most {@code maxIdle} buffers are kept.
 * A buffer sits either in the pool or in exactly one live lease.
 */
public class ScratchBufferPool {

    public static final int DEFAULT_INITIAL_CAPACITY = 2048;
    public static final int DEFAULT_MAX_RETAINED_CAPACITY = 256 * 1024;

    private final ConcurrentLinkedDeque<StringBuilder> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger idleCount = new AtomicInteger();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong reused = new AtomicLong();
    private final int maxIdle;
    private final int initialCapacity;
    private final int maxRetainedCapacity;

    public ScratchBufferPool(int maxIdle) {
        this(maxIdle, DEFAULT_INITIAL_CAPACITY, DEFAULT_MAX_RETAINED_CAPACITY);
    }

    /**
     * @param maxIdle             upper bound of pooled idle buffers
     * @param initialCapacity     capacity of newly created buffers
     * @param maxRetainedCapacity buffers above this capacity are discarded on release
     */
    public ScratchBufferPool(int maxIdle, int initialCapacity, int maxRetainedCapacity) {
        this.maxIdle = Math.max(0, maxIdle);
        this.initialCapacity = Math.max(16, initialCapacity);
        this.maxRetainedCapacity = Math.max(this.initialCapacity, maxRetainedCapacity);
    }

    /**
     * Hands out an empty buffer, reusing a pooled one when available.
     *
     * @return lease owning the buffer until closed
     */
    public Lease acquire() {
        StringBuilder buffer = idle.pollFirst();
        if (buffer != null) {
            idleCount.decrementAndGet();
            reused.incrementAndGet();
        } else {
            buffer = new StringBuilder(initialCapacity);
            created.incrementAndGet();
        }
        return new Lease(this, buffer);
    }

    /**
     * Returns a leased buffer. Releasing the same lease twice has no effect.
     *
     * @param lease lease to give back
     */
    public void release(Lease lease) {
        if (lease == null || !lease.released.compareAndSet(false, true)) {
            return;
        }
        StringBuilder buffer = lease.buffer;
        lease.buffer = null;
        if (buffer.capacity() > maxRetainedCapacity) {
            return;
        }
        buffer.setLength(0);
        if (idleCount.incrementAndGet() > maxIdle) {
            idleCount.decrementAndGet();
            return;
        }
        idle.offerFirst(buffer);
    }

    public int idleBuffers() {
        return idleCount.get();
    }

    public long createdBuffers() {
        return created.get();
    }

    public long reusedBuffers() {
        return reused.get();
    }

    /**
     * Exclusive ownership of one pooled buffer.
     */
    public static final class Lease implements AutoCloseable {
        private final ScratchBufferPool pool;
        private final AtomicBoolean released = new AtomicBoolean();
        private StringBuilder buffer;

        private Lease(ScratchBufferPool pool, StringBuilder buffer) {
            this.pool = pool;
            this.buffer = buffer;
        }

        /**
         * @return the leased buffer
         * @throws IllegalStateException when the lease was already released
         */
        public StringBuilder buffer() {
            StringBuilder current = buffer;
            if (current == null) {
                throw new IllegalStateException("Buffer lease already released");
            }
            return current;
        }

        @Override
        public void close() {
            pool.release(this);
        }
    }
}
