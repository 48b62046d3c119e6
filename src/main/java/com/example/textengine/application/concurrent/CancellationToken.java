package com.example.textengine.application.concurrent;

import com.example.textengine.application.exception.ExtractionCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by a caller and every extraction job it started.
 * Workers poll it at explicit check points (queue pop, before a page starts); a page already being
 * extracted runs to completion.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return a fresh token that has not fired
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Fires the token. Idempotent.
     *
     * @return {@code true} when this call fired the token, {@code false} when it had already fired
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Check point helper.
     *
     * @param pageNumber page about to be processed, or {@code 0} when none
     * @throws ExtractionCancelledException when the token has fired
     */
    public void throwIfCancelled(int pageNumber) {
        if (cancelled.get()) {
            throw new ExtractionCancelledException(pageNumber);
        }
    }
}
