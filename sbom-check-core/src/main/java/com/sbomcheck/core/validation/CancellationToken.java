package com.sbomcheck.core.validation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a validation run.
 *
 * <p>The orchestrator checks the token before starting each document; a document already
 * being evaluated always runs to completion.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation. Safe to call from any thread, any number of times.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
