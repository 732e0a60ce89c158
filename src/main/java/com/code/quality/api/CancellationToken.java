package com.code.quality.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a run.
 * The orchestrator checks it before each task is dispatched into a worker pool;
 * tasks that already started always run to completion.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
