package com.code.quality.progress;

/**
 * Callback for progress updates during an analysis run.
 * Invoked on the thread that changed the state, while the tracker's lock is held:
 * implementations must return quickly and must not call back into the tracker.
 * Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * No-op listener.
     */
    ProgressListener NOOP = state -> {};

    void onProgress(ProgressState state);
}
