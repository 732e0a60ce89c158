package com.code.quality.progress;

/**
 * Counter increments merged into a {@link ProgressTracker}. Deltas are never negative,
 * so the tracked counters only grow.
 *
 * @param filesProcessed     files finished since the last update
 * @param analyzersCompleted analyzer tasks finished since the last update
 */
public record ProgressDelta(int filesProcessed, int analyzersCompleted) {

    public ProgressDelta {
        if (filesProcessed < 0 || analyzersCompleted < 0) {
            throw new IllegalArgumentException("progress deltas must be >= 0");
        }
    }

    public static ProgressDelta files(int count) {
        return new ProgressDelta(count, 0);
    }

    public static ProgressDelta analyzers(int count) {
        return new ProgressDelta(0, count);
    }
}
