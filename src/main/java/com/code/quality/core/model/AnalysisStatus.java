package com.code.quality.core.model;

/**
 * Lifecycle status of an analysis run.
 * Transitions only move forward: PENDING, then RUNNING, then COMPLETED or FAILED.
 */
public enum AnalysisStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns whether a run in this status may move to {@code next}.
     */
    public boolean canTransitionTo(AnalysisStatus next) {
        if (isTerminal()) {
            return false;
        }
        return next.ordinal() > ordinal();
    }
}
