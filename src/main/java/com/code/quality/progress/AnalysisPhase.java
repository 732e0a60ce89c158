package com.code.quality.progress;

/**
 * Phases of an analysis run, in the order they are entered.
 */
public enum AnalysisPhase {
    INITIALIZING("Initializing"),
    DISCOVERING("Discovering files"),
    PARSING("Parsing files"),
    ANALYZING("Running analysis"),
    CALCULATING_METRICS("Calculating metrics"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    AnalysisPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
