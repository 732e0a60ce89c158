package com.code.quality.analyzer;

/**
 * Execution tier of an analyzer unit. Tiers are totally ordered; lower runs earlier.
 * Order only affects progress granularity and resource contention, never the merged result.
 */
public enum AnalyzerPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4);

    private final int tier;

    AnalyzerPriority(int tier) {
        this.tier = tier;
    }

    public int getTier() {
        return tier;
    }
}
