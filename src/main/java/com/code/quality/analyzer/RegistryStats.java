package com.code.quality.analyzer;

import com.code.quality.core.model.IssueCategory;

import java.util.Map;

/**
 * Snapshot statistics of an {@link AnalyzerRegistry}.
 */
public record RegistryStats(
        int totalAnalyzers,
        int enabledAnalyzers,
        Map<IssueCategory, Integer> byCategory,
        Map<String, Integer> byLanguage,
        Map<AnalyzerPriority, Integer> byPriority
) {
    public RegistryStats {
        byCategory = Map.copyOf(byCategory);
        byLanguage = Map.copyOf(byLanguage);
        byPriority = Map.copyOf(byPriority);
    }

    public int disabledAnalyzers() {
        return totalAnalyzers - enabledAnalyzers;
    }
}
