package com.code.quality.core.model;

import java.util.Map;

/**
 * Aggregate quality metrics of a run.
 *
 * @param overallScore         0-100, higher is better
 * @param categoryScores       0-100 per category
 * @param maintainabilityIndex simplified maintainability index, 0-100
 * @param technicalDebtRatio   severity-weighted issues per 1000 lines
 * @param filesAnalyzed        number of parsed files
 * @param totalLines           total lines across parsed files
 * @param totalIssues          number of merged issues
 * @param issuesBySeverity     issue counts per severity
 */
public record QualityMetrics(
        double overallScore,
        Map<IssueCategory, Double> categoryScores,
        double maintainabilityIndex,
        double technicalDebtRatio,
        int filesAnalyzed,
        long totalLines,
        int totalIssues,
        Map<Severity, Long> issuesBySeverity
) {
    public QualityMetrics {
        categoryScores = categoryScores != null ? Map.copyOf(categoryScores) : Map.of();
        issuesBySeverity = issuesBySeverity != null ? Map.copyOf(issuesBySeverity) : Map.of();
    }

    public static QualityMetrics empty() {
        return new QualityMetrics(100.0, Map.of(), 100.0, 0.0, 0, 0, 0, Map.of());
    }
}
