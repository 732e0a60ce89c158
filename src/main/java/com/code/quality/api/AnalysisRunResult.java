package com.code.quality.api;

import com.code.quality.core.model.Issue;
import com.code.quality.core.model.IssueCategory;
import com.code.quality.core.model.ParsedFile;
import com.code.quality.core.model.QualityMetrics;
import com.code.quality.core.model.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final, immutable output of an analysis run.
 *
 * @param analysisId  id of the run that produced this result
 * @param root        analyzed root, as given by the caller
 * @param timestamp   when the result was assembled
 * @param parsedFiles parsed files in discovery order
 * @param issues      merged issues, sorted by location
 * @param metrics     aggregate quality metrics
 * @param options     options of the run
 * @param failures    ledger of recovered per-file and per-unit failures
 * @param statistics  work counters of the run
 */
public record AnalysisRunResult(
        String analysisId,
        String root,
        Instant timestamp,
        List<ParsedFile> parsedFiles,
        List<Issue> issues,
        QualityMetrics metrics,
        AnalysisOptions options,
        List<RunFailure> failures,
        RunStatistics statistics
) {
    public AnalysisRunResult {
        Objects.requireNonNull(analysisId, "analysisId is required");
        Objects.requireNonNull(root, "root is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        parsedFiles = parsedFiles != null ? List.copyOf(parsedFiles) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        metrics = metrics != null ? metrics : QualityMetrics.empty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<Issue> issuesForFile(String filePath) {
        return issues.stream().filter(i -> i.filePath().equals(filePath)).toList();
    }

    public List<Issue> issuesByCategory(IssueCategory category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }

    public List<Issue> issuesBySeverity(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }
}
