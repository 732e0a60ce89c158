package com.code.quality.metrics;

import com.code.quality.core.model.Issue;
import com.code.quality.core.model.IssueCategory;
import com.code.quality.core.model.ParsedFile;
import com.code.quality.core.model.QualityMetrics;
import com.code.quality.core.model.Severity;
import com.code.quality.parser.PlainTextParser;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes aggregate quality metrics from merged issues and parsed files.
 *
 * <p>Issues are weighted by severity. The overall score drops 1000 points per unit of weighted
 * issue density (weight per line); the technical debt ratio is the weighted issue count per
 * 1000 lines. Each category score is 100 minus the category's share of all issues. The
 * maintainability index subtracts twice the average number of declarations per file and a
 * tenth of the total weight from 100. Scores are clamped at 0.</p>
 */
public class QualityMetricsCalculator {

    public QualityMetrics calculate(List<Issue> issues, List<ParsedFile> parsedFiles) {
        long totalLines = 0;
        long declarations = 0;
        for (ParsedFile file : parsedFiles) {
            totalLines += file.lineCount();
            declarations += count(file.attributes().get(PlainTextParser.ATTR_FUNCTIONS))
                    + count(file.attributes().get(PlainTextParser.ATTR_CLASSES));
        }

        double totalWeight = 0.0;
        Map<IssueCategory, Long> byCategory = new EnumMap<>(IssueCategory.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Issue issue : issues) {
            totalWeight += issue.severity().getWeight();
            byCategory.merge(issue.category(), 1L, Long::sum);
            bySeverity.merge(issue.severity(), 1L, Long::sum);
        }

        double overall = 100.0;
        double debtRatio = 0.0;
        if (totalLines > 0) {
            double density = totalWeight / totalLines;
            overall = Math.max(0.0, 100.0 - density * 1000.0);
            debtRatio = density * 1000.0;
        }

        Map<IssueCategory, Double> categoryScores = new EnumMap<>(IssueCategory.class);
        for (IssueCategory category : IssueCategory.values()) {
            if (issues.isEmpty()) {
                categoryScores.put(category, 100.0);
            } else {
                double ratio = (double) byCategory.getOrDefault(category, 0L) / issues.size();
                categoryScores.put(category, Math.max(0.0, 100.0 - ratio * 100.0));
            }
        }

        double averageDeclarations = (double) declarations / Math.max(parsedFiles.size(), 1);
        double maintainability = Math.max(0.0, 100.0 - averageDeclarations * 2.0 - totalWeight / 10.0);

        return new QualityMetrics(overall, categoryScores, maintainability, debtRatio,
                parsedFiles.size(), totalLines, issues.size(), bySeverity);
    }

    private static long count(Object attribute) {
        if (attribute instanceof Number number) {
            return number.longValue();
        }
        if (attribute instanceof Collection<?> collection) {
            return collection.size();
        }
        return 0;
    }
}
