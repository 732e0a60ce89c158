package com.code.quality.analyzer;

import com.code.quality.api.AnalysisContext;
import com.code.quality.core.model.Issue;
import com.code.quality.core.model.IssueCategory;
import com.code.quality.core.model.ParsedFile;

import java.util.List;
import java.util.Set;

/**
 * A pluggable quality check.
 *
 * <p>Implementations must be independent of each other: the engine may run units in
 * any order and concurrently, but never invokes the same unit twice at once within a run.
 * The metadata methods are verified once, when the unit is registered.</p>
 */
public interface AnalyzerUnit {

    double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    /**
     * Unique name of this unit. Registering another unit under the same name replaces it.
     */
    String getName();

    IssueCategory getCategory();

    /**
     * Languages this unit understands, lower case, matching {@link ParsedFile#language()}.
     */
    Set<String> getSupportedLanguages();

    default boolean isEnabled() {
        return true;
    }

    /**
     * Minimum confidence an emitted issue needs to be reported, in [0, 1].
     */
    default double getConfidenceThreshold() {
        return DEFAULT_CONFIDENCE_THRESHOLD;
    }

    /**
     * Inspects the given files and returns the issues found.
     * Every returned issue must point at one of {@code files}.
     *
     * @param files   files in a language this unit supports
     * @param context context of the current run
     */
    List<Issue> analyze(List<ParsedFile> files, AnalysisContext context);
}
