package com.code.quality.api;

/**
 * Work counters of a single run.
 *
 * @param filesDiscovered  files returned by discovery
 * @param filesParsed      files handed to the parser (changed files)
 * @param filesFromCache   files served verbatim from the per-file cache
 * @param parseFailures    files that failed to parse
 * @param analyzerTasks    (unit, file subset) tasks executed
 * @param analyzerFailures analyzer tasks that failed
 */
public record RunStatistics(
        int filesDiscovered,
        int filesParsed,
        int filesFromCache,
        int parseFailures,
        int analyzerTasks,
        int analyzerFailures
) {
}
