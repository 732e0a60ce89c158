package com.code.quality.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementFilesParsed(int count) {
    }

    @Override
    public void incrementFilesFromCache(int count) {
    }

    @Override
    public void incrementParseFailure() {
    }

    @Override
    public void incrementAnalyzerFailure(String analyzerName) {
    }

    @Override
    public void recordIssueCount(int count) {
    }

    @Override
    public void recordCacheHit(String tier) {
    }

    @Override
    public void recordCacheMiss(String tier) {
    }
}
