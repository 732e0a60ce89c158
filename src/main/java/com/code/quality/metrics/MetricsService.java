package com.code.quality.metrics;

import java.time.Duration;

/**
 * Interface for recording analysis engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    String TIER_FILE = "file";
    String TIER_RUN = "run";

    void recordRunDuration(String outcome, Duration duration);

    void incrementFilesParsed(int count);

    void incrementFilesFromCache(int count);

    void incrementParseFailure();

    void incrementAnalyzerFailure(String analyzerName);

    void recordIssueCount(int count);

    void recordCacheHit(String tier);

    void recordCacheMiss(String tier);
}
