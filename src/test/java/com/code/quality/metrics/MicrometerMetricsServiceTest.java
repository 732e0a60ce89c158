package com.code.quality.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("Should record run durations per outcome")
    void testRunDuration() {
        metrics.recordRunDuration("completed", Duration.ofMillis(200));
        metrics.recordRunDuration("completed", Duration.ofMillis(100));
        metrics.recordRunDuration("failed", Duration.ofMillis(50));

        assertEquals(2, registry.get("analysis.run.duration").tag("outcome", "completed").timer().count());
        assertEquals(300.0, registry.get("analysis.run.duration").tag("outcome", "completed").timer()
                .totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get("analysis.run.duration").tag("outcome", "failed").timer().count());
    }

    @Test
    @DisplayName("Should count files and failures")
    void testCounters() {
        metrics.incrementFilesParsed(3);
        metrics.incrementFilesFromCache(2);
        metrics.incrementParseFailure();
        metrics.incrementAnalyzerFailure("security");
        metrics.incrementAnalyzerFailure("security");

        assertEquals(3.0, registry.get("analysis.files.parsed").counter().count());
        assertEquals(2.0, registry.get("analysis.files.cached").counter().count());
        assertEquals(1.0, registry.get("analysis.parse.failures").counter().count());
        assertEquals(2.0, registry.get("analysis.analyzer.failures").tag("analyzer", "security").counter().count());
    }

    @Test
    @DisplayName("Should tag cache hits and misses by tier")
    void testCacheCounters() {
        metrics.recordCacheHit(MetricsService.TIER_FILE);
        metrics.recordCacheHit(MetricsService.TIER_FILE);
        metrics.recordCacheMiss(MetricsService.TIER_RUN);

        assertEquals(2.0, registry.get("analysis.cache.hit").tag("tier", "file").counter().count());
        assertEquals(1.0, registry.get("analysis.cache.miss").tag("tier", "run").counter().count());
    }

    @Test
    @DisplayName("Should summarize issue counts")
    void testIssueSummary() {
        metrics.recordIssueCount(4);
        metrics.recordIssueCount(6);

        assertEquals(2, registry.get("analysis.issues").summary().count());
        assertEquals(10.0, registry.get("analysis.issues").summary().totalAmount());
    }
}
