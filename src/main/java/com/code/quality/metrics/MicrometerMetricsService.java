package com.code.quality.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code analysis.run.duration} - Timer (tag: outcome)</li>
 *   <li>{@code analysis.files.parsed} - Counter</li>
 *   <li>{@code analysis.files.cached} - Counter</li>
 *   <li>{@code analysis.parse.failures} - Counter</li>
 *   <li>{@code analysis.analyzer.failures} - Counter (tag: analyzer)</li>
 *   <li>{@code analysis.issues} - DistributionSummary</li>
 *   <li>{@code analysis.cache.hit} / {@code analysis.cache.miss} - Counter (tag: tier)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter filesParsedCounter;
    private final Counter filesCachedCounter;
    private final Counter parseFailureCounter;
    private final DistributionSummary issueCountSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.filesParsedCounter = Counter.builder("analysis.files.parsed")
                .description("Number of files handed to a parser")
                .register(registry);
        this.filesCachedCounter = Counter.builder("analysis.files.cached")
                .description("Number of files served from the per-file cache")
                .register(registry);
        this.parseFailureCounter = Counter.builder("analysis.parse.failures")
                .description("Number of files that failed to parse")
                .register(registry);
        this.issueCountSummary = DistributionSummary.builder("analysis.issues")
                .description("Distribution of merged issue counts per run")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("analysis.run.duration")
                        .description("Duration of analysis runs")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementFilesParsed(int count) {
        filesParsedCounter.increment(count);
    }

    @Override
    public void incrementFilesFromCache(int count) {
        filesCachedCounter.increment(count);
    }

    @Override
    public void incrementParseFailure() {
        parseFailureCounter.increment();
    }

    @Override
    public void incrementAnalyzerFailure(String analyzerName) {
        counter("analyzer:" + analyzerName, () -> Counter.builder("analysis.analyzer.failures")
                .description("Number of failed analyzer unit invocations")
                .tag("analyzer", analyzerName)
                .register(registry)).increment();
    }

    @Override
    public void recordIssueCount(int count) {
        issueCountSummary.record(count);
    }

    @Override
    public void recordCacheHit(String tier) {
        counter("hit:" + tier, () -> Counter.builder("analysis.cache.hit")
                .description("Number of analysis cache hits")
                .tag("tier", tier)
                .register(registry)).increment();
    }

    @Override
    public void recordCacheMiss(String tier) {
        counter("miss:" + tier, () -> Counter.builder("analysis.cache.miss")
                .description("Number of analysis cache misses")
                .tag("tier", tier)
                .register(registry)).increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
