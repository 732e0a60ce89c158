package com.code.quality.api;

import com.code.quality.core.model.IssueCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Options for an analysis run.
 * Configures file selection, parallelism, caching and confidence filtering.
 *
 * <p>Options are part of the run-cache key, so two runs over the same root share a
 * cached result only when every option is equal.</p>
 */
@JsonDeserialize(builder = AnalysisOptions.Builder.class)
public final class AnalysisOptions {

    private static final List<String> DEFAULT_INCLUDE_PATTERNS =
            List.of("*.py", "*.js", "*.ts", "*.jsx", "*.tsx");
    private static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "node_modules/**", ".git/**", "__pycache__/**", "*.pyc",
            ".venv/**", "venv/**", "build/**", "dist/**");
    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    private static final double DEFAULT_MAX_FILE_SIZE_MB = 10.0;
    private static final double DEFAULT_CACHE_TTL_HOURS = 24.0;

    private final List<String> includePatterns;
    private final List<String> excludePatterns;
    private final Set<IssueCategory> categories;
    private final boolean parallelProcessing;
    private final int maxWorkers;
    private final boolean useCache;
    private final boolean incremental;
    private final double confidenceThreshold;
    private final double maxFileSizeMb;
    private final double cacheTtlHours;
    private final long taskTimeoutMs;

    private AnalysisOptions(Builder builder) {
        this.includePatterns = List.copyOf(builder.includePatterns);
        this.excludePatterns = List.copyOf(builder.excludePatterns);
        EnumSet<IssueCategory> cats = EnumSet.noneOf(IssueCategory.class);
        cats.addAll(builder.categories);
        this.categories = Collections.unmodifiableSet(cats);
        this.parallelProcessing = builder.parallelProcessing;
        this.maxWorkers = builder.maxWorkers;
        this.useCache = builder.useCache;
        this.incremental = builder.incremental;
        this.confidenceThreshold = builder.confidenceThreshold;
        this.maxFileSizeMb = builder.maxFileSizeMb;
        this.cacheTtlHours = builder.cacheTtlHours;
        this.taskTimeoutMs = builder.taskTimeoutMs;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    /**
     * Categories whose analyzers take part in the run. Empty means all categories.
     */
    public Set<IssueCategory> getCategories() {
        return categories;
    }

    public boolean isParallelProcessing() {
        return parallelProcessing;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public double getCacheTtlHours() {
        return cacheTtlHours;
    }

    /**
     * Per-task timeout in milliseconds; {@code 0} disables the timeout.
     */
    public long getTaskTimeoutMs() {
        return taskTimeoutMs;
    }

    @JsonIgnore
    public Duration getCacheTtl() {
        return Duration.ofMillis((long) (cacheTtlHours * 3_600_000L));
    }

    @JsonIgnore
    public long getMaxFileSizeBytes() {
        return (long) (maxFileSizeMb * 1024 * 1024);
    }

    /**
     * Creates default options.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that bypass both caches and reprocess every file.
     */
    public static AnalysisOptions fullAnalysis() {
        return builder().useCache(false).incremental(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .includePatterns(includePatterns)
                .excludePatterns(excludePatterns)
                .categories(categories)
                .parallelProcessing(parallelProcessing)
                .maxWorkers(maxWorkers)
                .useCache(useCache)
                .incremental(incremental)
                .confidenceThreshold(confidenceThreshold)
                .maxFileSizeMb(maxFileSizeMb)
                .cacheTtlHours(cacheTtlHours)
                .taskTimeoutMs(taskTimeoutMs);
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private List<String> includePatterns = DEFAULT_INCLUDE_PATTERNS;
        private List<String> excludePatterns = DEFAULT_EXCLUDE_PATTERNS;
        private Set<IssueCategory> categories = Set.of();
        private boolean parallelProcessing = true;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private boolean useCache = true;
        private boolean incremental = true;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private double maxFileSizeMb = DEFAULT_MAX_FILE_SIZE_MB;
        private double cacheTtlHours = DEFAULT_CACHE_TTL_HOURS;
        private long taskTimeoutMs = 0;

        public Builder includePatterns(List<String> includePatterns) {
            this.includePatterns = Objects.requireNonNull(includePatterns, "includePatterns");
            return this;
        }

        public Builder excludePatterns(List<String> excludePatterns) {
            this.excludePatterns = Objects.requireNonNull(excludePatterns, "excludePatterns");
            return this;
        }

        public Builder categories(Set<IssueCategory> categories) {
            this.categories = categories != null ? categories : Set.of();
            return this;
        }

        public Builder parallelProcessing(boolean parallelProcessing) {
            this.parallelProcessing = parallelProcessing;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1");
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder incremental(boolean incremental) {
            this.incremental = incremental;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
                throw new IllegalArgumentException("confidenceThreshold must be between 0.0 and 1.0");
            }
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder maxFileSizeMb(double maxFileSizeMb) {
            if (maxFileSizeMb <= 0) {
                throw new IllegalArgumentException("maxFileSizeMb must be positive");
            }
            this.maxFileSizeMb = maxFileSizeMb;
            return this;
        }

        public Builder cacheTtlHours(double cacheTtlHours) {
            if (cacheTtlHours <= 0) {
                throw new IllegalArgumentException("cacheTtlHours must be positive");
            }
            this.cacheTtlHours = cacheTtlHours;
            return this;
        }

        public Builder taskTimeoutMs(long taskTimeoutMs) {
            if (taskTimeoutMs < 0) {
                throw new IllegalArgumentException("taskTimeoutMs must be >= 0");
            }
            this.taskTimeoutMs = taskTimeoutMs;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisOptions that)) return false;
        return parallelProcessing == that.parallelProcessing
                && maxWorkers == that.maxWorkers
                && useCache == that.useCache
                && incremental == that.incremental
                && Double.compare(confidenceThreshold, that.confidenceThreshold) == 0
                && Double.compare(maxFileSizeMb, that.maxFileSizeMb) == 0
                && Double.compare(cacheTtlHours, that.cacheTtlHours) == 0
                && taskTimeoutMs == that.taskTimeoutMs
                && includePatterns.equals(that.includePatterns)
                && excludePatterns.equals(that.excludePatterns)
                && categories.equals(that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(includePatterns, excludePatterns, categories, parallelProcessing, maxWorkers,
                useCache, incremental, confidenceThreshold, maxFileSizeMb, cacheTtlHours, taskTimeoutMs);
    }

    @Override
    public String toString() {
        return "AnalysisOptions{" +
                "includePatterns=" + includePatterns +
                ", excludePatterns=" + excludePatterns +
                ", categories=" + categories +
                ", parallelProcessing=" + parallelProcessing +
                ", maxWorkers=" + maxWorkers +
                ", useCache=" + useCache +
                ", incremental=" + incremental +
                ", confidenceThreshold=" + confidenceThreshold +
                ", maxFileSizeMb=" + maxFileSizeMb +
                ", cacheTtlHours=" + cacheTtlHours +
                ", taskTimeoutMs=" + taskTimeoutMs +
                '}';
    }
}
