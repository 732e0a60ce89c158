package com.code.quality.api;

import com.code.quality.analyzer.AnalyzerPriority;
import com.code.quality.analyzer.AnalyzerRegistry;
import com.code.quality.analyzer.AnalyzerUnit;
import com.code.quality.analyzer.ExecutionPlan;
import com.code.quality.cache.CacheAdmin;
import com.code.quality.cache.CacheStore;
import com.code.quality.cache.DiffResult;
import com.code.quality.cache.FileFingerprinter;
import com.code.quality.cache.FileRecord;
import com.code.quality.cache.RunCacheEntry;
import com.code.quality.cache.RunCacheKeys;
import com.code.quality.concurrent.TaskOutcome;
import com.code.quality.concurrent.WorkerPool;
import com.code.quality.core.model.FileFingerprint;
import com.code.quality.core.model.Issue;
import com.code.quality.core.model.ParsedFile;
import com.code.quality.core.model.QualityMetrics;
import com.code.quality.discovery.FileDiscovery;
import com.code.quality.discovery.GlobFileDiscovery;
import com.code.quality.error.AnalysisCancelledException;
import com.code.quality.error.AnalysisException;
import com.code.quality.error.CodeQualityException;
import com.code.quality.error.ErrorKind;
import com.code.quality.error.ParsingException;
import com.code.quality.error.ResourceException;
import com.code.quality.logging.LogContext;
import com.code.quality.metrics.MetricsService;
import com.code.quality.metrics.NoOpMetricsService;
import com.code.quality.metrics.QualityMetricsCalculator;
import com.code.quality.parser.LanguageRoutingParser;
import com.code.quality.parser.ParserAdapter;
import com.code.quality.progress.AnalysisPhase;
import com.code.quality.progress.ProgressDelta;
import com.code.quality.progress.ProgressListener;
import com.code.quality.progress.ProgressState;
import com.code.quality.progress.ProgressTracker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point of the analysis engine.
 * Discovers files, decides which ones need reprocessing, parses and analyzes them on bounded
 * worker pools, merges fresh and cached results and keeps both cache tiers current.
 *
 * <h2>Key Design Principles</h2>
 * <ul>
 *   <li>A cached result is only served after its inputs were verified against the files on disk</li>
 *   <li>One bad file or analyzer is recorded in the result's failure ledger; the run continues</li>
 *   <li>Results are merged on the calling thread only; workers never share mutable state</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * AnalysisOrchestrator orchestrator = AnalysisOrchestrator.builder()
 *     .analyzer(new MySecurityAnalyzer(), AnalyzerPriority.HIGH)
 *     .build();
 *
 * AnalysisRunResult result = orchestrator.run(Path.of("src"), AnalysisOptions.defaults(),
 *     state -&gt; System.out.printf("%s %.0f%%%n", state.phase().getDisplayName(), state.percentage()));
 * </pre>
 */
public class AnalysisOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private static final Comparator<Issue> ISSUE_ORDER = Comparator
            .comparing(Issue::filePath)
            .thenComparingInt(i -> i.location().lineStart())
            .thenComparing(Issue::category)
            .thenComparing(Issue::id)
            .thenComparing(Issue::severity)
            .thenComparing(Issue::title);

    private final AnalyzerRegistry registry;
    private final ParserAdapter parser;
    private final FileDiscovery discovery;
    private final CacheStore cacheStore;
    private final MetricsService metricsService;
    private final Clock clock;
    private final AnalysisOptions defaultOptions;
    private final QualityMetricsCalculator metricsCalculator = new QualityMetricsCalculator();
    private final FileFingerprinter fingerprinter;
    private final Cache<String, ProgressTracker> progressHistory;

    private AnalysisOrchestrator(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : new AnalyzerRegistry();
        this.parser = builder.parser != null ? builder.parser : new LanguageRoutingParser();
        this.discovery = builder.discovery != null ? builder.discovery : new GlobFileDiscovery();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.cacheStore = builder.cacheStore != null ? builder.cacheStore : CacheStore.inMemory();
        this.clock = builder.clock;
        this.defaultOptions = builder.options;
        this.fingerprinter = cacheStore.fingerprinter();
        this.progressHistory = Caffeine.newBuilder()
                .maximumSize(builder.statusHistorySize)
                .expireAfterWrite(builder.statusRetention)
                .build();
        builder.analyzers.forEach((unit, priority) -> registry.register(unit, priority));
        log.info("AnalysisOrchestrator initialized: analyzers={}, cacheEnabled={}",
                registry.size(), cacheStore.getConfig().enabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Runs ==========

    /**
     * Analyzes {@code root} with the default options.
     */
    public AnalysisRunResult run(Path root) {
        return run(root, defaultOptions);
    }

    public AnalysisRunResult run(Path root, AnalysisOptions options) {
        return run(root, options, ProgressListener.NOOP, CancellationToken.create());
    }

    public AnalysisRunResult run(Path root, AnalysisOptions options, ProgressListener listener) {
        return run(root, options, listener, CancellationToken.create());
    }

    /**
     * Analyzes {@code root}.
     *
     * @param listener progress callback, invoked on the calling thread; a run served from the
     *                 run cache reports only its completion
     * @param token    cooperative cancellation, checked before every task dispatch
     * @return the run result, with recovered per-file and per-unit failures in its ledger
     * @throws ResourceException           if files cannot be discovered
     * @throws AnalysisException           if no file could be parsed
     * @throws AnalysisCancelledException  if the token fired before all tasks were dispatched
     */
    public AnalysisRunResult run(Path root, AnalysisOptions options, ProgressListener listener,
                                 CancellationToken token) {
        Objects.requireNonNull(root, "root is required");
        Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(token, "token is required");

        String analysisId = LogContext.generateAnalysisId();
        ProgressTracker tracker = new ProgressTracker(analysisId, clock);
        tracker.addListener(listener);
        progressHistory.put(analysisId, tracker);
        long startNanos = System.nanoTime();

        try (LogContext ignored = LogContext.forRun(analysisId, root.toString())) {
            log.info("analysis.started analysisId={} root={}", analysisId, root);
            tracker.holdNotifications();
            tracker.start();
            RunOutcome outcome = execute(analysisId, root, options, tracker, token);
            tracker.complete();
            AnalysisRunResult result = outcome.result();
            metricsService.recordRunDuration(outcome.fromRunCache() ? "cached" : "completed",
                    Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("analysis.completed analysisId={} files={} issues={} failures={} cached={}",
                    analysisId, result.parsedFiles().size(), result.issues().size(),
                    result.failures().size(), outcome.fromRunCache());
            return result;
        } catch (AnalysisCancelledException e) {
            tracker.fail("Cancelled");
            metricsService.recordRunDuration("cancelled", Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("analysis.cancelled analysisId={}", analysisId);
            throw e;
        } catch (CodeQualityException e) {
            tracker.fail(e.getMessage());
            metricsService.recordRunDuration("failed", Duration.ofNanos(System.nanoTime() - startNanos));
            log.error("analysis.failed analysisId={} kind={} error={}", analysisId, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            tracker.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            metricsService.recordRunDuration("failed", Duration.ofNanos(System.nanoTime() - startNanos));
            log.error("analysis.failed analysisId={} error={}", analysisId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Analyzes {@code root} ignoring both caches. Results are still written to the cache.
     */
    public AnalysisRunResult forceFullAnalysis(Path root, AnalysisOptions options, ProgressListener listener) {
        AnalysisOptions full = options.toBuilder().useCache(false).incremental(false).build();
        return run(root, full, listener, CancellationToken.create());
    }

    /**
     * Returns the progress of a running or recently finished run.
     */
    public Optional<ProgressState> getStatus(String analysisId) {
        return Optional.ofNullable(progressHistory.getIfPresent(analysisId)).map(ProgressTracker::snapshot);
    }

    // ========== Registry and cache access ==========

    public void register(AnalyzerUnit unit, AnalyzerPriority priority) {
        registry.register(unit, priority);
    }

    public boolean unregister(String name) {
        return registry.unregister(name);
    }

    public AnalyzerRegistry getRegistry() {
        return registry;
    }

    public CacheAdmin cacheAdmin() {
        return cacheStore;
    }

    // ========== Pipeline ==========

    private RunOutcome execute(String analysisId, Path root, AnalysisOptions options,
                               ProgressTracker tracker, CancellationToken token) {
        Path rootPath = root.toAbsolutePath().normalize();
        AnalysisContext context = new AnalysisContext(analysisId, rootPath, options);
        String signature = registry.signature(options.getCategories(), Set.of());
        Duration ttl = options.getCacheTtl();

        tracker.enterPhase(AnalysisPhase.DISCOVERING);
        List<Path> files = discover(rootPath, options);
        String runKey = RunCacheKeys.key(rootPath, options, signature);

        if (options.isUseCache()) {
            Optional<AnalysisRunResult> cached = cacheStore.runGet(runKey, ttl, entry -> manifestMatches(entry, files));
            if (cached.isPresent()) {
                log.info("analysis.cache.hit analysisId={} files={}", analysisId, files.size());
                return new RunOutcome(fromRunCache(analysisId, cached.get(), files.size()), true);
            }
        }

        // not a cached replay, so listeners see the run from here on
        tracker.releaseNotifications();
        tracker.setTotalFiles(files.size());

        // Split into changed and unchanged files
        Map<Path, FileFingerprint> fingerprints;
        List<Path> changed;
        Map<Path, FileRecord> cachedRecords;
        if (options.isIncremental()) {
            DiffResult diff = cacheStore.diff(files, ttl, signature);
            fingerprints = diff.fingerprints();
            changed = diff.changed();
            cachedRecords = diff.unchangedRecords();
        } else {
            fingerprints = fingerprintAll(files);
            changed = files;
            cachedRecords = Map.of();
        }
        if (!cachedRecords.isEmpty()) {
            tracker.update(ProgressDelta.files(cachedRecords.size()));
            metricsService.incrementFilesFromCache(cachedRecords.size());
        }
        log.debug("{} files changed, {} served from cache", changed.size(), cachedRecords.size());

        List<RunFailure> failures = new ArrayList<>();

        // Parse changed files
        tracker.enterPhase(AnalysisPhase.PARSING);
        Map<Path, ParsedFile> freshParsed = parseAll(analysisId, changed, options, tracker, token, failures);

        List<ParsedFile> parsedFiles = new ArrayList<>();
        List<ParsedFile> freshInOrder = new ArrayList<>();
        for (Path file : files) {
            FileRecord record = cachedRecords.get(file);
            if (record != null) {
                parsedFiles.add(record.parsedFile());
            } else if (freshParsed.containsKey(file)) {
                parsedFiles.add(freshParsed.get(file));
                freshInOrder.add(freshParsed.get(file));
            }
        }
        if (parsedFiles.isEmpty()) {
            throw new AnalysisException(files.isEmpty()
                    ? "No files found to analyze under " + rootPath
                    : "None of the " + files.size() + " discovered files could be parsed", null);
        }

        // Analyze changed files only
        tracker.enterPhase(AnalysisPhase.ANALYZING);
        ExecutionPlan plan = registry.plan(freshInOrder, options.getCategories(), Set.of());
        tracker.setTotalAnalyzers(plan.size());
        Set<String> tainted = new HashSet<>();
        List<Issue> freshIssues = analyzeAll(context, plan, options, tracker, token, failures, tainted);

        // Merge
        Set<String> analyzedPaths = new HashSet<>();
        parsedFiles.forEach(f -> analyzedPaths.add(f.path()));
        List<Issue> merged = new ArrayList<>();
        cachedRecords.values().forEach(record -> merged.addAll(record.issues()));
        merged.addAll(freshIssues);
        List<Issue> issues = merged.stream()
                .filter(i -> i.confidence() >= options.getConfidenceThreshold())
                .filter(i -> analyzedPaths.contains(i.filePath()))
                .sorted(ISSUE_ORDER)
                .toList();

        tracker.enterPhase(AnalysisPhase.CALCULATING_METRICS);
        QualityMetrics qualityMetrics = metricsCalculator.calculate(issues, parsedFiles);
        metricsService.recordIssueCount(issues.size());

        writeFileRecords(freshParsed, fingerprints, freshIssues, tainted, signature);
        cacheStore.evictMissing(rootPath);

        RunStatistics statistics = new RunStatistics(files.size(), changed.size(), cachedRecords.size(),
                countFailures(failures, ErrorKind.PARSING), plan.size(),
                countFailures(failures, ErrorKind.ANALYSIS));
        AnalysisRunResult result = new AnalysisRunResult(analysisId, root.toString(), clock.instant(),
                parsedFiles, issues, qualityMetrics, options, failures, statistics);

        if (failures.isEmpty() && fingerprints.size() == files.size()) {
            List<FileFingerprint> manifest = files.stream().map(fingerprints::get).toList();
            cacheStore.runPut(runKey, result, manifest);
        }
        return new RunOutcome(result, false);
    }

    private List<Path> discover(Path rootPath, AnalysisOptions options) {
        try {
            return discovery.discover(rootPath, options.getIncludePatterns(), options.getExcludePatterns(),
                    options.getMaxFileSizeBytes()).stream()
                    .map(FileFingerprinter::normalize)
                    .distinct()
                    .toList();
        } catch (IOException e) {
            throw new ResourceException("Failed to discover files under " + rootPath, "directory", e);
        }
    }

    private boolean manifestMatches(RunCacheEntry entry, List<Path> files) {
        List<FileFingerprint> manifest = entry.manifest();
        if (manifest.size() != files.size()) {
            return false;
        }
        for (int i = 0; i < files.size(); i++) {
            try {
                if (!fingerprinter.fingerprint(files.get(i)).equals(manifest.get(i))) {
                    return false;
                }
            } catch (IOException e) {
                return false;
            }
        }
        return true;
    }

    private AnalysisRunResult fromRunCache(String analysisId, AnalysisRunResult cached, int fileCount) {
        metricsService.incrementFilesFromCache(fileCount);
        RunStatistics statistics = new RunStatistics(fileCount, 0, fileCount, 0, 0, 0);
        return new AnalysisRunResult(analysisId, cached.root(), cached.timestamp(), cached.parsedFiles(),
                cached.issues(), cached.metrics(), cached.options(), cached.failures(), statistics);
    }

    private Map<Path, FileFingerprint> fingerprintAll(List<Path> files) {
        Map<Path, FileFingerprint> fingerprints = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                fingerprints.put(file, fingerprinter.fingerprint(file));
            } catch (IOException e) {
                log.debug("Cannot fingerprint {}: {}", file, e.getMessage());
            }
        }
        return fingerprints;
    }

    private Map<Path, ParsedFile> parseAll(String analysisId, List<Path> changed, AnalysisOptions options,
                                           ProgressTracker tracker, CancellationToken token,
                                           List<RunFailure> failures) {
        Map<Path, ParsedFile> parsed = new HashMap<>();
        if (changed.isEmpty()) {
            return parsed;
        }
        boolean parallel = options.isParallelProcessing() && changed.size() > 1;
        boolean[] cancelled = {false};
        try (WorkerPool pool = new WorkerPool("cq-parse", options.getMaxWorkers(), parallel,
                options.getTaskTimeoutMs())) {
            pool.<Path, ParsedFile>execute(changed, file -> parseOne(analysisId, file), token, outcome -> {
                switch (outcome.status()) {
                    case SUCCEEDED -> parsed.put(outcome.input(), outcome.value());
                    case CANCELLED -> cancelled[0] = true;
                    default -> {
                        ParsingException error = toParsingException(outcome, options);
                        failures.add(RunFailure.of(error, outcome.input().toString()));
                        metricsService.incrementParseFailure();
                        log.warn("Failed to parse {}: {}", outcome.input(), error.getTechnicalDetails());
                    }
                }
                if (outcome.status() != TaskOutcome.Status.CANCELLED) {
                    tracker.update(ProgressDelta.files(1));
                }
            });
        }
        if (cancelled[0]) {
            throw new AnalysisCancelledException(analysisId);
        }
        metricsService.incrementFilesParsed(parsed.size());
        return parsed;
    }

    private ParsedFile parseOne(String analysisId, Path file) throws IOException {
        try (LogContext ignored = LogContext.forTask(analysisId, "parse", file.toString())) {
            ParsedFile parsed = parser.parse(file);
            if (parsed == null) {
                throw new ParsingException("Parser returned no result", file.toString(), null);
            }
            if (!parsed.path().equals(file.toString())) {
                parsed = new ParsedFile(file.toString(), parsed.language(), parsed.content(),
                        parsed.lineCount(), parsed.attributes());
            }
            return parsed;
        }
    }

    private static ParsingException toParsingException(TaskOutcome<Path, ParsedFile> outcome, AnalysisOptions options) {
        String path = outcome.input().toString();
        Throwable error = outcome.error();
        if (outcome.status() == TaskOutcome.Status.TIMED_OUT || error instanceof TimeoutException) {
            return new ParsingException("Parsing timed out after " + options.getTaskTimeoutMs() + "ms", path, error);
        }
        if (error instanceof ParsingException parsingException) {
            return parsingException;
        }
        return new ParsingException("Failed to parse " + path, path, error);
    }

    private List<Issue> analyzeAll(AnalysisContext context, ExecutionPlan plan, AnalysisOptions options,
                                   ProgressTracker tracker, CancellationToken token,
                                   List<RunFailure> failures, Set<String> tainted) {
        List<Issue> issues = new ArrayList<>();
        if (plan.isEmpty()) {
            return issues;
        }
        boolean parallel = options.isParallelProcessing() && plan.size() > 1;
        boolean[] cancelled = {false};
        try (WorkerPool pool = new WorkerPool("cq-analyze", options.getMaxWorkers(), parallel,
                options.getTaskTimeoutMs())) {
            pool.<ExecutionPlan.PlannedTask, List<Issue>>execute(plan.tasks(), task -> analyzeOne(context, task), token, outcome -> {
                ExecutionPlan.PlannedTask task = outcome.input();
                String unitName = task.unit().getName();
                switch (outcome.status()) {
                    case SUCCEEDED -> issues.addAll(accepted(task, outcome.value()));
                    case CANCELLED -> cancelled[0] = true;
                    default -> {
                        AnalysisException error = toAnalysisException(outcome, options);
                        failures.add(RunFailure.of(error, unitName));
                        task.files().forEach(f -> tainted.add(f.path()));
                        metricsService.incrementAnalyzerFailure(unitName);
                        log.warn("Analyzer {} failed: {}", unitName, error.getTechnicalDetails());
                    }
                }
                if (outcome.status() != TaskOutcome.Status.CANCELLED) {
                    tracker.update(ProgressDelta.analyzers(1));
                }
            });
        }
        if (cancelled[0]) {
            throw new AnalysisCancelledException(context.analysisId());
        }
        return issues;
    }

    private static List<Issue> analyzeOne(AnalysisContext context, ExecutionPlan.PlannedTask task) {
        AnalyzerUnit unit = task.unit();
        try (LogContext ignored = LogContext.forTask(context.analysisId(), "analyze", unit.getName())) {
            List<Issue> found = unit.analyze(task.files(), context);
            log.debug("Analyzer {} found {} issues in {} files", unit.getName(),
                    found != null ? found.size() : 0, task.files().size());
            return found != null ? found : List.of();
        }
    }

    /**
     * Keeps the issues that pass the unit's confidence threshold and point at one of its files.
     */
    private static List<Issue> accepted(ExecutionPlan.PlannedTask task, List<Issue> found) {
        AnalyzerUnit unit = task.unit();
        Set<String> paths = new HashSet<>();
        task.files().forEach(f -> paths.add(f.path()));
        List<Issue> accepted = new ArrayList<>(found.size());
        for (Issue issue : found) {
            if (issue == null || issue.confidence() < unit.getConfidenceThreshold()) {
                continue;
            }
            if (!paths.contains(issue.filePath())) {
                log.warn("Analyzer {} reported issue {} for {} which it was not given, dropping it",
                        unit.getName(), issue.id(), issue.filePath());
                continue;
            }
            accepted.add(issue);
        }
        return accepted;
    }

    private static AnalysisException toAnalysisException(TaskOutcome<ExecutionPlan.PlannedTask, List<Issue>> outcome,
                                                         AnalysisOptions options) {
        String unitName = outcome.input().unit().getName();
        Throwable error = outcome.error();
        if (outcome.status() == TaskOutcome.Status.TIMED_OUT) {
            return new AnalysisException("Analyzer " + unitName + " timed out after "
                    + options.getTaskTimeoutMs() + "ms", unitName, error);
        }
        if (error instanceof AnalysisException analysisException) {
            return analysisException;
        }
        return new AnalysisException("Analyzer " + unitName + " failed", unitName, error);
    }

    private void writeFileRecords(Map<Path, ParsedFile> freshParsed, Map<Path, FileFingerprint> fingerprints,
                                  List<Issue> freshIssues, Set<String> tainted, String signature) {
        Map<String, List<Issue>> issuesByFile = new HashMap<>();
        for (Issue issue : freshIssues) {
            issuesByFile.computeIfAbsent(issue.filePath(), k -> new ArrayList<>()).add(issue);
        }
        int written = 0;
        for (Map.Entry<Path, ParsedFile> entry : freshParsed.entrySet()) {
            FileFingerprint fingerprint = fingerprints.get(entry.getKey());
            String path = entry.getValue().path();
            if (fingerprint == null || tainted.contains(path)) {
                continue;
            }
            try {
                cacheStore.put(fingerprint, entry.getValue(), issuesByFile.getOrDefault(path, List.of()), signature);
                written++;
            } catch (RuntimeException e) {
                log.warn("cache.file.put.failed path={} error={}", path, e.getMessage());
            }
        }
        log.debug("Cached {} file records", written);
    }

    private static int countFailures(List<RunFailure> failures, ErrorKind kind) {
        return (int) failures.stream().filter(f -> f.kind() == kind).count();
    }

    private record RunOutcome(AnalysisRunResult result, boolean fromRunCache) {}

    /**
     * Builder for {@link AnalysisOrchestrator}.
     */
    public static class Builder {
        private AnalyzerRegistry registry;
        private ParserAdapter parser;
        private FileDiscovery discovery;
        private CacheStore cacheStore;
        private MetricsService metricsService;
        private Clock clock = Clock.systemUTC();
        private AnalysisOptions options = AnalysisOptions.defaults();
        private final Map<AnalyzerUnit, AnalyzerPriority> analyzers = new LinkedHashMap<>();
        private long statusHistorySize = 1_000;
        private Duration statusRetention = Duration.ofHours(1);

        /**
         * Uses an existing registry instead of a new, empty one.
         */
        public Builder registry(AnalyzerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder analyzer(AnalyzerUnit unit) {
            return analyzer(unit, AnalyzerPriority.MEDIUM);
        }

        public Builder analyzer(AnalyzerUnit unit, AnalyzerPriority priority) {
            this.analyzers.put(Objects.requireNonNull(unit, "unit"), Objects.requireNonNull(priority, "priority"));
            return this;
        }

        public Builder parser(ParserAdapter parser) {
            this.parser = parser;
            return this;
        }

        public Builder fileDiscovery(FileDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder cacheStore(CacheStore cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        /**
         * Sets a metrics service for recording run metrics.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the options used by {@link #run(Path)}.
         */
        public Builder options(AnalysisOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * How long and how many finished runs stay visible through {@link #getStatus(String)}.
         */
        public Builder statusHistory(long maxRuns, Duration retention) {
            if (maxRuns <= 0) {
                throw new IllegalArgumentException("maxRuns must be > 0");
            }
            if (retention == null || retention.isNegative() || retention.isZero()) {
                throw new IllegalArgumentException("retention must be > 0");
            }
            this.statusHistorySize = maxRuns;
            this.statusRetention = retention;
            return this;
        }

        public AnalysisOrchestrator build() {
            return new AnalysisOrchestrator(this);
        }
    }
}
