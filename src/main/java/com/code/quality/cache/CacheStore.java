package com.code.quality.cache;

import com.code.quality.api.AnalysisRunResult;
import com.code.quality.core.model.FileFingerprint;
import com.code.quality.core.model.Issue;
import com.code.quality.core.model.ParsedFile;
import com.code.quality.error.CacheException;
import com.code.quality.logging.LogContext;
import com.code.quality.metrics.MetricsService;
import com.code.quality.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Content-addressed, TTL-bound cache of per-file results and whole-run results.
 *
 * <p>The per-file store is split into path-hash shards, each behind its own read/write lock,
 * so parse and analyze workers can use it concurrently. The whole-run store is a separate
 * {@link RunCache}; the full-bypass lookup never goes through the per-file logic.</p>
 *
 * <p>Freshness is validated here and nowhere else: a record is returned only when its
 * fingerprint matches the live file, it is younger than the TTL and it was produced by the
 * requested analyzer set. Records are checked for integrity when written. Corrupted run
 * entries are removed and count as misses. Cache write failures are logged and never
 * propagate to the caller.</p>
 */
public class CacheStore implements CacheAdmin {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final CacheConfig config;
    private final Shard[] shards;
    private final RunCache runCache;
    private final FileFingerprinter fingerprinter;
    private final MetricsService metrics;
    private final Clock clock;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public CacheStore(CacheConfig config) {
        this(config, defaultRunCache(config), new NoOpMetricsService(), Clock.systemUTC());
    }

    public CacheStore(CacheConfig config, MetricsService metrics) {
        this(config, defaultRunCache(config), metrics, Clock.systemUTC());
    }

    public CacheStore(CacheConfig config, RunCache runCache, MetricsService metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.runCache = Objects.requireNonNull(runCache, "runCache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.fingerprinter = new FileFingerprinter();
        this.shards = new Shard[config.shardCount()];
        for (int i = 0; i < shards.length; i++) {
            shards[i] = new Shard();
        }
        log.info("CacheStore initialized: enabled={}, shards={}, defaultTtl={}, runCache={}",
                config.enabled(), config.shardCount(), config.defaultTtl(), runCache.getClass().getSimpleName());
    }

    /**
     * Creates an enabled, memory-only cache store with default settings.
     */
    public static CacheStore inMemory() {
        return new CacheStore(CacheConfig.defaults());
    }

    public static CacheStore disabled() {
        return new CacheStore(CacheConfig.disabled());
    }

    private static RunCache defaultRunCache(CacheConfig config) {
        if (!config.enabled()) {
            return new NoOpRunCache();
        }
        if (config.persistentDirectory() != null) {
            return new JsonFileRunCache(config.persistentDirectory());
        }
        return new CaffeineRunCache(config);
    }

    public CacheConfig getConfig() {
        return config;
    }

    public FileFingerprinter fingerprinter() {
        return fingerprinter;
    }

    // ========== Per-file cache ==========

    /**
     * Looks up a record with the default TTL, regardless of the analyzer set that produced it.
     */
    public Optional<FileRecord> get(Path path) {
        return get(path, config.defaultTtl(), null);
    }

    /**
     * Returns the record for {@code path} if it is intact, not expired, matches the live file on
     * disk, and (when {@code analyzerSignature} is non-null) was produced by that analyzer set.
     */
    public Optional<FileRecord> get(Path path, Duration ttl, String analyzerSignature) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        Path key = FileFingerprinter.normalize(path);
        FileFingerprint live;
        try {
            live = fingerprinter.fingerprint(key);
        } catch (IOException e) {
            log.debug("Cannot fingerprint {}: {}", key, e.getMessage());
            recordMiss();
            return Optional.empty();
        }
        Optional<FileRecord> record = validRecord(key, live, ttl, analyzerSignature);
        if (record.isPresent()) {
            recordHit();
        } else {
            recordMiss();
        }
        return record;
    }

    public void put(FileFingerprint fingerprint, ParsedFile parsedFile, List<Issue> issues) {
        put(fingerprint, parsedFile, issues, null);
    }

    /**
     * Upserts the record of one file, stamped with the current time.
     *
     * @throws IllegalArgumentException if the parsed file or an issue belongs to another path
     */
    public void put(FileFingerprint fingerprint, ParsedFile parsedFile, List<Issue> issues,
                    String analyzerSignature) {
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        Objects.requireNonNull(parsedFile, "parsedFile is required");
        Objects.requireNonNull(issues, "issues is required");
        if (!config.enabled()) {
            return;
        }
        FileRecord record = new FileRecord(fingerprint, parsedFile, issues, analyzerSignature, clock.instant());
        if (!record.isIntact()) {
            throw new IllegalArgumentException("Record for " + fingerprint.path()
                    + " contains a parsed file or issue of another path");
        }
        shardFor(fingerprint.path()).write(map -> map.put(fingerprint.path(), record));
    }

    /**
     * Removes the record of one file.
     *
     * @return true if a record was removed
     */
    public boolean remove(Path path) {
        Path key = FileFingerprinter.normalize(path);
        return shardFor(key).write(map -> map.remove(key) != null);
    }

    public DiffResult diff(Collection<Path> paths) {
        return diff(paths, config.defaultTtl(), null);
    }

    /**
     * Splits {@code paths} into changed and unchanged files by recomputing each live
     * fingerprint. A missing, expired or foreign-signature record, a fingerprint
     * mismatch and an unreadable file all make the file changed.
     */
    public DiffResult diff(Collection<Path> paths, Duration ttl, String analyzerSignature) {
        List<Path> changed = new ArrayList<>();
        List<Path> unchanged = new ArrayList<>();
        Map<Path, FileRecord> records = new HashMap<>();
        Map<Path, FileFingerprint> fingerprints = new LinkedHashMap<>();

        for (Path path : paths) {
            Path key = FileFingerprinter.normalize(path);
            FileFingerprint live;
            try {
                live = fingerprinter.fingerprint(key);
                fingerprints.put(key, live);
            } catch (IOException e) {
                log.debug("Cannot fingerprint {}, treating as changed: {}", key, e.getMessage());
                changed.add(key);
                recordMiss();
                continue;
            }
            Optional<FileRecord> record = config.enabled()
                    ? validRecord(key, live, ttl, analyzerSignature)
                    : Optional.empty();
            if (record.isPresent()) {
                unchanged.add(key);
                records.put(key, record.get());
                recordHit();
            } else {
                changed.add(key);
                recordMiss();
            }
        }
        log.debug("Cache diff: {} changed, {} unchanged", changed.size(), unchanged.size());
        return new DiffResult(changed, unchanged, records, fingerprints);
    }

    private Optional<FileRecord> validRecord(Path key, FileFingerprint live, Duration ttl, String analyzerSignature) {
        Shard shard = shardFor(key);
        FileRecord record = shard.read(map -> map.get(key));
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpired(ttl, clock.instant())) {
            shard.write(map -> map.remove(key, record));
            return Optional.empty();
        }
        if (analyzerSignature != null && !analyzerSignature.equals(record.analyzerSignature())) {
            return Optional.empty();
        }
        if (!record.fingerprint().equals(live)) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * Removes every record under {@code root} whose file no longer exists.
     *
     * @return the number of records removed
     */
    public int evictMissing(Path root) {
        Path normalizedRoot = FileFingerprinter.normalize(root);
        int removed = 0;
        for (Shard shard : shards) {
            removed += shard.write(map -> {
                int count = 0;
                Iterator<Path> it = map.keySet().iterator();
                while (it.hasNext()) {
                    Path path = it.next();
                    if (path.startsWith(normalizedRoot) && !Files.exists(path)) {
                        it.remove();
                        count++;
                    }
                }
                return count;
            });
        }
        if (removed > 0) {
            log.debug("Evicted {} records of deleted files under {}", removed, normalizedRoot);
        }
        return removed;
    }

    public long fileEntryCount() {
        long total = 0;
        for (Shard shard : shards) {
            total += shard.read(Map::size);
        }
        return total;
    }

    // ========== Whole-run cache ==========

    /**
     * Looks up a whole-run result. The entry must be fresh and must pass {@code validator}
     * (the manifest check of the caller); otherwise this is a miss. An unreadable entry is
     * removed and is a miss.
     */
    public Optional<AnalysisRunResult> runGet(String key, Duration ttl, Predicate<RunCacheEntry> validator) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        Optional<RunCacheEntry> entry;
        try {
            entry = runCache.get(key);
        } catch (CacheException e) {
            log.warn("Discarding unreadable run cache entry {}: {}", key, e.getMessage());
            removeRunEntry(key);
            recordRunMiss();
            return Optional.empty();
        }
        if (entry.isEmpty()) {
            recordRunMiss();
            return Optional.empty();
        }
        if (entry.get().isExpired(ttl, clock.instant())) {
            removeRunEntry(key);
            recordRunMiss();
            return Optional.empty();
        }
        if (!validator.test(entry.get())) {
            log.debug("Run cache entry {} is stale, inputs changed", key);
            recordRunMiss();
            return Optional.empty();
        }
        hits.increment();
        metrics.recordCacheHit(MetricsService.TIER_RUN);
        return Optional.of(entry.get().result());
    }

    /**
     * Stores a whole-run result. Best-effort: failures are logged and swallowed, since a
     * missing run entry only costs a slower next run.
     */
    public void runPut(String key, AnalysisRunResult result, List<FileFingerprint> manifest) {
        if (!config.enabled()) {
            return;
        }
        try {
            runCache.put(new RunCacheEntry(key, result, manifest, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("cache.run.put.failed key={} error={}", key, e.getMessage());
        }
    }

    private void removeRunEntry(String key) {
        try {
            runCache.remove(key);
        } catch (RuntimeException e) {
            log.warn("Failed to remove run cache entry {}: {}", key, e.getMessage());
        }
    }

    // ========== Maintenance ==========

    /**
     * Removes every per-file and whole-run entry with {@code cachedAt + ttl < now}.
     *
     * @return exactly the number of entries removed
     */
    public int expire(Duration ttl) {
        try (LogContext ignored = LogContext.forCacheMaintenance()) {
            Instant now = clock.instant();
            int removed = 0;
            for (Shard shard : shards) {
                removed += shard.write(map -> {
                    int count = 0;
                    Iterator<FileRecord> it = map.values().iterator();
                    while (it.hasNext()) {
                        if (it.next().isExpired(ttl, now)) {
                            it.remove();
                            count++;
                        }
                    }
                    return count;
                });
            }
            try {
                removed += runCache.expireBefore(now.minus(ttl));
            } catch (CacheException e) {
                log.warn("Run cache expiry sweep failed: {}", e.getMessage());
            }
            log.info("cache.expired removed={} ttl={}", removed, ttl);
            return removed;
        }
    }

    @Override
    public int cleanupExpired() {
        return expire(config.defaultTtl());
    }

    @Override
    public void clearCache() {
        for (Shard shard : shards) {
            shard.write(map -> {
                map.clear();
                return null;
            });
        }
        try {
            runCache.clear();
        } catch (CacheException e) {
            log.warn("Failed to clear run cache: {}", e.getMessage());
        }
        hits.reset();
        misses.reset();
        log.info("cache.cleared");
    }

    @Override
    public CacheStats stats() {
        long runEntries;
        try {
            runEntries = runCache.size();
        } catch (CacheException e) {
            log.warn("Cannot count run cache entries: {}", e.getMessage());
            runEntries = 0;
        }
        return new CacheStats(fileEntryCount(), runEntries, hits.sum(), misses.sum());
    }

    private void recordHit() {
        hits.increment();
        metrics.recordCacheHit(MetricsService.TIER_FILE);
    }

    private void recordMiss() {
        misses.increment();
        metrics.recordCacheMiss(MetricsService.TIER_FILE);
    }

    private void recordRunMiss() {
        misses.increment();
        metrics.recordCacheMiss(MetricsService.TIER_RUN);
    }

    private Shard shardFor(Path path) {
        return shards[Math.floorMod(path.hashCode(), shards.length)];
    }

    /**
     * One lock-protected partition of the per-file store.
     */
    private static final class Shard {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<Path, FileRecord> records = new HashMap<>();

        <T> T read(Function<Map<Path, FileRecord>, T> action) {
            lock.readLock().lock();
            try {
                return action.apply(records);
            } finally {
                lock.readLock().unlock();
            }
        }

        <T> T write(Function<Map<Path, FileRecord>, T> action) {
            lock.writeLock().lock();
            try {
                return action.apply(records);
            } finally {
                lock.writeLock().unlock();
            }
        }
    }
}
