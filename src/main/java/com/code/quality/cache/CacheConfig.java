package com.code.quality.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the analysis cache.
 *
 * @param defaultTtl          time-to-live used when a caller does not pass one
 * @param shardCount          number of independently locked shards of the per-file cache
 * @param maxRunEntries       maximum number of whole-run entries kept in memory
 * @param persistentDirectory directory for persisted run entries, or null for memory only
 * @param enabled             whether caching is enabled
 */
public record CacheConfig(Duration defaultTtl, int shardCount, int maxRunEntries,
                          Path persistentDirectory, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(defaultTtl, "defaultTtl is required");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0");
        }
        if (maxRunEntries <= 0) {
            throw new IllegalArgumentException("maxRunEntries must be > 0");
        }
    }

    /**
     * Default cache configuration: 24h TTL, 16 shards, 256 run entries, memory only, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(Duration.ofHours(24), 16, 256, null, true);
    }

    /**
     * Default configuration with run entries persisted as JSON under {@code directory}.
     */
    public static CacheConfig persistent(Path directory) {
        return new CacheConfig(Duration.ofHours(24), 16, 256, directory, true);
    }

    /**
     * Disabled cache configuration. Every lookup misses and nothing is stored.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(Duration.ofHours(24), 1, 1, null, false);
    }

    public CacheConfig withDefaultTtl(Duration ttl) {
        return new CacheConfig(ttl, shardCount, maxRunEntries, persistentDirectory, enabled);
    }
}
