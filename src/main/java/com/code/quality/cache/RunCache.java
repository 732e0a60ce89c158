package com.code.quality.cache;

import com.code.quality.error.CacheException;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for whole-run entries. Independent of the per-file cache.
 * Freshness checks are done by {@link CacheStore}, not by implementations.
 */
public interface RunCache {

    /**
     * @throws CacheException if a stored entry exists but cannot be read
     */
    Optional<RunCacheEntry> get(String key);

    void put(RunCacheEntry entry);

    void remove(String key);

    /**
     * Removes entries cached before {@code cutoff}.
     *
     * @return the number of entries removed
     */
    int expireBefore(Instant cutoff);

    void clear();

    long size();
}
