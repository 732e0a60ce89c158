package com.code.quality.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * No-op run cache. Used when caching is disabled.
 */
public class NoOpRunCache implements RunCache {

    @Override
    public Optional<RunCacheEntry> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(RunCacheEntry entry) {
        // no-op
    }

    @Override
    public void remove(String key) {
        // no-op
    }

    @Override
    public int expireBefore(Instant cutoff) {
        return 0;
    }

    @Override
    public void clear() {
        // no-op
    }

    @Override
    public long size() {
        return 0;
    }
}
