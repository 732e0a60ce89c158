package com.code.quality.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * In-memory run cache backed by Caffeine, bounded by {@link CacheConfig#maxRunEntries()}.
 */
public class CaffeineRunCache implements RunCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineRunCache.class);

    private final Cache<String, RunCacheEntry> cache;

    public CaffeineRunCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxRunEntries())
                .removalListener((String key, RunCacheEntry value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Evicted run cache entry {} ({})", key, cause);
                    }
                })
                .build();
        log.info("CaffeineRunCache initialized: maxSize={}", config.maxRunEntries());
    }

    @Override
    public Optional<RunCacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(RunCacheEntry entry) {
        cache.put(entry.key(), entry);
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public int expireBefore(Instant cutoff) {
        int removed = 0;
        for (RunCacheEntry entry : cache.asMap().values()) {
            if (entry.cachedAt().isBefore(cutoff) && cache.asMap().remove(entry.key(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
