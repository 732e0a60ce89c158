package com.code.quality.cache;

/**
 * Administrative operations on the analysis cache.
 */
public interface CacheAdmin {

    /**
     * Removes every per-file and whole-run entry and resets hit/miss counters.
     */
    void clearCache();

    /**
     * Removes entries older than the configured default TTL.
     *
     * @return the number of entries removed
     */
    int cleanupExpired();

    CacheStats stats();
}
