package com.code.quality.cache;

/**
 * Cache metrics.
 *
 * @param fileEntries number of per-file records
 * @param runEntries  number of whole-run entries
 * @param hits        lookups that returned a fresh entry
 * @param misses      lookups that returned nothing
 */
public record CacheStats(long fileEntries, long runEntries, long hits, long misses) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
