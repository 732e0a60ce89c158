package com.code.quality.cache;

import com.code.quality.api.AnalysisRunResult;
import com.code.quality.core.model.FileFingerprint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Cached result of a whole run.
 *
 * @param key      deterministic key of root and options, see {@link RunCacheKeys}
 * @param result   the run result
 * @param manifest fingerprints of every input file of the run, in discovery order
 * @param cachedAt when the entry was written
 */
public record RunCacheEntry(String key, AnalysisRunResult result, List<FileFingerprint> manifest, Instant cachedAt) {

    public RunCacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(cachedAt, "cachedAt is required");
        manifest = manifest != null ? List.copyOf(manifest) : List.of();
    }

    public boolean isExpired(Duration ttl, Instant now) {
        return cachedAt.plus(ttl).isBefore(now);
    }
}
