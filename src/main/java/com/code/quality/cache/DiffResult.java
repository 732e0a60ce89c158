package com.code.quality.cache;

import com.code.quality.core.model.FileFingerprint;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of comparing live files against the per-file cache.
 *
 * @param changed          files that must be reprocessed, in input order
 * @param unchanged        files whose cached record is fresh, in input order
 * @param unchangedRecords the validated record of every unchanged file
 * @param fingerprints     live fingerprint of every file that could be read
 */
public record DiffResult(
        List<Path> changed,
        List<Path> unchanged,
        Map<Path, FileRecord> unchangedRecords,
        Map<Path, FileFingerprint> fingerprints
) {
    public DiffResult {
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
        unchangedRecords = Map.copyOf(unchangedRecords);
        fingerprints = Map.copyOf(fingerprints);
    }
}
