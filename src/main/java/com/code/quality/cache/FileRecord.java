package com.code.quality.cache;

import com.code.quality.core.model.FileFingerprint;
import com.code.quality.core.model.Issue;
import com.code.quality.core.model.ParsedFile;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Cached result for one file: its parsed form and the issues found in it.
 * An empty issue list is a cached result too.
 *
 * @param fingerprint       fingerprint of the file when it was analyzed
 * @param parsedFile        parser output
 * @param issues            issues that passed their unit's confidence threshold
 * @param analyzerSignature signature of the analyzer set that produced the issues, may be null
 * @param cachedAt          when the record was written
 */
public record FileRecord(
        FileFingerprint fingerprint,
        ParsedFile parsedFile,
        List<Issue> issues,
        String analyzerSignature,
        Instant cachedAt
) {
    public FileRecord {
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        Objects.requireNonNull(cachedAt, "cachedAt is required");
        issues = issues != null ? List.copyOf(issues) : null;
    }

    /**
     * An entry with {@code cachedAt + ttl < now} is expired.
     */
    public boolean isExpired(Duration ttl, Instant now) {
        return cachedAt.plus(ttl).isBefore(now);
    }

    /**
     * Whether the record is internally consistent: it has a parsed file and an issue list,
     * and both refer to the fingerprinted file.
     */
    public boolean isIntact() {
        if (parsedFile == null || issues == null) {
            return false;
        }
        String path = fingerprint.path().toString();
        return parsedFile.path().equals(path)
                && issues.stream().allMatch(i -> i.filePath().equals(path));
    }
}
