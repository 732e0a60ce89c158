package com.code.quality.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Cheap, comparable identity of a file's on-disk state.
 * Two fingerprints are equal iff path, content hash and size all match.
 *
 * @param path        absolute, normalized file path
 * @param contentHash hex-encoded SHA-256 of the file bytes
 * @param size        file size in bytes
 */
public record FileFingerprint(Path path, String contentHash, long size) {

    public FileFingerprint {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
    }
}
