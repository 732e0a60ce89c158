package com.code.quality.cache;

import com.code.quality.core.Digests;
import com.code.quality.core.model.FileFingerprint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Computes {@link FileFingerprint}s from a strong content hash and the file size.
 * Modification times are not used; they miss changes within the filesystem's clock resolution.
 */
public class FileFingerprinter {

    public FileFingerprint fingerprint(Path file) throws IOException {
        Path path = normalize(file);
        long size = Files.size(path);
        return new FileFingerprint(path, Digests.sha256Hex(path), size);
    }

    public static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
