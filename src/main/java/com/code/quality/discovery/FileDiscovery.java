package com.code.quality.discovery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves include/exclude glob patterns under a root to a list of files.
 */
public interface FileDiscovery {

    /**
     * @param root             directory to search, or a single file
     * @param includePatterns  patterns a file must match
     * @param excludePatterns  patterns that exclude a file or prune a directory
     * @param maxFileSizeBytes files larger than this are skipped
     * @return matching files as absolute, normalized paths in a deterministic order
     * @throws IOException if the root does not exist or cannot be read
     */
    List<Path> discover(Path root, List<String> includePatterns, List<String> excludePatterns,
                        long maxFileSizeBytes) throws IOException;
}
