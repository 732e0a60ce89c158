package com.code.quality.cache;

import com.code.quality.api.AnalysisOptions;
import com.code.quality.core.Digests;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Builds whole-run cache keys.
 *
 * <p>A key is the SHA-256 of the cache format version, the canonical path of the root, the
 * canonical JSON form of the options and optionally the analyzer signature. Equal inputs always
 * give the same key; a different root or any different option gives a different key.</p>
 */
public final class RunCacheKeys {

    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper CANONICAL = CacheJson.canonicalMapper();

    private RunCacheKeys() {
    }

    public static String key(Path root, AnalysisOptions options) {
        return key(root, options, "");
    }

    /**
     * Key that also covers the analyzer set, so registering or reconfiguring a unit
     * never serves a result computed by the previous set.
     */
    public static String key(Path root, AnalysisOptions options, String analyzerSignature) {
        return Digests.sha256Hex(FORMAT_VERSION + "\n" + canonicalPath(root) + "\n" + serialize(options)
                + "\n" + (analyzerSignature != null ? analyzerSignature : ""));
    }

    /**
     * Resolves symbolic links when the root exists, so two spellings of one directory share a key.
     */
    static String canonicalPath(Path root) {
        try {
            return root.toRealPath().toString();
        } catch (IOException e) {
            return root.toAbsolutePath().normalize().toString();
        }
    }

    static String serialize(AnalysisOptions options) {
        try {
            return CANONICAL.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis options", e);
        }
    }
}
