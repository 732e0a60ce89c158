package com.code.quality.discovery;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to language names.
 */
public class LanguageDetector {

    private static final Map<String, String> DEFAULT_EXTENSIONS = Map.of(
            ".py", "python",
            ".js", "javascript",
            ".jsx", "javascript",
            ".mjs", "javascript",
            ".cjs", "javascript",
            ".ts", "typescript",
            ".tsx", "typescript");

    private final Map<String, String> extensions;

    public LanguageDetector() {
        this(Map.of());
    }

    /**
     * @param additional extra extension mappings (e.g. {@code ".rb" -> "ruby"}), overriding defaults
     */
    public LanguageDetector(Map<String, String> additional) {
        Map<String, String> merged = new HashMap<>(DEFAULT_EXTENSIONS);
        additional.forEach((ext, language) -> merged.put(ext.toLowerCase(Locale.ROOT), language));
        this.extensions = Map.copyOf(merged);
    }

    public Optional<String> detect(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(fileName.substring(dot).toLowerCase(Locale.ROOT)));
    }
}
