package com.code.quality.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Parser output for one source file. The engine treats the parsed
 * representation as opaque; language-specific structure lives in {@code attributes}.
 *
 * @param path       absolute, normalized file path
 * @param language   detected language, lower case (e.g. {@code python})
 * @param content    file content
 * @param lineCount  number of lines
 * @param attributes parser-specific structure (functions, classes, imports...)
 */
public record ParsedFile(
        String path,
        String language,
        String content,
        int lineCount,
        Map<String, Object> attributes
) {
    public ParsedFile {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(language, "language is required");
        content = content != null ? content : "";
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static ParsedFile of(String path, String language, String content) {
        return new ParsedFile(path, language, content, (int) content.lines().count(), Map.of());
    }
}
