package com.code.quality.core.model;

import java.util.Objects;

/**
 * A line range inside one source file.
 *
 * @param filePath  absolute path of the file, as reported by {@link ParsedFile#path()}
 * @param lineStart first line (1-based)
 * @param lineEnd   last line, inclusive
 */
public record CodeLocation(String filePath, int lineStart, int lineEnd) {

    public CodeLocation {
        Objects.requireNonNull(filePath, "filePath is required");
        if (lineStart < 0 || lineEnd < lineStart) {
            throw new IllegalArgumentException("Invalid line range " + lineStart + "-" + lineEnd);
        }
    }

    public static CodeLocation of(String filePath, int line) {
        return new CodeLocation(filePath, line, line);
    }

    @Override
    public String toString() {
        return filePath + ":" + lineStart + "-" + lineEnd;
    }
}
