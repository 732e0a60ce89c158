package com.code.quality.parser;

import com.code.quality.core.model.ParsedFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a source file into a {@link ParsedFile}.
 * Implementations must be safe to call from several worker threads at once.
 */
@FunctionalInterface
public interface ParserAdapter {

    /**
     * @param file absolute, normalized path of the file
     * @throws IOException if the file cannot be read
     * @throws com.code.quality.error.ParsingException if the content cannot be parsed
     */
    ParsedFile parse(Path file) throws IOException;
}
