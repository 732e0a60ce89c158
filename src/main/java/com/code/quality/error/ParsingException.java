package com.code.quality.error;

import java.util.List;

/**
 * Raised when a single file cannot be parsed.
 */
public class ParsingException extends CodeQualityException {

    private final String filePath;

    public ParsingException(String message, String filePath, Throwable cause) {
        super(ErrorKind.PARSING, message, List.of("Check the file for syntax errors or an unsupported encoding"), cause);
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }
}
