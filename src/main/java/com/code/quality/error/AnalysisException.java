package com.code.quality.error;

import java.util.List;

/**
 * Raised when an analyzer unit fails, or when a run has no parseable file at all.
 */
public class AnalysisException extends CodeQualityException {

    private final String analyzerName;

    public AnalysisException(String message, String analyzerName) {
        this(message, analyzerName, null);
    }

    public AnalysisException(String message, String analyzerName, Throwable cause) {
        super(ErrorKind.ANALYSIS, message, List.of(), cause);
        this.analyzerName = analyzerName;
    }

    public String getAnalyzerName() {
        return analyzerName;
    }
}
