package com.code.quality.error;

import java.util.List;

/**
 * Raised from a run whose cancellation token fired before all tasks were dispatched.
 */
public class AnalysisCancelledException extends CodeQualityException {

    private final String analysisId;

    public AnalysisCancelledException(String analysisId) {
        super(ErrorKind.CANCELLED, "Analysis " + analysisId + " was cancelled", List.of(), null);
        this.analysisId = analysisId;
    }

    public String getAnalysisId() {
        return analysisId;
    }
}
