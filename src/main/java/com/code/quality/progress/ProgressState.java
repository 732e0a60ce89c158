package com.code.quality.progress;

import com.code.quality.core.model.AnalysisStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a run's progress.
 *
 * @param analysisId          id of the run
 * @param status              lifecycle status
 * @param phase               current phase
 * @param filesProcessed      files parsed or loaded from cache
 * @param totalFiles          files to process, 0 until known
 * @param analyzersCompleted  analyzer tasks finished
 * @param totalAnalyzers      analyzer tasks planned, 0 until known
 * @param startTime           when the run started, null while pending
 * @param snapshotTime        when this snapshot was taken
 * @param estimatedCompletion linear estimate of the finish time, null when unknown
 * @param errorMessage        failure message, null unless failed
 */
public record ProgressState(
        String analysisId,
        AnalysisStatus status,
        AnalysisPhase phase,
        int filesProcessed,
        int totalFiles,
        int analyzersCompleted,
        int totalAnalyzers,
        Instant startTime,
        Instant snapshotTime,
        Instant estimatedCompletion,
        String errorMessage
) {
    static final double FILES_WEIGHT = 0.3;
    static final double ANALYZERS_WEIGHT = 0.7;

    /**
     * Overall progress in [0, 100]. File processing weighs 30%, analyzer tasks 70%;
     * a completed run reports 100.
     */
    public double percentage() {
        if (status == AnalysisStatus.COMPLETED) {
            return 100.0;
        }
        double fileProgress = totalFiles > 0 ? (double) filesProcessed / totalFiles : 0.0;
        double analyzerProgress = totalAnalyzers > 0 ? (double) analyzersCompleted / totalAnalyzers : 0.0;
        double value = (FILES_WEIGHT * fileProgress + ANALYZERS_WEIGHT * analyzerProgress) * 100.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    public Duration elapsed() {
        if (startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, snapshotTime);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
