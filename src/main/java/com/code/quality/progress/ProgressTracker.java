package com.code.quality.progress;

import com.code.quality.core.model.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe shared state of one analysis run.
 *
 * <p>All mutations are serialized on the tracker's monitor. Status moves one way only
 * (pending, running, then completed or failed) and a terminal tracker rejects every further
 * change. Counters only grow and never exceed their totals, so {@link ProgressState#percentage()}
 * never decreases within a run.</p>
 *
 * <p>Listeners are notified after each change with a fresh snapshot. A listener that throws
 * is logged and skipped; it never affects the run. Notifications can be held while the run
 * may still turn out to be a cached replay; terminal transitions always notify.</p>
 */
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String analysisId;
    private final Clock clock;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private AnalysisStatus status = AnalysisStatus.PENDING;
    private AnalysisPhase phase = AnalysisPhase.INITIALIZING;
    private int filesProcessed;
    private int totalFiles;
    private int analyzersCompleted;
    private int totalAnalyzers;
    private Instant startTime;
    private String errorMessage;
    private boolean notificationsHeld;

    public ProgressTracker(String analysisId) {
        this(analysisId, Clock.systemUTC());
    }

    public ProgressTracker(String analysisId, Clock clock) {
        this.analysisId = Objects.requireNonNull(analysisId, "analysisId is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public void addListener(ProgressListener listener) {
        if (listener != null && listener != ProgressListener.NOOP) {
            listeners.add(listener);
        }
    }

    /**
     * Suspends listener notifications until {@link #releaseNotifications()} or a terminal
     * transition. {@link #snapshot()} keeps reflecting every change.
     */
    public synchronized void holdNotifications() {
        notificationsHeld = true;
    }

    /**
     * Resumes listener notifications and publishes the current state once.
     */
    public synchronized void releaseNotifications() {
        if (notificationsHeld) {
            notificationsHeld = false;
            notifyListeners();
        }
    }

    /**
     * Moves the run from pending to running.
     *
     * @throws IllegalStateException if the run is not pending
     */
    public synchronized void start() {
        transition(AnalysisStatus.RUNNING);
        startTime = clock.instant();
        notifyListeners();
    }

    public synchronized void enterPhase(AnalysisPhase next) {
        Objects.requireNonNull(next, "phase is required");
        ensureActive();
        phase = next;
        log.debug("analysis.phase analysisId={} phase={}", analysisId, next.getDisplayName());
        notifyListeners();
    }

    /**
     * Sets the number of files to process. The total can only be set while no file has
     * been counted yet, so the percentage never moves backwards.
     */
    public synchronized void setTotalFiles(int total) {
        ensureActive();
        requireNonNegative(total);
        if (filesProcessed > 0 && total != totalFiles) {
            throw new IllegalStateException("totalFiles cannot change once files were processed");
        }
        totalFiles = total;
        notifyListeners();
    }

    /**
     * Sets the number of analyzer tasks. Same rule as {@link #setTotalFiles(int)}.
     */
    public synchronized void setTotalAnalyzers(int total) {
        ensureActive();
        requireNonNegative(total);
        if (analyzersCompleted > 0 && total != totalAnalyzers) {
            throw new IllegalStateException("totalAnalyzers cannot change once analyzers completed");
        }
        totalAnalyzers = total;
        notifyListeners();
    }

    /**
     * Atomically merges counter increments. Counters are capped at their totals when a total is known.
     */
    public synchronized void update(ProgressDelta delta) {
        Objects.requireNonNull(delta, "delta is required");
        ensureActive();
        filesProcessed = capped(filesProcessed + delta.filesProcessed(), totalFiles);
        analyzersCompleted = capped(analyzersCompleted + delta.analyzersCompleted(), totalAnalyzers);
        notifyListeners();
    }

    public synchronized void complete() {
        transition(AnalysisStatus.COMPLETED);
        if (startTime == null) {
            startTime = clock.instant();
        }
        phase = AnalysisPhase.COMPLETED;
        notificationsHeld = false;
        log.debug("analysis.progress.completed analysisId={}", analysisId);
        notifyListeners();
    }

    public synchronized void fail(String message) {
        transition(AnalysisStatus.FAILED);
        if (startTime == null) {
            startTime = clock.instant();
        }
        phase = AnalysisPhase.FAILED;
        errorMessage = message;
        notificationsHeld = false;
        log.debug("analysis.progress.failed analysisId={} error={}", analysisId, message);
        notifyListeners();
    }

    public synchronized ProgressState snapshot() {
        Instant now = clock.instant();
        ProgressState state = new ProgressState(analysisId, status, phase, filesProcessed, totalFiles,
                analyzersCompleted, totalAnalyzers, startTime, now, null, errorMessage);
        return new ProgressState(analysisId, status, phase, filesProcessed, totalFiles,
                analyzersCompleted, totalAnalyzers, startTime, now, estimateCompletion(state, now), errorMessage);
    }

    private Instant estimateCompletion(ProgressState state, Instant now) {
        if (status.isTerminal()) {
            return status == AnalysisStatus.COMPLETED ? now : null;
        }
        double percentage = state.percentage();
        if (startTime == null || percentage <= 0.0) {
            return null;
        }
        long elapsedMillis = Duration.between(startTime, now).toMillis();
        long totalMillis = (long) (elapsedMillis * 100.0 / percentage);
        return startTime.plusMillis(totalMillis);
    }

    private void transition(AnalysisStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Analysis " + analysisId + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    private void ensureActive() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Analysis " + analysisId + " is already " + status);
        }
    }

    private void notifyListeners() {
        if (notificationsHeld || listeners.isEmpty()) {
            return;
        }
        ProgressState state = snapshot();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(state);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for {}: {}", analysisId, e.getMessage(), e);
            }
        }
    }

    private static int capped(int value, int total) {
        return total > 0 ? Math.min(value, total) : value;
    }

    private static void requireNonNegative(int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
    }
}
