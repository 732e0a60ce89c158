package com.code.quality.progress;

import com.code.quality.core.model.AnalysisStatus;
import com.code.quality.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private MutableClock clock;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        tracker = new ProgressTracker("analysis-1", clock);
    }

    @Nested
    @DisplayName("Status transitions")
    class TransitionTests {

        @Test
        @DisplayName("Should move from pending to running to completed")
        void testHappyPath() {
            assertEquals(AnalysisStatus.PENDING, tracker.snapshot().status());
            tracker.start();
            assertEquals(AnalysisStatus.RUNNING, tracker.snapshot().status());
            tracker.complete();

            ProgressState state = tracker.snapshot();
            assertEquals(AnalysisStatus.COMPLETED, state.status());
            assertEquals(AnalysisPhase.COMPLETED, state.phase());
            assertEquals(100.0, state.percentage());
        }

        @Test
        @DisplayName("Should reject every change once terminal")
        void testTerminalRejectsChanges() {
            tracker.start();
            tracker.fail("broken");

            assertThrows(IllegalStateException.class, () -> tracker.complete());
            assertThrows(IllegalStateException.class, () -> tracker.fail("again"));
            assertThrows(IllegalStateException.class, () -> tracker.start());
            assertThrows(IllegalStateException.class, () -> tracker.update(ProgressDelta.files(1)));
            assertThrows(IllegalStateException.class, () -> tracker.enterPhase(AnalysisPhase.PARSING));
            assertEquals("broken", tracker.snapshot().errorMessage());
            assertEquals(AnalysisPhase.FAILED, tracker.snapshot().phase());
        }

        @Test
        @DisplayName("Should not start twice")
        void testNoRestart() {
            tracker.start();
            assertThrows(IllegalStateException.class, () -> tracker.start());
        }

        @Test
        @DisplayName("Should allow failing a pending run")
        void testFailFromPending() {
            tracker.fail("early");
            assertEquals(AnalysisStatus.FAILED, tracker.snapshot().status());
        }
    }

    @Nested
    @DisplayName("Counters and percentage")
    class CounterTests {

        @Test
        @DisplayName("Should weigh files 30% and analyzers 70%")
        void testPercentage() {
            tracker.start();
            tracker.setTotalFiles(10);
            tracker.setTotalAnalyzers(4);
            tracker.update(ProgressDelta.files(5));
            assertEquals(15.0, tracker.snapshot().percentage(), 1e-9);

            tracker.update(new ProgressDelta(5, 2));
            assertEquals(65.0, tracker.snapshot().percentage(), 1e-9);
        }

        @Test
        @DisplayName("Should cap counters at their totals")
        void testCapped() {
            tracker.start();
            tracker.setTotalFiles(2);
            tracker.update(ProgressDelta.files(5));
            assertEquals(2, tracker.snapshot().filesProcessed());
            assertTrue(tracker.snapshot().percentage() <= 100.0);
        }

        @Test
        @DisplayName("Should reject negative deltas")
        void testNegativeDelta() {
            assertThrows(IllegalArgumentException.class, () -> new ProgressDelta(-1, 0));
        }

        @Test
        @DisplayName("Should not change totals after counting started")
        void testTotalsFixed() {
            tracker.start();
            tracker.setTotalFiles(3);
            tracker.update(ProgressDelta.files(1));
            assertThrows(IllegalStateException.class, () -> tracker.setTotalFiles(10));
        }

        @Test
        @DisplayName("Should merge concurrent updates without losing any")
        void testConcurrentUpdates() throws Exception {
            tracker.start();
            tracker.setTotalFiles(1_000);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(1_000);
            for (int i = 0; i < 1_000; i++) {
                executor.submit(() -> {
                    tracker.update(ProgressDelta.files(1));
                    done.countDown();
                });
            }
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(1_000, tracker.snapshot().filesProcessed());
        }

        @Test
        @DisplayName("Should report elapsed time and an estimate")
        void testElapsedAndEstimate() {
            tracker.start();
            tracker.setTotalFiles(1);
            tracker.setTotalAnalyzers(1);
            clock.advance(Duration.ofSeconds(10));
            tracker.update(new ProgressDelta(1, 0));

            ProgressState state = tracker.snapshot();
            assertEquals(Duration.ofSeconds(10), state.elapsed());
            Instant expected = Instant.parse("2024-01-01T00:00:00Z").plusMillis(10_000 * 100 / 30);
            assertEquals(expected, state.estimatedCompletion());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Should notify listeners with snapshots")
        void testNotify() {
            List<ProgressState> states = new ArrayList<>();
            tracker.addListener(states::add);

            tracker.start();
            tracker.enterPhase(AnalysisPhase.PARSING);
            tracker.complete();

            assertEquals(3, states.size());
            assertEquals(AnalysisPhase.PARSING, states.get(1).phase());
            assertEquals(AnalysisStatus.COMPLETED, states.get(2).status());
        }

        @Test
        @DisplayName("Should keep notifying after a listener throws")
        void testFailingListener() {
            List<ProgressState> states = new ArrayList<>();
            tracker.addListener(state -> {
                throw new IllegalStateException("listener broke");
            });
            tracker.addListener(states::add);

            assertDoesNotThrow(() -> tracker.start());
            assertEquals(1, states.size());
        }

        @Test
        @DisplayName("Should publish one snapshot when held notifications are released")
        void testHoldAndRelease() {
            List<ProgressState> states = new ArrayList<>();
            tracker.addListener(states::add);

            tracker.holdNotifications();
            tracker.start();
            tracker.enterPhase(AnalysisPhase.DISCOVERING);
            assertTrue(states.isEmpty());
            assertEquals(AnalysisPhase.DISCOVERING, tracker.snapshot().phase());

            tracker.releaseNotifications();
            tracker.releaseNotifications();

            assertEquals(1, states.size());
            assertEquals(AnalysisPhase.DISCOVERING, states.get(0).phase());
            assertEquals(AnalysisStatus.RUNNING, states.get(0).status());
        }

        @Test
        @DisplayName("Should always notify terminal transitions while held")
        void testTerminalWhileHeld() {
            List<ProgressState> states = new ArrayList<>();
            tracker.addListener(states::add);

            tracker.holdNotifications();
            tracker.start();
            tracker.complete();

            assertEquals(1, states.size());
            assertEquals(AnalysisStatus.COMPLETED, states.get(0).status());
        }
    }
}
