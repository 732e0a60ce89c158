package com.code.quality.concurrent;

import com.code.quality.api.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private static List<Integer> numbers(int count) {
        return IntStream.range(0, count).boxed().toList();
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should return outcomes in submission order")
        void testOrderedOutcomes() {
            try (WorkerPool pool = new WorkerPool("test", 4, true, 0)) {
                List<TaskOutcome<Integer, Integer>> outcomes = pool.execute(numbers(20), i -> {
                    Thread.sleep((20 - i) % 5);
                    return i * 2;
                }, CancellationToken.create());

                assertEquals(20, outcomes.size());
                for (int i = 0; i < 20; i++) {
                    assertEquals(i, outcomes.get(i).input());
                    assertEquals(i * 2, outcomes.get(i).value());
                }
            }
        }

        @Test
        @DisplayName("Should never run more tasks at once than its slots")
        void testBounded() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            try (WorkerPool pool = new WorkerPool("test", 3, true, 0)) {
                pool.execute(numbers(30), i -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(5);
                    running.decrementAndGet();
                    return i;
                }, CancellationToken.create());
            }
            assertTrue(peak.get() <= 3, "peak was " + peak.get());
        }

        @Test
        @DisplayName("Should run one task at a time in order when sequential")
        void testSequential() {
            List<Integer> seen = new ArrayList<>();
            try (WorkerPool pool = new WorkerPool("test", 8, false, 0)) {
                assertEquals(1, pool.getSlots());
                pool.execute(numbers(10), i -> {
                    synchronized (seen) {
                        seen.add(i);
                    }
                    return i;
                }, CancellationToken.create());
            }
            assertEquals(numbers(10), seen);
        }

        @Test
        @DisplayName("Should run tasks on named threads")
        void testThreadNames() {
            Set<String> names = ConcurrentHashMap.newKeySet();
            try (WorkerPool pool = new WorkerPool("cq-parse", 2, true, 0)) {
                pool.execute(numbers(4), i -> {
                    names.add(Thread.currentThread().getName());
                    return i;
                }, CancellationToken.create());
            }
            assertTrue(names.stream().allMatch(n -> n.startsWith("cq-parse-")));
        }

        @Test
        @DisplayName("Should validate its arguments")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new WorkerPool("x", 0, true, 0));
            assertThrows(IllegalArgumentException.class, () -> new WorkerPool("x", 1, true, -1));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should isolate a failing task")
        void testFailureIsolated() {
            try (WorkerPool pool = new WorkerPool("test", 2, true, 0)) {
                List<TaskOutcome<Integer, Integer>> outcomes = pool.execute(numbers(3), i -> {
                    if (i == 1) {
                        throw new IOException("unreadable");
                    }
                    return i;
                }, CancellationToken.create());

                assertTrue(outcomes.get(0).isSuccess());
                assertEquals(TaskOutcome.Status.FAILED, outcomes.get(1).status());
                assertInstanceOf(IOException.class, outcomes.get(1).error());
                assertTrue(outcomes.get(2).isSuccess());
            }
        }

        @Test
        @DisplayName("Should report a task exceeding the timeout")
        void testTimeout() {
            try (WorkerPool pool = new WorkerPool("test", 2, true, 50)) {
                List<TaskOutcome<Integer, Integer>> outcomes = pool.execute(List.of(1, 2), i -> {
                    if (i == 1) {
                        Thread.sleep(1_000);
                    }
                    return i;
                }, CancellationToken.create());

                assertEquals(TaskOutcome.Status.TIMED_OUT, outcomes.get(0).status());
                assertInstanceOf(TimeoutException.class, outcomes.get(0).error());
                assertTrue(outcomes.get(1).isSuccess());
            }
        }

        @Test
        @DisplayName("Should start the timeout when a task runs, not while it waits for a slot")
        void testTimeoutCountsFromStart() {
            AtomicInteger finished = new AtomicInteger();
            Set<Integer> interrupted = ConcurrentHashMap.newKeySet();
            List<TaskOutcome<Integer, Integer>> outcomes;
            try (WorkerPool pool = new WorkerPool("test", 4, false, 150)) {
                outcomes = pool.execute(List.of(0, 1, 2), i -> {
                    try {
                        Thread.sleep(i == 0 ? 600 : 10);
                    } catch (InterruptedException e) {
                        interrupted.add(i);
                        throw e;
                    }
                    finished.incrementAndGet();
                    return i;
                }, CancellationToken.create());
            }

            assertEquals(TaskOutcome.Status.TIMED_OUT, outcomes.get(0).status());
            assertTrue(outcomes.get(1).isSuccess());
            assertTrue(outcomes.get(2).isSuccess());
            assertEquals(3, finished.get(), "the timed out task still ran to completion");
            assertTrue(interrupted.isEmpty());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should dispatch nothing when already cancelled")
        void testAlreadyCancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();
            AtomicInteger calls = new AtomicInteger();
            try (WorkerPool pool = new WorkerPool("test", 2, true, 0)) {
                List<TaskOutcome<Integer, Integer>> outcomes = pool.execute(numbers(5), i -> {
                    calls.incrementAndGet();
                    return i;
                }, token);

                assertEquals(5, outcomes.size());
                assertTrue(outcomes.stream().allMatch(o -> o.status() == TaskOutcome.Status.CANCELLED));
            }
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("Should finish in-flight tasks and skip the rest")
        void testCancelMidway() throws InterruptedException {
            CancellationToken token = CancellationToken.create();
            CountDownLatch firstStarted = new CountDownLatch(1);
            AtomicInteger completed = new AtomicInteger();
            List<TaskOutcome<Integer, Integer>> outcomes;
            try (WorkerPool pool = new WorkerPool("test", 4, false, 0)) {
                outcomes = pool.execute(numbers(5), i -> {
                    firstStarted.countDown();
                    token.cancel();
                    Thread.sleep(20);
                    completed.incrementAndGet();
                    return i;
                }, token);
            }
            assertTrue(firstStarted.await(1, TimeUnit.SECONDS));
            assertEquals(1, completed.get());
            assertTrue(outcomes.get(0).isSuccess());
            assertTrue(outcomes.subList(1, 5).stream().allMatch(o -> o.status() == TaskOutcome.Status.CANCELLED));
        }
    }
}
