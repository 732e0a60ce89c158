package com.code.quality.concurrent;

import com.code.quality.api.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded pool of platform threads running one batch of independent tasks.
 *
 * <p>At most {@code maxWorkers} tasks are in flight; the dispatching thread waits for a free
 * slot before handing over the next task. The cancellation token is checked before each
 * dispatch. Tasks already running always run to completion.</p>
 *
 * <p>Outcomes are delivered to the collector on the dispatching thread, in submission order,
 * so callers can merge results without further synchronization. In sequential mode a single
 * slot is used, so tasks run one after another in submission order.</p>
 *
 * <p>A per-task timeout counts from the moment the task starts running. A timed-out task is
 * reported as {@link TaskOutcome.Status#TIMED_OUT} but keeps its slot until it actually ends;
 * it is never interrupted.</p>
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final long CLOSE_GRACE_MS = 100;

    private final String name;
    private final int slots;
    private final long timeoutMs;
    private final ExecutorService executor;

    /**
     * A unit of work on one input item.
     */
    @FunctionalInterface
    public interface Task<I, T> {
        T call(I input) throws Exception;
    }

    /**
     * @param name       thread name prefix
     * @param maxWorkers maximum concurrent tasks, at least 1
     * @param parallel   false for one task at a time in submission order
     * @param timeoutMs  per-task timeout, 0 for none
     */
    public WorkerPool(String name, int maxWorkers, boolean parallel, long timeoutMs) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        this.name = Objects.requireNonNull(name, "name is required");
        this.slots = parallel ? maxWorkers : 1;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(slots, new NamedThreadFactory(name));
    }

    public int getSlots() {
        return slots;
    }

    /**
     * Runs {@code task} over every item and returns all outcomes in submission order.
     */
    public <I, T> List<TaskOutcome<I, T>> execute(List<I> items, Task<I, T> task, CancellationToken token) {
        List<TaskOutcome<I, T>> outcomes = new ArrayList<>(items.size());
        execute(items, task, token, outcomes::add);
        return outcomes;
    }

    /**
     * Runs {@code task} over every item, handing each outcome to {@code collector} on the calling
     * thread in submission order. Items not dispatched because of cancellation are reported as
     * {@link TaskOutcome.Status#CANCELLED}.
     */
    public <I, T> void execute(List<I> items, Task<I, T> task, CancellationToken token,
                               Consumer<TaskOutcome<I, T>> collector) {
        Semaphore permits = new Semaphore(slots);
        Deque<Pending<I, T>> pending = new ArrayDeque<>();
        boolean cancelled = false;

        for (I item : items) {
            if (!cancelled) {
                if (!acquire(permits)) {
                    cancelled = true;
                } else if (token.isCancellationRequested()) {
                    permits.release();
                    cancelled = true;
                }
                if (cancelled) {
                    log.debug("{} pool: cancellation requested, skipping remaining tasks", name);
                }
            }
            if (cancelled) {
                pending.addLast(new Pending<>(item, null));
                continue;
            }
            pending.addLast(new Pending<>(item, dispatch(item, task, permits)));
            drainCompleted(pending, collector);
        }
        while (!pending.isEmpty()) {
            collector.accept(await(pending.removeFirst()));
        }
    }

    private <I, T> CompletableFuture<T> dispatch(I item, Task<I, T> task, Semaphore permits) {
        CompletableFuture<Void> started = new CompletableFuture<>();
        CompletableFuture<T> running = CompletableFuture.supplyAsync(() -> {
            started.complete(null);
            try {
                return task.call(item);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
        // the slot is held until the task itself ends, even after its timeout fired
        running.whenComplete((value, error) -> permits.release());
        if (timeoutMs == 0) {
            return running;
        }
        // the timeout clock starts once the task runs, not while it waits for a thread
        return started.thenCompose(ignored -> running.copy().orTimeout(timeoutMs, TimeUnit.MILLISECONDS));
    }

    private static <I, T> void drainCompleted(Deque<Pending<I, T>> pending, Consumer<TaskOutcome<I, T>> collector) {
        while (!pending.isEmpty() && pending.peekFirst().isDone()) {
            collector.accept(await(pending.removeFirst()));
        }
    }

    private static <I, T> TaskOutcome<I, T> await(Pending<I, T> entry) {
        if (entry.future() == null) {
            return TaskOutcome.cancelled(entry.input());
        }
        try {
            return TaskOutcome.succeeded(entry.input(), entry.future().get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failed(entry.input(), e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof TimeoutException) {
                return TaskOutcome.timedOut(entry.input(), cause);
            }
            return TaskOutcome.failed(entry.input(), cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean acquire(Semaphore permits) {
        try {
            permits.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops accepting tasks. Tasks still running, which can only be tasks that timed out,
     * finish on their own daemon threads and are never interrupted.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("{} pool closed with tasks still running past their timeout", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Pending<I, T>(I input, CompletableFuture<T> future) {
        boolean isDone() {
            return future == null || future.isDone();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
