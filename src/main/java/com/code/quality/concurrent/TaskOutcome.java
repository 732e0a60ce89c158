package com.code.quality.concurrent;

/**
 * Result of one worker-pool task.
 *
 * @param input  the item the task worked on
 * @param value  task result, null unless {@link Status#SUCCEEDED}
 * @param error  failure cause, null unless {@link Status#FAILED} or {@link Status#TIMED_OUT}
 * @param status how the task ended
 */
public record TaskOutcome<I, T>(I input, T value, Throwable error, Status status) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        /** Never dispatched because the run was cancelled. */
        CANCELLED
    }

    public static <I, T> TaskOutcome<I, T> succeeded(I input, T value) {
        return new TaskOutcome<>(input, value, null, Status.SUCCEEDED);
    }

    public static <I, T> TaskOutcome<I, T> failed(I input, Throwable error) {
        return new TaskOutcome<>(input, null, error, Status.FAILED);
    }

    public static <I, T> TaskOutcome<I, T> timedOut(I input, Throwable error) {
        return new TaskOutcome<>(input, null, error, Status.TIMED_OUT);
    }

    public static <I, T> TaskOutcome<I, T> cancelled(I input) {
        return new TaskOutcome<>(input, null, null, Status.CANCELLED);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
