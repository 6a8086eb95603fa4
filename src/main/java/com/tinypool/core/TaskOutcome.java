package com.tinypool.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running one queued entry.
 * Either a result value, nothing, or the signal for a worker to stop.
 *
 * @param <R> Result type
 */
final class TaskOutcome<R> {

    enum Kind {
        RESULT,
        EMPTY,
        SHUTDOWN
    }

    private static final TaskOutcome<?> EMPTY = new TaskOutcome<>(Kind.EMPTY, null);
    private static final TaskOutcome<?> SHUTDOWN = new TaskOutcome<>(Kind.SHUTDOWN, null);

    private final Kind kind;
    private final R value;

    private TaskOutcome(Kind kind, R value) {
        this.kind = kind;
        this.value = value;
    }

    static <R> TaskOutcome<R> result(R value) {
        return new TaskOutcome<>(Kind.RESULT, Objects.requireNonNull(value, "value"));
    }

    @SuppressWarnings("unchecked")
    static <R> TaskOutcome<R> empty() {
        return (TaskOutcome<R>) EMPTY;
    }

    @SuppressWarnings("unchecked")
    static <R> TaskOutcome<R> shutdown() {
        return (TaskOutcome<R>) SHUTDOWN;
    }

    /**
     * Map a user task's return value. A {@code null} Optional counts as empty.
     */
    static <R> TaskOutcome<R> of(Optional<? extends R> maybe) {
        if (maybe == null || maybe.isEmpty()) {
            return empty();
        }
        return result(maybe.get());
    }

    Kind kind() {
        return kind;
    }

    R value() {
        return value;
    }

    boolean isShutdown() {
        return kind == Kind.SHUTDOWN;
    }

    @Override
    public String toString() {
        return kind == Kind.RESULT ? "RESULT(" + value + ")" : kind.name();
    }
}
