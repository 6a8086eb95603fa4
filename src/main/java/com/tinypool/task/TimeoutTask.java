package com.tinypool.task;

import com.tinypool.core.Task;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task with a deadline measured in dispatch rounds.
 * <p>
 * {@link TimeoutDispatcher} counts every pending task down once per round. A task
 * that reaches zero before a worker picks it up runs {@link #onTimeout()} instead
 * of {@link #onSuccess()}.
 *
 * @param <R> Result type
 */
public abstract class TimeoutTask<R> implements Task<R> {

    private final AtomicLong remainingRounds;

    protected TimeoutTask(long rounds) {
        if (rounds < 0) {
            throw new IllegalArgumentException("Rounds must not be negative: " + rounds);
        }
        this.remainingRounds = new AtomicLong(rounds);
    }

    @Override
    public final Optional<R> execute() {
        return remainingRounds.get() == 0 ? onTimeout() : onSuccess();
    }

    protected abstract Optional<R> onSuccess();

    protected abstract Optional<R> onTimeout();

    /**
     * Consume one round. Never goes below zero.
     */
    public void countDown() {
        remainingRounds.updateAndGet(r -> r == 0 ? 0 : r - 1);
    }

    public long getRemainingRounds() {
        return remainingRounds.get();
    }

    public boolean isTimedOut() {
        return remainingRounds.get() == 0;
    }
}
