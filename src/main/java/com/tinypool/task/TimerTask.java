package com.tinypool.task;

import com.tinypool.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Task that ticks a fixed number of times at a fixed interval.
 * Occupies its worker for {@code times * interval}.
 *
 * @param <R> Result type produced when ticking finishes
 */
public abstract class TimerTask<R> implements Task<R> {

    private static final Logger log = LoggerFactory.getLogger(TimerTask.class);

    private final int times;
    private final long intervalMillis;

    protected TimerTask(int times, long interval, TimeUnit unit) {
        if (times < 0) {
            throw new IllegalArgumentException("Times must not be negative: " + times);
        }
        if (interval < 0) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
        this.times = times;
        this.intervalMillis = unit.toMillis(interval);
    }

    @Override
    public final Optional<R> execute() {
        int ticks = 0;
        while (ticks < times) {
            try {
                Thread.sleep(intervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Timer interrupted after {}/{} ticks", ticks, times);
                break;
            }
            ticks++;
            onTick(ticks);
        }
        return onFinished(ticks);
    }

    /**
     * Called after each interval, with the 1-based tick count.
     */
    protected abstract void onTick(int tick);

    /**
     * Result once ticking stops. Nothing by default.
     */
    protected Optional<R> onFinished(int ticks) {
        return Optional.empty();
    }

    public int getTimes() {
        return times;
    }

    public long getIntervalMillis() {
        return intervalMillis;
    }
}
