package com.questrail.mdoc.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution expressed in monotonic deadlines.
 *
 * <p>The link state machine never sleeps. Grace periods and negotiation
 * timeouts are armed here and come back into the dispatcher as events.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Runs {@code task} at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock} time line
     * @param task          work to run
     * @return handle that cancels the task
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Runs {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
