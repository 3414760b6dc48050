package com.questrail.mdoc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for every deadline computed by the transport and scanner.
 *
 * <p>Values are nanoseconds from an arbitrary origin and only differences
 * between two readings carry meaning. Wall-clock time is used for event
 * timestamps only (see {@link WallClock}).</p>
 */
public interface MonotonicClock
{
    long nowNanos();
}
