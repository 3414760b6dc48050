package com.questrail.mdoc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned for every scheduled link or scan timer (MTU negotiation
 * timeout, shutdown linger, scan window).
 */
public interface Cancellable
{
    /**
     * Cancels the timer if it has not fired yet.
     *
     * @return {@code true} if this call prevented the task from running
     */
    boolean cancel();
}
