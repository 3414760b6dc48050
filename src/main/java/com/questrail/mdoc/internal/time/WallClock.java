package com.questrail.mdoc.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of human-readable timestamps stamped on link events and
 * observability records. Never used to compute a deadline.
 */
public interface WallClock
{
    Instant now();
}
