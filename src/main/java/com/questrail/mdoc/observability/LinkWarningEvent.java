package com.questrail.mdoc.observability;

import java.time.Instant;

/**
 * Record representing a non-fatal anomaly on a link.
 */
public record LinkWarningEvent(
    Instant timestamp,
    String deviceId,
    String message
) {
}
