package com.questrail.mdoc.observability;

import com.questrail.mdoc.api.MdocErrorKind;

import java.time.Instant;

/**
 * Record representing an error in the transport stack.
 *
 * @param kind error category, or {@code null} for failures outside the taxonomy
 *             (listener exceptions, dispatcher faults)
 */
public record LinkErrorEvent(
    Instant timestamp,
    MdocErrorKind kind,
    String message,
    Throwable cause
) {
}
