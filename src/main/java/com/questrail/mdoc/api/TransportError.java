package com.questrail.mdoc.api;

import java.util.Objects;

/**
 * Error delivered to {@link TransportListener#onError(TransportError)}.
 *
 * @param kind    failure category
 * @param message human-readable description
 * @param cause   underlying throwable; may be {@code null}
 */
public record TransportError(MdocErrorKind kind, String message, Throwable cause)
{
    public TransportError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static TransportError framing(String message) {
        return new TransportError(MdocErrorKind.FRAMING, message, null);
    }

    public static TransportError platform(String message, Throwable cause) {
        return new TransportError(MdocErrorKind.PLATFORM, message, cause);
    }

    public static TransportError precondition(String message) {
        return new TransportError(MdocErrorKind.PRECONDITION, message, null);
    }

    /**
     * Returns this error as an exception, for callers that prefer to throw.
     */
    public MdocTransportException toException() {
        return new MdocTransportException(this);
    }
}
