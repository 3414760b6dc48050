package com.questrail.mdoc.api;

/**
 * Unchecked wrapper around a {@link TransportError}.
 */
public final class MdocTransportException extends RuntimeException
{
    private final TransportError error;

    public MdocTransportException(TransportError error) {
        super(error.kind() + ": " + error.message(), error.cause());
        this.error = error;
    }

    public TransportError error() {
        return error;
    }
}
