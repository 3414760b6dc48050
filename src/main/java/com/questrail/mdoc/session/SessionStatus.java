package com.questrail.mdoc.session;

/**
 * Status codes carried in the {@code status} field of SessionData.
 */
public final class SessionStatus
{
    private SessionStatus() {}

    public static final long SESSION_ENCRYPTION_ERROR = 10;
    public static final long CBOR_DECODING_ERROR = 11;
    public static final long SESSION_TERMINATION = 20;
}
