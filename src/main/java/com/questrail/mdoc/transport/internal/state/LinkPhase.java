package com.questrail.mdoc.transport.internal.state;

/**
 * Lifecycle phase of one mdoc link. Phases only move forward.
 */
public enum LinkPhase
{
    IDLE,
    CONNECTING,
    SERVICE_DISCOVERY,
    MTU_NEGOTIATION,
    /** Reading the Ident characteristic. Skipped when not configured. */
    IDENT_EXCHANGE,
    /** Reading the PSM and opening the socket. */
    SOCKET_SETUP,
    /** Subscribing to Server2Client, then to State. */
    NOTIFICATION_SETUP,
    /** Writing the ready code to State. */
    HANDSHAKE,
    OPEN,
    /** Outbound queue drained; waiting out the linger before teardown. */
    CLOSING,
    CLOSED;

    /** {@code true} for the phases before {@link #OPEN} that follow a connect request. */
    public boolean isSetup() {
        return ordinal() > IDLE.ordinal() && ordinal() < OPEN.ordinal();
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
