package com.questrail.mdoc.api;

/**
 * ProximityTransport
 * -----------------------------------------------------------------------------
 * Message-level view of one mdoc proximity connection.
 *
 * <p>All methods return immediately. Results arrive on the
 * {@link TransportListener}. A transport instance carries exactly one
 * connection and is not reused once closed.</p>
 */
public interface ProximityTransport
{
    /**
     * Registers the upward listener. Must be called before {@link #connect(PeerCandidate)}.
     */
    void setListener(TransportListener listener);

    /**
     * Starts connecting to the selected peer.
     */
    void connect(PeerCandidate peer);

    /**
     * Sends one message. A zero-length message asks for an orderly shutdown
     * once everything queued before it has been written.
     */
    void sendMessage(byte[] message);

    /**
     * Writes an already-framed chunk as-is. Intended for diagnostics.
     */
    void write(byte[] rawChunk);

    /**
     * Silences all further callbacks and tears the connection down after the
     * outbound queue drains.
     */
    void disconnect();

    /**
     * Signals session termination through the State characteristic.
     * Only valid when {@link #supportsTransportSpecificTermination()} is {@code true}.
     */
    void sendTransportSpecificTermination();

    /**
     * Returns {@code true} unless the connection switched to the socket path,
     * which has no side channel and terminates by closing.
     */
    boolean supportsTransportSpecificTermination();
}
