package com.questrail.mdoc.api;

/**
 * TransportListener
 * -----------------------------------------------------------------------------
 * Upward callbacks of a {@link ProximityTransport}.
 *
 * <p>Callbacks for one connection are delivered one at a time, never
 * concurrently. Once the application has called
 * {@link ProximityTransport#disconnect()} no further callbacks arrive.</p>
 */
public interface TransportListener
{
    /** The handshake completed and messages may be sent. */
    void onPeerConnected();

    /**
     * A complete message was reassembled.
     *
     * @param message message bytes, owned by the receiver
     */
    void onMessageReceived(byte[] message);

    /** The peer went away or the connection was torn down. */
    void onPeerDisconnected();

    /** The peer wrote the transport-specific termination code to the State characteristic. */
    void onTransportSpecificTermination();

    /**
     * A failure occurred. {@link MdocErrorKind#FRAMING} and
     * {@link MdocErrorKind#PLATFORM} errors have already closed the connection.
     */
    void onError(TransportError error);
}
