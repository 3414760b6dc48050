package com.questrail.mdoc.session;

/**
 * Callbacks of a {@link DeviceSession}.
 */
public interface DeviceSessionListener
{
    /** The transport handshake completed; the reader may now send its request. */
    void onPeerConnected();

    /**
     * A decrypted DeviceRequest arrived.
     *
     * @param deviceRequest plaintext request bytes
     */
    void onRequest(byte[] deviceRequest);

    /** The reader ended the session, by status code or transport-specific signal. */
    void onSessionTerminated();

    /** The link is gone. */
    void onPeerDisconnected();

    /**
     * The session failed. Transport, decoding and decryption failures all end
     * up here; the session is closed by the time this is called.
     */
    void onError(Throwable cause);
}
