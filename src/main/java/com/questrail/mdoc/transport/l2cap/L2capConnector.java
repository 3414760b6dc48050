package com.questrail.mdoc.transport.l2cap;

/**
 * Port for opening connection-oriented (L2CAP CoC style) sockets to a peer.
 *
 * <p>Messages on such a socket are whole mdoc messages, each framed with a
 * 4-byte big-endian length prefix. No chunk markers are used.</p>
 */
public interface L2capConnector
{
    /** {@code false} if the platform cannot open connection-oriented channels. */
    boolean isSupported();

    /**
     * Opens a channel. Completes with {@link L2capChannelListener#onConnected}
     * or {@link L2capChannelListener#onConnectFailed}.
     *
     * @param deviceId peer handle, as used for the GATT connection
     * @param psm      protocol/service multiplexer read from the peer
     * @param listener callbacks for this channel
     */
    void connect(String deviceId, int psm, L2capChannelListener listener);
}
