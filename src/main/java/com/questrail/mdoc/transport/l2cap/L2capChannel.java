package com.questrail.mdoc.transport.l2cap;

/**
 * An open connection-oriented channel.
 */
public interface L2capChannel
{
    /** Queues one whole message for sending. */
    void send(byte[] message);

    /** Closes the channel. {@link L2capChannelListener#onClosed} follows once. */
    void close();
}
