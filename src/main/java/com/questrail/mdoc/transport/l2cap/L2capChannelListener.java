package com.questrail.mdoc.transport.l2cap;

/**
 * Callback sink for one {@link L2capChannel}. Callbacks are delivered serially.
 */
public interface L2capChannelListener
{
    void onConnected(L2capChannel channel);

    void onConnectFailed(Throwable cause);

    /** One complete, de-framed message. */
    void onMessage(byte[] message);

    /**
     * The channel closed.
     *
     * @param cause failure cause, or {@code null} for an orderly close
     */
    void onClosed(Throwable cause);
}
