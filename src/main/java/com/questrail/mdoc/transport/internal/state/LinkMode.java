package com.questrail.mdoc.transport.internal.state;

/**
 * How messages travel once the link is open.
 */
public enum LinkMode
{
    /** Chunked writes to Client2Server, notifications on Server2Client. */
    GATT,

    /** Length-prefixed whole messages over a connection-oriented socket. */
    L2CAP
}
