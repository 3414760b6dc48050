package com.questrail.mdoc.transport.internal.exec;

import com.questrail.mdoc.transport.internal.state.LinkIntents;

/**
 * LinkIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure link state machine and the impure world
 * of GATT operations, sockets, timers and application callbacks.
 *
 * <p>It is the only layer allowed to touch the ports, arm or cancel timers and
 * call the {@link com.questrail.mdoc.api.TransportListener}. Outcomes of the
 * work it starts come back to the state machine only as
 * {@link com.questrail.mdoc.transport.internal.events.LinkEvent}s.</p>
 *
 * <p>Execution must be non-blocking and must preserve action order.</p>
 */
public interface LinkIntentExecutor
{
    void execute(LinkIntents intents);
}
