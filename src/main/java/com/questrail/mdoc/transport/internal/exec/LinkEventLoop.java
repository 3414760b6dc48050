package com.questrail.mdoc.transport.internal.exec;

import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.state.LinkState;

/**
 * Serialized dispatch context of one link: every event is reduced and its
 * actions executed before the next event is looked at.
 *
 * <p>Two implementations exist: {@link LinkController} runs events on the
 * calling thread, {@link LinkOperationalDriver} on a dedicated thread.</p>
 */
public interface LinkEventLoop
{
    void start();

    /** Hands an event to the loop. Safe to call from any thread, including from inside an action. */
    void dispatch(LinkEvent event);

    /** Latest state snapshot. */
    LinkState state();

    void stop();
}
