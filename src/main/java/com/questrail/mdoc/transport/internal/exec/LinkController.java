package com.questrail.mdoc.transport.internal.exec;

import com.questrail.mdoc.internal.time.WallClock;
import com.questrail.mdoc.observability.LinkErrorEvent;
import com.questrail.mdoc.observability.LinkObservabilitySink;
import com.questrail.mdoc.observability.LinkStateTransitionEvent;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.state.LinkReducer;
import com.questrail.mdoc.transport.internal.state.LinkState;

import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LinkController
 * -----------------------------------------------------------------------------
 * Owner of the link event loop when no dedicated thread is wanted.
 *
 * <p>All link semantics live in the {@link LinkReducer} and the
 * {@link LinkIntentExecutor}; this class only hosts them:</p>
 * <pre>
 *   event → reducer → new state → intents → executor
 * </pre>
 *
 * <h2>Driving the loop</h2>
 * Tests drive the loop explicitly with {@link #submit(LinkEvent)},
 * {@link #step()} and {@link #drain()}. Production code uses
 * {@link #dispatch(LinkEvent)}, which drains on the calling thread unless a
 * drain is already running. Events raised from inside an action (a listener
 * that sends a reply, a fake port that answers synchronously) are therefore
 * queued and handled after the current step, never re-entrantly.
 */
public final class LinkController implements LinkEventLoop
{
    private final LinkReducer reducer;
    private final LinkIntentExecutor executor;
    private final LinkObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Queue<LinkEvent> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile LinkState state;

    public LinkController(LinkState initialState,
                          LinkReducer reducer,
                          LinkIntentExecutor executor,
                          LinkObservabilitySink observabilitySink,
                          WallClock wallClock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Enqueue an event for later processing.
     */
    public void submit(LinkEvent event)
    {
        Objects.requireNonNull(event, "event");
        queue.add(event);
    }

    /**
     * Process exactly one queued event, if present.
     *
     * @return {@code true} if an event was processed; {@code false} if the queue was empty.
     */
    public boolean step()
    {
        LinkEvent event = queue.poll();
        if (event == null) {
            return false;
        }

        final LinkState oldState;
        final LinkReducer.Result result;
        synchronized (stateLock) {
            oldState = state;
            result = reducer.apply(oldState, event);
            state = result.newState();
        }

        observabilitySink.onStateTransition(new LinkStateTransitionEvent(
                wallClock.now(), oldState, result.newState(), event, result.intents()));

        executor.execute(result.intents());
        return true;
    }

    /**
     * Drain the queue until no events remain.
     */
    public void drain()
    {
        while (step()) {
            // Intentionally empty.
        }
    }

    @Override
    public void start()
    {
        // Runs on the caller's thread; nothing to start.
    }

    @Override
    public void dispatch(LinkEvent event)
    {
        submit(event);
        while (draining.compareAndSet(false, true)) {
            try {
                drain();
            }
            catch (RuntimeException e) {
                observabilitySink.onError(new LinkErrorEvent(
                        wallClock.now(), null, "Event processing error", e));
            }
            finally {
                draining.set(false);
            }
            if (queue.isEmpty()) {
                return;
            }
        }
    }

    @Override
    public LinkState state()
    {
        return state;
    }

    @Override
    public void stop()
    {
        queue.clear();
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    /**
     * Peek for test assertions without mutating the queue.
     */
    public Optional<LinkEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peek());
    }
}
