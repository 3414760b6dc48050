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
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * LinkOperationalDriver
 * =============================================================================
 * Runs the serialized event loop of one link on a dedicated thread.
 *
 * <h2>Threading Model</h2>
 * Port callbacks arrive on whatever thread the platform stack uses. They are
 * queued here and processed one at a time on the driver thread, so that
 * <ul>
 *   <li>link state is never modified concurrently</li>
 *   <li>events are reduced in submission order</li>
 *   <li>listener callbacks for one link never overlap</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()        → starts event loop thread
 *   driver.dispatch(...)  → enqueues event for processing
 *   driver.stop()         → stops event loop, drops pending events
 * </pre>
 */
public final class LinkOperationalDriver implements LinkEventLoop {

    private static final long STOP_JOIN_MILLIS = 5000;

    private final LinkReducer reducer;
    private final LinkIntentExecutor executor;
    private final Supplier<LinkState> initialStateSupplier;
    private final LinkObservabilitySink observabilitySink;
    private final WallClock wallClock;
    private final String threadName;

    private final BlockingQueue<LinkEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile LinkState currentState;
    private volatile Thread eventLoopThread;

    public LinkOperationalDriver(LinkReducer reducer,
                                 LinkIntentExecutor executor,
                                 Supplier<LinkState> initialStateSupplier,
                                 LinkObservabilitySink observabilitySink,
                                 WallClock wallClock,
                                 String threadName)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.initialStateSupplier = Objects.requireNonNull(initialStateSupplier, "initialStateSupplier");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.threadName = Objects.requireNonNull(threadName, "threadName");

        this.currentState = initialStateSupplier.get();
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            currentState = initialStateSupplier.get();
            Thread t = new Thread(this::runEventLoop, threadName);
            t.setDaemon(true);
            eventLoopThread = t;
            t.start();
        }
    }

    /**
     * Stops the event loop thread.
     * Blocks until the thread terminates unless called from the loop itself.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(STOP_JOIN_MILLIS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            eventQueue.clear();
        }
    }

    /**
     * Submits an event for processing.
     * Events are processed sequentially in submission order.
     */
    @Override
    public void dispatch(LinkEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    @Override
    public LinkState state() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                LinkEvent event = eventQueue.take();
                if (running.get()) {
                    processEvent(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown; a stray interrupt while running is ignored.
                continue;
            } catch (Exception e) {
                observabilitySink.onError(new LinkErrorEvent(
                    wallClock.now(),
                    null,
                    "Event processing error",
                    e
                ));
            }
        }
    }

    private void processEvent(LinkEvent event) {
        final LinkState oldState;
        final LinkReducer.Result result;

        synchronized (stateLock) {
            oldState = currentState;
            result = reducer.apply(currentState, event);
            currentState = result.newState();
        }

        observabilitySink.onStateTransition(new LinkStateTransitionEvent(
            wallClock.now(),
            oldState,
            result.newState(),
            event,
            result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }
}
