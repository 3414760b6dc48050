package com.questrail.mdoc.transport.internal.exec;

import com.questrail.mdoc.api.MdocErrorKind;
import com.questrail.mdoc.api.TransportError;
import com.questrail.mdoc.api.TransportListener;
import com.questrail.mdoc.config.MdocTransportConfig;
import com.questrail.mdoc.internal.time.Cancellable;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.MonotonicScheduler;
import com.questrail.mdoc.internal.time.WallClock;
import com.questrail.mdoc.observability.LinkErrorEvent;
import com.questrail.mdoc.observability.LinkObservabilitySink;
import com.questrail.mdoc.observability.LinkWarningEvent;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.transport.gatt.GattCacheControl;
import com.questrail.mdoc.transport.gatt.GattClientPort;
import com.questrail.mdoc.transport.internal.events.L2capEvent;
import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.events.LinkTimerEvent;
import com.questrail.mdoc.transport.internal.state.LinkAction;
import com.questrail.mdoc.transport.internal.state.LinkIntents;
import com.questrail.mdoc.transport.l2cap.L2capChannel;
import com.questrail.mdoc.transport.l2cap.L2capChannelListener;
import com.questrail.mdoc.transport.l2cap.L2capConnector;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * PlatformLinkIntentExecutor
 * =============================================================================
 * Realizes {@link LinkAction}s against the GATT client port, the socket
 * connector, the scheduler and the application listener.
 *
 * <h2>Outbound wiring flow</h2>
 * <pre>
 *   LinkEvent
 *      ↓
 *   LinkReducer
 *      ↓ emits
 *   LinkIntents
 *      ↓ consumed by
 *   PlatformLinkIntentExecutor   (this class)
 *      ↓ delegates to
 *   GattClientPort / L2capConnector / MonotonicScheduler / TransportListener
 * </pre>
 *
 * <h2>Owned resources</h2>
 * The executor keeps the open {@link L2capChannel} and the two timer
 * handles (MTU timeout, shutdown linger). The reducer only ever refers to
 * them symbolically.
 *
 * <h2>Listener faults</h2>
 * An exception thrown by the application listener is reported to the
 * observability sink and does not stop the remaining actions of the step.
 */
public final class PlatformLinkIntentExecutor implements LinkIntentExecutor
{
    private final UUID serviceUuid;
    private final GattClientPort gatt;
    private final L2capConnector l2cap;
    private final GattCacheControl cacheControl;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Consumer<LinkEvent> events;
    private final Supplier<TransportListener> listener;
    private final LinkObservabilitySink observabilitySink;

    private volatile String deviceId;
    private volatile L2capChannel channel;
    private volatile boolean channelReleased;
    private Cancellable mtuTimer;
    private Cancellable lingerTimer;

    /**
     * @param config            link configuration (service UUID)
     * @param gatt              GATT client port
     * @param l2cap             socket connector, or {@code null} if the platform has none
     * @param cacheControl      platform quirk hook run before service discovery
     * @param scheduler         timer source
     * @param clock             clock the scheduler deadlines are computed on
     * @param wallClock         timestamps for events raised by timers and the socket
     * @param events            entry point of the link event loop
     * @param listener          current application listener
     * @param observabilitySink warnings and errors; may be {@code null}
     */
    public PlatformLinkIntentExecutor(MdocTransportConfig config,
                                      GattClientPort gatt,
                                      L2capConnector l2cap,
                                      GattCacheControl cacheControl,
                                      MonotonicScheduler scheduler,
                                      MonotonicClock clock,
                                      WallClock wallClock,
                                      Consumer<LinkEvent> events,
                                      Supplier<TransportListener> listener,
                                      LinkObservabilitySink observabilitySink)
    {
        this.serviceUuid = Objects.requireNonNull(config, "config").serviceUuid();
        this.gatt = Objects.requireNonNull(gatt, "gatt");
        this.l2cap = l2cap;
        this.cacheControl = Objects.requireNonNullElse(cacheControl, GattCacheControl.NONE);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.events = Objects.requireNonNull(events, "events");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void execute(LinkIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (LinkAction action : intents.actions()) {
            if (action.isNotification()) {
                notifyListener(action);
            }
            else {
                perform(action);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Platform actions
    // ---------------------------------------------------------------------

    private void perform(LinkAction action)
    {
        if (action instanceof LinkAction.ConnectGatt a) {
            deviceId = a.deviceId();
            gatt.connect(a.deviceId());
        }
        else if (action instanceof LinkAction.RefreshGattCache a) {
            cacheControl.refresh(a.deviceId());
        }
        else if (action instanceof LinkAction.DiscoverServices) {
            gatt.discoverServices();
        }
        else if (action instanceof LinkAction.RequestMtu a) {
            gatt.requestMtu(a.mtu());
        }
        else if (action instanceof LinkAction.ScheduleMtuTimeout a) {
            cancel(mtuTimer);
            mtuTimer = scheduler.scheduleAfter(a.timeout(), clock,
                    () -> events.accept(new LinkTimerEvent.MtuTimeout(wallClock.now())));
        }
        else if (action instanceof LinkAction.CancelTimers) {
            cancel(mtuTimer);
            cancel(lingerTimer);
            mtuTimer = null;
            lingerTimer = null;
        }
        else if (action instanceof LinkAction.ReadCharacteristic a) {
            gatt.readCharacteristic(serviceUuid, a.characteristic());
        }
        else if (action instanceof LinkAction.EnableNotifications a) {
            gatt.enableNotifications(serviceUuid, a.characteristic());
        }
        else if (action instanceof LinkAction.WriteCharacteristic a) {
            gatt.writeCharacteristic(serviceUuid, a.characteristic(), a.value());
        }
        else if (action instanceof LinkAction.OpenL2cap a) {
            openL2cap(a);
        }
        else if (action instanceof LinkAction.SendL2cap a) {
            L2capChannel ch = channel;
            if (ch == null) {
                // Treated as a socket failure so the link closes with an error.
                events.accept(new L2capEvent.Closed(wallClock.now(),
                        new IllegalStateException("No open L2CAP channel for outbound message")));
                return;
            }
            ch.send(a.message());
        }
        else if (action instanceof LinkAction.CloseL2cap) {
            releaseChannel();
        }
        else if (action instanceof LinkAction.ScheduleLinger a) {
            cancel(lingerTimer);
            lingerTimer = scheduler.scheduleAfter(a.linger(), clock,
                    () -> events.accept(new LinkTimerEvent.LingerElapsed(wallClock.now())));
        }
        else if (action instanceof LinkAction.CloseGatt) {
            gatt.close();
        }
        else if (action instanceof LinkAction.ReportWarning a) {
            observabilitySink.onWarning(new LinkWarningEvent(wallClock.now(), deviceId, a.message()));
        }
        else {
            throw new IllegalArgumentException("Unsupported action: " + action);
        }
    }

    private void openL2cap(LinkAction.OpenL2cap action)
    {
        if (l2cap == null) {
            events.accept(new L2capEvent.ConnectFailed(wallClock.now(),
                    new IllegalStateException("No L2CAP connector configured")));
            return;
        }
        channelReleased = false;
        l2cap.connect(action.deviceId(), action.psm(), new ChannelEvents());
    }

    private void releaseChannel()
    {
        channelReleased = true;
        L2capChannel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
    }

    private static void cancel(Cancellable timer)
    {
        if (timer != null) {
            timer.cancel();
        }
    }

    // ---------------------------------------------------------------------
    // Listener notifications
    // ---------------------------------------------------------------------

    private void notifyListener(LinkAction action)
    {
        if (action instanceof LinkAction.NotifyError a) {
            TransportError error = a.error();
            reportError(error.kind(), error.message(), error.cause());
        }

        TransportListener l = listener.get();
        if (l == null) {
            return;
        }

        try {
            if (action instanceof LinkAction.NotifyPeerConnected) {
                l.onPeerConnected();
            }
            else if (action instanceof LinkAction.NotifyMessageReceived a) {
                l.onMessageReceived(a.message());
            }
            else if (action instanceof LinkAction.NotifyPeerDisconnected) {
                l.onPeerDisconnected();
            }
            else if (action instanceof LinkAction.NotifyTransportSpecificTermination) {
                l.onTransportSpecificTermination();
            }
            else if (action instanceof LinkAction.NotifyError a) {
                l.onError(a.error());
            }
        }
        catch (RuntimeException e) {
            reportError(null, "Transport listener threw from " + action, e);
        }
    }

    private void reportError(MdocErrorKind kind, String message, Throwable cause)
    {
        observabilitySink.onError(new LinkErrorEvent(wallClock.now(), kind, message, cause));
    }

    /**
     * ChannelEvents
     * -------------------------------------------------------------------------
     * Turns socket callbacks into link events. A channel that connects after
     * the link already let go of it is closed straight away.
     */
    private final class ChannelEvents implements L2capChannelListener
    {
        @Override
        public void onConnected(L2capChannel ch)
        {
            if (channelReleased) {
                ch.close();
                return;
            }
            channel = ch;
            events.accept(new L2capEvent.Connected(wallClock.now()));
        }

        @Override
        public void onConnectFailed(Throwable cause)
        {
            events.accept(new L2capEvent.ConnectFailed(wallClock.now(), cause));
        }

        @Override
        public void onMessage(byte[] message)
        {
            events.accept(new L2capEvent.MessageReceived(wallClock.now(), message));
        }

        @Override
        public void onClosed(Throwable cause)
        {
            events.accept(new L2capEvent.Closed(wallClock.now(), cause));
        }
    }
}
