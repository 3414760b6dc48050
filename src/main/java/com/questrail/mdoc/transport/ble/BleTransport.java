package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.api.PeerCandidate;
import com.questrail.mdoc.api.ProximityTransport;
import com.questrail.mdoc.api.TransportListener;
import com.questrail.mdoc.codec.impl.DefaultChunkDecoder;
import com.questrail.mdoc.codec.impl.DefaultChunkEncoder;
import com.questrail.mdoc.config.MdocTransportConfig;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.MonotonicScheduler;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.internal.time.SystemWallClock;
import com.questrail.mdoc.internal.time.WallClock;
import com.questrail.mdoc.observability.LinkObservabilitySink;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.transport.gatt.GattCacheControl;
import com.questrail.mdoc.transport.gatt.GattClientPort;
import com.questrail.mdoc.transport.gatt.GattClientPortListener;
import com.questrail.mdoc.transport.gatt.GattServiceInfo;
import com.questrail.mdoc.transport.internal.events.GattEvent;
import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.events.LinkRequestEvent;
import com.questrail.mdoc.transport.internal.exec.LinkController;
import com.questrail.mdoc.transport.internal.exec.LinkEventLoop;
import com.questrail.mdoc.transport.internal.exec.LinkOperationalDriver;
import com.questrail.mdoc.transport.internal.exec.PlatformLinkIntentExecutor;
import com.questrail.mdoc.transport.internal.state.LinkMode;
import com.questrail.mdoc.transport.internal.state.LinkPhase;
import com.questrail.mdoc.transport.internal.state.LinkReducer;
import com.questrail.mdoc.transport.internal.state.LinkState;
import com.questrail.mdoc.transport.l2cap.L2capConnector;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * BleTransport
 * =============================================================================
 * {@link ProximityTransport} for the mdoc BLE central client role: connects
 * to the reader's GATT server, negotiates the MTU, optionally checks the
 * reader's Ident, then runs either the notification path or the L2CAP socket
 * path.
 *
 * <h2>Composition</h2>
 * <pre>
 *   GattClientPort callbacks ─┐
 *   L2CAP channel callbacks ──┼─→ LinkEventLoop → LinkReducer → PlatformLinkIntentExecutor
 *   application requests ────┘                                     ↓
 *                                                   ports, timers, TransportListener
 * </pre>
 *
 * <p>Every public method only enqueues an event and returns. With a
 * dedicated event thread (the default) listener callbacks arrive on that
 * thread; otherwise they run on whichever thread delivered the triggering
 * port callback or request.</p>
 *
 * <p>One instance carries one connection.</p>
 */
public final class BleTransport implements ProximityTransport
{
    private final MdocTransportConfig config;
    private final GattClientPort gatt;
    private final WallClock wallClock;
    private final LinkEventLoop loop;

    private volatile TransportListener listener;

    private BleTransport(Builder b)
    {
        this.config = Objects.requireNonNull(b.config, "config");
        this.gatt = Objects.requireNonNull(b.gatt, "gatt");
        this.wallClock = b.wallClock;

        boolean socketCapable = config.l2capEnabled() && b.l2cap != null && b.l2cap.isSupported();

        LinkReducer reducer = new LinkReducer(config, new DefaultChunkEncoder(), new DefaultChunkDecoder());
        PlatformLinkIntentExecutor executor = new PlatformLinkIntentExecutor(
                config,
                gatt,
                b.l2cap,
                b.cacheControl,
                Objects.requireNonNull(b.scheduler, "scheduler"),
                b.clock,
                wallClock,
                this::dispatch,
                () -> listener,
                b.observabilitySink);

        if (b.dedicatedEventThread) {
            this.loop = new LinkOperationalDriver(reducer, executor,
                    () -> LinkState.initial(socketCapable), b.observabilitySink, wallClock,
                    "mdoc-link-" + config.serviceUuid());
        }
        else {
            this.loop = new LinkController(LinkState.initial(socketCapable), reducer, executor,
                    b.observabilitySink, wallClock);
        }

        gatt.setListener(new GattEvents());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public void setListener(TransportListener listener)
    {
        this.listener = listener;
    }

    @Override
    public void connect(PeerCandidate peer)
    {
        Objects.requireNonNull(peer, "peer");
        if (listener == null) {
            throw new IllegalStateException("setListener() must be called before connect()");
        }
        loop.start();
        dispatch(new LinkRequestEvent.ConnectRequested(wallClock.now(), peer));
    }

    @Override
    public void sendMessage(byte[] message)
    {
        Objects.requireNonNull(message, "message");
        dispatch(new LinkRequestEvent.SendRequested(wallClock.now(), message));
    }

    @Override
    public void write(byte[] rawChunk)
    {
        Objects.requireNonNull(rawChunk, "rawChunk");
        dispatch(new LinkRequestEvent.RawWriteRequested(wallClock.now(), rawChunk));
    }

    @Override
    public void disconnect()
    {
        dispatch(new LinkRequestEvent.DisconnectRequested(wallClock.now()));
    }

    @Override
    public void sendTransportSpecificTermination()
    {
        dispatch(new LinkRequestEvent.TerminationRequested(wallClock.now()));
    }

    @Override
    public boolean supportsTransportSpecificTermination()
    {
        return loop.state().mode() != LinkMode.L2CAP;
    }

    /**
     * Current link phase, for diagnostics.
     */
    public LinkPhase phase()
    {
        return loop.state().phase();
    }

    /**
     * Characteristic value size negotiated for this link.
     */
    public int attributeSize()
    {
        return loop.state().attributeSize();
    }

    /**
     * Stops the event loop. Call once the link reached {@link LinkPhase#CLOSED}
     * or the transport is abandoned; pending events are dropped.
     */
    public void shutdown()
    {
        loop.stop();
    }

    private void dispatch(LinkEvent event)
    {
        loop.dispatch(event);
    }

    /**
     * GattEvents
     * -------------------------------------------------------------------------
     * Adapts the GATT port callbacks into link events.
     */
    private final class GattEvents implements GattClientPortListener
    {
        @Override
        public void onConnected()
        {
            dispatch(new GattEvent.Connected(wallClock.now()));
        }

        @Override
        public void onDisconnected(Throwable cause)
        {
            dispatch(new GattEvent.Disconnected(wallClock.now(), cause));
        }

        @Override
        public void onServicesDiscovered(boolean success, List<GattServiceInfo> services)
        {
            dispatch(new GattEvent.ServicesDiscovered(wallClock.now(), success, services));
        }

        @Override
        public void onMtuChanged(int mtu, boolean success)
        {
            dispatch(new GattEvent.MtuChanged(wallClock.now(), mtu, success));
        }

        @Override
        public void onCharacteristicRead(UUID characteristic, byte[] value, boolean success)
        {
            dispatch(new GattEvent.CharacteristicRead(wallClock.now(), characteristic, value, success));
        }

        @Override
        public void onCharacteristicWritten(UUID characteristic, boolean success)
        {
            dispatch(new GattEvent.CharacteristicWritten(wallClock.now(), characteristic, success));
        }

        @Override
        public void onDescriptorWritten(UUID characteristic, UUID descriptor, boolean success)
        {
            dispatch(new GattEvent.DescriptorWritten(wallClock.now(), characteristic, descriptor, success));
        }

        @Override
        public void onCharacteristicChanged(UUID characteristic, byte[] value)
        {
            dispatch(new GattEvent.CharacteristicChanged(wallClock.now(), characteristic, value));
        }
    }

    public static final class Builder
    {
        private MdocTransportConfig config;
        private GattClientPort gatt;
        private L2capConnector l2cap;
        private GattCacheControl cacheControl = GattCacheControl.NONE;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private LinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private boolean dedicatedEventThread = true;

        private Builder() {}

        public Builder withConfig(MdocTransportConfig config) {
            this.config = config;
            return this;
        }

        public Builder withGattClient(GattClientPort gatt) {
            this.gatt = gatt;
            return this;
        }

        /** Socket connector; leave unset if the platform cannot open L2CAP channels. */
        public Builder withL2capConnector(L2capConnector l2cap) {
            this.l2cap = l2cap;
            return this;
        }

        public Builder withGattCacheControl(GattCacheControl cacheControl) {
            this.cacheControl = Objects.requireNonNull(cacheControl, "cacheControl");
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withObservabilitySink(LinkObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
            return this;
        }

        /**
         * {@code false} runs every event on the thread that raised it.
         * Intended for tests with synchronous fakes.
         */
        public Builder withDedicatedEventThread(boolean dedicated) {
            this.dedicatedEventThread = dedicated;
            return this;
        }

        public BleTransport build() {
            return new BleTransport(this);
        }
    }
}
