package com.questrail.mdoc.transport.internal.state;

import com.questrail.mdoc.api.TransportError;
import com.questrail.mdoc.codec.ChunkDecodeResult;
import com.questrail.mdoc.codec.ChunkDecoder;
import com.questrail.mdoc.codec.ChunkEncoder;
import com.questrail.mdoc.codec.ChunkReassembly;
import com.questrail.mdoc.codec.impl.ChunkFraming;
import com.questrail.mdoc.config.MdocServiceUuids;
import com.questrail.mdoc.config.MdocTransportConfig;
import com.questrail.mdoc.transport.gatt.GattServiceInfo;
import com.questrail.mdoc.transport.internal.events.GattEvent;
import com.questrail.mdoc.transport.internal.events.L2capEvent;
import com.questrail.mdoc.transport.internal.events.LinkEvent;
import com.questrail.mdoc.transport.internal.events.LinkRequestEvent;
import com.questrail.mdoc.transport.internal.events.LinkTimerEvent;
import com.questrail.mdoc.transport.l2cap.L2capPsm;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * LinkReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one mdoc BLE link.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link LinkState} and a single {@link LinkEvent}, the reducer
 * computes the next state and an ordered list of {@link LinkAction}s. It never
 * performs I/O, never reads a clock and never blocks. The executor carries the
 * actions out; every port callback comes back as another event.
 *
 * <h2>Phases</h2>
 * <pre>
 *   IDLE → CONNECTING → SERVICE_DISCOVERY → MTU_NEGOTIATION
 *        → [IDENT_EXCHANGE] → SOCKET_SETUP | NOTIFICATION_SETUP → HANDSHAKE
 *        → OPEN → CLOSING → CLOSED
 * </pre>
 *
 * <h2>Failure policy</h2>
 * Nothing is retried. A failed platform operation or an unexpected callback
 * during setup moves straight to {@link LinkPhase#CLOSED} and reports a
 * {@link com.questrail.mdoc.api.MdocErrorKind#PLATFORM} error. Protocol
 * violations by the peer report {@link com.questrail.mdoc.api.MdocErrorKind#FRAMING}.
 * Requests that do not fit the current phase report
 * {@link com.questrail.mdoc.api.MdocErrorKind#PRECONDITION} and leave the
 * state untouched.
 *
 * <h2>Inhibit</h2>
 * Once the link is inhibited, listener notifications are dropped from every
 * result. Warnings and platform actions are unaffected.
 */
public final class LinkReducer
{
    /** Value written to State to signal readiness. */
    public static final byte STATE_READY = 0x01;

    /** Value written to or notified on State to signal session termination. */
    public static final byte STATE_TERMINATE = 0x02;

    /**
     * Result of applying an event to a link state.
     *
     * @param newState the updated link state
     * @param intents  actions to be executed by the caller, in order
     */
    public record Result(LinkState newState, LinkIntents intents) {}

    private final MdocTransportConfig config;
    private final MdocServiceUuids uuids;
    private final ChunkEncoder encoder;
    private final ChunkDecoder decoder;

    public LinkReducer(MdocTransportConfig config, ChunkEncoder encoder, ChunkDecoder decoder) {
        this.config = Objects.requireNonNull(config, "config");
        this.uuids = config.characteristics();
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Applies a single event to the current link state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and actions
     */
    public Result apply(LinkState state, LinkEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        Result raw = dispatch(state, event);
        if (!raw.newState().inhibited() || raw.intents().isEmpty()) {
            return raw;
        }

        LinkIntents.Builder kept = LinkIntents.builder();
        for (LinkAction action : raw.intents().actions()) {
            if (!action.isNotification()) {
                kept.add(action);
            }
        }
        return new Result(raw.newState(), kept.build());
    }

    private Result dispatch(LinkState state, LinkEvent event) {
        if (event instanceof LinkRequestEvent e) {
            return onRequest(state, e);
        }
        if (state.phase().isTerminal()) {
            // Stragglers from the platform after teardown.
            return unchanged(state);
        }
        if (event instanceof GattEvent e) {
            return onGatt(state, e);
        }
        if (event instanceof L2capEvent e) {
            return onL2cap(state, e);
        }
        if (event instanceof LinkTimerEvent e) {
            return onTimer(state, e);
        }
        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Application requests
    // ---------------------------------------------------------------------

    private Result onRequest(LinkState state, LinkRequestEvent event) {
        if (event instanceof LinkRequestEvent.ConnectRequested e) {
            if (state.phase() != LinkPhase.IDLE) {
                return precondition(state, "connect() called in phase " + state.phase());
            }
            String deviceId = e.peer().deviceId();
            return new Result(
                    state.withPhase(LinkPhase.CONNECTING).withDeviceId(deviceId),
                    LinkIntents.of(new LinkAction.ConnectGatt(deviceId)));
        }
        if (event instanceof LinkRequestEvent.DisconnectRequested) {
            return onDisconnectRequested(state);
        }

        if (state.phase() != LinkPhase.OPEN) {
            return precondition(state, "Link not open (phase " + state.phase() + ")");
        }

        if (event instanceof LinkRequestEvent.SendRequested e) {
            return onSendRequested(state, e);
        }
        if (event instanceof LinkRequestEvent.RawWriteRequested e) {
            if (state.mode() == LinkMode.L2CAP) {
                return precondition(state, "Raw chunk writes are not available on the socket path");
            }
            LinkState queued = state.withEnqueued(
                    OutboundWrite.Chunks.of(uuids.client2Server(), List.of(e.chunk())));
            return pump(queued, LinkIntents.builder());
        }
        if (event instanceof LinkRequestEvent.TerminationRequested) {
            if (state.mode() == LinkMode.L2CAP) {
                return precondition(state, "Transport-specific termination is not available on the socket path");
            }
            LinkState queued = state.withEnqueued(
                    OutboundWrite.Chunks.of(uuids.state(), List.of(new byte[] { STATE_TERMINATE })));
            return pump(queued, LinkIntents.builder());
        }
        return unchanged(state);
    }

    private Result onSendRequested(LinkState state, LinkRequestEvent.SendRequested e) {
        if (state.mode() == LinkMode.L2CAP) {
            if (e.isShutdownSentinel()) {
                return beginLinger(state, LinkIntents.builder());
            }
            return new Result(state, LinkIntents.of(new LinkAction.SendL2cap(e.message())));
        }

        OutboundWrite write = e.isShutdownSentinel()
                ? new OutboundWrite.Sentinel()
                : OutboundWrite.Chunks.of(uuids.client2Server(),
                        encoder.encode(e.message(), state.chunkPayloadSize()));
        return pump(state.withEnqueued(write), LinkIntents.builder());
    }

    private Result onDisconnectRequested(LinkState state) {
        LinkState inhibited = state.withInhibited(true);

        switch (state.phase()) {
            case IDLE, CLOSED:
                return new Result(inhibited.withPhase(LinkPhase.CLOSED), LinkIntents.none());
            case CLOSING:
                return new Result(inhibited, LinkIntents.none());
            case OPEN: {
                LinkIntents.Builder b = LinkIntents.builder();
                if (state.mode() == LinkMode.L2CAP) {
                    b.add(new LinkAction.CloseL2cap());
                    return beginLinger(inhibited, b);
                }
                return pump(inhibited.withEnqueued(new OutboundWrite.Sentinel()), b);
            }
            default:
                // Nothing queued during setup; tear down at once.
                return new Result(closed(inhibited), teardown().build());
        }
    }

    // ---------------------------------------------------------------------
    // GATT callbacks
    // ---------------------------------------------------------------------

    private Result onGatt(LinkState state, GattEvent event) {
        if (event instanceof GattEvent.Disconnected e) {
            return onGattDisconnected(state, e);
        }
        if (event instanceof GattEvent.MtuChanged e) {
            if (state.phase() != LinkPhase.MTU_NEGOTIATION) {
                // Late answer after the timeout already settled the MTU.
                return unchanged(state);
            }
            return onMtuChanged(state, e);
        }
        if (event instanceof GattEvent.CharacteristicChanged e) {
            return onNotification(state, e);
        }

        switch (state.phase()) {
            case CONNECTING:
                if (event instanceof GattEvent.Connected) {
                    return new Result(
                            state.withPhase(LinkPhase.SERVICE_DISCOVERY),
                            LinkIntents.of(
                                    new LinkAction.RefreshGattCache(state.deviceId()),
                                    new LinkAction.DiscoverServices()));
                }
                break;
            case SERVICE_DISCOVERY:
                if (event instanceof GattEvent.ServicesDiscovered e) {
                    return onServicesDiscovered(state, e);
                }
                break;
            case IDENT_EXCHANGE:
                if (event instanceof GattEvent.CharacteristicRead e
                        && e.characteristic().equals(uuids.ident())) {
                    return onIdentRead(state, e);
                }
                break;
            case SOCKET_SETUP:
                if (event instanceof GattEvent.CharacteristicRead e
                        && e.characteristic().equals(uuids.l2cap())) {
                    return onPsmRead(state, e);
                }
                break;
            case NOTIFICATION_SETUP:
                if (event instanceof GattEvent.DescriptorWritten e) {
                    return onDescriptorWritten(state, e);
                }
                break;
            case HANDSHAKE:
                if (event instanceof GattEvent.CharacteristicWritten e
                        && e.characteristic().equals(uuids.state())) {
                    return onHandshakeWritten(state, e);
                }
                break;
            case OPEN:
                if (event instanceof GattEvent.CharacteristicWritten e && state.writeInFlight()) {
                    return onWriteCompleted(state, e);
                }
                break;
            case CLOSING:
                // Completions of the last writes before the sentinel.
                return unchanged(state);
            default:
                break;
        }

        return fail(state, TransportError.platform(
                "Unexpected " + event + " in phase " + state.phase(), null));
    }

    private Result onGattDisconnected(LinkState state, GattEvent.Disconnected e) {
        if (state.phase().isSetup()) {
            return fail(state, TransportError.platform(
                    "GATT link lost during " + state.phase(), e.cause()));
        }
        return new Result(closed(state),
                teardown().add(new LinkAction.NotifyPeerDisconnected()).build());
    }

    private Result onServicesDiscovered(LinkState state, GattEvent.ServicesDiscovered e) {
        if (!e.success()) {
            return fail(state, TransportError.platform("Service discovery failed", null));
        }

        Optional<GattServiceInfo> service = e.services().stream()
                .filter(s -> s.serviceUuid().equals(config.serviceUuid()))
                .findFirst();
        if (service.isEmpty()) {
            return fail(state, TransportError.framing(
                    "mdoc service " + config.serviceUuid() + " not offered by peer"));
        }

        GattServiceInfo svc = service.get();
        for (UUID mandatory : List.of(uuids.state(), uuids.client2Server(), uuids.server2Client())) {
            if (!svc.has(mandatory)) {
                return fail(state, TransportError.framing("Missing characteristic " + mandatory));
            }
        }

        LinkState next = state
                .withDiscovered(svc.has(uuids.ident()), svc.has(uuids.l2cap()))
                .withPhase(LinkPhase.MTU_NEGOTIATION);

        return new Result(next, LinkIntents.of(
                new LinkAction.RequestMtu(config.requestedMtu()),
                new LinkAction.ScheduleMtuTimeout(config.mtuTimeout())));
    }

    private Result onMtuChanged(LinkState state, GattEvent.MtuChanged e) {
        LinkIntents.Builder b = LinkIntents.builder().add(new LinkAction.CancelTimers());

        int mtu = e.mtu();
        if (!e.success() || mtu < ChunkFraming.DEFAULT_MTU) {
            b.add(new LinkAction.ReportWarning(
                    "MTU negotiation failed (" + e + "), using " + ChunkFraming.DEFAULT_MTU));
            mtu = ChunkFraming.DEFAULT_MTU;
        }
        return afterMtu(state.withMtu(mtu), b);
    }

    private Result afterMtu(LinkState state, LinkIntents.Builder b) {
        if (state.identPresent() && config.expectedIdentValue().isPresent()) {
            b.add(new LinkAction.ReadCharacteristic(uuids.ident()));
            return new Result(state.withPhase(LinkPhase.IDENT_EXCHANGE), b.build());
        }
        return afterIdent(state, b);
    }

    private Result onIdentRead(LinkState state, GattEvent.CharacteristicRead e) {
        if (!e.success()) {
            return fail(state, TransportError.platform("Reading Ident characteristic failed", null));
        }

        LinkIntents.Builder b = LinkIntents.builder();
        byte[] expected = config.expectedIdent();
        if (!MessageDigest.isEqual(expected, e.value())) {
            b.add(new LinkAction.ReportWarning(
                    "Ident mismatch: expected " + hex(expected) + ", got " + hex(e.value())));
        }
        return afterIdent(state, b);
    }

    private Result afterIdent(LinkState state, LinkIntents.Builder b) {
        if (state.l2capPresent() && state.socketCapable()) {
            b.add(new LinkAction.ReadCharacteristic(uuids.l2cap()));
            return new Result(state.withPhase(LinkPhase.SOCKET_SETUP), b.build());
        }
        b.add(new LinkAction.EnableNotifications(uuids.server2Client()));
        return new Result(state.withPhase(LinkPhase.NOTIFICATION_SETUP), b.build());
    }

    private Result onPsmRead(LinkState state, GattEvent.CharacteristicRead e) {
        if (!e.success()) {
            return fail(state, TransportError.platform("Reading L2CAP PSM failed", null));
        }
        OptionalInt psm = L2capPsm.decode(e.value());
        if (psm.isEmpty()) {
            return fail(state, TransportError.framing(
                    "Invalid L2CAP PSM value " + hex(e.value())));
        }
        return new Result(state,
                LinkIntents.of(new LinkAction.OpenL2cap(state.deviceId(), psm.getAsInt())));
    }

    private Result onDescriptorWritten(LinkState state, GattEvent.DescriptorWritten e) {
        if (!e.success() || !MdocServiceUuids.CCCD.equals(e.descriptor())) {
            return fail(state, TransportError.platform(
                    "Enabling notifications on " + e.characteristic() + " failed", null));
        }

        if (!state.serverToClientSubscribed() && e.characteristic().equals(uuids.server2Client())) {
            return new Result(state.withServerToClientSubscribed(true),
                    LinkIntents.of(new LinkAction.EnableNotifications(uuids.state())));
        }
        if (state.serverToClientSubscribed() && e.characteristic().equals(uuids.state())) {
            return new Result(state.withPhase(LinkPhase.HANDSHAKE),
                    LinkIntents.of(new LinkAction.WriteCharacteristic(
                            uuids.state(), new byte[] { STATE_READY })));
        }
        return fail(state, TransportError.platform(
                "Unexpected descriptor write on " + e.characteristic(), null));
    }

    private Result onHandshakeWritten(LinkState state, GattEvent.CharacteristicWritten e) {
        if (!e.success()) {
            return fail(state, TransportError.platform("Writing ready code to State failed", null));
        }
        return new Result(state.withPhase(LinkPhase.OPEN),
                LinkIntents.of(new LinkAction.NotifyPeerConnected()));
    }

    private Result onWriteCompleted(LinkState state, GattEvent.CharacteristicWritten e) {
        if (!e.success()) {
            return fail(state, TransportError.platform(
                    "Write to " + e.characteristic() + " failed", null));
        }
        return pump(state.withWriteInFlight(false), LinkIntents.builder());
    }

    private Result onNotification(LinkState state, GattEvent.CharacteristicChanged e) {
        LinkPhase phase = state.phase();
        if (phase != LinkPhase.HANDSHAKE && phase != LinkPhase.OPEN) {
            return unchanged(state);
        }
        if (e.characteristic().equals(uuids.server2Client())) {
            return onChunk(state, e.value());
        }
        if (e.characteristic().equals(uuids.state())) {
            return onStateNotification(state, e.value());
        }
        return new Result(state, LinkIntents.of(new LinkAction.ReportWarning(
                "Ignoring notification on unknown characteristic " + e.characteristic())));
    }

    private Result onChunk(LinkState state, byte[] chunk) {
        ChunkDecodeResult decoded = decoder.decode(state.reassembly(), chunk);

        if (decoded instanceof ChunkDecodeResult.Partial p) {
            LinkIntents.Builder b = LinkIntents.builder();
            if (chunk.length < state.attributeSize()) {
                b.add(new LinkAction.ReportWarning("Non-final chunk of " + chunk.length
                        + " bytes is shorter than the attribute size " + state.attributeSize()));
            }
            return new Result(state.withReassembly(p.pending()), b.build());
        }
        if (decoded instanceof ChunkDecodeResult.Complete c) {
            return new Result(state.withReassembly(ChunkReassembly.empty()),
                    LinkIntents.of(new LinkAction.NotifyMessageReceived(c.message())));
        }
        if (decoded instanceof ChunkDecodeResult.Shutdown) {
            return new Result(closed(state),
                    teardown().add(new LinkAction.NotifyPeerDisconnected()).build());
        }
        ChunkDecodeResult.Invalid invalid = (ChunkDecodeResult.Invalid) decoded;
        return fail(state, TransportError.framing(invalid.reason()));
    }

    private Result onStateNotification(LinkState state, byte[] value) {
        if (value.length != 1) {
            return fail(state, TransportError.framing(
                    "State notification of " + value.length + " bytes"));
        }
        if (value[0] == STATE_TERMINATE) {
            return new Result(state,
                    LinkIntents.of(new LinkAction.NotifyTransportSpecificTermination()));
        }
        return fail(state, TransportError.framing("Unexpected State value " + hex(value)));
    }

    // ---------------------------------------------------------------------
    // Socket callbacks
    // ---------------------------------------------------------------------

    private Result onL2cap(LinkState state, L2capEvent event) {
        if (event instanceof L2capEvent.Connected && state.phase() == LinkPhase.SOCKET_SETUP) {
            return new Result(state.withPhase(LinkPhase.OPEN).withMode(LinkMode.L2CAP),
                    LinkIntents.of(new LinkAction.NotifyPeerConnected()));
        }
        if (event instanceof L2capEvent.ConnectFailed e && state.phase() == LinkPhase.SOCKET_SETUP) {
            return fail(state, TransportError.platform("L2CAP connect failed", e.cause()));
        }
        if (state.phase() == LinkPhase.OPEN && state.mode() == LinkMode.L2CAP) {
            if (event instanceof L2capEvent.MessageReceived e) {
                return new Result(state,
                        LinkIntents.of(new LinkAction.NotifyMessageReceived(e.message())));
            }
            if (event instanceof L2capEvent.Closed e) {
                if (e.cause() != null) {
                    return fail(state, TransportError.platform("L2CAP socket failed", e.cause()));
                }
                return new Result(closed(state),
                        teardown().add(new LinkAction.NotifyPeerDisconnected()).build());
            }
        }
        // Socket already released or closing.
        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------------

    private Result onTimer(LinkState state, LinkTimerEvent event) {
        if (event instanceof LinkTimerEvent.MtuTimeout && state.phase() == LinkPhase.MTU_NEGOTIATION) {
            LinkIntents.Builder b = LinkIntents.builder().add(new LinkAction.ReportWarning(
                    "No MTU callback within " + config.mtuTimeout().toMillis()
                            + " ms, using " + ChunkFraming.DEFAULT_MTU));
            return afterMtu(state.withMtu(ChunkFraming.DEFAULT_MTU), b);
        }
        if (event instanceof LinkTimerEvent.LingerElapsed && state.phase() == LinkPhase.CLOSING) {
            // Local shutdown: the peer did not leave, so nothing is reported.
            return new Result(closed(state), teardown().build());
        }
        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Outbound queue
    // ---------------------------------------------------------------------

    /**
     * Issues the next queued write if none is in flight. A sentinel at the
     * head of the queue starts the linger instead.
     */
    private Result pump(LinkState state, LinkIntents.Builder b) {
        if (state.writeInFlight() || state.outbound().isEmpty()) {
            return new Result(state, b.build());
        }

        OutboundWrite head = state.outbound().get(0);
        if (head instanceof OutboundWrite.Sentinel) {
            return beginLinger(state.withOutbound(List.of()), b);
        }

        OutboundWrite.Chunks chunks = (OutboundWrite.Chunks) head;
        List<OutboundWrite> rest = new ArrayList<>(state.outbound());
        OutboundWrite.Chunks remaining = chunks.advance();
        if (remaining != null) {
            rest.set(0, remaining);
        }
        else {
            rest.remove(0);
        }

        b.add(new LinkAction.WriteCharacteristic(chunks.characteristic(), chunks.head()));
        return new Result(state.withOutbound(rest).withWriteInFlight(true), b.build());
    }

    private Result beginLinger(LinkState state, LinkIntents.Builder b) {
        b.add(new LinkAction.ScheduleLinger(config.shutdownLinger()));
        return new Result(state.withPhase(LinkPhase.CLOSING), b.build());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result unchanged(LinkState state) {
        return new Result(state, LinkIntents.none());
    }

    private static Result precondition(LinkState state, String message) {
        return new Result(state,
                LinkIntents.of(new LinkAction.NotifyError(TransportError.precondition(message))));
    }

    private static Result fail(LinkState state, TransportError error) {
        return new Result(closed(state),
                teardown().add(new LinkAction.NotifyError(error)).build());
    }

    private static LinkState closed(LinkState state) {
        return state.withPhase(LinkPhase.CLOSED)
                .withOutbound(List.of())
                .withWriteInFlight(false)
                .withReassembly(ChunkReassembly.empty());
    }

    private static LinkIntents.Builder teardown() {
        return LinkIntents.builder()
                .add(new LinkAction.CancelTimers())
                .add(new LinkAction.CloseL2cap())
                .add(new LinkAction.CloseGatt());
    }

    private static String hex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
        }
        return sb.toString();
    }
}
