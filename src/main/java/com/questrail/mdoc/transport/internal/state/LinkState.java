package com.questrail.mdoc.transport.internal.state;

import com.questrail.mdoc.codec.ChunkReassembly;
import com.questrail.mdoc.codec.impl.ChunkFraming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LinkState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one mdoc link.
 *
 * <p>Pure data. All transitions are computed by {@link LinkReducer}; the
 * {@code withX} methods exist for the reducer and for tests that need to
 * start from an arbitrary phase.</p>
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>lifecycle phase and transport mode</li>
 *   <li>what service discovery found (Ident, L2CAP PSM characteristic)</li>
 *   <li>negotiated MTU and the attribute size derived from it</li>
 *   <li>FIFO outbound queue and the single in-flight write flag</li>
 *   <li>inbound reassembly buffer</li>
 *   <li>the inhibit flag that silences listener notifications</li>
 * </ul>
 */
public final class LinkState
{
    private final LinkPhase phase;
    private final String deviceId;
    private final boolean socketCapable;
    private final boolean identPresent;
    private final boolean l2capPresent;
    private final int mtu;
    private final LinkMode mode;
    private final List<OutboundWrite> outbound;
    private final boolean writeInFlight;
    private final boolean serverToClientSubscribed;
    private final ChunkReassembly reassembly;
    private final boolean inhibited;

    private LinkState(LinkPhase phase,
                      String deviceId,
                      boolean socketCapable,
                      boolean identPresent,
                      boolean l2capPresent,
                      int mtu,
                      LinkMode mode,
                      List<OutboundWrite> outbound,
                      boolean writeInFlight,
                      boolean serverToClientSubscribed,
                      ChunkReassembly reassembly,
                      boolean inhibited) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.deviceId = deviceId;
        this.socketCapable = socketCapable;
        this.identPresent = identPresent;
        this.l2capPresent = l2capPresent;
        this.mtu = mtu;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.outbound = List.copyOf(outbound);
        this.writeInFlight = writeInFlight;
        this.serverToClientSubscribed = serverToClientSubscribed;
        this.reassembly = Objects.requireNonNull(reassembly, "reassembly");
        this.inhibited = inhibited;
    }

    /**
     * State of a link that has not been asked to connect yet.
     *
     * @param socketCapable whether the socket path may be taken if the peer offers it
     */
    public static LinkState initial(boolean socketCapable) {
        return new LinkState(LinkPhase.IDLE, null, socketCapable, false, false,
                ChunkFraming.DEFAULT_MTU, LinkMode.GATT, List.of(), false, false,
                ChunkReassembly.empty(), false);
    }

    public LinkPhase phase() {
        return phase;
    }

    /** Peer handle, {@code null} before connect. */
    public String deviceId() {
        return deviceId;
    }

    public boolean socketCapable() {
        return socketCapable;
    }

    public boolean identPresent() {
        return identPresent;
    }

    public boolean l2capPresent() {
        return l2capPresent;
    }

    public int mtu() {
        return mtu;
    }

    /** Characteristic value size for the negotiated MTU. */
    public int attributeSize() {
        return ChunkFraming.attributeSizeForMtu(mtu);
    }

    /** Chunk payload size for the negotiated MTU. */
    public int chunkPayloadSize() {
        return ChunkFraming.payloadSizeForAttribute(attributeSize());
    }

    public LinkMode mode() {
        return mode;
    }

    public List<OutboundWrite> outbound() {
        return outbound;
    }

    public boolean writeInFlight() {
        return writeInFlight;
    }

    public boolean serverToClientSubscribed() {
        return serverToClientSubscribed;
    }

    public ChunkReassembly reassembly() {
        return reassembly;
    }

    public boolean inhibited() {
        return inhibited;
    }

    // ---------------------------------------------------------------------
    // Copy-on-write helpers
    // ---------------------------------------------------------------------

    public LinkState withPhase(LinkPhase phase) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withDeviceId(String deviceId) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withDiscovered(boolean identPresent, boolean l2capPresent) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withMtu(int mtu) {
        ChunkFraming.attributeSizeForMtu(mtu);
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withMode(LinkMode mode) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withOutbound(List<OutboundWrite> outbound) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withEnqueued(OutboundWrite write) {
        List<OutboundWrite> next = new ArrayList<>(outbound.size() + 1);
        next.addAll(outbound);
        next.add(Objects.requireNonNull(write, "write"));
        return withOutbound(next);
    }

    public LinkState withWriteInFlight(boolean writeInFlight) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withServerToClientSubscribed(boolean subscribed) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, subscribed, reassembly, inhibited);
    }

    public LinkState withReassembly(ChunkReassembly reassembly) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    public LinkState withInhibited(boolean inhibited) {
        return new LinkState(phase, deviceId, socketCapable, identPresent, l2capPresent, mtu, mode,
                outbound, writeInFlight, serverToClientSubscribed, reassembly, inhibited);
    }

    @Override
    public String toString() {
        return "LinkState[" + phase
                + ", mode=" + mode
                + ", mtu=" + mtu
                + ", queued=" + outbound.size()
                + (writeInFlight ? ", writing" : "")
                + (inhibited ? ", inhibited" : "")
                + "]";
    }
}
