package com.questrail.mdoc.session;

import com.questrail.mdoc.api.PeerCandidate;
import com.questrail.mdoc.api.ProximityTransport;
import com.questrail.mdoc.api.TransportListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Test-only {@link ProximityTransport} that records what a session sends.
 */
final class FakeProximityTransport implements ProximityTransport {

    TransportListener listener;
    final List<byte[]> sent = new ArrayList<>();
    int disconnects;
    int terminations;
    boolean transportSpecificTermination = true;

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect(PeerCandidate peer) {
    }

    @Override
    public void sendMessage(byte[] message) {
        sent.add(message);
    }

    @Override
    public void write(byte[] rawChunk) {
        sent.add(rawChunk);
    }

    @Override
    public void disconnect() {
        disconnects++;
    }

    @Override
    public void sendTransportSpecificTermination() {
        terminations++;
    }

    @Override
    public boolean supportsTransportSpecificTermination() {
        return transportSpecificTermination;
    }

    byte[] lastSent() {
        return sent.get(sent.size() - 1);
    }
}
