package com.questrail.mdoc.scan;

import com.questrail.mdoc.api.PeerCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PeerSelectionTest {

    private static final UUID SERVICE = UUID.fromString("45efef74-2b2c-4837-a9a3-b0e1d05a6917");

    private static PeerCandidate peer(String id, int rssi, long sequence) {
        return new PeerCandidate(id, rssi, SERVICE, sequence);
    }

    @Test
    void strongestSignalWins() {
        List<PeerCandidate> seen = List.of(peer("a", -70, 0), peer("b", -40, 1), peer("c", -55, 2));

        assertEquals("b", PeerSelection.strongest(seen).orElseThrow().deviceId());
    }

    @Test
    void tieGoesToLatestSighting() {
        List<PeerCandidate> seen = List.of(peer("a", -50, 3), peer("b", -50, 7), peer("c", -50, 5));

        assertEquals("b", PeerSelection.strongest(seen).orElseThrow().deviceId());
    }

    @Test
    void nothingSeenSelectsNothing() {
        assertTrue(PeerSelection.strongest(List.of()).isEmpty());
    }
}
