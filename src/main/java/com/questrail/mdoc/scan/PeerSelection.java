package com.questrail.mdoc.scan;

import com.questrail.mdoc.api.PeerCandidate;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Choice of the peer to connect to at the end of a scan window.
 */
public final class PeerSelection
{
    /** Strongest signal first; among equals, the most recent sighting. */
    public static final Comparator<PeerCandidate> STRONGEST_THEN_LATEST =
            Comparator.comparingInt(PeerCandidate::rssi)
                    .thenComparingLong(PeerCandidate::sequence);

    private PeerSelection() {}

    /**
     * Returns the candidate with the highest RSSI. Ties go to the candidate
     * seen last.
     */
    public static Optional<PeerCandidate> strongest(Collection<PeerCandidate> candidates) {
        return candidates.stream().max(STRONGEST_THEN_LATEST);
    }
}
