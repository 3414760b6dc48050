package com.questrail.mdoc.scan;

import com.questrail.mdoc.api.PeerCandidate;

/**
 * Outcome callbacks of one scan window.
 */
public interface ScanListener
{
    void onScanningStarted();

    /** The window closed and {@code peer} had the strongest signal. */
    void onDeviceSelected(PeerCandidate peer);

    /** The window closed without a single matching advertisement. */
    void onNoDeviceFound();

    /** A platform scan error. The window keeps running. */
    void onError(Throwable cause);
}
