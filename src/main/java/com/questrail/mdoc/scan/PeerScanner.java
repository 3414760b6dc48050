package com.questrail.mdoc.scan;

import com.questrail.mdoc.api.PeerCandidate;
import com.questrail.mdoc.internal.time.Cancellable;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.MonotonicScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PeerScanner
 * =============================================================================
 * Runs a timed discovery window and picks the reader to connect to.
 *
 * <p>During the window, advertisements that list the wanted service UUID are
 * collected, one entry per device; a later sighting replaces an earlier one.
 * When the window closes the scanner stops the platform scan and selects
 * with {@link PeerSelection#strongest(java.util.Collection)}.</p>
 *
 * <p>Only one window runs at a time. All state is guarded by the instance
 * monitor because advertisements and the window timer arrive on different
 * threads. Listener callbacks are made outside the monitor.</p>
 */
public final class PeerScanner
{
    private static final Logger log = LoggerFactory.getLogger(PeerScanner.class);

    private final BleScannerPort port;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private final Map<String, PeerCandidate> candidates = new LinkedHashMap<>();
    private Window window;
    private long sequence;

    public PeerScanner(BleScannerPort port, MonotonicScheduler scheduler, MonotonicClock clock)
    {
        this.port = Objects.requireNonNull(port, "port");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens a scan window of {@code duration}. If the platform refuses to
     * start scanning, the failure goes to {@link ScanListener#onError} and no
     * window stays open.
     *
     * @throws IllegalStateException if a window is already open
     */
    public void scan(UUID serviceUuid, Duration duration, ScanListener listener)
    {
        Objects.requireNonNull(serviceUuid, "serviceUuid");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(listener, "listener");

        Window opened;
        synchronized (this) {
            if (window != null) {
                throw new IllegalStateException("Scan already in progress");
            }
            candidates.clear();
            sequence = 0;
            opened = new Window(serviceUuid, listener);
            window = opened;
        }

        log.debug("Scanning for {} during {} ms", serviceUuid, duration.toMillis());
        listener.onScanningStarted();
        try {
            port.startScan(serviceUuid, opened);
        }
        catch (RuntimeException e) {
            log.warn("BLE scan for {} could not start", serviceUuid, e);
            synchronized (this) {
                if (window == opened) {
                    window = null;
                    candidates.clear();
                }
            }
            listener.onError(e);
            return;
        }

        Cancellable timer = scheduler.scheduleAfter(duration, clock, () -> windowElapsed(opened));
        synchronized (this) {
            opened.timer = timer;
        }
    }

    /**
     * Closes the current window without selecting. No listener callback follows.
     */
    public void cancel()
    {
        Window closed;
        synchronized (this) {
            closed = window;
            if (closed == null) {
                return;
            }
            window = null;
            candidates.clear();
            if (closed.timer != null) {
                closed.timer.cancel();
            }
        }
        log.debug("Scan for {} cancelled", closed.serviceUuid);
        port.stopScan();
    }

    public synchronized boolean isScanning()
    {
        return window != null;
    }

    /** Candidates collected so far in the current window. */
    public synchronized List<PeerCandidate> candidates()
    {
        return new ArrayList<>(candidates.values());
    }

    private void windowElapsed(Window elapsed)
    {
        Optional<PeerCandidate> selected;
        synchronized (this) {
            if (window != elapsed) {
                return;
            }
            window = null;
            selected = PeerSelection.strongest(candidates.values());
            candidates.clear();
        }

        port.stopScan();

        if (selected.isPresent()) {
            PeerCandidate peer = selected.get();
            log.info("Selected {} (rssi {})", peer.deviceId(), peer.rssi());
            elapsed.listener.onDeviceSelected(peer);
        }
        else {
            log.info("No device advertising {} found", elapsed.serviceUuid);
            elapsed.listener.onNoDeviceFound();
        }
    }

    /**
     * One scan window; also the callback handed to the port so that late
     * callbacks of an earlier window are recognized and dropped.
     */
    private final class Window implements BleScanCallback
    {
        private final UUID serviceUuid;
        private final ScanListener listener;
        private Cancellable timer;

        private Window(UUID serviceUuid, ScanListener listener)
        {
            this.serviceUuid = serviceUuid;
            this.listener = listener;
        }

        @Override
        public void onAdvertisement(String deviceId, int rssi, List<UUID> serviceUuids)
        {
            if (deviceId == null || serviceUuids == null || !serviceUuids.contains(serviceUuid)) {
                return;
            }
            synchronized (PeerScanner.this) {
                if (window != this) {
                    return;
                }
                candidates.put(deviceId, new PeerCandidate(deviceId, rssi, serviceUuid, sequence++));
            }
            log.trace("Advertisement from {} rssi {}", deviceId, rssi);
        }

        @Override
        public void onScanFailed(Throwable cause)
        {
            synchronized (PeerScanner.this) {
                if (window != this) {
                    return;
                }
            }
            log.warn("BLE scan error", cause);
            listener.onError(cause);
        }
    }
}
