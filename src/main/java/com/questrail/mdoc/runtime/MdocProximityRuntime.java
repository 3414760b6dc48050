package com.questrail.mdoc.runtime;

import com.questrail.mdoc.api.PeerCandidate;
import com.questrail.mdoc.config.MdocTransportConfig;
import com.questrail.mdoc.crypto.BleIdent;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.internal.time.MonotonicScheduler;
import com.questrail.mdoc.internal.time.ScheduledExecutorScheduler;
import com.questrail.mdoc.internal.time.SystemMonotonicClock;
import com.questrail.mdoc.observability.LinkObservabilitySink;
import com.questrail.mdoc.observability.NullObservabilitySink;
import com.questrail.mdoc.scan.BleScannerPort;
import com.questrail.mdoc.scan.PeerScanner;
import com.questrail.mdoc.scan.ScanListener;
import com.questrail.mdoc.session.DeviceSession;
import com.questrail.mdoc.session.DeviceSessionListener;
import com.questrail.mdoc.transport.ble.BleTransport;
import com.questrail.mdoc.transport.gatt.GattCacheControl;
import com.questrail.mdoc.transport.gatt.GattClientPort;
import com.questrail.mdoc.transport.l2cap.L2capConnector;

import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MdocProximityRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one device-side mdoc presentation
 * over BLE: scanner, link transport, timer thread and the device session.
 *
 * <pre>
 *   runtime.openDeviceSession(engagement, handover, listener);
 *   runtime.scanAndConnect(scanListener);
 *   ...
 *   runtime.stop();
 * </pre>
 */
public final class MdocProximityRuntime {
    public static final Duration DEFAULT_SCAN_DURATION = Duration.ofSeconds(10);

    private final MdocTransportConfig config;
    private final BleTransport transport;
    private final PeerScanner scanner;
    private final ScheduledExecutorService schedulerExecutor;
    private final KeyPair eDeviceKey;
    private final Duration scanDuration;

    private MdocProximityRuntime(MdocTransportConfig config,
                                 BleTransport transport,
                                 PeerScanner scanner,
                                 ScheduledExecutorService schedulerExecutor,
                                 KeyPair eDeviceKey,
                                 Duration scanDuration) {
        this.config = config;
        this.transport = transport;
        this.scanner = scanner;
        this.schedulerExecutor = schedulerExecutor;
        this.eDeviceKey = eDeviceKey;
        this.scanDuration = scanDuration;
    }

    public MdocTransportConfig config() {
        return config;
    }

    public BleTransport transport() {
        return transport;
    }

    public PeerScanner scanner() {
        return scanner;
    }

    /**
     * Binds a {@link DeviceSession} to the transport. Must precede
     * {@link #scanAndConnect(ScanListener)}.
     *
     * @param deviceEngagement encoded DeviceEngagement shown to the reader
     * @param handover         encoded Handover, or {@code null} for QR engagement
     */
    public DeviceSession openDeviceSession(byte[] deviceEngagement,
                                           byte[] handover,
                                           DeviceSessionListener listener) {
        if (eDeviceKey == null) {
            throw new IllegalStateException("No ephemeral device key configured");
        }
        return new DeviceSession(transport, eDeviceKey, deviceEngagement, handover, listener);
    }

    /**
     * Scans for the configured service and connects to the strongest reader.
     * {@code scanListener} sees every scan outcome; the connect happens right
     * after {@link ScanListener#onDeviceSelected(PeerCandidate)} returns.
     */
    public void scanAndConnect(ScanListener scanListener) {
        Objects.requireNonNull(scanListener, "scanListener");
        scanner.scan(config.serviceUuid(), scanDuration, new ScanListener() {
            @Override
            public void onScanningStarted() {
                scanListener.onScanningStarted();
            }

            @Override
            public void onDeviceSelected(PeerCandidate peer) {
                scanListener.onDeviceSelected(peer);
                transport.connect(peer);
            }

            @Override
            public void onNoDeviceFound() {
                scanListener.onNoDeviceFound();
            }

            @Override
            public void onError(Throwable cause) {
                scanListener.onError(cause);
            }
        });
    }

    public void stop() {
        scanner.cancel();
        transport.shutdown();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MdocTransportConfig config;
        private GattClientPort gattClient;
        private L2capConnector l2capConnector;
        private GattCacheControl cacheControl = GattCacheControl.NONE;
        private BleScannerPort scannerPort;
        private LinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private KeyPair eDeviceKey;
        private Duration scanDuration = DEFAULT_SCAN_DURATION;

        public Builder withConfig(MdocTransportConfig config) {
            this.config = config;
            return this;
        }

        public Builder withGattClient(GattClientPort gattClient) {
            this.gattClient = gattClient;
            return this;
        }

        public Builder withL2capConnector(L2capConnector connector) {
            this.l2capConnector = connector;
            return this;
        }

        public Builder withGattCacheControl(GattCacheControl cacheControl) {
            this.cacheControl = cacheControl;
            return this;
        }

        public Builder withScanner(BleScannerPort scannerPort) {
            this.scannerPort = scannerPort;
            return this;
        }

        public Builder withObservabilitySink(LinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Ephemeral device key of this presentation. Unless the configuration
         * already carries one, the expected Ident is derived from it.
         */
        public Builder withEphemeralDeviceKey(KeyPair eDeviceKey) {
            this.eDeviceKey = eDeviceKey;
            return this;
        }

        public Builder withScanDuration(Duration scanDuration) {
            this.scanDuration = scanDuration;
            return this;
        }

        public MdocProximityRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(gattClient, "gattClient");
            Objects.requireNonNull(scannerPort, "scannerPort");
            Objects.requireNonNull(scanDuration, "scanDuration");

            MdocTransportConfig effectiveConfig = config;
            if (eDeviceKey != null && config.expectedIdent() == null) {
                byte[] ident = BleIdent.forKey((ECPublicKey) eDeviceKey.getPublic());
                effectiveConfig = new MdocTransportConfig(config.serviceUuid(), config.characteristics(),
                        config.requestedMtu(), config.mtuTimeout(), config.shutdownLinger(),
                        config.l2capEnabled(), ident);
            }

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "mdoc-timers");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            BleTransport transport = BleTransport.builder()
                    .withConfig(effectiveConfig)
                    .withGattClient(gattClient)
                    .withL2capConnector(l2capConnector)
                    .withGattCacheControl(cacheControl)
                    .withScheduler(scheduler)
                    .withClock(clock)
                    .withObservabilitySink(observabilitySink)
                    .build();

            PeerScanner scanner = new PeerScanner(scannerPort, scheduler, clock);

            return new MdocProximityRuntime(effectiveConfig, transport, scanner, schedulerExec,
                    eDeviceKey, scanDuration);
        }
    }
}
