package com.questrail.mdoc.transport.gatt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * FakeGattClientPort
 * -----------------------------------------------------------------------------
 * Test-only {@link GattClientPort} implementation.
 *
 * <p>The fake records every operation it is asked to perform and lets tests
 * inject the matching completion callbacks. It contains no mdoc semantics.</p>
 */
public final class FakeGattClientPort implements GattClientPort {

    public record Op(String name, UUID characteristic, byte[] value, int mtu, String deviceId) {
        static Op of(String name) {
            return new Op(name, null, null, 0, null);
        }
    }

    public record Write(UUID characteristic, byte[] value) {}

    private GattClientPortListener listener;
    private final List<Op> ops = new ArrayList<>();
    private final List<Write> writes = new ArrayList<>();

    @Override
    public synchronized void setListener(GattClientPortListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void connect(String deviceId) {
        ops.add(new Op("connect", null, null, 0, deviceId));
    }

    @Override
    public synchronized void discoverServices() {
        ops.add(Op.of("discoverServices"));
    }

    @Override
    public synchronized void requestMtu(int mtu) {
        ops.add(new Op("requestMtu", null, null, mtu, null));
    }

    @Override
    public synchronized void readCharacteristic(UUID service, UUID characteristic) {
        ops.add(new Op("read", characteristic, null, 0, null));
    }

    @Override
    public synchronized void enableNotifications(UUID service, UUID characteristic) {
        ops.add(new Op("enableNotifications", characteristic, null, 0, null));
    }

    @Override
    public synchronized void writeCharacteristic(UUID service, UUID characteristic, byte[] value) {
        ops.add(new Op("write", characteristic, value.clone(), 0, null));
        writes.add(new Write(characteristic, value.clone()));
    }

    @Override
    public synchronized void close() {
        ops.add(Op.of("close"));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public GattClientPortListener listener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }

    public void injectConnected() {
        listener().onConnected();
    }

    public void injectDisconnected(Throwable cause) {
        listener().onDisconnected(cause);
    }

    public void injectServices(UUID serviceUuid, Set<UUID> characteristics) {
        listener().onServicesDiscovered(true, List.of(new GattServiceInfo(serviceUuid, characteristics)));
    }

    public void injectMtu(int mtu) {
        listener().onMtuChanged(mtu, true);
    }

    public void injectRead(UUID characteristic, byte[] value) {
        listener().onCharacteristicRead(characteristic, value, true);
    }

    public void injectDescriptorWritten(UUID characteristic) {
        listener().onDescriptorWritten(characteristic, UUID.fromString("00002902-0000-1000-8000-00805f9b34fb"), true);
    }

    public void injectWritten(UUID characteristic) {
        listener().onCharacteristicWritten(characteristic, true);
    }

    public void injectNotification(UUID characteristic, byte[] value) {
        listener().onCharacteristicChanged(characteristic, value);
    }

    public synchronized List<Op> ops() {
        return Collections.unmodifiableList(new ArrayList<>(ops));
    }

    public synchronized List<String> opNames() {
        return ops.stream().map(Op::name).toList();
    }

    public synchronized List<Write> writes() {
        return Collections.unmodifiableList(new ArrayList<>(writes));
    }

    public synchronized Op lastOp() {
        return ops.isEmpty() ? null : ops.get(ops.size() - 1);
    }

    public synchronized void clear() {
        ops.clear();
        writes.clear();
    }
}
