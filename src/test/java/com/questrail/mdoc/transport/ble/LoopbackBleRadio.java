package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.transport.ConnectionTimeoutException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory BLE radio connecting {@link GattCentralLink}s and
 * {@link GattPeripheralLink}s created from the same instance.
 *
 * - Delivery is synchronous, on the sending thread, to the peer only
 * - {@code connect} blocks until a peripheral publishes the service UUID
 * - L2CAP writes are split in two to exercise stream reassembly
 * - Disconnecting or closing either end notifies the other
 */
public final class LoopbackBleRadio {

    private final Object lock = new Object();
    private final Map<UUID, Peripheral> advertised = new HashMap<>();
    private final Map<Integer, Peripheral> l2capServers = new HashMap<>();
    private final int maxMtu;
    private int nextPsm = 0x80;
    private int openChannels;

    public LoopbackBleRadio() {
        this(185);
    }

    public LoopbackBleRadio(int maxMtu) {
        this.maxMtu = maxMtu;
    }

    public GattCentralLink newCentral() {
        return new Central();
    }

    public GattPeripheralLink newPeripheral() {
        return new Peripheral();
    }

    /** No service advertised, no GATT connection and no L2CAP channel open. */
    public boolean isIdle() {
        synchronized (lock) {
            return advertised.isEmpty() && l2capServers.isEmpty() && openChannels == 0;
        }
    }

    private static UncheckedIOException radioError(String message) {
        return new UncheckedIOException(new IOException(message));
    }

    // -------------------------------------------------------------------------
    // Peripheral (GATT server)
    // -------------------------------------------------------------------------

    private final class Peripheral implements GattPeripheralLink {
        private volatile GattLinkListener listener;
        private volatile Central central;
        private volatile int mtu = 23;
        private Set<UUID> characteristics = Set.of();
        private Map<UUID, byte[]> readOnlyValues = Map.of();
        private final List<Integer> psms = new ArrayList<>();
        private Consumer<L2capChannel> onL2capAccepted;
        private boolean closed;

        @Override
        public void setListener(GattLinkListener listener) {
            this.listener = listener;
        }

        @Override
        public int listenL2cap(Consumer<L2capChannel> onAccepted) {
            synchronized (lock) {
                int psm = nextPsm++;
                onL2capAccepted = onAccepted;
                psms.add(psm);
                l2capServers.put(psm, this);
                return psm;
            }
        }

        @Override
        public void publish(UUID serviceUuid, Set<UUID> characteristics, Map<UUID, byte[]> readOnlyValues) {
            if (listener == null) {
                throw new IllegalStateException("setListener() must be called before publish()");
            }
            synchronized (lock) {
                if (closed) {
                    throw radioError("Peripheral closed");
                }
                if (advertised.containsKey(serviceUuid)) {
                    throw radioError("Service already advertised: " + serviceUuid);
                }
                this.characteristics = new HashSet<>(characteristics);
                this.readOnlyValues = new HashMap<>(readOnlyValues);
                advertised.put(serviceUuid, this);
                lock.notifyAll();
            }
        }

        @Override
        public int mtu() {
            return mtu;
        }

        @Override
        public void notifyCharacteristic(UUID characteristic, byte[] value) {
            Central c = central;
            if (c == null) {
                throw radioError("No central connected");
            }
            if (c.subscribed.contains(characteristic)) {
                c.listener.onCharacteristicValue(characteristic, value.clone());
            }
        }

        @Override
        public void close() {
            Central c;
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
                advertised.values().removeIf(p -> p == this);
                psms.forEach(l2capServers::remove);
                c = central;
                central = null;
            }
            if (c != null) {
                c.peripheralGone();
            }
        }

        private void centralGone() {
            GattLinkListener l = listener;
            if (l != null) {
                l.onDisconnected();
            }
        }
    }

    // -------------------------------------------------------------------------
    // Central (GATT client)
    // -------------------------------------------------------------------------

    private final class Central implements GattCentralLink {
        private volatile GattLinkListener listener;
        private volatile Peripheral peripheral;
        private final Set<UUID> subscribed = ConcurrentHashMap.newKeySet();
        private boolean disconnected;

        @Override
        public void setListener(GattLinkListener listener) {
            this.listener = listener;
        }

        @Override
        public void connect(UUID serviceUuid, Duration timeout) {
            if (listener == null) {
                throw new IllegalStateException("setListener() must be called before connect()");
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            synchronized (lock) {
                while (true) {
                    if (disconnected) {
                        throw radioError("Disconnected while scanning");
                    }
                    Peripheral p = advertised.get(serviceUuid);
                    if (p != null && p.central == null) {
                        p.central = this;
                        peripheral = p;
                        return;
                    }
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new ConnectionTimeoutException("No peripheral advertising " + serviceUuid);
                    }
                    try {
                        lock.wait(Math.max(1, remaining / 1_000_000L));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw radioError("Interrupted while scanning");
                    }
                }
            }
        }

        @Override
        public int requestMtu(int mtu) {
            Peripheral p = requirePeripheral();
            int negotiated = Math.min(mtu, maxMtu);
            p.mtu = negotiated;
            return negotiated;
        }

        @Override
        public boolean hasCharacteristic(UUID characteristic) {
            return requirePeripheral().characteristics.contains(characteristic);
        }

        @Override
        public byte[] readCharacteristic(UUID characteristic) {
            byte[] value = requirePeripheral().readOnlyValues.get(characteristic);
            return value == null ? null : value.clone();
        }

        @Override
        public void writeCharacteristic(UUID characteristic, byte[] value) {
            Peripheral p = requirePeripheral();
            if (!p.characteristics.contains(characteristic)) {
                throw radioError("Unknown characteristic " + characteristic);
            }
            p.listener.onCharacteristicValue(characteristic, value.clone());
        }

        @Override
        public void enableNotifications(UUID characteristic) {
            requirePeripheral();
            subscribed.add(characteristic);
        }

        @Override
        public L2capChannel connectL2cap(int psm) {
            Peripheral server;
            synchronized (lock) {
                server = l2capServers.get(psm);
                if (server == null) {
                    throw radioError("Nothing listening on PSM " + psm);
                }
                openChannels++;
            }
            AtomicInteger openEnds = new AtomicInteger(2);
            LoopbackChannel centralSide = new LoopbackChannel(openEnds);
            LoopbackChannel peripheralSide = new LoopbackChannel(openEnds);
            centralSide.peer = peripheralSide;
            peripheralSide.peer = centralSide;
            server.onL2capAccepted.accept(peripheralSide);
            return centralSide;
        }

        @Override
        public void disconnect() {
            Peripheral p;
            synchronized (lock) {
                if (disconnected) {
                    return;
                }
                disconnected = true;
                lock.notifyAll();
                p = peripheral;
                peripheral = null;
                if (p != null && p.central == this) {
                    p.central = null;
                } else {
                    p = null;
                }
            }
            if (p != null) {
                p.centralGone();
            }
        }

        private void peripheralGone() {
            synchronized (lock) {
                peripheral = null;
            }
            GattLinkListener l = listener;
            if (l != null) {
                l.onDisconnected();
            }
        }

        private Peripheral requirePeripheral() {
            Peripheral p = peripheral;
            if (p == null) {
                throw radioError("Not connected");
            }
            return p;
        }
    }

    // -------------------------------------------------------------------------
    // L2CAP
    // -------------------------------------------------------------------------

    private final class LoopbackChannel implements L2capChannel {
        private final AtomicInteger openEnds;
        private LoopbackChannel peer;
        private final Object deliveryLock = new Object();
        private final List<byte[]> pending = new ArrayList<>();
        private final AtomicBoolean closed = new AtomicBoolean();
        private L2capChannelListener listener;
        private boolean peerClosed;

        private LoopbackChannel(AtomicInteger openEnds) {
            this.openEnds = openEnds;
        }

        @Override
        public void setListener(L2capChannelListener listener) {
            synchronized (deliveryLock) {
                this.listener = listener;
                for (byte[] bytes : pending) {
                    listener.onData(bytes);
                }
                pending.clear();
                if (peerClosed) {
                    listener.onClosed();
                }
            }
        }

        @Override
        public void write(byte[] bytes) {
            if (closed.get()) {
                throw radioError("L2CAP channel closed");
            }
            int half = bytes.length / 2;
            peer.receive(Arrays.copyOfRange(bytes, 0, half));
            peer.receive(Arrays.copyOfRange(bytes, half, bytes.length));
        }

        private void receive(byte[] bytes) {
            synchronized (deliveryLock) {
                if (closed.get()) {
                    return;
                }
                if (listener == null) {
                    pending.add(bytes);
                } else {
                    listener.onData(bytes);
                }
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (openEnds.decrementAndGet() == 0) {
                synchronized (lock) {
                    openChannels--;
                }
            } else {
                peer.onPeerClosed();
            }
        }

        private void onPeerClosed() {
            synchronized (deliveryLock) {
                peerClosed = true;
                if (listener != null) {
                    listener.onClosed();
                }
            }
        }
    }
}
