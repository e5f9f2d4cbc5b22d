package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.connectionmethod.ConnectionMethod;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.MdocTransport;

import java.nio.ByteBuffer;
import java.security.interfaces.ECPublicKey;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

/**
 * BlePeripheralTransport
 * =============================================================================
 * The GATT server side of BLE data retrieval: the reader in central-client mode,
 * the holder in peripheral-server mode.
 *
 * <h2>Advertising</h2>
 * In peripheral-server mode the holder calls {@link #advertise()} before building
 * its engagement; with L2CAP enabled the PSM is then part of
 * {@link #connectionMethod()}. In central-client mode the GATT service carries
 * the ident characteristic, which is derived from EDeviceKey, so advertising
 * starts in {@link #open}.
 *
 * <h2>Connected</h2>
 * The link counts as connected when the central writes {@code 0x01} to the state
 * characteristic, or when it opens the L2CAP channel.
 */
public final class BlePeripheralTransport extends MdocTransport
{
    private final GattPeripheralLink link;
    private final BleMode mode;
    private final BleCharacteristics characteristics;
    private final UUID serviceUuid;
    private final BleMessageChunker.Assembler assembler = new BleMessageChunker.Assembler();
    private final L2capMessageFramer framer = new L2capMessageFramer();
    private final CountDownLatch connected = new CountDownLatch(1);

    private final Object advertiseLock = new Object();
    private boolean advertised;
    private volatile BleConnectionMethod advertisedMethod;
    private volatile L2capChannel channel;
    private volatile boolean peerGone;

    public BlePeripheralTransport(Role role,
                                  BleConnectionMethod connectionMethod,
                                  GattPeripheralLink link,
                                  MdocTransportOptions options,
                                  MdocObservabilitySink sink,
                                  MonotonicClock clock)
    {
        super(role, connectionMethod, options, sink, clock);
        this.link = Objects.requireNonNull(link, "link");
        this.mode = BleMode.forPeripheral(role);
        this.characteristics = BleCharacteristics.forMode(mode);
        Optional<UUID> uuid = mode == BleMode.CENTRAL_CLIENT
                ? connectionMethod.centralClientModeUuid()
                : connectionMethod.peripheralServerModeUuid();
        this.serviceUuid = uuid.orElseThrow(() -> new IllegalArgumentException(
                "Connection method does not support " + mode + " mode: " + connectionMethod));
        this.advertisedMethod = connectionMethod;
    }

    @Override
    protected String name() {
        return "BLE peripheral (" + mode + ")";
    }

    @Override
    public ConnectionMethod connectionMethod() {
        return advertisedMethod;
    }

    public boolean usesL2cap() {
        return channel != null;
    }

    /**
     * @throws IllegalStateException in central-client mode, which advertises on open
     */
    @Override
    public void advertise() {
        if (mode == BleMode.CENTRAL_CLIENT) {
            throw new IllegalStateException("Central-client mode advertises on open()");
        }
        publish(null);
    }

    private void publish(ECPublicKey eDeviceKey) {
        synchronized (advertiseLock) {
            if (advertised) {
                return;
            }
            advertised = true;
            link.setListener(new GattListener());
            Map<UUID, byte[]> readOnly = new LinkedHashMap<>();
            if (mode == BleMode.CENTRAL_CLIENT) {
                readOnly.put(characteristics.ident(), BleIdent.compute(eDeviceKey));
            }
            if (options.bleUseL2cap()) {
                int psm = link.listenL2cap(this::onL2capAccepted);
                readOnly.put(characteristics.l2cap(), ByteBuffer.allocate(4).putInt(psm).array());
                if (mode == BleMode.PERIPHERAL_SERVER) {
                    advertisedMethod = advertisedMethod.withPeripheralServerModePsm(psm);
                }
            }
            link.publish(serviceUuid, characteristics.all(), readOnly);
        }
    }

    @Override
    protected void doOpen(ECPublicKey eDeviceKey, CancellationToken token) {
        publish(eDeviceKey);
        awaitLink(connected, token, "a central to connect");
    }

    private void onL2capAccepted(L2capChannel accepted) {
        if (channel != null) {
            accepted.close();
            return;
        }
        channel = accepted;
        accepted.setListener(new ChannelListener());
        connected.countDown();
    }

    @Override
    protected void doSend(byte[] message) {
        L2capChannel c = channel;
        if (c != null) {
            c.write(L2capMessageFramer.frame(message));
            return;
        }
        for (byte[] chunk : BleMessageChunker.chunk(message, link.mtu())) {
            link.notifyCharacteristic(characteristics.serverToClient(), chunk);
        }
    }

    @Override
    protected void doSendTransportSpecificTermination() {
        L2capChannel c = channel;
        if (c != null) {
            c.close();
            return;
        }
        link.notifyCharacteristic(characteristics.state(), new byte[] {BleCharacteristics.STATE_END});
    }

    @Override
    protected void doClose() {
        peerGone = true;
        L2capChannel c = channel;
        if (c != null) {
            c.close();
        }
        link.close();
    }

    private void peerTerminated() {
        if (!peerGone) {
            peerGone = true;
            onPeerTerminated();
        }
    }

    private final class GattListener implements GattLinkListener
    {
        @Override
        public void onCharacteristicValue(UUID characteristic, byte[] value) {
            try {
                if (characteristic.equals(characteristics.state())) {
                    if (value.length == 1 && value[0] == BleCharacteristics.STATE_START) {
                        connected.countDown();
                    } else if (value.length == 1 && value[0] == BleCharacteristics.STATE_END) {
                        peerTerminated();
                    }
                } else if (characteristic.equals(characteristics.clientToServer())) {
                    byte[] message = assembler.accept(value);
                    if (message != null) {
                        deliverMessage(message);
                    }
                }
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        @Override
        public void onDisconnected() {
            // A central may drop and retry before writing START.
            if (connected.getCount() == 0) {
                peerTerminated();
            }
        }
    }

    private final class ChannelListener implements L2capChannelListener
    {
        @Override
        public void onData(byte[] bytes) {
            try {
                for (byte[] message : framer.accept(bytes)) {
                    deliverMessage(message);
                }
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        @Override
        public void onClosed() {
            peerTerminated();
        }
    }
}
