package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.config.MdocTransportOptions;
import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.internal.time.MonotonicClock;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.observability.MdocObservabilitySink;
import com.questrail.mdoc.transport.CancellationToken;
import com.questrail.mdoc.transport.MdocTransport;
import com.questrail.mdoc.transport.TransportFailedException;

import java.nio.ByteBuffer;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * BleCentralTransport
 * =============================================================================
 * The GATT central side of BLE data retrieval: the holder in central-client
 * mode, the reader in peripheral-server mode.
 *
 * <h2>Connection sequence</h2>
 * <ol>
 *   <li>scan for the service UUID and connect (scanning time is recorded)</li>
 *   <li>request the MTU</li>
 *   <li>central-client mode only: read the ident characteristic and compare it
 *       with the value derived from EDeviceKey; a mismatch fails the transport</li>
 *   <li>if L2CAP is preferred and a PSM is known (from the connection method or
 *       the L2CAP characteristic), open the channel and stop here</li>
 *   <li>subscribe to state and server-to-client, write {@code 0x01} to state</li>
 * </ol>
 */
public final class BleCentralTransport extends MdocTransport
{
    private final GattCentralLink link;
    private final BleMode mode;
    private final BleCharacteristics characteristics;
    private final UUID serviceUuid;
    private final BleMessageChunker.Assembler assembler = new BleMessageChunker.Assembler();
    private final L2capMessageFramer framer = new L2capMessageFramer();

    private volatile int mtu = MdocTransportOptions.BLE_MIN_MTU;
    private volatile L2capChannel channel;
    private volatile Duration scanningTime;
    private volatile boolean peerGone;

    public BleCentralTransport(Role role,
                               BleConnectionMethod connectionMethod,
                               GattCentralLink link,
                               MdocTransportOptions options,
                               MdocObservabilitySink sink,
                               MonotonicClock clock)
    {
        super(role, connectionMethod, options, sink, clock);
        this.link = Objects.requireNonNull(link, "link");
        this.mode = BleMode.forCentral(role);
        this.characteristics = BleCharacteristics.forMode(mode);
        Optional<UUID> uuid = mode == BleMode.CENTRAL_CLIENT
                ? connectionMethod.centralClientModeUuid()
                : connectionMethod.peripheralServerModeUuid();
        this.serviceUuid = uuid.orElseThrow(() -> new IllegalArgumentException(
                "Connection method does not support " + mode + " mode: " + connectionMethod));
    }

    @Override
    protected String name() {
        return "BLE central (" + mode + ")";
    }

    @Override
    public Optional<Duration> scanningTime() {
        return Optional.ofNullable(scanningTime);
    }

    public boolean usesL2cap() {
        return channel != null;
    }

    @Override
    protected void doOpen(ECPublicKey eDeviceKey, CancellationToken token) {
        link.setListener(new GattListener());
        long scanStart = clock.nowNanos();
        link.connect(serviceUuid, options.connectTimeout());
        scanningTime = Duration.ofNanos(Math.max(0L, clock.nowNanos() - scanStart));
        mtu = link.requestMtu(options.bleMaxMtu());

        if (mode == BleMode.CENTRAL_CLIENT) {
            byte[] ident = link.readCharacteristic(characteristics.ident());
            if (!BleIdent.matches(ident, eDeviceKey)) {
                throw new TransportFailedException("Ident characteristic does not match EDeviceKey");
            }
        }

        Integer psm = options.bleUseL2cap() ? findPsm() : null;
        if (psm != null) {
            L2capChannel c = link.connectL2cap(psm);
            c.setListener(new ChannelListener());
            channel = c;
            return;
        }

        link.enableNotifications(characteristics.state());
        link.enableNotifications(characteristics.serverToClient());
        link.writeCharacteristic(characteristics.state(), new byte[] {BleCharacteristics.STATE_START});
    }

    private Integer findPsm() {
        BleConnectionMethod method = (BleConnectionMethod) connectionMethod();
        if (mode == BleMode.PERIPHERAL_SERVER && method.peripheralServerModePsm().isPresent()) {
            return method.peripheralServerModePsm().getAsInt();
        }
        if (!link.hasCharacteristic(characteristics.l2cap())) {
            return null;
        }
        byte[] value = link.readCharacteristic(characteristics.l2cap());
        if (value == null || value.length != 4) {
            return null;
        }
        return ByteBuffer.wrap(value).getInt();
    }

    @Override
    protected void doSend(byte[] message) {
        L2capChannel c = channel;
        if (c != null) {
            c.write(L2capMessageFramer.frame(message));
            return;
        }
        for (byte[] chunk : BleMessageChunker.chunk(message, mtu)) {
            link.writeCharacteristic(characteristics.clientToServer(), chunk);
        }
    }

    @Override
    protected void doSendTransportSpecificTermination() {
        L2capChannel c = channel;
        if (c != null) {
            c.close();
            return;
        }
        link.writeCharacteristic(characteristics.state(), new byte[] {BleCharacteristics.STATE_END});
    }

    @Override
    protected void doClose() {
        peerGone = true;
        L2capChannel c = channel;
        if (c != null) {
            c.close();
        }
        link.disconnect();
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
                    if (value.length == 1 && value[0] == BleCharacteristics.STATE_END) {
                        peerTerminated();
                    }
                } else if (characteristic.equals(characteristics.serverToClient())) {
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
            peerTerminated();
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
