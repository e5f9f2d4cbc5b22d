package com.questrail.mdoc.connectionmethod;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * BLE connection method.
 *
 * <p>In <em>peripheral server mode</em> the mdoc is the GATT server and the reader
 * connects to it; in <em>central client mode</em> the reader is the GATT server and
 * the mdoc connects. A single method may advertise both modes.</p>
 *
 * <p>Field validity (a flagged mode must name its UUID, and so on) is checked by
 * {@link ConnectionMethods#disambiguate}, not here, so that peer data can be
 * represented before it is judged.</p>
 */
public final class BleConnectionMethod implements ConnectionMethod
{
    public static final int TYPE = 2;

    private final boolean supportsPeripheralServerMode;
    private final boolean supportsCentralClientMode;
    private final UUID peripheralServerModeUuid;
    private final UUID centralClientModeUuid;
    private final Integer peripheralServerModePsm;
    private final byte[] peripheralServerModeMacAddress;

    public BleConnectionMethod(
            boolean supportsPeripheralServerMode,
            boolean supportsCentralClientMode,
            UUID peripheralServerModeUuid,
            UUID centralClientModeUuid,
            Integer peripheralServerModePsm,
            byte[] peripheralServerModeMacAddress)
    {
        this.supportsPeripheralServerMode = supportsPeripheralServerMode;
        this.supportsCentralClientMode = supportsCentralClientMode;
        this.peripheralServerModeUuid = peripheralServerModeUuid;
        this.centralClientModeUuid = centralClientModeUuid;
        this.peripheralServerModePsm = peripheralServerModePsm;
        this.peripheralServerModeMacAddress = peripheralServerModeMacAddress == null
                ? null
                : peripheralServerModeMacAddress.clone();
    }

    /** Mdoc connects as GATT central to a reader advertising {@code uuid}. */
    public static BleConnectionMethod centralClient(UUID uuid) {
        return new BleConnectionMethod(false, true, null, Objects.requireNonNull(uuid, "uuid"), null, null);
    }

    /** Mdoc advertises {@code uuid} as GATT server and the reader connects. */
    public static BleConnectionMethod peripheralServer(UUID uuid) {
        return new BleConnectionMethod(true, false, Objects.requireNonNull(uuid, "uuid"), null, null, null);
    }

    public BleConnectionMethod withPeripheralServerModePsm(int psm) {
        return new BleConnectionMethod(supportsPeripheralServerMode, supportsCentralClientMode,
                peripheralServerModeUuid, centralClientModeUuid, psm, peripheralServerModeMacAddress);
    }

    @Override
    public int type() {
        return TYPE;
    }

    public boolean supportsPeripheralServerMode() {
        return supportsPeripheralServerMode;
    }

    public boolean supportsCentralClientMode() {
        return supportsCentralClientMode;
    }

    public Optional<UUID> peripheralServerModeUuid() {
        return Optional.ofNullable(peripheralServerModeUuid);
    }

    public Optional<UUID> centralClientModeUuid() {
        return Optional.ofNullable(centralClientModeUuid);
    }

    public OptionalInt peripheralServerModePsm() {
        return peripheralServerModePsm == null ? OptionalInt.empty() : OptionalInt.of(peripheralServerModePsm);
    }

    public Optional<byte[]> peripheralServerModeMacAddress() {
        return Optional.ofNullable(peripheralServerModeMacAddress).map(byte[]::clone);
    }

    /** True when both modes are advertised. */
    public boolean isDualRole() {
        return supportsPeripheralServerMode && supportsCentralClientMode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BleConnectionMethod other)) {
            return false;
        }
        return supportsPeripheralServerMode == other.supportsPeripheralServerMode
                && supportsCentralClientMode == other.supportsCentralClientMode
                && Objects.equals(peripheralServerModeUuid, other.peripheralServerModeUuid)
                && Objects.equals(centralClientModeUuid, other.centralClientModeUuid)
                && Objects.equals(peripheralServerModePsm, other.peripheralServerModePsm)
                && Arrays.equals(peripheralServerModeMacAddress, other.peripheralServerModeMacAddress);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(supportsPeripheralServerMode, supportsCentralClientMode,
                peripheralServerModeUuid, centralClientModeUuid, peripheralServerModePsm);
        return 31 * result + Arrays.hashCode(peripheralServerModeMacAddress);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ble:");
        if (supportsCentralClientMode) {
            sb.append("central_client_mode:").append(centralClientModeUuid).append(':');
        }
        if (supportsPeripheralServerMode) {
            sb.append("peripheral_server_mode:").append(peripheralServerModeUuid).append(':');
        }
        if (peripheralServerModePsm != null) {
            sb.append("psm=").append(peripheralServerModePsm).append(':');
        }
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }
}
