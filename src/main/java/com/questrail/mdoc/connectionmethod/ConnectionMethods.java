package com.questrail.mdoc.connectionmethod;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.model.Role;
import com.upokecenter.cbor.CBORObject;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * ConnectionMethods
 * =============================================================================
 * Disambiguation and wire encoding of connection-method lists.
 *
 * <h2>Disambiguation</h2>
 * The same BLE service is often advertised once per mode (peripheral server and
 * central client) or repeated across QR and NFC engagement. {@link #disambiguate}
 * folds every group of BLE entries that share a UUID and agree on all fields they
 * both set into a single entry, then drops exact duplicates. Merging runs to a
 * fixpoint, so the function is idempotent.
 *
 * <h2>Wire form</h2>
 * Each method is a DeviceRetrievalMethod {@code [type, version, options]}.
 * Unknown types are skipped on decode; a known type with a malformed options map
 * raises {@link CborStructureException}.
 */
public final class ConnectionMethods
{
    public static final int METHOD_VERSION = 1;

    static final int BLE_OPTION_PERIPHERAL_SERVER_MODE = 0;
    static final int BLE_OPTION_CENTRAL_CLIENT_MODE = 1;
    static final int BLE_OPTION_PERIPHERAL_SERVER_MODE_UUID = 10;
    static final int BLE_OPTION_CENTRAL_CLIENT_MODE_UUID = 11;
    static final int BLE_OPTION_PERIPHERAL_SERVER_MODE_MAC = 20;
    static final int BLE_OPTION_PERIPHERAL_SERVER_MODE_PSM = 21;

    static final int NFC_OPTION_MAX_COMMAND = 0;
    static final int NFC_OPTION_MAX_RESPONSE = 1;

    // Identity sentinel returned by pick() when both sides name different UUIDs.
    private static final UUID CONFLICT = new UUID(0, 0);

    private ConnectionMethods() {}

    // -------------------------------------------------------------------------
    // Disambiguation
    // -------------------------------------------------------------------------

    /**
     * Merges complementary BLE entries and removes duplicates.
     *
     * @param role the side performing the check; reported in failures
     * @throws MalformedEngagementException if an entry advertises a mode it cannot serve
     */
    public static List<ConnectionMethod> disambiguate(List<ConnectionMethod> methods, Role role) {
        Objects.requireNonNull(methods, "methods");
        Objects.requireNonNull(role, "role");

        for (ConnectionMethod method : methods) {
            if (method instanceof BleConnectionMethod ble) {
                validate(ble, role);
            }
        }

        List<ConnectionMethod> current = new ArrayList<>(new LinkedHashSet<>(methods));
        boolean changed = true;
        while (changed) {
            changed = false;
            List<ConnectionMethod> next = new ArrayList<>();
            for (ConnectionMethod method : current) {
                if (!(method instanceof BleConnectionMethod ble)) {
                    next.add(method);
                    continue;
                }
                int target = -1;
                BleConnectionMethod merged = null;
                for (int i = 0; i < next.size() && merged == null; i++) {
                    if (next.get(i) instanceof BleConnectionMethod existing) {
                        merged = tryMerge(existing, ble);
                        target = i;
                    }
                }
                if (merged == null) {
                    next.add(ble);
                } else {
                    next.set(target, merged);
                    changed = true;
                }
            }
            current = new ArrayList<>(new LinkedHashSet<>(next));
        }
        return List.copyOf(current);
    }

    private static void validate(BleConnectionMethod ble, Role role) {
        if (!ble.supportsCentralClientMode() && !ble.supportsPeripheralServerMode()) {
            throw new MalformedEngagementException(role + ": BLE method " + ble + " supports neither mode");
        }
        if (ble.supportsCentralClientMode() != ble.centralClientModeUuid().isPresent()) {
            throw new MalformedEngagementException(role + ": BLE central client mode flag and UUID disagree in " + ble);
        }
        if (ble.supportsPeripheralServerMode() != ble.peripheralServerModeUuid().isPresent()) {
            throw new MalformedEngagementException(role + ": BLE peripheral server mode flag and UUID disagree in " + ble);
        }
        if (!ble.supportsPeripheralServerMode()
                && (ble.peripheralServerModePsm().isPresent() || ble.peripheralServerModeMacAddress().isPresent())) {
            throw new MalformedEngagementException(role + ": peripheral server parameters without peripheral server mode in " + ble);
        }
    }

    /**
     * Returns the union of {@code a} and {@code b} if they share a UUID and do not
     * contradict each other, otherwise {@code null}.
     */
    private static BleConnectionMethod tryMerge(BleConnectionMethod a, BleConnectionMethod b) {
        if (a.equals(b)) {
            return a;
        }
        List<UUID> aUuids = uuids(a);
        boolean sharesUuid = uuids(b).stream().anyMatch(aUuids::contains);
        if (!sharesUuid) {
            return null;
        }
        UUID peripheralUuid = pick(a.peripheralServerModeUuid(), b.peripheralServerModeUuid());
        UUID centralUuid = pick(a.centralClientModeUuid(), b.centralClientModeUuid());
        if (peripheralUuid == CONFLICT || centralUuid == CONFLICT) {
            return null;
        }
        Integer psm = a.peripheralServerModePsm().isPresent() ? Integer.valueOf(a.peripheralServerModePsm().getAsInt()) : null;
        if (b.peripheralServerModePsm().isPresent()) {
            if (psm != null && psm != b.peripheralServerModePsm().getAsInt()) {
                return null;
            }
            psm = b.peripheralServerModePsm().getAsInt();
        }
        byte[] mac = a.peripheralServerModeMacAddress().orElse(null);
        if (b.peripheralServerModeMacAddress().isPresent()) {
            if (mac != null && !Arrays.equals(mac, b.peripheralServerModeMacAddress().get())) {
                return null;
            }
            mac = b.peripheralServerModeMacAddress().get();
        }
        return new BleConnectionMethod(
                a.supportsPeripheralServerMode() || b.supportsPeripheralServerMode(),
                a.supportsCentralClientMode() || b.supportsCentralClientMode(),
                peripheralUuid,
                centralUuid,
                psm,
                mac);
    }

    private static UUID pick(Optional<UUID> a, Optional<UUID> b) {
        if (a.isPresent() && b.isPresent()) {
            return a.get().equals(b.get()) ? a.get() : CONFLICT;
        }
        return a.orElse(b.orElse(null));
    }

    private static List<UUID> uuids(BleConnectionMethod ble) {
        List<UUID> uuids = new ArrayList<>(2);
        ble.peripheralServerModeUuid().ifPresent(uuids::add);
        ble.centralClientModeUuid().ifPresent(uuids::add);
        return uuids;
    }

    // -------------------------------------------------------------------------
    // Wire encoding
    // -------------------------------------------------------------------------

    public static CBORObject toCbor(List<ConnectionMethod> methods) {
        CBORObject array = CBORObject.NewArray();
        for (ConnectionMethod method : methods) {
            array.Add(toCbor(method));
        }
        return array;
    }

    public static CBORObject toCbor(ConnectionMethod method) {
        CBORObject options = MdocCbor.newMap();
        if (method instanceof BleConnectionMethod ble) {
            options.Add(BLE_OPTION_PERIPHERAL_SERVER_MODE, ble.supportsPeripheralServerMode());
            options.Add(BLE_OPTION_CENTRAL_CLIENT_MODE, ble.supportsCentralClientMode());
            ble.peripheralServerModeUuid().ifPresent(u -> options.Add(BLE_OPTION_PERIPHERAL_SERVER_MODE_UUID, uuidToBytes(u)));
            ble.centralClientModeUuid().ifPresent(u -> options.Add(BLE_OPTION_CENTRAL_CLIENT_MODE_UUID, uuidToBytes(u)));
            ble.peripheralServerModeMacAddress().ifPresent(m -> options.Add(BLE_OPTION_PERIPHERAL_SERVER_MODE_MAC, m));
            ble.peripheralServerModePsm().ifPresent(p -> options.Add(BLE_OPTION_PERIPHERAL_SERVER_MODE_PSM, p));
        } else if (method instanceof NfcConnectionMethod nfc) {
            options.Add(NFC_OPTION_MAX_COMMAND, nfc.commandDataFieldMaxLength());
            options.Add(NFC_OPTION_MAX_RESPONSE, nfc.responseDataFieldMaxLength());
        }
        CBORObject array = CBORObject.NewArray();
        array.Add(method.type());
        array.Add(METHOD_VERSION);
        array.Add(options);
        return array;
    }

    /**
     * Decodes a DeviceRetrievalMethods array, skipping method types this stack does
     * not implement.
     */
    public static List<ConnectionMethod> fromCbor(CBORObject array) {
        MdocCbor.requireArray(array, "DeviceRetrievalMethods");
        List<ConnectionMethod> methods = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            fromCborEntry(array.get(i)).ifPresent(methods::add);
        }
        return methods;
    }

    public static Optional<ConnectionMethod> fromCborEntry(CBORObject entry) {
        MdocCbor.requireArray(entry, "DeviceRetrievalMethod");
        if (entry.size() != 3) {
            throw new CborStructureException("DeviceRetrievalMethod must have 3 elements");
        }
        int type = MdocCbor.requireInt(entry.get(0), "type");
        int version = MdocCbor.requireInt(entry.get(1), "version");
        CBORObject options = MdocCbor.requireMap(entry.get(2), "options");
        if (version != METHOD_VERSION) {
            throw new CborStructureException("Unsupported DeviceRetrievalMethod version " + version);
        }
        switch (type) {
            case BleConnectionMethod.TYPE:
                return Optional.of(bleFromOptions(options));
            case NfcConnectionMethod.TYPE:
                return Optional.of(new NfcConnectionMethod(
                        MdocCbor.requireInt(MdocCbor.field(options, NFC_OPTION_MAX_COMMAND), "maxCommand"),
                        MdocCbor.requireInt(MdocCbor.field(options, NFC_OPTION_MAX_RESPONSE), "maxResponse")));
            default:
                return Optional.empty();
        }
    }

    private static BleConnectionMethod bleFromOptions(CBORObject options) {
        boolean peripheral = MdocCbor.requireBoolean(MdocCbor.field(options, BLE_OPTION_PERIPHERAL_SERVER_MODE), "peripheralServerMode");
        boolean central = MdocCbor.requireBoolean(MdocCbor.field(options, BLE_OPTION_CENTRAL_CLIENT_MODE), "centralClientMode");
        CBORObject peripheralUuid = MdocCbor.optionalField(options, BLE_OPTION_PERIPHERAL_SERVER_MODE_UUID);
        CBORObject centralUuid = MdocCbor.optionalField(options, BLE_OPTION_CENTRAL_CLIENT_MODE_UUID);
        CBORObject mac = MdocCbor.optionalField(options, BLE_OPTION_PERIPHERAL_SERVER_MODE_MAC);
        CBORObject psm = MdocCbor.optionalField(options, BLE_OPTION_PERIPHERAL_SERVER_MODE_PSM);
        return new BleConnectionMethod(
                peripheral,
                central,
                peripheralUuid == null ? null : uuidFromBytes(MdocCbor.requireBytes(peripheralUuid, "peripheralServerModeUuid")),
                centralUuid == null ? null : uuidFromBytes(MdocCbor.requireBytes(centralUuid, "centralClientModeUuid")),
                psm == null ? null : MdocCbor.requireInt(psm, "psm"),
                mac == null ? null : macFromBytes(MdocCbor.requireBytes(mac, "mac")));
    }

    static byte[] uuidToBytes(UUID uuid) {
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    static UUID uuidFromBytes(byte[] bytes) {
        if (bytes.length != 16) {
            throw new CborStructureException("UUID must be 16 bytes, got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    private static byte[] macFromBytes(byte[] bytes) {
        if (bytes.length != 6) {
            throw new CborStructureException("MAC address must be 6 bytes, got " + bytes.length);
        }
        return bytes;
    }
}
