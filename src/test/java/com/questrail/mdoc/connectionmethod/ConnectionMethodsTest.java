package com.questrail.mdoc.connectionmethod;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.model.Role;
import com.upokecenter.cbor.CBORObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionMethodsTest
{
    private static final UUID UUID_A = UUID.fromString("0000a001-0000-1000-8000-00805f9b34fb");
    private static final UUID UUID_B = UUID.fromString("0000b002-0000-1000-8000-00805f9b34fb");

    // ---------------------------------------------------------------------
    // Disambiguation
    // ---------------------------------------------------------------------

    @Test
    void complementaryBleEntriesWithSameUuidAreMerged() {
        // GIVEN the same service advertised once per mode
        List<ConnectionMethod> input = List.of(
                BleConnectionMethod.peripheralServer(UUID_A),
                BleConnectionMethod.centralClient(UUID_A));

        // WHEN
        List<ConnectionMethod> result = ConnectionMethods.disambiguate(input, Role.READER);

        // THEN one dual-role entry remains
        assertEquals(1, result.size());
        BleConnectionMethod merged = (BleConnectionMethod) result.get(0);
        assertTrue(merged.isDualRole());
        assertEquals(UUID_A, merged.peripheralServerModeUuid().orElseThrow());
        assertEquals(UUID_A, merged.centralClientModeUuid().orElseThrow());
    }

    @Test
    void psmIsCarriedIntoMergedEntry() {
        List<ConnectionMethod> result = ConnectionMethods.disambiguate(List.of(
                BleConnectionMethod.peripheralServer(UUID_A).withPeripheralServerModePsm(0x85),
                BleConnectionMethod.centralClient(UUID_A)), Role.READER);

        assertEquals(1, result.size());
        assertEquals(0x85, ((BleConnectionMethod) result.get(0)).peripheralServerModePsm().getAsInt());
    }

    @Test
    void differentUuidsStaySeparate() {
        List<ConnectionMethod> input = List.of(
                BleConnectionMethod.peripheralServer(UUID_A),
                BleConnectionMethod.centralClient(UUID_B));
        assertEquals(input, ConnectionMethods.disambiguate(input, Role.HOLDER));
    }

    @Test
    void conflictingPsmsAreNotMerged() {
        List<ConnectionMethod> input = List.of(
                BleConnectionMethod.peripheralServer(UUID_A).withPeripheralServerModePsm(0x81),
                new BleConnectionMethod(true, true, UUID_A, UUID_A, 0x82, null));
        assertEquals(2, ConnectionMethods.disambiguate(input, Role.READER).size());
    }

    @Test
    void exactDuplicatesAreRemovedAndOrderKept() {
        NfcConnectionMethod nfc = new NfcConnectionMethod(255, 256);
        List<ConnectionMethod> result = ConnectionMethods.disambiguate(List.of(
                nfc,
                BleConnectionMethod.peripheralServer(UUID_A),
                new NfcConnectionMethod(255, 256),
                BleConnectionMethod.peripheralServer(UUID_A)), Role.READER);

        assertEquals(List.of(nfc, BleConnectionMethod.peripheralServer(UUID_A)), result);
    }

    @Test
    void disambiguationIsIdempotent() {
        List<ConnectionMethod> input = List.of(
                BleConnectionMethod.centralClient(UUID_B),
                BleConnectionMethod.peripheralServer(UUID_A),
                new NfcConnectionMethod(255, 256),
                BleConnectionMethod.centralClient(UUID_A),
                BleConnectionMethod.peripheralServer(UUID_B).withPeripheralServerModePsm(0x90),
                BleConnectionMethod.centralClient(UUID_A));

        List<ConnectionMethod> once = ConnectionMethods.disambiguate(input, Role.READER);
        List<ConnectionMethod> twice = ConnectionMethods.disambiguate(once, Role.READER);

        assertEquals(once, twice);
        assertEquals(3, once.size());
    }

    @Test
    void modeFlagWithoutUuidIsMalformed() {
        BleConnectionMethod bad = new BleConnectionMethod(true, false, null, null, null, null);
        MalformedEngagementException e = assertThrows(MalformedEngagementException.class,
                () -> ConnectionMethods.disambiguate(List.of(bad), Role.READER));
        assertTrue(e.getMessage().startsWith("READER"));
    }

    @Test
    void methodWithNoModeIsMalformed() {
        BleConnectionMethod bad = new BleConnectionMethod(false, false, null, null, null, null);
        assertThrows(MalformedEngagementException.class,
                () -> ConnectionMethods.disambiguate(List.of(bad), Role.HOLDER));
    }

    @Test
    void peripheralParametersWithoutPeripheralModeAreMalformed() {
        BleConnectionMethod bad = new BleConnectionMethod(false, true, null, UUID_A, 0x81, null);
        assertThrows(MalformedEngagementException.class,
                () -> ConnectionMethods.disambiguate(List.of(bad), Role.READER));
    }

    // ---------------------------------------------------------------------
    // Wire form
    // ---------------------------------------------------------------------

    @Test
    void wireFormKeepsEveryBleField() {
        BleConnectionMethod ble = new BleConnectionMethod(true, true, UUID_A, UUID_B, 0x83,
                new byte[] { 1, 2, 3, 4, 5, 6 });
        NfcConnectionMethod nfc = new NfcConnectionMethod(239, 65536);

        CBORObject encoded = CBORObject.DecodeFromBytes(ConnectionMethods.toCbor(List.of(ble, nfc)).EncodeToBytes());

        assertEquals(List.of(ble, nfc), ConnectionMethods.fromCbor(encoded));
    }

    @Test
    void unknownMethodTypeIsSkipped() {
        CBORObject wifi = CBORObject.NewArray().Add(3).Add(1).Add(CBORObject.NewMap());
        CBORObject array = CBORObject.NewArray()
                .Add(wifi)
                .Add(ConnectionMethods.toCbor(BleConnectionMethod.peripheralServer(UUID_A)));

        assertEquals(List.of(BleConnectionMethod.peripheralServer(UUID_A)), ConnectionMethods.fromCbor(array));
    }

    @Test
    void malformedKnownMethodIsRejected() {
        CBORObject options = CBORObject.NewMap()
                .Add(0, true)
                .Add(1, false)
                .Add(10, new byte[] { 1, 2, 3 });
        CBORObject entry = CBORObject.NewArray().Add(2).Add(1).Add(options);

        assertThrows(CborStructureException.class, () -> ConnectionMethods.fromCborEntry(entry));
    }

    @Test
    void wrongMethodVersionIsRejected() {
        CBORObject entry = CBORObject.NewArray().Add(1).Add(2).Add(CBORObject.NewMap().Add(0, 255).Add(1, 256));
        assertThrows(CborStructureException.class, () -> ConnectionMethods.fromCborEntry(entry));
    }
}
