package com.questrail.mdoc.transport.nfc;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class ApduTest
{
    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Command APDUs
    // ---------------------------------------------------------------------

    @Test
    void selectEncodesAsShortCaseThree() {
        CommandApdu select = CommandApdu.of(0x00, Nfc.INS_SELECT, Nfc.INS_SELECT_P1_APPLICATION,
                Nfc.INS_SELECT_P2_NO_RESPONSE_DATA, Nfc.dataTransferApplicationId(), 0);

        assertArrayEquals(
                bytes(0x00, 0xa4, 0x04, 0x0c, 0x07, 0xa0, 0x00, 0x00, 0x02, 0x48, 0x04, 0x00),
                select.encode());
        assertEquals(select, CommandApdu.decode(select.encode()));
    }

    @Test
    void shortLeOf256IsEncodedAsZero() {
        CommandApdu getResponse = CommandApdu.of(0x00, Nfc.INS_GET_RESPONSE, 0, 0, new byte[0], 256);

        assertArrayEquals(bytes(0x00, 0xc0, 0x00, 0x00, 0x00), getResponse.encode());
        assertEquals(256, CommandApdu.decode(getResponse.encode()).le());
    }

    @Test
    void longDataSwitchesToExtendedLength() {
        byte[] data = new byte[300];
        Arrays.fill(data, (byte) 0x5a);
        CommandApdu envelope = CommandApdu.of(Nfc.CLA_CHAIN_LAST, Nfc.INS_ENVELOPE, 0, 0, data, 65536);

        byte[] encoded = envelope.encode();
        assertEquals(4 + 3 + 300 + 2, encoded.length);
        assertArrayEquals(bytes(0x00, 0x01, 0x2c), Arrays.copyOfRange(encoded, 4, 7));
        assertArrayEquals(bytes(0x00, 0x00), Arrays.copyOfRange(encoded, encoded.length - 2, encoded.length));

        CommandApdu decoded = CommandApdu.decode(encoded);
        assertEquals(65536, decoded.le());
        assertArrayEquals(data, decoded.data());
    }

    @Test
    void extendedLeWithoutData() {
        CommandApdu apdu = CommandApdu.of(0x00, Nfc.INS_GET_RESPONSE, 0, 0, new byte[0], 1000);

        assertArrayEquals(bytes(0x00, 0xc0, 0x00, 0x00, 0x00, 0x03, 0xe8), apdu.encode());
        assertEquals(1000, CommandApdu.decode(apdu.encode()).le());
    }

    @Test
    void malformedCommandsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandApdu.decode(bytes(0x00, 0xa4, 0x04)));
        // Lc says 5 but only 2 data bytes follow
        assertThrows(IllegalArgumentException.class,
                () -> CommandApdu.decode(bytes(0x00, 0xc3, 0x00, 0x00, 0x05, 0x01, 0x02)));
        assertThrows(IllegalArgumentException.class,
                () -> CommandApdu.of(0x00, 0xc3, 0, 0, new byte[0], 70000));
    }

    // ---------------------------------------------------------------------
    // Response APDUs
    // ---------------------------------------------------------------------

    @Test
    void responseCarriesDataThenStatusWord() {
        ResponseApdu response = new ResponseApdu(bytes(0x01, 0x02), 0x6110);

        assertArrayEquals(bytes(0x01, 0x02, 0x61, 0x10), response.encode());
        assertTrue(response.hasMoreData());
        assertEquals(response, ResponseApdu.decode(response.encode()));
        assertFalse(ResponseApdu.ofStatus(Nfc.STATUS_SUCCESS).hasMoreData());
        assertThrows(IllegalArgumentException.class, () -> ResponseApdu.decode(bytes(0x90)));
    }

    // ---------------------------------------------------------------------
    // DO53
    // ---------------------------------------------------------------------

    @Test
    void do53UsesShortestLengthForm() {
        assertArrayEquals(bytes(0x53, 0x7f), Arrays.copyOf(Do53.wrap(new byte[0x7f]), 2));
        assertArrayEquals(bytes(0x53, 0x81, 0x80), Arrays.copyOf(Do53.wrap(new byte[0x80]), 3));
        assertArrayEquals(bytes(0x53, 0x82, 0x01, 0x00), Arrays.copyOf(Do53.wrap(new byte[0x100]), 4));
        assertArrayEquals(bytes(0x53, 0x83, 0x01, 0x00, 0x00), Arrays.copyOf(Do53.wrap(new byte[0x10000]), 5));

        byte[] payload = bytes(1, 2, 3);
        assertArrayEquals(payload, Do53.unwrap(Do53.wrap(payload)));
    }

    @Test
    void do53RejectsWrongTagAndLength() {
        assertThrows(IllegalArgumentException.class, () -> Do53.unwrap(bytes(0x54, 0x01, 0x00)));
        assertThrows(IllegalArgumentException.class, () -> Do53.unwrap(bytes(0x53, 0x02, 0x00)));
        assertThrows(IllegalArgumentException.class, () -> Do53.unwrap(bytes(0x53, 0x84, 0, 0, 0, 1, 0)));
    }
}
