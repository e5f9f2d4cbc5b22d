package com.questrail.mdoc.cbor;

import com.upokecenter.cbor.CBORObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class MdocCborTest
{
    @Test
    void orderedMapKeepsInsertionOrder() {
        CBORObject map = MdocCbor.newMap();
        map.Add("z", 1);
        map.Add("a", 2);

        // a2 617a 01 6161 02
        assertArrayEquals(new byte[] {(byte) 0xa2, 0x61, 0x7a, 0x01, 0x61, 0x61, 0x02}, map.EncodeToBytes());
    }

    @Test
    void tag24WrapsAndUnwrapsTheExactBytes() {
        byte[] inner = {(byte) 0xa1, 0x01, 0x02};

        byte[] encoded = MdocCbor.encodeTag24(inner);

        assertArrayEquals(new byte[] {(byte) 0xd8, 0x18, 0x43, (byte) 0xa1, 0x01, 0x02}, encoded);
        assertArrayEquals(inner, MdocCbor.untag24(CBORObject.DecodeFromBytes(encoded), "item"));
        assertEquals(2, MdocCbor.decodeTag24(CBORObject.DecodeFromBytes(encoded), "item")
                .get(CBORObject.FromObject(1)).AsInt32Value());
    }

    @Test
    void untag24RequiresTheTag() {
        CborStructureException e = assertThrows(CborStructureException.class,
                () -> MdocCbor.untag24(CBORObject.FromObject(new byte[] {1}), "deviceAuth"));
        assertTrue(e.getMessage().startsWith("deviceAuth"));
    }

    @Test
    void tdateIsTruncatedToSeconds() {
        Instant instant = Instant.parse("2024-03-01T12:30:45.678Z");

        CBORObject tdate = MdocCbor.tdate(instant);

        assertTrue(tdate.HasMostOuterTag(MdocCbor.TAG_TDATE));
        assertEquals(Instant.parse("2024-03-01T12:30:45Z"), MdocCbor.requireTdate(tdate, "signed"));
    }

    @Test
    void requiredFieldsNameWhatIsMissing() {
        CBORObject map = MdocCbor.newMap();
        map.Add("docType", "org.iso.18013.5.1.mDL");

        assertEquals("org.iso.18013.5.1.mDL", MdocCbor.requireString(MdocCbor.field(map, "docType"), "docType"));
        assertNull(MdocCbor.optionalField(map, "status"));
        CborStructureException e = assertThrows(CborStructureException.class,
                () -> MdocCbor.field(map, "version"));
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void typeMismatchesBecomeStructureErrors() {
        CBORObject text = CBORObject.FromObject("1.0");

        assertThrows(CborStructureException.class, () -> MdocCbor.requireLong(text, "status"));
        assertThrows(CborStructureException.class, () -> MdocCbor.requireMap(text, "deviceSigned"));
        assertThrows(CborStructureException.class, () -> MdocCbor.requireBytes(text, "data"));
        assertThrows(CborStructureException.class,
                () -> MdocCbor.requireInt(CBORObject.FromObject(1L << 40), "iteration"));
        assertThrows(CborStructureException.class, () -> MdocCbor.requireTdate(text, "validFrom"));
    }

    @Test
    void malformedBytesAreRejected() {
        assertThrows(CborStructureException.class, () -> MdocCbor.decode(new byte[] {0x5f}, "SessionData"));
    }
}
