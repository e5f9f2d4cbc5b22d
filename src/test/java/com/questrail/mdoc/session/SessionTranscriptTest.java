package com.questrail.mdoc.session;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.engagement.CborEngagementCodec;
import com.questrail.mdoc.engagement.DeviceEngagement;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;
import org.junit.jupiter.api.Test;

import java.security.interfaces.ECPublicKey;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SessionTranscriptTest
{
    private final byte[] engagement = new CborEngagementCodec().encode(DeviceEngagement.of(
            (ECPublicKey) EcKeys.generateKeyPair(EcCurve.P256).getPublic(),
            List.of(BleConnectionMethod.peripheralServer(UUID.randomUUID()))));
    private final byte[] eReaderKey = CoseKey.encode((ECPublicKey) EcKeys.generateKeyPair(EcCurve.P256).getPublic());

    @Test
    void equalInputsGiveEqualBytes() {
        byte[] a = SessionTranscript.compute(engagement, eReaderKey, Handover.qr());
        byte[] b = SessionTranscript.compute(engagement.clone(), eReaderKey.clone(), Handover.qr());
        assertArrayEquals(a, b);
    }

    @Test
    void differentEngagementGivesDifferentTranscript() {
        byte[] tampered = engagement.clone();
        tampered[tampered.length - 1] ^= 0x01;
        assertFalse(Arrays.equals(
                SessionTranscript.compute(engagement, eReaderKey, Handover.qr()),
                SessionTranscript.compute(tampered, eReaderKey, Handover.qr())));
    }

    @Test
    void qrHandoverIsNullAndFieldsAreTagged() {
        CBORObject transcript = CBORObject.DecodeFromBytes(SessionTranscript.compute(engagement, eReaderKey, Handover.qr()));

        assertEquals(CBORType.Array, transcript.getType());
        assertEquals(3, transcript.size());
        assertArrayEquals(engagement, MdocCbor.untag24(transcript.get(0), "DeviceEngagementBytes"));
        assertArrayEquals(eReaderKey, MdocCbor.untag24(transcript.get(1), "EReaderKeyBytes"));
        assertTrue(transcript.get(2).isNull());
    }

    @Test
    void nfcHandoverCarriesBothMessages() {
        byte[] select = { 0x01, 0x02 };
        CBORObject transcript = CBORObject.DecodeFromBytes(
                SessionTranscript.compute(engagement, eReaderKey, Handover.nfc(select, null)));

        CBORObject handover = transcript.get(2);
        assertEquals(2, handover.size());
        assertArrayEquals(select, handover.get(0).GetByteString());
        assertTrue(handover.get(1).isNull());
    }
}
