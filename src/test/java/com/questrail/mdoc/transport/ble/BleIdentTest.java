package com.questrail.mdoc.transport.ble;

import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import org.junit.jupiter.api.Test;

import java.security.interfaces.ECPublicKey;

import static org.junit.jupiter.api.Assertions.*;

final class BleIdentTest
{
    @Test
    void identIsSixteenBytesAndKeySpecific() {
        ECPublicKey a = (ECPublicKey) EcKeys.generateKeyPair(EcCurve.P256).getPublic();
        ECPublicKey b = (ECPublicKey) EcKeys.generateKeyPair(EcCurve.P256).getPublic();

        byte[] ident = BleIdent.compute(a);

        assertEquals(BleIdent.LENGTH, ident.length);
        assertArrayEquals(ident, BleIdent.compute(a));
        assertTrue(BleIdent.matches(ident, a));
        assertFalse(BleIdent.matches(ident, b));
        assertFalse(BleIdent.matches(null, a));
    }
}
