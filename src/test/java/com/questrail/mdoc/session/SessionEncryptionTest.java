package com.questrail.mdoc.session;

import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.securearea.CreateKeySettings;
import com.questrail.mdoc.securearea.KeyPurpose;
import com.questrail.mdoc.securearea.SoftwareSecureArea;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SessionEncryptionTest
{
    private KeyPair eDeviceKey;
    private KeyPair eReaderKey;
    private byte[] transcript;
    private SessionEncryption holder;
    private SessionEncryption reader;

    @BeforeEach
    void setUp() {
        eDeviceKey = EcKeys.generateKeyPair(EcCurve.P256);
        eReaderKey = EcKeys.generateKeyPair(EcCurve.P256);
        transcript = SessionTranscript.compute(new byte[] { (byte) 0xa0 },
                CoseKey.encode((ECPublicKey) eReaderKey.getPublic()), Handover.qr());
        holder = SessionEncryption.establish(Role.HOLDER, eDeviceKey, (ECPublicKey) eReaderKey.getPublic(), transcript);
        reader = SessionEncryption.establish(Role.READER, eReaderKey, (ECPublicKey) eDeviceKey.getPublic(), transcript);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ---------------------------------------------------------------------
    // Round trip
    // ---------------------------------------------------------------------

    @Test
    void messagesRoundTripInBothDirections() {
        byte[] establishment = reader.encryptMessage(bytes("request"), null);
        assertArrayEquals(bytes("request"), holder.decryptMessage(establishment).plaintext());

        byte[] response = holder.encryptMessage(bytes("response"), SessionData.STATUS_SESSION_TERMINATION);
        DecryptedMessage decrypted = reader.decryptMessage(response);
        assertArrayEquals(bytes("response"), decrypted.plaintext());
        assertTrue(decrypted.isSessionTermination());

        assertEquals(1, reader.numMessagesEncrypted());
        assertEquals(1, reader.numMessagesDecrypted());
        assertEquals(1, holder.numMessagesEncrypted());
        assertEquals(1, holder.numMessagesDecrypted());
    }

    @Test
    void firstReaderMessageIsSessionEstablishmentCarryingItsKey() {
        byte[] establishment = reader.encryptMessage(bytes("request"), null);

        ECPublicKey extracted = SessionEncryption.extractEReaderKey(establishment);
        assertEquals(((ECPublicKey) eReaderKey.getPublic()).getW(), extracted.getW());
        assertArrayEquals(CoseKey.encode((ECPublicKey) eReaderKey.getPublic()),
                SessionEncryption.extractEncodedEReaderKey(establishment));

        // Later messages are plain SessionData
        byte[] second = reader.encryptMessage(bytes("more"), null);
        assertThrows(DecryptionException.class, () -> SessionEncryption.extractEncodedEReaderKey(second));
    }

    @Test
    void sessionEstablishmentCannotCarryStatus() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.encryptMessage(bytes("request"), SessionData.STATUS_SESSION_TERMINATION));

        // The rejected call leaves the counter and establishment untouched
        assertEquals(0, reader.numMessagesEncrypted());
        byte[] establishment = reader.encryptMessage(bytes("request"), null);
        assertNotNull(SessionEncryption.extractEReaderKey(establishment));
        assertArrayEquals(bytes("request"), holder.decryptMessage(establishment).plaintext());
    }

    @Test
    void readerEngagementFlowSkipsEstablishment() {
        reader.setSendSessionEstablishment(false);
        byte[] message = reader.encryptMessage(bytes("request"), null);
        assertThrows(DecryptionException.class, () -> SessionEncryption.extractEncodedEReaderKey(message));
        assertArrayEquals(bytes("request"), holder.decryptMessage(message).plaintext());
    }

    @Test
    void statusOnlyMessageHasNoPlaintext() {
        DecryptedMessage decrypted = reader.decryptMessage(
                SessionEncryption.encodeStatus(SessionData.STATUS_SESSION_TERMINATION));
        assertTrue(decrypted.plaintextOptional().isEmpty());
        assertTrue(decrypted.isSessionTermination());
        assertEquals(0, reader.numMessagesDecrypted());
    }

    // ---------------------------------------------------------------------
    // Counters and fail-closed receive
    // ---------------------------------------------------------------------

    @Test
    void replayedMessageIsRejectedAndPoisonsSession() {
        holder.decryptMessage(reader.encryptMessage(bytes("establish"), null));
        byte[] first = holder.encryptMessage(bytes("one"), null);
        byte[] second = holder.encryptMessage(bytes("two"), null);

        reader.decryptMessage(first);
        assertThrows(DecryptionException.class, () -> reader.decryptMessage(first));

        // Even a legitimate next message is refused afterwards
        assertThrows(DecryptionException.class, () -> reader.decryptMessage(second));
    }

    @Test
    void outOfOrderMessageIsRejected() {
        holder.decryptMessage(reader.encryptMessage(bytes("establish"), null));
        holder.encryptMessage(bytes("one"), null);
        byte[] second = holder.encryptMessage(bytes("two"), null);

        DecryptionException e = assertThrows(DecryptionException.class, () -> reader.decryptMessage(second));
        assertEquals(0, reader.numMessagesDecrypted());
        assertNotNull(e.getMessage());
    }

    @Test
    void tamperedCiphertextIsRejectedWithUniformMessage() {
        byte[] establishment = reader.encryptMessage(bytes("request"), null);
        byte[] ciphertext = SessionData.decode(establishment).data();
        ciphertext[ciphertext.length - 1] ^= 0x01;
        byte[] tampered = new SessionData(ciphertext, null).encode();

        DecryptionException tag = assertThrows(DecryptionException.class, () -> holder.decryptMessage(tampered));
        DecryptionException garbage = assertThrows(DecryptionException.class,
                () -> freshHolder().decryptMessage(new byte[] { 0x01, 0x02 }));
        assertEquals(tag.getMessage(), garbage.getMessage());
    }

    @Test
    void ownMessagesCannotBeDecryptedBySender() {
        byte[] response = holder.encryptMessage(bytes("response"), null);
        assertThrows(DecryptionException.class, () -> holder.decryptMessage(response));
    }

    @Test
    void differentTranscriptDerivesDifferentKeys() {
        byte[] otherTranscript = SessionTranscript.compute(new byte[] { (byte) 0xa1 },
                CoseKey.encode((ECPublicKey) eReaderKey.getPublic()), Handover.qr());
        SessionEncryption otherHolder = SessionEncryption.establish(
                Role.HOLDER, eDeviceKey, (ECPublicKey) eReaderKey.getPublic(), otherTranscript);

        assertThrows(DecryptionException.class,
                () -> otherHolder.decryptMessage(reader.encryptMessage(bytes("request"), null)));
    }

    // ---------------------------------------------------------------------
    // Establishment
    // ---------------------------------------------------------------------

    @Test
    void mismatchedCurvesAreRejected() {
        KeyPair p384 = EcKeys.generateKeyPair(EcCurve.P384);
        assertThrows(KeyAgreementException.class, () -> SessionEncryption.establish(
                Role.HOLDER, p384, (ECPublicKey) eReaderKey.getPublic(), transcript));
    }

    @Test
    void secureAreaKeyInteroperatesWithInMemoryKey() {
        SoftwareSecureArea secureArea = new SoftwareSecureArea();
        ECPublicKey deviceKey = secureArea.createKey("eDeviceKey", CreateKeySettings.builder()
                .withCurve(EcCurve.P256)
                .withPurposes(Set.of(KeyPurpose.AGREE_KEY))
                .build()).publicKey();
        SessionEncryption secureHolder = SessionEncryption.establish(
                Role.HOLDER, secureArea, "eDeviceKey", (ECPublicKey) eReaderKey.getPublic(), transcript);
        SessionEncryption matchingReader = SessionEncryption.establish(
                Role.READER, eReaderKey, deviceKey, transcript);

        byte[] message = matchingReader.encryptMessage(bytes("request"), null);
        assertArrayEquals(bytes("request"), secureHolder.decryptMessage(message).plaintext());
    }

    private SessionEncryption freshHolder() {
        return SessionEncryption.establish(Role.HOLDER, eDeviceKey, (ECPublicKey) eReaderKey.getPublic(), transcript);
    }
}
