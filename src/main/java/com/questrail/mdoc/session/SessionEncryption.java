package com.questrail.mdoc.session;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.Hkdf;
import com.questrail.mdoc.crypto.cose.CoseException;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.securearea.SecureArea;
import com.questrail.mdoc.securearea.SecureAreaException;
import com.upokecenter.cbor.CBORObject;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * SessionEncryption
 * =============================================================================
 * Symmetric encryption of session messages between holder and reader
 * (ISO 18013-5 clause 9.1.1).
 *
 * <h2>Key derivation</h2>
 * <pre>
 * Z        = ECDH(own ephemeral private key, peer ephemeral public key)
 * salt     = SHA-256(#6.24(bstr .cbor SessionTranscript))
 * SKDevice = HKDF-SHA256(Z, salt, "SKDevice", 32)   ; holder to reader
 * SKReader = HKDF-SHA256(Z, salt, "SKReader", 32)   ; reader to holder
 * </pre>
 *
 * <h2>Nonces</h2>
 * AES-256-GCM with a 12-byte IV: four zero bytes, a four-byte sender identifier
 * (0 for the reader, 1 for the holder), and a four-byte big-endian message
 * counter starting at 1. Each direction has its own counter.
 *
 * <h2>Fail-closed receive</h2>
 * The receive counter advances only after a message authenticates. Any failure
 * (bad envelope, bad tag, replay, reordering) throws {@link DecryptionException}
 * with one uniform message and permanently disables decryption on this instance,
 * so no later message on the channel is accepted either.
 *
 * <h2>Thread safety</h2>
 * Instances are owned by a single session. Methods are synchronized so a sender
 * thread and a receiver thread may share one instance.
 */
public final class SessionEncryption
{
    private static final int IDENTIFIER_READER = 0;
    private static final int IDENTIFIER_HOLDER = 1;
    private static final int GCM_TAG_BITS = 128;
    private static final int KEY_LENGTH = 32;
    private static final long MAX_COUNTER = 0xffffffffL;
    private static final String DECRYPTION_FAILED = "Unable to decrypt session message";

    private final Role role;
    private final SecretKeySpec sendKey;
    private final SecretKeySpec receiveKey;
    private final byte[] encodedESelfKey;

    private long sendCounter = 1;
    private long receiveCounter = 1;
    private boolean sendSessionEstablishment;
    private boolean failed;

    private SessionEncryption(Role role, byte[] sharedSecret, byte[] sessionTranscript, ECPublicKey eSelfKey) {
        this.role = role;
        byte[] salt = Digests.SHA_256.digest(SessionTranscript.toSessionTranscriptBytes(sessionTranscript));
        byte[] skDevice = Hkdf.sha256(sharedSecret, salt, "SKDevice", KEY_LENGTH);
        byte[] skReader = Hkdf.sha256(sharedSecret, salt, "SKReader", KEY_LENGTH);
        Arrays.fill(sharedSecret, (byte) 0);
        if (role == Role.HOLDER) {
            this.sendKey = new SecretKeySpec(skDevice, "AES");
            this.receiveKey = new SecretKeySpec(skReader, "AES");
        } else {
            this.sendKey = new SecretKeySpec(skReader, "AES");
            this.receiveKey = new SecretKeySpec(skDevice, "AES");
        }
        this.encodedESelfKey = CoseKey.encode(eSelfKey);
        this.sendSessionEstablishment = role == Role.READER;
    }

    // -------------------------------------------------------------------------
    // Establishment
    // -------------------------------------------------------------------------

    /**
     * Establishes a session from an in-memory ephemeral key pair.
     *
     * @throws KeyAgreementException if the keys are on different or unsupported curves
     */
    public static SessionEncryption establish(Role role, KeyPair localEphemeralKey,
                                              ECPublicKey remoteEphemeralKey, byte[] sessionTranscript) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(localEphemeralKey, "localEphemeralKey");
        Objects.requireNonNull(remoteEphemeralKey, "remoteEphemeralKey");
        Objects.requireNonNull(sessionTranscript, "sessionTranscript");

        ECPublicKey localPublic = (ECPublicKey) localEphemeralKey.getPublic();
        checkCurves(localPublic, remoteEphemeralKey);
        byte[] shared;
        try {
            shared = EcKeys.keyAgreement((ECPrivateKey) localEphemeralKey.getPrivate(), remoteEphemeralKey);
        } catch (IllegalArgumentException e) {
            throw new KeyAgreementException("ECDH failed", e);
        }
        return new SessionEncryption(role, shared, sessionTranscript, localPublic);
    }

    /**
     * Establishes a session whose local ephemeral key lives in a secure area.
     */
    public static SessionEncryption establish(Role role, SecureArea secureArea, String alias,
                                              ECPublicKey remoteEphemeralKey, byte[] sessionTranscript) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(secureArea, "secureArea");
        Objects.requireNonNull(remoteEphemeralKey, "remoteEphemeralKey");
        Objects.requireNonNull(sessionTranscript, "sessionTranscript");

        ECPublicKey localPublic = secureArea.getKeyInfo(alias).publicKey();
        checkCurves(localPublic, remoteEphemeralKey);
        byte[] shared;
        try {
            shared = secureArea.keyAgreement(alias, remoteEphemeralKey);
        } catch (SecureAreaException e) {
            throw new KeyAgreementException("Secure area key agreement failed", e);
        }
        return new SessionEncryption(role, shared, sessionTranscript, localPublic);
    }

    private static void checkCurves(ECPublicKey local, ECPublicKey remote) {
        EcCurve localCurve = EcCurve.fromKey(local)
                .orElseThrow(() -> new KeyAgreementException("Local ephemeral key is on an unsupported curve"));
        EcCurve remoteCurve = EcCurve.fromKey(remote)
                .orElseThrow(() -> new KeyAgreementException("Remote ephemeral key is on an unsupported curve"));
        if (localCurve != remoteCurve) {
            throw new KeyAgreementException("Ephemeral keys are on different curves: " + localCurve + " and " + remoteCurve);
        }
    }

    // -------------------------------------------------------------------------
    // Messages
    // -------------------------------------------------------------------------

    /**
     * Encrypts {@code plaintext} and wraps it in an envelope.
     *
     * <p>The first message a reader sends is a SessionEstablishment carrying its
     * ephemeral key; that message cannot carry a status.</p>
     *
     * @param status session status to attach, or {@code null}
     */
    public synchronized byte[] encryptMessage(byte[] plaintext, Integer status) {
        Objects.requireNonNull(plaintext, "plaintext");
        if (sendCounter > MAX_COUNTER) {
            throw new IllegalStateException("Send counter exhausted");
        }
        if (sendSessionEstablishment && status != null) {
            throw new IllegalArgumentException("SessionEstablishment cannot carry a status");
        }
        byte[] ciphertext = crypt(Cipher.ENCRYPT_MODE, sendKey, nonce(role, sendCounter), plaintext);
        sendCounter++;

        if (sendSessionEstablishment) {
            sendSessionEstablishment = false;
            CBORObject map = MdocCbor.newMap();
            map.Add(SessionData.KEY_E_READER_KEY, MdocCbor.tag24(encodedESelfKey));
            map.Add(SessionData.KEY_DATA, ciphertext);
            return map.EncodeToBytes();
        }
        return new SessionData(ciphertext, status).encode();
    }

    /**
     * Decrypts a SessionData or SessionEstablishment message.
     *
     * @throws DecryptionException on any failure; the instance rejects all later messages
     */
    public synchronized DecryptedMessage decryptMessage(byte[] message) {
        if (failed) {
            throw new DecryptionException(DECRYPTION_FAILED);
        }
        try {
            SessionData envelope = SessionData.decode(message);
            if (envelope.data() == null) {
                return new DecryptedMessage(null, envelope.status());
            }
            if (receiveCounter > MAX_COUNTER) {
                throw new IllegalStateException("Receive counter exhausted");
            }
            byte[] plaintext = crypt(Cipher.DECRYPT_MODE, receiveKey, nonce(role.peer(), receiveCounter), envelope.data());
            receiveCounter++;
            return new DecryptedMessage(plaintext, envelope.status());
        } catch (RuntimeException e) {
            failed = true;
            throw new DecryptionException(DECRYPTION_FAILED, e);
        }
    }

    /** A data-less envelope carrying only {@code status}. */
    public static byte[] encodeStatus(int status) {
        return new SessionData(null, status).encode();
    }

    /**
     * Overrides whether the next encrypted message is a SessionEstablishment.
     * Reader-engagement flows, where the holder already knows the reader key,
     * turn it off.
     */
    public synchronized void setSendSessionEstablishment(boolean sendSessionEstablishment) {
        this.sendSessionEstablishment = sendSessionEstablishment;
    }

    public synchronized int numMessagesEncrypted() {
        return (int) (sendCounter - 1);
    }

    public synchronized int numMessagesDecrypted() {
        return (int) (receiveCounter - 1);
    }

    // -------------------------------------------------------------------------
    // SessionEstablishment helpers
    // -------------------------------------------------------------------------

    /**
     * Returns the reader's ephemeral key as encoded COSE_Key bytes, the form the
     * session transcript needs.
     *
     * @throws DecryptionException if the message is not a SessionEstablishment
     */
    public static byte[] extractEncodedEReaderKey(byte[] sessionEstablishment) {
        try {
            CBORObject map = MdocCbor.requireMap(MdocCbor.decode(sessionEstablishment, "SessionEstablishment"), "SessionEstablishment");
            return MdocCbor.untag24(MdocCbor.field(map, SessionData.KEY_E_READER_KEY), SessionData.KEY_E_READER_KEY);
        } catch (CborStructureException e) {
            throw new DecryptionException("Malformed SessionEstablishment", e);
        }
    }

    public static ECPublicKey extractEReaderKey(byte[] sessionEstablishment) {
        try {
            return CoseKey.decode(extractEncodedEReaderKey(sessionEstablishment));
        } catch (CoseException e) {
            throw new DecryptionException("Malformed SessionEstablishment", e);
        }
    }

    // -------------------------------------------------------------------------
    // AES-GCM
    // -------------------------------------------------------------------------

    private static byte[] nonce(Role sender, long counter) {
        return ByteBuffer.allocate(12)
                .putInt(0)
                .putInt(sender == Role.HOLDER ? IDENTIFIER_HOLDER : IDENTIFIER_READER)
                .putInt((int) counter)
                .array();
    }

    private static byte[] crypt(int mode, SecretKeySpec key, byte[] nonce, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(mode, key, new GCMParameterSpec(GCM_TAG_BITS, nonce));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM operation failed", e);
        }
    }
}
