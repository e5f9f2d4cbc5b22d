package com.questrail.mdoc.securearea;

import com.questrail.mdoc.crypto.CoseAlgorithm;
import com.questrail.mdoc.crypto.cose.CoseSigner;

import java.security.interfaces.ECPublicKey;
import java.util.Objects;

/**
 * SecureArea
 * =============================================================================
 * The narrow contract the presentment stack needs from a key store.
 *
 * <p>Where and how private keys are stored is the implementation's business; the
 * protocol code only asks for public keys, signatures and ECDH shared secrets by
 * alias. Instances are passed explicitly to whoever needs them; there is no
 * process-wide registry.</p>
 *
 * <h2>Concurrency</h2>
 * {@link #getOrCreateKey(String, CreateKeySettings)} must be atomic with respect to
 * other key creation in the same secure area, so that concurrent first use of an
 * alias yields exactly one key.
 */
public interface SecureArea
{
    /** Stable identifier of this backend, for diagnostics. */
    String identifier();

    /**
     * Creates a key, replacing any existing key with the same alias.
     */
    KeyInfo createKey(String alias, CreateKeySettings settings);

    /**
     * Returns the existing key for {@code alias}, or creates it.
     */
    KeyInfo getOrCreateKey(String alias, CreateKeySettings settings);

    /**
     * @throws SecureAreaException if no key exists for {@code alias}
     */
    KeyInfo getKeyInfo(String alias);

    /**
     * Signs {@code message} with the curve's ECDSA algorithm.
     *
     * @return the raw {@code r || s} signature
     * @throws SecureAreaException if the key is unknown or not a signing key
     */
    byte[] sign(String alias, byte[] message);

    /**
     * @return the raw ECDH shared secret
     * @throws SecureAreaException if the key is unknown, not a key-agreement key,
     *                             or on a different curve than {@code peerPublicKey}
     */
    byte[] keyAgreement(String alias, ECPublicKey peerPublicKey);

    void deleteKey(String alias);

    /**
     * Adapts a signing key to {@link CoseSigner}.
     */
    default CoseSigner signer(String alias) {
        Objects.requireNonNull(alias, "alias");
        CoseAlgorithm algorithm = getKeyInfo(alias).curve().signatureAlgorithm();
        return new CoseSigner() {
            @Override
            public CoseAlgorithm algorithm() {
                return algorithm;
            }

            @Override
            public byte[] sign(byte[] toBeSigned) {
                return SecureArea.this.sign(alias, toBeSigned);
            }
        };
    }
}
