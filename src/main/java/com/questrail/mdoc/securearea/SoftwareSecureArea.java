package com.questrail.mdoc.securearea;

import com.questrail.mdoc.crypto.EcKeys;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SoftwareSecureArea
 * =============================================================================
 * In-process {@link SecureArea} holding JCA key pairs in memory.
 *
 * <p>Key creation is serialised by a single lock; signing and key agreement read
 * the concurrent map without locking.</p>
 */
public final class SoftwareSecureArea implements SecureArea
{
    private record Entry(KeyInfo info, ECPrivateKey privateKey) {}

    private final String identifier;
    private final Map<String, Entry> keys = new ConcurrentHashMap<>();
    private final ReentrantLock keyCreationLock = new ReentrantLock();

    public SoftwareSecureArea() {
        this("software");
    }

    public SoftwareSecureArea(String identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public KeyInfo createKey(String alias, CreateKeySettings settings) {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(settings, "settings");
        keyCreationLock.lock();
        try {
            return generate(alias, settings);
        } finally {
            keyCreationLock.unlock();
        }
    }

    @Override
    public KeyInfo getOrCreateKey(String alias, CreateKeySettings settings) {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(settings, "settings");
        keyCreationLock.lock();
        try {
            Entry existing = keys.get(alias);
            if (existing != null) {
                return existing.info();
            }
            return generate(alias, settings);
        } finally {
            keyCreationLock.unlock();
        }
    }

    @Override
    public KeyInfo getKeyInfo(String alias) {
        return require(alias).info();
    }

    @Override
    public byte[] sign(String alias, byte[] message) {
        Objects.requireNonNull(message, "message");
        Entry entry = require(alias);
        if (!entry.info().purposes().contains(KeyPurpose.SIGN)) {
            throw new SecureAreaException("Key '" + alias + "' is not a signing key");
        }
        try {
            Signature signature = Signature.getInstance(entry.info().curve().signatureAlgorithm().jcaName());
            signature.initSign(entry.privateKey());
            signature.update(message);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new SecureAreaException("Signing with '" + alias + "' failed", e);
        }
    }

    @Override
    public byte[] keyAgreement(String alias, ECPublicKey peerPublicKey) {
        Objects.requireNonNull(peerPublicKey, "peerPublicKey");
        Entry entry = require(alias);
        if (!entry.info().purposes().contains(KeyPurpose.AGREE_KEY)) {
            throw new SecureAreaException("Key '" + alias + "' is not a key-agreement key");
        }
        try {
            return EcKeys.keyAgreement(entry.privateKey(), peerPublicKey);
        } catch (IllegalArgumentException e) {
            throw new SecureAreaException("Key agreement with '" + alias + "' failed", e);
        }
    }

    @Override
    public void deleteKey(String alias) {
        keys.remove(Objects.requireNonNull(alias, "alias"));
    }

    private KeyInfo generate(String alias, CreateKeySettings settings) {
        KeyPair pair = EcKeys.generateKeyPair(settings.curve());
        KeyInfo info = new KeyInfo(alias, (ECPublicKey) pair.getPublic(), settings.curve(), settings.purposes());
        keys.put(alias, new Entry(info, (ECPrivateKey) pair.getPrivate()));
        return info;
    }

    private Entry require(String alias) {
        Entry entry = keys.get(Objects.requireNonNull(alias, "alias"));
        if (entry == null) {
            throw new SecureAreaException("No key with alias '" + alias + "'");
        }
        return entry;
    }
}
