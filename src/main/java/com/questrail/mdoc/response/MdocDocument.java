package com.questrail.mdoc.response;

import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed mdoc document with its verification results.
 *
 * <p>{@code validityInfo} and {@code deviceKey} are {@code null} when issuerAuth
 * could not be decoded; in that case both authentication flags are false.</p>
 */
public record MdocDocument(
    String docType,
    ValidityInfo validityInfo,
    ECPublicKey deviceKey,
    List<X509Certificate> issuerCertificateChain,
    Map<String, Map<String, IssuerEntry>> issuerEntries,
    Map<String, Map<String, CBORObject>> deviceEntries,
    boolean issuerSignedAuthenticated,
    boolean deviceSignedAuthenticated,
    boolean deviceSignedWithMac,
    int numIssuerEntryDigestMatchFailures
) {
    public MdocDocument {
        issuerCertificateChain = List.copyOf(issuerCertificateChain);
        issuerEntries = unmodifiable(issuerEntries);
        deviceEntries = unmodifiable(deviceEntries);
    }

    public Optional<IssuerEntry> getIssuerEntry(String namespace, String element) {
        Map<String, IssuerEntry> entries = issuerEntries.get(namespace);
        return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(element));
    }

    public Optional<String> getIssuerEntryString(String namespace, String element) {
        return value(namespace, element)
                .filter(v -> v.getType() == CBORType.TextString)
                .map(CBORObject::AsString);
    }

    public Optional<Long> getIssuerEntryLong(String namespace, String element) {
        return value(namespace, element)
                .filter(v -> v.getType() == CBORType.Integer && v.CanValueFitInInt64())
                .map(CBORObject::AsInt64Value);
    }

    public Optional<Boolean> getIssuerEntryBoolean(String namespace, String element) {
        return value(namespace, element)
                .filter(v -> v.getType() == CBORType.Boolean)
                .map(CBORObject::AsBoolean);
    }

    public Optional<byte[]> getIssuerEntryBytes(String namespace, String element) {
        return value(namespace, element)
                .filter(v -> v.getType() == CBORType.ByteString)
                .map(CBORObject::GetByteString);
    }

    /** True when issuer data, device data and every element digest verified. */
    public boolean isFullyAuthenticated() {
        return issuerSignedAuthenticated && deviceSignedAuthenticated && numIssuerEntryDigestMatchFailures == 0;
    }

    private Optional<CBORObject> value(String namespace, String element) {
        return getIssuerEntry(namespace, element).map(IssuerEntry::value);
    }

    private static <V> Map<String, Map<String, V>> unmodifiable(Map<String, Map<String, V>> source) {
        Map<String, Map<String, V>> copy = new LinkedHashMap<>();
        source.forEach((ns, values) -> copy.put(ns, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        return Collections.unmodifiableMap(copy);
    }
}
