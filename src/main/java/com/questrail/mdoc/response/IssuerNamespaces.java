package com.questrail.mdoc.response;

import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.EcKeys;
import com.upokecenter.cbor.CBORObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The issuer-signed data elements of one credential, as encoded
 * {@link IssuerSignedItem}s per namespace.
 *
 * <p>Built once at issuance; at presentment {@link #filter(Map)} selects the
 * requested elements without re-encoding them.</p>
 */
public final class IssuerNamespaces
{
    private static final int RANDOM_LENGTH = 16;

    private final Map<String, List<byte[]>> encodedItems;

    private IssuerNamespaces(Map<String, List<byte[]>> encodedItems) {
        this.encodedItems = encodedItems;
    }

    public static IssuerNamespaces of(Map<String, List<byte[]>> encodedItems) {
        Map<String, List<byte[]>> copy = new LinkedHashMap<>();
        encodedItems.forEach((ns, items) -> copy.put(ns, List.copyOf(items)));
        return new IssuerNamespaces(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<byte[]>> encodedItems() {
        return encodedItems;
    }

    /** Value digests for the MSO: namespace to digest ID to digest. */
    public Map<String, Map<Long, byte[]>> digests(Digests algorithm) {
        Map<String, Map<Long, byte[]>> result = new LinkedHashMap<>();
        encodedItems.forEach((ns, items) -> {
            Map<Long, byte[]> digests = new LinkedHashMap<>();
            for (byte[] item : items) {
                digests.put(IssuerSignedItem.decode(item).digestId(), IssuerSignedItem.digest(algorithm, item));
            }
            result.put(ns, digests);
        });
        return result;
    }

    /**
     * Keeps only the elements named in {@code requested} (namespace to element to
     * intent-to-retain). Namespaces left empty are dropped.
     */
    public IssuerNamespaces filter(Map<String, Map<String, Boolean>> requested) {
        Map<String, List<byte[]>> result = new LinkedHashMap<>();
        encodedItems.forEach((ns, items) -> {
            Map<String, Boolean> wanted = requested.get(ns);
            if (wanted == null) {
                return;
            }
            List<byte[]> kept = new ArrayList<>();
            for (byte[] item : items) {
                if (wanted.containsKey(IssuerSignedItem.decode(item).elementIdentifier())) {
                    kept.add(item);
                }
            }
            if (!kept.isEmpty()) {
                result.put(ns, kept);
            }
        });
        return new IssuerNamespaces(Collections.unmodifiableMap(result));
    }

    /**
     * Assigns digest IDs in insertion order and a fresh 16-byte random to each element.
     */
    public static final class Builder {
        private final Map<String, List<byte[]>> items = new LinkedHashMap<>();
        private long nextDigestId;

        public Builder addDataElement(String namespace, String elementIdentifier, CBORObject value) {
            Objects.requireNonNull(namespace, "namespace");
            IssuerSignedItem item = new IssuerSignedItem(
                    nextDigestId++, EcKeys.randomBytes(RANDOM_LENGTH), elementIdentifier, value);
            items.computeIfAbsent(namespace, k -> new ArrayList<>()).add(item.encode());
            return this;
        }

        public IssuerNamespaces build() {
            return IssuerNamespaces.of(items);
        }
    }
}
