package com.questrail.mdoc.zkp;

import com.upokecenter.cbor.CBORObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ZkSystemRepositoryTest
{
    private final ZkSystemRepository repository = new ZkSystemRepository().add(new FakeZkSystem());

    private static ZkDocument document(String specId, byte[] proof) {
        ZkDocumentData data = new ZkDocumentData(specId, "org.iso.18013.5.1.mDL", Instant.parse("2026-01-01T00:00:00Z"),
                Map.of("org.iso.18013.5.1", Map.of("age_over_21", CBORObject.True)), List.of());
        return ZkDocument.of(data, proof);
    }

    @Test
    void matchingIgnoresSpecIds() {
        ZkSystemSpec requested = FakeZkSystem.spec("reader-label", 1L);

        ZkSystemSpec found = repository.findMatchingSpec(List.of(requested)).orElseThrow();

        assertEquals("fake-v1", found.id());
    }

    @Test
    void differentParametersDoNotMatch() {
        assertTrue(repository.findMatchingSpec(List.of(FakeZkSystem.spec("x", 2L))).isEmpty());
        ZkSystemSpec otherSystem = new ZkSystemSpec("y", "other-system", Map.of());
        assertTrue(repository.findMatchingSpec(List.of(otherSystem)).isEmpty());
    }

    @Test
    void firstRequestedMatchWins() {
        List<ZkSystemSpec> requested = List.of(
                new ZkSystemSpec("a", "other-system", Map.of()),
                FakeZkSystem.spec("b", 1L));

        assertTrue(repository.findMatchingSpec(requested).isPresent());
        assertTrue(repository.lookup(FakeZkSystem.NAME).isPresent());
        assertTrue(repository.lookup("other-system").isEmpty());
    }

    @Test
    void unknownSpecIdIsNotFound() {
        assertThrows(ProofSystemNotFoundException.class,
                () -> repository.verify(document("unknown", new byte[32]), new byte[] {1}));
    }

    @Test
    void badProofFailsVerification() {
        assertThrows(ProofVerificationException.class,
                () -> repository.verify(document("fake-v1", new byte[32]), new byte[] {1}));
    }

    @Test
    void documentSurvivesEncodingVerbatim() {
        ZkDocument original = document("fake-v1", new byte[] {9, 9});

        ZkDocument decoded = ZkDocument.fromCbor(CBORObject.DecodeFromBytes(original.toCbor().EncodeToBytes()));

        assertArrayEquals(original.encodedDocumentData(), decoded.encodedDocumentData());
        assertArrayEquals(new byte[] {9, 9}, decoded.proof());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), decoded.documentData().timestamp());
    }

    @Test
    void specParamsAreTyped() {
        ZkSystemSpec spec = FakeZkSystem.spec("id", 7L);

        assertEquals(7L, spec.param("version", Long.class).orElseThrow());
        assertTrue(spec.param("version", String.class).isEmpty());
        assertEquals(spec, ZkSystemSpec.fromCbor(spec.toCbor()));
        assertThrows(IllegalArgumentException.class, () -> new ZkSystemSpec("id", "s", Map.of("n", 1)));
    }
}
