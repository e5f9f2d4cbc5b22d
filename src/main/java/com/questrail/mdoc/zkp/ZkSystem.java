package com.questrail.mdoc.zkp;

import java.time.Instant;
import java.util.List;

/**
 * A zero-knowledge proof backend.
 *
 * <p>Implementations are registered in a {@link ZkSystemRepository} under
 * {@link #name()}.</p>
 */
public interface ZkSystem
{
    /** Name used in {@link ZkSystemSpec#system()}. */
    String name();

    /** The configurations this backend can prove and verify. */
    List<ZkSystemSpec> systemSpecs();

    /**
     * Proves possession of an issuer-signed document.
     *
     * @param encodedDocument   the mdoc {@code Document} to prove over
     * @param sessionTranscript the session the proof is bound to
     */
    ZkDocument generateProof(ZkSystemSpec spec, byte[] encodedDocument, byte[] sessionTranscript, Instant timestamp);

    /**
     * @throws ProofVerificationException if the proof does not verify
     */
    void verifyProof(ZkDocument document, ZkSystemSpec spec, byte[] sessionTranscript);
}
