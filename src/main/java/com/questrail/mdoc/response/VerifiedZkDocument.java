package com.questrail.mdoc.response;

import com.questrail.mdoc.zkp.ZkDocument;

import java.util.Optional;

/**
 * A parsed ZK document. {@code failureReason} is {@code null} when the proof verified.
 */
public record VerifiedZkDocument(ZkDocument document, boolean proofVerified, String failureReason)
{
    public Optional<String> failureReasonOptional() {
        return Optional.ofNullable(failureReason);
    }
}
