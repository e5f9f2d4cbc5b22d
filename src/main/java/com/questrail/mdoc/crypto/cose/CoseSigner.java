package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.crypto.CoseAlgorithm;

/**
 * Produces raw ({@code r || s}) ECDSA signatures for COSE_Sign1.
 *
 * <p>Implementations typically delegate to a secure area so the private key never
 * leaves it.</p>
 */
public interface CoseSigner
{
    CoseAlgorithm algorithm();

    byte[] sign(byte[] toBeSigned);
}
