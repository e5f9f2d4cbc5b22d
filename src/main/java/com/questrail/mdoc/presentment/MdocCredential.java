package com.questrail.mdoc.presentment;

import com.questrail.mdoc.response.IssuerNamespaces;
import com.questrail.mdoc.securearea.SecureArea;

import java.util.Objects;

/**
 * An issued credential as the holder keeps it: issuer-signed data, the signed
 * MSO, and the device key that the MSO binds.
 *
 * @param encodedIssuerAuth the issuer's COSE_Sign1 over the MSO
 * @param deviceKeyAlias    alias of the device key in {@code secureArea}
 */
public record MdocCredential(
    String docType,
    IssuerNamespaces issuerNamespaces,
    byte[] encodedIssuerAuth,
    SecureArea secureArea,
    String deviceKeyAlias
) {
    public MdocCredential {
        Objects.requireNonNull(docType, "docType");
        Objects.requireNonNull(issuerNamespaces, "issuerNamespaces");
        Objects.requireNonNull(encodedIssuerAuth, "encodedIssuerAuth");
        Objects.requireNonNull(secureArea, "secureArea");
        Objects.requireNonNull(deviceKeyAlias, "deviceKeyAlias");
        encodedIssuerAuth = encodedIssuerAuth.clone();
    }
}
