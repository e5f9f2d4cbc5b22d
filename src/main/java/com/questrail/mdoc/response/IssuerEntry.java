package com.questrail.mdoc.response;

import com.upokecenter.cbor.CBORObject;

/**
 * An issuer-signed element value and whether its digest matched the MSO.
 */
public record IssuerEntry(CBORObject value, boolean digestMatch)
{
}
