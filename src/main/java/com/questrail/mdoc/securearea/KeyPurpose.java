package com.questrail.mdoc.securearea;

/**
 * Operations a secure-area key may be used for.
 */
public enum KeyPurpose
{
    SIGN,
    AGREE_KEY
}
