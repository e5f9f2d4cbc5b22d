package com.questrail.mdoc.crypto.cose;

/**
 * Header and key-parameter labels from RFC 9052/9053 used by mdoc.
 */
public final class CoseLabels
{
    public static final int HEADER_ALG = 1;
    public static final int HEADER_X5CHAIN = 33;

    public static final int KEY_KTY = 1;
    public static final int KEY_CRV = -1;
    public static final int KEY_X = -2;
    public static final int KEY_Y = -3;

    public static final int KTY_EC2 = 2;

    private CoseLabels() {}
}
