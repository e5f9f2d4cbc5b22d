package com.questrail.mdoc.model;

/**
 * The side of a proximity presentment a component acts for.
 */
public enum Role
{
    /** The device presenting credentials (the mdoc). */
    HOLDER,

    /** The device requesting credentials (the mdoc reader). */
    READER;

    public Role peer() {
        return this == HOLDER ? READER : HOLDER;
    }
}
