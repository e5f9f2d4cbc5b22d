package com.questrail.mdoc.response;

/**
 * The kinds of document a {@code DeviceResponse} can carry, each under its own key.
 */
public enum DocumentFormat
{
    MDOC("documents"),
    MDOC_ZK("zkDocuments");

    private final String responseKey;

    DocumentFormat(String responseKey) {
        this.responseKey = responseKey;
    }

    /** Key of the array holding documents of this format. */
    public String responseKey() {
        return responseKey;
    }
}
