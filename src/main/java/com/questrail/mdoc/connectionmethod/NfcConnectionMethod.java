package com.questrail.mdoc.connectionmethod;

/**
 * NFC connection method with the maximum APDU data field sizes the mdoc supports.
 */
public record NfcConnectionMethod(
    int commandDataFieldMaxLength,
    int responseDataFieldMaxLength
) implements ConnectionMethod {

    public static final int TYPE = 1;

    public NfcConnectionMethod {
        if (commandDataFieldMaxLength <= 0 || responseDataFieldMaxLength <= 0) {
            throw new IllegalArgumentException("NFC data field lengths must be positive");
        }
    }

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public String toString() {
        return "nfc:cmd_max_length=" + commandDataFieldMaxLength + ":resp_max_length=" + responseDataFieldMaxLength;
    }
}
