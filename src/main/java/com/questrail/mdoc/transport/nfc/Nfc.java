package com.questrail.mdoc.transport.nfc;

/**
 * Constants for ISO 18013-5 NFC data retrieval (clause 8.3.3.1.2).
 */
public final class Nfc
{
    private Nfc() {
    }

    /** AID of the mdoc NFC data transfer application. */
    private static final byte[] DATA_TRANSFER_AID = {
            (byte) 0xa0, 0x00, 0x00, 0x02, 0x48, 0x04, 0x00
    };

    public static byte[] dataTransferApplicationId() {
        return DATA_TRANSFER_AID.clone();
    }

    public static final int CLA_CHAIN_LAST = 0x00;
    public static final int CLA_CHAIN_NOT_LAST = 0x10;

    public static final int INS_SELECT = 0xa4;
    public static final int INS_SELECT_P1_APPLICATION = 0x04;
    public static final int INS_SELECT_P2_NO_RESPONSE_DATA = 0x0c;
    public static final int INS_ENVELOPE = 0xc3;
    public static final int INS_GET_RESPONSE = 0xc0;

    public static final int STATUS_SUCCESS = 0x9000;
    public static final int STATUS_BYTES_STILL_AVAILABLE = 0x6100;
    public static final int STATUS_NO_PRECISE_DIAGNOSIS = 0x6f00;
    public static final int STATUS_INSTRUCTION_NOT_SUPPORTED = 0x6d00;
    public static final int STATUS_FILE_OR_APPLICATION_NOT_FOUND = 0x6a82;

    /** Bytes of APDU overhead the reader reserves out of the tag's transceive limit. */
    public static final int APDU_OVERHEAD = 7;

    public static String statusHex(int status) {
        return String.format("%04x", status);
    }
}
