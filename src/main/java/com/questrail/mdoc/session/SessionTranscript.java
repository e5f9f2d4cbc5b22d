package com.questrail.mdoc.session;

import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORObject;

import java.util.Objects;

/**
 * SessionTranscript
 * =============================================================================
 * {@code SessionTranscript = [DeviceEngagementBytes, EReaderKeyBytes, Handover]}
 * where both byte fields are tag-24 wrapped.
 *
 * <p>The transcript binds the encrypted channel to the engagement that was
 * actually scanned or tapped; any difference between the two sides' inputs makes
 * every subsequent decryption fail. Computation is pure: equal inputs give equal
 * bytes.</p>
 */
public final class SessionTranscript
{
    private SessionTranscript() {}

    /**
     * @param encodedDeviceEngagement device engagement bytes exactly as transmitted
     * @param encodedEReaderKey       the reader's ephemeral key as an encoded COSE_Key
     */
    public static byte[] compute(byte[] encodedDeviceEngagement, byte[] encodedEReaderKey, Handover handover) {
        Objects.requireNonNull(encodedDeviceEngagement, "encodedDeviceEngagement");
        Objects.requireNonNull(encodedEReaderKey, "encodedEReaderKey");
        Objects.requireNonNull(handover, "handover");

        CBORObject transcript = CBORObject.NewArray();
        transcript.Add(MdocCbor.tag24(encodedDeviceEngagement));
        transcript.Add(MdocCbor.tag24(encodedEReaderKey));
        transcript.Add(handover.toCbor());
        return transcript.EncodeToBytes();
    }

    /** {@code #6.24(bstr .cbor SessionTranscript)}, the form hashed for key-derivation salts. */
    public static byte[] toSessionTranscriptBytes(byte[] sessionTranscript) {
        return MdocCbor.encodeTag24(sessionTranscript);
    }
}
