package com.questrail.mdoc.session;

import com.upokecenter.cbor.CBORObject;

import java.util.Objects;

/**
 * The handover element of the session transcript: how engagement reached the reader.
 */
public sealed interface Handover
{
    CBORObject toCbor();

    /** QR code engagement: handover is CBOR {@code null}. */
    static Handover qr() {
        return Qr.INSTANCE;
    }

    /** NFC static or negotiated handover: {@code [handoverSelect, handoverRequest / null]}. */
    static Handover nfc(byte[] handoverSelectMessage, byte[] handoverRequestMessage) {
        return new Nfc(handoverSelectMessage, handoverRequestMessage);
    }

    enum Qr implements Handover {
        INSTANCE;

        @Override
        public CBORObject toCbor() {
            return CBORObject.Null;
        }
    }

    record Nfc(byte[] handoverSelectMessage, byte[] handoverRequestMessage) implements Handover {
        public Nfc {
            Objects.requireNonNull(handoverSelectMessage, "handoverSelectMessage");
            handoverSelectMessage = handoverSelectMessage.clone();
            handoverRequestMessage = handoverRequestMessage == null ? null : handoverRequestMessage.clone();
        }

        @Override
        public CBORObject toCbor() {
            CBORObject array = CBORObject.NewArray();
            array.Add(handoverSelectMessage);
            array.Add(handoverRequestMessage == null ? CBORObject.Null : CBORObject.FromObject(handoverRequestMessage));
            return array;
        }
    }
}
