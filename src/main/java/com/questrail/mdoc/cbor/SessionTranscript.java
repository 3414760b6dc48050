package com.questrail.mdoc.cbor;

import com.authlete.cbor.CBORItem;
import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * SessionTranscript
 * -----------------------------------------------------------------------------
 * The CBOR array binding engagement and handover data into every key and
 * signature of a session:
 *
 * <pre>
 *   SessionTranscript = [
 *     #6.24(bstr .cbor DeviceEngagement),
 *     #6.24(bstr .cbor EReaderKey),
 *     Handover
 *   ]
 * </pre>
 *
 * <p>Instances are immutable and hold the canonical encoding computed at
 * construction time.</p>
 */
public final class SessionTranscript
{
    private final byte[] encoded;

    private SessionTranscript(byte[] encoded) {
        this.encoded = encoded;
    }

    /**
     * Builds a transcript.
     *
     * @param deviceEngagement encoded DeviceEngagement
     * @param eReaderKey       encoded COSE_Key of the reader's ephemeral key
     * @param handover         encoded Handover, or {@code null} for QR engagement (CBOR null)
     */
    public static SessionTranscript of(byte[] deviceEngagement, byte[] eReaderKey, byte[] handover) {
        Objects.requireNonNull(deviceEngagement, "deviceEngagement");
        Objects.requireNonNull(eReaderKey, "eReaderKey");

        CBORItem handoverItem = handover == null ? CBORNull.INSTANCE : Cbor.decode(handover);

        CBORItemList array = new CBORItemList(
                Cbor.tag24(deviceEngagement),
                Cbor.tag24(eReaderKey),
                handoverItem);
        return new SessionTranscript(Cbor.encode(array));
    }

    /**
     * Wraps an already encoded transcript after checking its shape.
     */
    public static SessionTranscript fromEncoded(byte[] encoded) {
        List<? extends CBORItem> items = Cbor.asArray(Cbor.decode(encoded));
        if (items.size() != 3) {
            throw new CborDecodeException("SessionTranscript must have 3 elements, found " + items.size());
        }
        return new SessionTranscript(encoded.clone());
    }

    /** Canonical encoding of the transcript array. */
    public byte[] encoded() {
        return encoded.clone();
    }

    /**
     * Encoding of {@code #6.24(bstr .cbor SessionTranscript)}, the input of the
     * key derivation salt.
     */
    public byte[] taggedEncoding() {
        return Cbor.encode(Cbor.tag24(encoded));
    }

    /** Encoded DeviceEngagement as embedded in the transcript. */
    public byte[] deviceEngagement() {
        return Cbor.untag24(Cbor.asArray(Cbor.decode(encoded)).get(0));
    }

    /** Encoded EReaderKey COSE_Key as embedded in the transcript. */
    public byte[] eReaderKey() {
        return Cbor.untag24(Cbor.asArray(Cbor.decode(encoded)).get(1));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SessionTranscript other && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }
}
