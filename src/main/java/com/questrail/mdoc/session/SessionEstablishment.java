package com.questrail.mdoc.session;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;

import java.util.Objects;

/**
 * First message of a session, sent by the reader:
 *
 * <pre>
 *   SessionEstablishment = {
 *     "eReaderKey": #6.24(bstr .cbor COSE_Key),
 *     "data": bstr
 *   }
 * </pre>
 *
 * @param eReaderKey encoded COSE_Key of the reader's ephemeral key
 * @param data       encrypted DeviceRequest
 */
public record SessionEstablishment(byte[] eReaderKey, byte[] data)
{
    static final String KEY_E_READER_KEY = "eReaderKey";
    static final String KEY_DATA = "data";

    public SessionEstablishment {
        Objects.requireNonNull(eReaderKey, "eReaderKey");
        Objects.requireNonNull(data, "data");
    }

    public byte[] encode() {
        return Cbor.encode(new CBORPairList(
                new CBORPair(new CBORString(KEY_E_READER_KEY), Cbor.tag24(eReaderKey)),
                new CBORPair(new CBORString(KEY_DATA), new CBORByteArray(data))));
    }

    public static SessionEstablishment decode(byte[] encoded) {
        return fromMap(Cbor.asMap(Cbor.decode(encoded)));
    }

    static SessionEstablishment fromMap(CBORPairList map) {
        byte[] eReaderKey = Cbor.untag24(Cbor.require(map, KEY_E_READER_KEY));
        byte[] data = Cbor.asBytes(Cbor.require(map, KEY_DATA));
        return new SessionEstablishment(eReaderKey, data);
    }
}
