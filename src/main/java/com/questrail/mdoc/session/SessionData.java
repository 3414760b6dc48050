package com.questrail.mdoc.session;

import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Every message after SessionEstablishment, in either direction:
 *
 * <pre>
 *   SessionData = {
 *     ? "data": bstr,
 *     ? "status": uint
 *   }
 * </pre>
 *
 * @param data   encrypted payload, or {@code null}
 * @param status status code, or {@code null}
 */
public record SessionData(byte[] data, Long status)
{
    private static final String KEY_STATUS = "status";

    public SessionData {
        if (data == null && status == null) {
            throw new IllegalArgumentException("SessionData needs data, status or both");
        }
        if (status != null && status < 0) {
            throw new IllegalArgumentException("status must be unsigned");
        }
    }

    public static SessionData ofData(byte[] data) {
        return new SessionData(data, null);
    }

    public static SessionData ofStatus(long status) {
        return new SessionData(null, status);
    }

    public Optional<byte[]> dataValue() {
        return Optional.ofNullable(data);
    }

    public OptionalLong statusValue() {
        return status == null ? OptionalLong.empty() : OptionalLong.of(status);
    }

    public byte[] encode() {
        List<CBORPair> pairs = new ArrayList<>(2);
        if (data != null) {
            pairs.add(new CBORPair(new CBORString(SessionEstablishment.KEY_DATA), new CBORByteArray(data)));
        }
        if (status != null) {
            pairs.add(new CBORPair(new CBORString(KEY_STATUS), Cbor.integer(status)));
        }
        return Cbor.encode(new CBORPairList(pairs));
    }

    public static SessionData decode(byte[] encoded) {
        return fromMap(Cbor.asMap(Cbor.decode(encoded)));
    }

    static SessionData fromMap(CBORPairList map) {
        byte[] data = Cbor.lookup(map, SessionEstablishment.KEY_DATA).map(Cbor::asBytes).orElse(null);
        Long status = Cbor.lookup(map, KEY_STATUS).map(Cbor::asLong).orElse(null);
        if (data == null && status == null) {
            throw new CborDecodeException("SessionData has neither data nor status");
        }
        return new SessionData(data, status);
    }
}
