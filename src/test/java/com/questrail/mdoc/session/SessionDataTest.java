package com.questrail.mdoc.session;

import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionDataTest {

    @Test
    void statusOnlyMessageHasNoDataEntry() {
        byte[] encoded = SessionData.ofStatus(SessionStatus.SESSION_TERMINATION).encode();

        CBORPairList map = Cbor.asMap(Cbor.decode(encoded));
        assertTrue(Cbor.lookup(map, "data").isEmpty());
        assertEquals(20, Cbor.asLong(Cbor.require(map, "status")));
    }

    @Test
    void decodeReadsDataAndStatus() {
        SessionData decoded = SessionData.decode(new SessionData(new byte[] { 1, 2 }, 10L).encode());

        assertArrayEquals(new byte[] { 1, 2 }, decoded.dataValue().orElseThrow());
        assertEquals(10, decoded.statusValue().getAsLong());
    }

    @Test
    void emptyMapIsRejected() {
        byte[] empty = Cbor.encode(new CBORPairList(List.<CBORPair>of()));
        assertThrows(CborDecodeException.class, () -> SessionData.decode(empty));
    }

    @Test
    void constructorRequiresDataOrStatus() {
        assertThrows(IllegalArgumentException.class, () -> new SessionData(null, null));
        assertThrows(IllegalArgumentException.class, () -> new SessionData(null, -1L));
    }

    @Test
    void establishmentTagsReaderKey() {
        byte[] readerKey = Cbor.encode(new CBORString("key"));
        SessionEstablishment establishment = new SessionEstablishment(readerKey, new byte[] { 5 });

        CBORPairList map = Cbor.asMap(Cbor.decode(establishment.encode()));
        assertArrayEquals(readerKey, Cbor.untag24(Cbor.require(map, "eReaderKey")));

        SessionEstablishment decoded = SessionEstablishment.decode(establishment.encode());
        assertArrayEquals(readerKey, decoded.eReaderKey());
        assertArrayEquals(new byte[] { 5 }, decoded.data());
    }

    @Test
    void establishmentWithoutReaderKeyIsRejected() {
        byte[] encoded = SessionData.ofData(new byte[] { 1 }).encode();
        assertThrows(CborDecodeException.class, () -> SessionEstablishment.decode(encoded));
    }
}
