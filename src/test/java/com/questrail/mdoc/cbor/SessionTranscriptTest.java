package com.questrail.mdoc.cbor;

import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORNull;
import com.authlete.cbor.CBORString;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTranscriptTest {

    private static final byte[] DEVICE_ENGAGEMENT = Cbor.encode(new CBORString("engagement"));
    private static final byte[] E_READER_KEY = Cbor.encode(new CBORString("reader-key"));

    @Test
    void qrEngagementEncodesNullHandover() {
        SessionTranscript transcript = SessionTranscript.of(DEVICE_ENGAGEMENT, E_READER_KEY, null);

        var items = Cbor.asArray(Cbor.decode(transcript.encoded()));
        assertEquals(3, items.size());
        assertInstanceOf(CBORNull.class, items.get(2));
    }

    @Test
    void embeddedStructuresAreRecoverable() {
        SessionTranscript transcript = SessionTranscript.of(DEVICE_ENGAGEMENT, E_READER_KEY, null);

        assertArrayEquals(DEVICE_ENGAGEMENT, transcript.deviceEngagement());
        assertArrayEquals(E_READER_KEY, transcript.eReaderKey());
    }

    @Test
    void handoverIsEmbeddedAsIs() {
        byte[] handover = Cbor.encode(new CBORString("nfc-handover"));

        SessionTranscript transcript = SessionTranscript.of(DEVICE_ENGAGEMENT, E_READER_KEY, handover);

        var items = Cbor.asArray(Cbor.decode(transcript.encoded()));
        assertEquals("nfc-handover", Cbor.asString(items.get(2)));
    }

    @Test
    void taggedEncodingWrapsTranscriptInTag24() {
        SessionTranscript transcript = SessionTranscript.of(DEVICE_ENGAGEMENT, E_READER_KEY, null);

        byte[] tagged = transcript.taggedEncoding();

        assertEquals((byte) 0xd8, tagged[0]);
        assertEquals(0x18, tagged[1]);
        assertArrayEquals(transcript.encoded(), Cbor.untag24(Cbor.decode(tagged)));
    }

    @Test
    void fromEncodedAcceptsOnlyThreeElementArrays() {
        SessionTranscript original = SessionTranscript.of(DEVICE_ENGAGEMENT, E_READER_KEY, null);

        assertEquals(original, SessionTranscript.fromEncoded(original.encoded()));
        assertThrows(CborDecodeException.class, () -> SessionTranscript.fromEncoded(
                Cbor.encode(new CBORItemList(List.of(Cbor.integer(1))))));
    }
}
