package com.questrail.mdoc.cbor;

import com.authlete.cbor.CBORBigInteger;
import com.authlete.cbor.CBORByteArray;
import com.authlete.cbor.CBORDecoder;
import com.authlete.cbor.CBORInteger;
import com.authlete.cbor.CBORItem;
import com.authlete.cbor.CBORItemList;
import com.authlete.cbor.CBORLong;
import com.authlete.cbor.CBORPair;
import com.authlete.cbor.CBORPairList;
import com.authlete.cbor.CBORString;
import com.authlete.cbor.CBORTaggedItem;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cbor
 * =============================================================================
 * Thin helpers over the authlete CBOR model for the structures this stack
 * reads and writes: session envelopes, session transcripts, COSE objects.
 *
 * <p>Decoding failures of any kind surface as {@link CborDecodeException}.</p>
 */
public final class Cbor
{
    /** Tag for an embedded, already encoded CBOR data item. */
    public static final int TAG_ENCODED_CBOR = 24;

    private Cbor() {}

    public static byte[] encode(CBORItem item) {
        Objects.requireNonNull(item, "item");
        return item.encode();
    }

    /**
     * Decodes a single data item.
     *
     * @throws CborDecodeException if {@code bytes} is not well-formed CBOR
     */
    public static CBORItem decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new CborDecodeException("No CBOR data item in empty input");
        }

        CBORItem item;
        try {
            item = new CBORDecoder(bytes).next();
        }
        catch (IOException | RuntimeException e) {
            throw new CborDecodeException("Malformed CBOR: " + e.getMessage(), e);
        }
        if (item == null) {
            throw new CborDecodeException("No CBOR data item in input");
        }
        return item;
    }

    /**
     * Wraps encoded CBOR as {@code #6.24(bstr)}.
     */
    public static CBORTaggedItem tag24(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        return new CBORTaggedItem(TAG_ENCODED_CBOR, new CBORByteArray(encoded));
    }

    /**
     * Returns the embedded bytes of a {@code #6.24(bstr)} item.
     */
    public static byte[] untag24(CBORItem item) {
        if (!(item instanceof CBORTaggedItem tagged)
                || tagged.getTagNumber() == null
                || tagged.getTagNumber().intValue() != TAG_ENCODED_CBOR) {
            throw new CborDecodeException("Expected #6.24(bstr), found " + describe(item));
        }

        CBORItem content = tagged.getTagContent();
        if (content instanceof CBORByteArray bytes) {
            return bytes.getValue();
        }
        if (content != null) {
            // Some decoder configurations expand the embedded item eagerly.
            return content.encode();
        }
        throw new CborDecodeException("Empty #6.24 content");
    }

    /**
     * Small integers as {@link CBORInteger}, larger ones as {@link CBORLong}.
     */
    public static CBORItem integer(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return new CBORInteger((int) value);
        }
        return new CBORLong(value);
    }

    /**
     * Finds the value stored under {@code key} (an {@link Integer}, {@link Long}
     * or {@link String}) in a CBOR map.
     */
    public static Optional<CBORItem> lookup(CBORPairList map, Object key) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(key, "key");

        List<? extends CBORPair> pairs = map.getPairs();
        if (pairs == null) {
            return Optional.empty();
        }
        for (CBORPair pair : pairs) {
            if (keyMatches(pair.getKey(), key)) {
                return Optional.ofNullable(pair.getValue());
            }
        }
        return Optional.empty();
    }

    public static CBORItem require(CBORPairList map, Object key) {
        return lookup(map, key).orElseThrow(
                () -> new CborDecodeException("Missing map entry: " + key));
    }

    public static CBORPairList asMap(CBORItem item) {
        if (item instanceof CBORPairList map) {
            return map;
        }
        throw new CborDecodeException("Expected map, found " + describe(item));
    }

    public static List<? extends CBORItem> asArray(CBORItem item) {
        if (item instanceof CBORItemList list) {
            List<? extends CBORItem> items = list.getItems();
            return items == null ? List.of() : items;
        }
        throw new CborDecodeException("Expected array, found " + describe(item));
    }

    public static byte[] asBytes(CBORItem item) {
        if (item instanceof CBORByteArray bytes) {
            return bytes.getValue();
        }
        throw new CborDecodeException("Expected bstr, found " + describe(item));
    }

    public static String asString(CBORItem item) {
        if (item instanceof CBORString string) {
            return string.getValue();
        }
        throw new CborDecodeException("Expected tstr, found " + describe(item));
    }

    public static long asLong(CBORItem item) {
        if (item instanceof CBORInteger i) {
            return i.getValue();
        }
        if (item instanceof CBORLong l) {
            return l.getValue();
        }
        if (item instanceof CBORBigInteger big) {
            BigInteger value = big.getValue();
            if (value.bitLength() < 64) {
                return value.longValue();
            }
        }
        throw new CborDecodeException("Expected integer in 64-bit range, found " + describe(item));
    }

    private static boolean keyMatches(CBORItem candidate, Object key) {
        if (key instanceof String s) {
            return candidate instanceof CBORString cs && s.equals(cs.getValue());
        }
        if (key instanceof Integer || key instanceof Long) {
            long wanted = ((Number) key).longValue();
            if (candidate instanceof CBORInteger ci) {
                return ci.getValue() == wanted;
            }
            if (candidate instanceof CBORLong cl) {
                return cl.getValue() == wanted;
            }
            return false;
        }
        throw new IllegalArgumentException("Unsupported key type: " + key.getClass().getName());
    }

    private static String describe(CBORItem item) {
        return item == null ? "nothing" : item.getClass().getSimpleName();
    }
}
