package com.questrail.mdoc.cbor;

/**
 * Raised when bytes are not valid CBOR or do not have the structure a
 * session message or COSE object requires.
 */
public final class CborDecodeException extends RuntimeException
{
    public CborDecodeException(String message) {
        super(message);
    }

    public CborDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
