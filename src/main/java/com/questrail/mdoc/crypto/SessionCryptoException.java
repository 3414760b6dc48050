package com.questrail.mdoc.crypto;

import java.util.Objects;

/**
 * Cryptographic failure of a session operation. Never retried by the stack.
 */
public final class SessionCryptoException extends RuntimeException
{
    public enum Kind {
        /** AEAD tag did not verify. */
        DECRYPTION_FAILED,

        /** ECDH could not be computed from the supplied keys. */
        KEY_AGREEMENT_FAILED,

        /** A session message or COSE structure was structurally wrong. */
        MALFORMED_MESSAGE,

        /** A direction counter would leave its 32-bit nonce field. */
        SESSION_EXHAUSTED
    }

    private final Kind kind;

    public SessionCryptoException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SessionCryptoException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}
