package com.questrail.mdoc.crypto;

/**
 * Which end of the session an engine encrypts for.
 */
public enum SessionRole {
    /** The credential holder. Encrypts with SKDevice, decrypts with SKReader. */
    DEVICE,

    /** The verifier. Encrypts with SKReader, decrypts with SKDevice. */
    READER
}
