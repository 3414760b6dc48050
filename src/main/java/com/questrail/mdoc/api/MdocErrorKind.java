package com.questrail.mdoc.api;

/**
 * Closed set of failure categories surfaced by the proximity stack.
 */
public enum MdocErrorKind {
    /** Bad chunk marker, empty chunk, missing characteristic, malformed PSM. Fatal to the connection. */
    FRAMING,

    /** Radio or socket failure: failed read/write, lost link, failed connect. */
    PLATFORM,

    /** AEAD tag mismatch, missing key agreement input, malformed signature structure. */
    CRYPTO,

    /** Operation requested in a phase that does not allow it. */
    PRECONDITION
}
