/**
 * Chunking codec for the mdoc GATT data characteristics.
 *
 * <p>A message larger than one attribute write is carried as a run of chunks.
 * Every chunk starts with a marker byte:</p>
 *
 * <pre>
 *   0x01 | payload     more chunks follow
 *   0x00 | payload     last (or only) chunk
 * </pre>
 *
 * <p>A zero-length message is reserved. It travels as the single chunk
 * {@code [0x00]} and means "shut down", never "empty message".</p>
 *
 * <p>The codec is pure: partial reassembly state is an immutable
 * {@link com.questrail.mdoc.codec.ChunkReassembly} value so that the link
 * state machine can keep it inside its own state. A mutable convenience
 * wrapper for callers outside the state machine is
 * {@link com.questrail.mdoc.codec.impl.ChunkReassembler}.</p>
 *
 * <p>The socket path does not use chunks; it frames whole messages with a
 * length prefix in the socket adapter.</p>
 */
package com.questrail.mdoc.codec;
