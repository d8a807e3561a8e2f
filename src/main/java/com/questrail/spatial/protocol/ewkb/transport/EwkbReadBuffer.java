package com.questrail.spatial.protocol.ewkb.transport;

import java.io.IOException;

/**
 * EwkbReadBuffer
 * -----------------------------------------------------------------------------
 * Inbound port between a buffered transport and the EWKB decoder.
 *
 * <p>The buffer is owned by the transport. A decoder borrows it for exactly one
 * value and never retains it. The buffer may hold only part of a value at a
 * time, so every fixed-size read is preceded by {@link #ensure(int)}, which is
 * the single point where the caller may block waiting for more bytes.</p>
 *
 * <p>The accessors ({@link #readByte()}, {@link #readUInt32(EwkbByteOrder)},
 * {@link #readDouble(EwkbByteOrder)}, {@link #readBytes(byte[], int, int)})
 * never block; calling them for more bytes than a preceding
 * {@code ensure} made available is a programming error.</p>
 *
 * <p>Implementations are not thread-safe.</p>
 */
public interface EwkbReadBuffer
{
    /**
     * Blocks until at least {@code count} unread bytes are buffered.
     *
     * @throws java.io.EOFException if the stream ends first
     * @throws IOException if the underlying transport fails
     * @throws IllegalArgumentException if {@code count} exceeds {@link #bufferSize()}
     */
    void ensure(int count) throws IOException;

    /**
     * Reads one unsigned byte.
     */
    int readByte();

    /**
     * Reads an unsigned 32-bit integer in the given byte order.
     */
    long readUInt32(EwkbByteOrder order);

    /**
     * Reads an IEEE-754 double in the given byte order.
     */
    double readDouble(EwkbByteOrder order);

    /**
     * Copies {@code length} buffered bytes into {@code dst}.
     */
    void readBytes(byte[] dst, int offset, int length);

    /**
     * Discards {@code count} bytes, blocking for them if necessary.
     */
    void skip(int count) throws IOException;

    /**
     * Returns the largest {@code count} {@link #ensure(int)} accepts.
     */
    int bufferSize();
}
