package com.questrail.spatial.protocol.ewkb.transport;

import java.io.IOException;

/**
 * EwkbWriteBuffer
 * -----------------------------------------------------------------------------
 * Outbound port between the EWKB encoder and a buffered transport.
 *
 * <p>Before appending any fixed-size field the encoder checks
 * {@link #writeSpaceLeft()} and calls {@link #flush()} when the field would
 * not fit. {@code flush} is the single point where the caller may block.
 * Multi-byte values are always written big-endian.</p>
 *
 * <p>Implementations are not thread-safe.</p>
 */
public interface EwkbWriteBuffer
{
    /**
     * Returns the number of bytes that can be appended without flushing.
     */
    int writeSpaceLeft();

    void writeByte(int value);

    void writeInt32(int value);

    void writeDouble(double value);

    void writeBytes(byte[] src, int offset, int length);

    /**
     * Hands buffered bytes to the transport, blocking if necessary.
     *
     * @throws IOException if the underlying transport fails
     */
    void flush() throws IOException;

    /**
     * Returns the space available after a {@link #flush()} on an empty buffer.
     */
    int bufferSize();
}
