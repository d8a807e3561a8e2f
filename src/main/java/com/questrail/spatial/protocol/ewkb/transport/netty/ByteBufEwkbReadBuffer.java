package com.questrail.spatial.protocol.ewkb.transport.netty;

import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * ByteBufEwkbReadBuffer
 * =============================================================================
 * Netty {@link ByteBuf} backed implementation of {@link EwkbReadBuffer}.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@link #wrap(ByteBuf)}: the whole value is already resident. A read
 *       past the end fails with {@link EOFException}.</li>
 *   <li>{@link #over(InputStream, int, long)}: a bounded buffer in front of a
 *       stream. {@link #ensure(int)} compacts the buffer and blocks on the
 *       stream until enough bytes have arrived. No more than the given field
 *       length is ever taken from the stream, so the next value on it stays
 *       in place.</li>
 * </ul>
 *
 * <p>The wrapped buffer's reader index advances as bytes are consumed. The
 * caller keeps ownership of a wrapped buffer, including its release.</p>
 */
public final class ByteBufEwkbReadBuffer implements EwkbReadBuffer
{
    /**
     * Smallest bounded buffer accepted; one XYZ coordinate plus a full header
     * must always fit.
     */
    public static final int MIN_BUFFER_SIZE = 32;

    private final ByteBuf buf;
    private final InputStream source;
    private final int bufferSize;

    /** Bytes still allowed to be taken from {@link #source}. */
    private long sourceRemaining;

    private ByteBufEwkbReadBuffer(ByteBuf buf, InputStream source, int bufferSize, long sourceRemaining)
    {
        this.buf = buf;
        this.source = source;
        this.bufferSize = bufferSize;
        this.sourceRemaining = sourceRemaining;
    }

    /**
     * Reads from a buffer that already holds the whole value.
     */
    public static ByteBufEwkbReadBuffer wrap(ByteBuf buf)
    {
        return new ByteBufEwkbReadBuffer(Objects.requireNonNull(buf, "buf"), null, Integer.MAX_VALUE, 0);
    }

    /**
     * Reads from a stream through a bounded buffer of {@code bufferSize} bytes,
     * taking at most {@code limit} bytes from it.
     */
    public static ByteBufEwkbReadBuffer over(InputStream source, int bufferSize, long limit)
    {
        Objects.requireNonNull(source, "source");
        if (bufferSize < MIN_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                    "bufferSize must be at least " + MIN_BUFFER_SIZE + " (was " + bufferSize + ")");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative (was " + limit + ")");
        }
        return new ByteBufEwkbReadBuffer(Unpooled.buffer(bufferSize, bufferSize), source, bufferSize, limit);
    }

    /**
     * Reads from a stream through a bounded buffer of {@code bufferSize} bytes,
     * with no limit on how much is taken from it.
     */
    public static ByteBufEwkbReadBuffer over(InputStream source, int bufferSize)
    {
        return over(source, bufferSize, Long.MAX_VALUE);
    }

    /**
     * Returns the bytes not yet consumed: those buffered plus those the stream
     * may still supply under the limit. Zero for an exhausted wrapped buffer.
     */
    public long unreadBytes()
    {
        return buf.readableBytes() + sourceRemaining;
    }

    @Override
    public void ensure(int count) throws IOException
    {
        if (count < 0 || count > bufferSize) {
            throw new IllegalArgumentException(
                    "Cannot ensure " + count + " bytes in a buffer of " + bufferSize);
        }
        if (buf.readableBytes() >= count) {
            return;
        }
        if (source == null) {
            throw new EOFException(
                    "Needed " + count + " bytes but only " + buf.readableBytes() + " remain");
        }

        buf.discardReadBytes();
        while (buf.readableBytes() < count) {
            final int want = (int) Math.min(buf.writableBytes(), sourceRemaining);
            if (want == 0) {
                throw new EOFException(
                        "Field ended with " + buf.readableBytes() + " of " + count + " needed bytes");
            }
            final int read = buf.writeBytes(source, want);
            if (read < 0) {
                throw new EOFException(
                        "Stream ended with " + buf.readableBytes() + " of " + count + " needed bytes");
            }
            sourceRemaining -= read;
        }
    }

    @Override
    public int readByte()
    {
        return buf.readUnsignedByte();
    }

    @Override
    public long readUInt32(EwkbByteOrder order)
    {
        return order == EwkbByteOrder.LITTLE_ENDIAN ? buf.readUnsignedIntLE() : buf.readUnsignedInt();
    }

    @Override
    public double readDouble(EwkbByteOrder order)
    {
        long bits = order == EwkbByteOrder.LITTLE_ENDIAN ? buf.readLongLE() : buf.readLong();
        return Double.longBitsToDouble(bits);
    }

    @Override
    public void readBytes(byte[] dst, int offset, int length)
    {
        buf.readBytes(dst, offset, length);
    }

    @Override
    public void skip(int count) throws IOException
    {
        int remaining = count;
        while (remaining > 0) {
            int chunk = Math.min(remaining, bufferSize);
            ensure(chunk);
            buf.skipBytes(chunk);
            remaining -= chunk;
        }
    }

    @Override
    public int bufferSize()
    {
        return bufferSize;
    }
}
