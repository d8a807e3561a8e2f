package com.questrail.spatial.protocol.ewkb.transport.netty;

import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * ByteBufEwkbWriteBuffer
 * =============================================================================
 * Netty {@link ByteBuf} backed implementation of {@link EwkbWriteBuffer}.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@link #wrap(ByteBuf)}: appends to a caller-owned buffer that grows
 *       as needed; {@link #flush()} does nothing.</li>
 *   <li>{@link #over(OutputStream, int)}: a bounded buffer in front of a
 *       stream. {@link #flush()} drains it to the stream.</li>
 * </ul>
 */
public final class ByteBufEwkbWriteBuffer implements EwkbWriteBuffer
{
    private final ByteBuf buf;
    private final OutputStream sink;
    private final int bufferSize;

    private ByteBufEwkbWriteBuffer(ByteBuf buf, OutputStream sink, int bufferSize)
    {
        this.buf = buf;
        this.sink = sink;
        this.bufferSize = bufferSize;
    }

    /**
     * Appends to {@code buf}, growing it up to its max capacity.
     */
    public static ByteBufEwkbWriteBuffer wrap(ByteBuf buf)
    {
        Objects.requireNonNull(buf, "buf");
        return new ByteBufEwkbWriteBuffer(buf, null, buf.maxCapacity());
    }

    /**
     * Writes to a stream through a bounded buffer of {@code bufferSize} bytes.
     */
    public static ByteBufEwkbWriteBuffer over(OutputStream sink, int bufferSize)
    {
        Objects.requireNonNull(sink, "sink");
        if (bufferSize < ByteBufEwkbReadBuffer.MIN_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                    "bufferSize must be at least " + ByteBufEwkbReadBuffer.MIN_BUFFER_SIZE
                            + " (was " + bufferSize + ")");
        }
        return new ByteBufEwkbWriteBuffer(Unpooled.buffer(bufferSize, bufferSize), sink, bufferSize);
    }

    @Override
    public int writeSpaceLeft()
    {
        return buf.maxWritableBytes();
    }

    @Override
    public void writeByte(int value)
    {
        buf.writeByte(value);
    }

    @Override
    public void writeInt32(int value)
    {
        buf.writeInt(value);
    }

    @Override
    public void writeDouble(double value)
    {
        buf.writeDouble(value);
    }

    @Override
    public void writeBytes(byte[] src, int offset, int length)
    {
        buf.writeBytes(src, offset, length);
    }

    @Override
    public void flush() throws IOException
    {
        if (sink == null) {
            return;
        }
        if (buf.isReadable()) {
            buf.readBytes(sink, buf.readableBytes());
        }
        buf.clear();
        sink.flush();
    }

    @Override
    public int bufferSize()
    {
        return bufferSize;
    }
}
