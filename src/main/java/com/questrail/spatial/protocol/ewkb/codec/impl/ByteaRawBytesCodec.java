package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.protocol.ewkb.codec.RawBytesCodec;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import java.io.IOException;
import java.util.Objects;

/**
 * ByteaRawBytesCodec
 * -----------------------------------------------------------------------------
 * {@link RawBytesCodec} that copies a field value verbatim, the way a
 * {@code bytea} column is transferred.
 *
 * <p>Bytes move in chunks no larger than the buffer, so values bigger than
 * the transport buffer still stream through it.</p>
 */
public final class ByteaRawBytesCodec implements RawBytesCodec
{
    @Override
    public byte[] read(EwkbReadBuffer buffer, int length) throws IOException
    {
        Objects.requireNonNull(buffer, "buffer");
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative (was " + length + ")");
        }

        final byte[] value = new byte[length];
        int pos = 0;
        while (pos < length) {
            int chunk = Math.min(length - pos, buffer.bufferSize());
            buffer.ensure(chunk);
            buffer.readBytes(value, pos, chunk);
            pos += chunk;
        }
        return value;
    }

    @Override
    public int encodedLength(byte[] value)
    {
        return Objects.requireNonNull(value, "value").length;
    }

    @Override
    public void write(byte[] value, EwkbWriteBuffer buffer) throws IOException
    {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(buffer, "buffer");

        int pos = 0;
        while (pos < value.length) {
            if (buffer.writeSpaceLeft() == 0) {
                buffer.flush();
            }
            int chunk = Math.min(value.length - pos, buffer.writeSpaceLeft());
            buffer.writeBytes(value, pos, chunk);
            pos += chunk;
        }
    }
}
