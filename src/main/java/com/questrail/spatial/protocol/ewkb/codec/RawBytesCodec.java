package com.questrail.spatial.protocol.ewkb.codec;

import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import java.io.IOException;

/**
 * Pass-through codec for callers that want a geometry column's bytes without
 * decoding them.
 */
public interface RawBytesCodec
{
    byte[] read(EwkbReadBuffer buffer, int length) throws IOException;

    int encodedLength(byte[] value);

    void write(byte[] value, EwkbWriteBuffer buffer) throws IOException;
}
