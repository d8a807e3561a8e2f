package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbWriteBuffer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

final class ByteaRawBytesCodecTest
{
    private final ByteaRawBytesCodec codec = new ByteaRawBytesCodec();

    @Test
    void copiesValuesLargerThanTheBuffer() throws IOException
    {
        byte[] value = new byte[100];
        for (int i = 0; i < value.length; i++) {
            value[i] = (byte) i;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBufEwkbWriteBuffer writeBuffer = ByteBufEwkbWriteBuffer.over(out, 32);
        codec.write(value, writeBuffer);
        writeBuffer.flush();
        assertArrayEquals(value, out.toByteArray());

        byte[] read = codec.read(ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(out.toByteArray()), 32), 100);
        assertArrayEquals(value, read);
    }

    @Test
    void lengthIsArrayLength()
    {
        assertEquals(0, codec.encodedLength(new byte[0]));
        assertEquals(7, codec.encodedLength(new byte[7]));
    }

    @Test
    void shortStreamFailsWithEof()
    {
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(new byte[10]), 32);

        assertThrows(EOFException.class, () -> codec.read(buffer, 11));
    }

    @Test
    void rejectsNegativeLength()
    {
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(new byte[0]), 32);

        assertThrows(IllegalArgumentException.class, () -> codec.read(buffer, -1));
    }
}
