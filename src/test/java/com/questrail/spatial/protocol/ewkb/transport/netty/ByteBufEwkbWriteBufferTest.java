package com.questrail.spatial.protocol.ewkb.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

final class ByteBufEwkbWriteBufferTest
{
    @Test
    void boundedBufferDrainsOnFlush() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBufEwkbWriteBuffer buffer = ByteBufEwkbWriteBuffer.over(out, 32);

        assertEquals(32, buffer.writeSpaceLeft());
        buffer.writeByte(0);
        buffer.writeInt32(0x2000_0001);
        buffer.writeDouble(1.0);
        assertEquals(19, buffer.writeSpaceLeft());
        assertEquals(0, out.size());

        buffer.flush();

        assertEquals(13, out.size());
        assertEquals(32, buffer.writeSpaceLeft());
        ByteBuffer written = ByteBuffer.wrap(out.toByteArray());
        assertEquals(0, written.get());
        assertEquals(0x2000_0001, written.getInt());
        assertEquals(1.0, written.getDouble());
    }

    @Test
    void wrappedBufferGrowsAndIgnoresFlush() throws IOException
    {
        ByteBuf buf = Unpooled.buffer(4);
        try {
            ByteBufEwkbWriteBuffer buffer = ByteBufEwkbWriteBuffer.wrap(buf);
            for (int i = 0; i < 10; i++) {
                buffer.writeDouble(i);
            }
            buffer.flush();

            assertEquals(80, buf.readableBytes());
            assertEquals(9.0, buf.getDouble(72));
        }
        finally {
            buf.release();
        }
    }

    @Test
    void flushOfEmptyBufferWritesNothing() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBufEwkbWriteBuffer.over(out, 32).flush();

        assertEquals(0, out.size());
    }

    @Test
    void rejectsTinyBuffers()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ByteBufEwkbWriteBuffer.over(new ByteArrayOutputStream(), 8));
    }
}
