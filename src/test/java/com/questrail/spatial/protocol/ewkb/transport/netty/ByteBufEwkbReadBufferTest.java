package com.questrail.spatial.protocol.ewkb.transport.netty;

import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ByteBufEwkbReadBufferTest
 * -----------------------------------------------------------------------------
 * Byte order handling, refill behavior and end-of-stream reporting.
 */
final class ByteBufEwkbReadBufferTest
{
    @Test
    void readsBothByteOrders() throws IOException
    {
        byte[] bytes = {
                0x00, 0x00, 0x00, 0x01,
                0x01, 0x00, 0x00, 0x00,
                (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF
        };
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(bytes));

        buffer.ensure(12);
        assertEquals(1L, buffer.readUInt32(EwkbByteOrder.BIG_ENDIAN));
        assertEquals(1L, buffer.readUInt32(EwkbByteOrder.LITTLE_ENDIAN));
        assertEquals(0xFFFF_FFFFL, buffer.readUInt32(EwkbByteOrder.BIG_ENDIAN));
    }

    @Test
    void readsDoublesInBothByteOrders() throws IOException
    {
        long bits = Double.doubleToLongBits(-12.5);
        ByteBuf buf = Unpooled.buffer();
        buf.writeLong(bits).writeLongLE(bits);
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.wrap(buf);

        buffer.ensure(16);
        assertEquals(-12.5, buffer.readDouble(EwkbByteOrder.BIG_ENDIAN));
        assertEquals(-12.5, buffer.readDouble(EwkbByteOrder.LITTLE_ENDIAN));
    }

    @Test
    void wrappedBufferReportsEof()
    {
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(new byte[3]));

        assertThrows(EOFException.class, () -> buffer.ensure(4));
    }

    @Test
    void refillsFromTrickleStream() throws IOException
    {
        byte[] bytes = new byte[100];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new OneByteAtATime(bytes), 32);

        for (int i = 0; i < bytes.length; i++) {
            buffer.ensure(1);
            assertEquals(i, buffer.readByte());
        }
    }

    @Test
    void ensureCompactsBeforeRefilling() throws IOException
    {
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(new byte[64]), 32);

        buffer.ensure(30);
        buffer.skip(30);
        // Two bytes remain buffered; 32 more only fit after discarding the consumed ones.
        buffer.ensure(32);
        byte[] dst = new byte[32];
        buffer.readBytes(dst, 0, 32);
        assertThrows(EOFException.class, () -> buffer.ensure(3));
    }

    @Test
    void skipSpansMoreThanOneBuffer() throws IOException
    {
        byte[] bytes = new byte[101];
        bytes[100] = 42;
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(bytes), 32);

        buffer.skip(100);
        buffer.ensure(1);
        assertEquals(42, buffer.readByte());
    }

    @Test
    void limitLeavesFollowingBytesOnTheStream() throws IOException
    {
        byte[] bytes = new byte[40];
        bytes[10] = 7;
        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(in, 32, 10);

        assertEquals(10, buffer.unreadBytes());
        buffer.ensure(10);
        buffer.skip(10);

        assertEquals(0, buffer.unreadBytes());
        assertThrows(EOFException.class, () -> buffer.ensure(1));
        assertEquals(30, in.available());
        assertEquals(7, in.read());
    }

    @Test
    void rejectsEnsureBeyondCapacity()
    {
        ByteBufEwkbReadBuffer buffer = ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(new byte[64]), 32);

        assertEquals(32, buffer.bufferSize());
        assertThrows(IllegalArgumentException.class, () -> buffer.ensure(33));
    }

    @Test
    void rejectsTinyBuffers()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ByteBufEwkbReadBuffer.over(new ByteArrayInputStream(new byte[0]), 16));
    }

    private static final class OneByteAtATime extends InputStream
    {
        private final byte[] bytes;
        private int pos;

        OneByteAtATime(byte[] bytes)
        {
            this.bytes = bytes;
        }

        @Override
        public int read()
        {
            return pos < bytes.length ? bytes[pos++] & 0xFF : -1;
        }

        @Override
        public int read(byte[] b, int off, int len)
        {
            if (len == 0) {
                return 0;
            }
            int next = read();
            if (next < 0) {
                return -1;
            }
            b[off] = (byte) next;
            return 1;
        }
    }
}
