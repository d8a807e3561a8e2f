package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException;
import com.questrail.spatial.protocol.ewkb.codec.UnrecognizedShapeCodeException;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;
import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbWriteBuffer;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EwkbHeaderCodecTest
 * -----------------------------------------------------------------------------
 * Type word flags, byte order markers and SRID handling of the header codec.
 */
final class EwkbHeaderCodecTest
{
    @Test
    void decodesLittleEndianHeaderWithSrid() throws IOException
    {
        byte[] bytes = EwkbBytes.create()
                .header(true, 0x2000_0003L)
                .uint32(4326)
                .toArray();

        EwkbHeader header = decode(bytes);

        assertEquals(EwkbByteOrder.LITTLE_ENDIAN, header.byteOrder());
        assertEquals(ShapeKind.POLYGON, header.kind());
        assertEquals(Dimensionality.XY, header.dimensionality());
        assertEquals(SpatialReferenceId.of(4326), header.srid());
    }

    @Test
    void zAndMFlagsBothMeanThreeOrdinates() throws IOException
    {
        assertEquals(Dimensionality.XYZ, decode(EwkbBytes.create().header(false, 0x8000_0001L).toArray()).dimensionality());
        assertEquals(Dimensionality.XYZ, decode(EwkbBytes.create().header(false, 0x4000_0001L).toArray()).dimensionality());
        assertEquals(Dimensionality.XYZ, decode(EwkbBytes.create().header(false, 0xC000_0001L).toArray()).dimensionality());
        assertEquals(Dimensionality.XY, decode(EwkbBytes.create().header(false, 0x0000_0001L).toArray()).dimensionality());
    }

    @Test
    void rejectsShapeCodesOutsideOneToSeven()
    {
        UnrecognizedShapeCodeException zero = assertThrows(UnrecognizedShapeCodeException.class,
                () -> decode(EwkbBytes.create().header(false, 0x8000_0000L).toArray()));
        assertEquals(0x8000_0000L, zero.typeWord());

        assertThrows(UnrecognizedShapeCodeException.class,
                () -> decode(EwkbBytes.create().header(false, 8).toArray()));

        // ISO-style 1001 is not one of the seven codes once flags are cleared.
        assertThrows(UnrecognizedShapeCodeException.class,
                () -> decode(EwkbBytes.create().header(true, 1001).toArray()));
    }

    @Test
    void elementHeaderUsesLowThreeBitsOnly() throws IOException
    {
        byte[] iso = EwkbBytes.create().header(true, 1003).toArray();
        assertEquals(ShapeKind.POLYGON,
                EwkbHeaderCodec.decodeElement(ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(iso))).kind());

        // The outer header stays strict about the same type word.
        assertThrows(UnrecognizedShapeCodeException.class, () -> decode(iso));

        byte[] zero = EwkbBytes.create().header(false, 0x2000_0008L).uint32(4326).toArray();
        assertThrows(UnrecognizedShapeCodeException.class,
                () -> EwkbHeaderCodec.decodeElement(ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(zero))));
    }

    @Test
    void rejectsUnknownByteOrderMarker()
    {
        byte[] bytes = EwkbBytes.create().raw(2, 0, 0, 0, 1).toArray();

        EwkbCodecException e = assertThrows(EwkbCodecException.class, () -> decode(bytes));
        assertFalse(e instanceof UnrecognizedShapeCodeException);
    }

    @Test
    void typeWordCarriesZAndSridFlags()
    {
        SpatialReferenceId srid = SpatialReferenceId.of(4326);

        assertEquals(1L, EwkbHeaderCodec.typeWord(ShapeKind.POINT, Dimensionality.XY, SpatialReferenceId.UNSPECIFIED));
        assertEquals(0x2000_0001L, EwkbHeaderCodec.typeWord(ShapeKind.POINT, Dimensionality.XY, srid));
        assertEquals(0xA000_0007L, EwkbHeaderCodec.typeWord(ShapeKind.GEOMETRY_COLLECTION, Dimensionality.XYZ, srid));
    }

    @Test
    void encodedLengthDependsOnSridOnly()
    {
        assertEquals(5, EwkbHeaderCodec.encodedLength(SpatialReferenceId.UNSPECIFIED));
        assertEquals(9, EwkbHeaderCodec.encodedLength(SpatialReferenceId.of(1)));
    }

    @Test
    void encodeWritesBigEndianHeader() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBufEwkbWriteBuffer buffer = ByteBufEwkbWriteBuffer.over(out, 32);

        EwkbHeaderCodec.encode(buffer, ShapeKind.MULTI_POINT, Dimensionality.XYZ, SpatialReferenceId.of(3857));
        buffer.flush();

        byte[] expected = EwkbBytes.create().header(false, 0xA000_0004L).uint32(3857).toArray();
        assertArrayEquals(expected, out.toByteArray());
    }

    @Test
    void reserveFlushesOnlyWhenShort() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBufEwkbWriteBuffer buffer = ByteBufEwkbWriteBuffer.over(out, 32);
        buffer.writeBytes(new byte[28], 0, 28);

        EwkbHeaderCodec.reserve(buffer, 4);
        assertEquals(0, out.size());

        EwkbHeaderCodec.reserve(buffer, 5);
        assertEquals(28, out.size());
        assertEquals(32, buffer.writeSpaceLeft());
    }

    private static EwkbHeader decode(byte[] bytes) throws IOException
    {
        return EwkbHeaderCodec.decode(ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(bytes)));
    }
}
