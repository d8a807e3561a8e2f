package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException;
import com.questrail.spatial.protocol.ewkb.codec.UnrecognizedShapeCodeException;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;
import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import java.io.IOException;

/**
 * EwkbHeaderCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the fixed-layout prefix of an EWKB value.
 *
 * <pre>
 *   Header   := ByteOrder(1) TypeWord(4) [SRID(4)]
 *   TypeWord := bits 0..28 shape code, bit 29 SRID, bit 30 M, bit 31 Z
 * </pre>
 *
 * <p>Stateless; no recursion. The shape codec calls back into this class for
 * the mini-header in front of every nested element.</p>
 */
final class EwkbHeaderCodec
{
    /** Z ordinate present. */
    static final long Z_FLAG = 0x8000_0000L;

    /** M ordinate present; carried in the third ordinate like Z. */
    static final long M_FLAG = 0x4000_0000L;

    /** SRID field follows the type word. */
    static final long SRID_FLAG = 0x2000_0000L;

    private static final long FLAG_MASK = Z_FLAG | M_FLAG | SRID_FLAG;

    /** Shape bits of a nested element's type word. */
    private static final long ELEMENT_SHAPE_MASK = 0x7L;

    /** Byte order marker plus type word. */
    static final int HEADER_SIZE = 5;

    /** An unsigned 32-bit count or SRID. */
    static final int UINT32_SIZE = 4;

    private EwkbHeaderCodec() {}

    /**
     * Reads an outer header. The type word minus its flag bits must be a shape
     * code from 1 to 7. When the SRID flag is set the SRID field is always
     * consumed, here and for nested elements, so the stream stays aligned.
     *
     * @throws UnrecognizedShapeCodeException if the shape code is outside 1–7
     * @throws EwkbCodecException if the byte order marker is neither 0 nor 1
     */
    static EwkbHeader decode(EwkbReadBuffer buffer) throws IOException
    {
        return decode(buffer, ~FLAG_MASK);
    }

    /**
     * Reads the mini-header in front of a nested element. Only the low three
     * bits name the shape, so ISO-style codes such as 1001 (PointZ) resolve
     * to their base shape; a zero shape code is still rejected.
     *
     * @throws UnrecognizedShapeCodeException if the low three bits are zero
     */
    static EwkbHeader decodeElement(EwkbReadBuffer buffer) throws IOException
    {
        return decode(buffer, ELEMENT_SHAPE_MASK);
    }

    private static EwkbHeader decode(EwkbReadBuffer buffer, long shapeMask) throws IOException
    {
        buffer.ensure(HEADER_SIZE);

        final int marker = buffer.readByte();
        final EwkbByteOrder order = EwkbByteOrder.fromMarker(marker)
                .orElseThrow(() -> new EwkbCodecException("Unrecognized EWKB byte order marker: " + marker));

        final long typeWord = buffer.readUInt32(order);
        final ShapeKind kind = ShapeKind.fromCode(typeWord & shapeMask)
                .orElseThrow(() -> new UnrecognizedShapeCodeException(typeWord));

        SpatialReferenceId srid = SpatialReferenceId.UNSPECIFIED;
        if ((typeWord & SRID_FLAG) != 0) {
            buffer.ensure(UINT32_SIZE);
            srid = SpatialReferenceId.of(buffer.readUInt32(order));
        }

        return new EwkbHeader(order, kind, dimensionalityOf(typeWord), srid, typeWord);
    }

    /**
     * Writes a big-endian header. The SRID flag and field are emitted only for
     * a specified SRID.
     */
    static void encode(EwkbWriteBuffer buffer,
                       ShapeKind kind,
                       Dimensionality dimensionality,
                       SpatialReferenceId srid) throws IOException
    {
        reserve(buffer, encodedLength(srid));

        buffer.writeByte(EwkbByteOrder.BIG_ENDIAN.marker());
        buffer.writeInt32((int) typeWord(kind, dimensionality, srid));
        if (srid.isSpecified()) {
            buffer.writeInt32((int) srid.value());
        }
    }

    static int encodedLength(SpatialReferenceId srid)
    {
        return srid.isSpecified() ? HEADER_SIZE + UINT32_SIZE : HEADER_SIZE;
    }

    static long typeWord(ShapeKind kind, Dimensionality dimensionality, SpatialReferenceId srid)
    {
        long word = kind.code();
        if (dimensionality == Dimensionality.XYZ) {
            word |= Z_FLAG;
        }
        if (srid.isSpecified()) {
            word |= SRID_FLAG;
        }
        return word;
    }

    /**
     * Flushes {@code buffer} when fewer than {@code size} bytes of space remain.
     */
    static void reserve(EwkbWriteBuffer buffer, int size) throws IOException
    {
        if (buffer.writeSpaceLeft() < size) {
            buffer.flush();
        }
    }

    private static Dimensionality dimensionalityOf(long typeWord)
    {
        // Z, M and ZM all map onto the three-ordinate coordinate.
        return (typeWord & (Z_FLAG | M_FLAG)) != 0 ? Dimensionality.XYZ : Dimensionality.XY;
    }
}
