package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException;
import com.questrail.spatial.protocol.ewkb.codec.EwkbGeometryEncoder;
import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import java.io.IOException;
import java.util.Objects;

/**
 * DefaultEwkbGeometryEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EwkbGeometryEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultEwkbGeometryDecoder}, with
 * two canonicalizations: output is always big-endian, and a value decoded from
 * an M-only stream is written back with the Z flag.</p>
 */
public final class DefaultEwkbGeometryEncoder implements EwkbGeometryEncoder
{
    @Override
    public int encodedLength(Geometry geometry)
    {
        Objects.requireNonNull(geometry, "geometry");

        final long length = EwkbHeaderCodec.encodedLength(geometry.srid())
                + EwkbShapeCodec.bodyLength(geometry);
        if (length > Integer.MAX_VALUE) {
            throw new EwkbCodecException("Encoded geometry too large: " + length + " bytes");
        }
        return (int) length;
    }

    @Override
    public void encode(Geometry geometry, EwkbWriteBuffer buffer) throws IOException
    {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(buffer, "buffer");

        EwkbHeaderCodec.encode(buffer, geometry.kind(), geometry.dimensionality(), geometry.srid());
        EwkbShapeCodec.encode(buffer, geometry);
    }
}
