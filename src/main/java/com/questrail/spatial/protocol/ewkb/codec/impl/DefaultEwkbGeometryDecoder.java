package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.protocol.ewkb.codec.EwkbGeometryDecoder;
import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;

import java.io.IOException;
import java.util.Objects;

/**
 * DefaultEwkbGeometryDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EwkbGeometryDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Outer header: byte order, shape, Z/M flags, optional SRID</li>
 *   <li>Shape body, recursing through nested mini-headers</li>
 *   <li>Attaching the outer SRID to the root value only</li>
 * </ol>
 *
 * <p>Any failure aborts the whole value; nothing partially decoded escapes.</p>
 */
public final class DefaultEwkbGeometryDecoder implements EwkbGeometryDecoder
{
    @Override
    public Geometry decode(EwkbReadBuffer buffer) throws IOException
    {
        Objects.requireNonNull(buffer, "buffer");

        final EwkbHeader header = EwkbHeaderCodec.decode(buffer);
        final Geometry body = EwkbShapeCodec.decode(
                buffer, header.kind(), header.dimensionality(), header.byteOrder());

        return header.srid().isSpecified() ? body.withSrid(header.srid()) : body;
    }
}
