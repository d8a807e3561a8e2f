package com.questrail.spatial.protocol.ewkb.codec;

import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import java.io.IOException;

/**
 * EwkbGeometryEncoder
 * -----------------------------------------------------------------------------
 * Encoder from a {@link Geometry} to canonical EWKB bytes.
 *
 * <p>Output is always big-endian. The outer header carries the SRID when it is
 * specified; nested element headers never do.</p>
 *
 * <p>Transports that frame values with a length prefix call
 * {@link #encodedLength(Geometry)} first. It must agree exactly with the
 * number of bytes {@link #encode(Geometry, EwkbWriteBuffer)} then writes.</p>
 */
public interface EwkbGeometryEncoder
{
    /**
     * Returns the exact number of bytes {@code encode} will write for
     * {@code geometry}, header included.
     *
     * @throws EwkbCodecException if the length exceeds {@link Integer#MAX_VALUE}
     */
    int encodedLength(Geometry geometry);

    /**
     * Encode {@code geometry} into {@code buffer}, flushing as needed.
     *
     * @throws IOException if the transport fails while flushing
     */
    void encode(Geometry geometry, EwkbWriteBuffer buffer) throws IOException;
}
