package com.questrail.spatial.protocol.ewkb.codec;

import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;

import java.io.IOException;

/**
 * EwkbGeometryDecoder
 * -----------------------------------------------------------------------------
 * Decoder from EWKB bytes to a structured {@link Geometry}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Interpreting the header (byte order, shape, Z/M flags, SRID)</li>
 *   <li>Walking the shape body, recursing into nested elements</li>
 *   <li>Constructing a fully materialized {@link Geometry}</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Validating geometric well-formedness</li>
 *   <li>Reprojecting coordinates</li>
 *   <li>Retrying after a transport or format failure</li>
 * </ul>
 */
public interface EwkbGeometryDecoder
{
    /**
     * Decode exactly one geometry value starting at the buffer's current
     * position.
     *
     * @param buffer a buffer positioned at the first header byte
     * @return the decoded geometry
     * @throws UnrecognizedShapeCodeException if any header names an unknown shape
     * @throws EwkbCodecException if the value is otherwise malformed
     * @throws IOException if the transport fails or the stream is truncated
     */
    Geometry decode(EwkbReadBuffer buffer) throws IOException;
}
