/**
 * EWKB Codec Ports
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> boundary for PostGIS
 * geometry values, together with the exceptions it raises.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> the type handler that a
 * value-transfer layer invokes, and <strong>above</strong> the buffered
 * transport:</p>
 *
 * <pre>
 *   EwkbGeometryTypeHandler
 *        → EwkbGeometryDecoder / EwkbGeometryEncoder
 *            → EwkbReadBuffer / EwkbWriteBuffer
 * </pre>
 *
 * <h2>Error taxonomy</h2>
 * <ul>
 *   <li>{@link com.questrail.spatial.protocol.ewkb.codec.UnrecognizedShapeCodeException}:
 *       a header names an unknown shape, at any depth</li>
 *   <li>{@link com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException}:
 *       any other malformed value</li>
 *   <li>{@link java.io.IOException}: transport failure, propagated unchanged</li>
 *   <li>{@link com.questrail.spatial.protocol.ewkb.codec.MisconfiguredFallbackException}:
 *       raw byte access without a raw codec</li>
 * </ul>
 *
 * <p>None of these is retried inside the codec.</p>
 */
package com.questrail.spatial.protocol.ewkb.codec;
