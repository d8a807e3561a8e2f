/**
 * EWKB Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete codec that bridges buffered transport
 * bytes and the {@link com.questrail.spatial.protocol.ewkb.model.Geometry}
 * model.</p>
 *
 * <h2>Normative Authority</h2>
 * <p>The wire layout is PostGIS extended WKB: OGC WKB (Simple Feature Access,
 * Part 1, §8.2) with the SRID, Z and M flags carried in the high bits of the
 * type word.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   EwkbReadBuffer
 *        → EwkbHeaderCodec.decode
 *        → EwkbShapeCodec.decode   (re-enters EwkbHeaderCodec per element)
 *        → Geometry
 *
 *   Geometry
 *        → EwkbHeaderCodec.encode
 *        → EwkbShapeCodec.encode   (re-enters EwkbHeaderCodec per element)
 *        → EwkbWriteBuffer
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>stateless</li>
 *   <li>transport-agnostic</li>
 *   <li>geometry-agnostic (no validation, no reprojection)</li>
 * </ul>
 *
 * <p>Any failure aborts the value being processed.</p>
 */
package com.questrail.spatial.protocol.ewkb.codec.impl;
