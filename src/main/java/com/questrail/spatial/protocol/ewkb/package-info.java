/**
 * PostGIS Geometry over EWKB
 * =============================================================================
 *
 * <p>Root of the EWKB codec. {@link
 * com.questrail.spatial.protocol.ewkb.EwkbGeometryTypeHandler} is the entry
 * point; the sub-packages split the work by layer:</p>
 *
 * <ul>
 *   <li>{@code model}: the sealed {@code Geometry} union</li>
 *   <li>{@code codec}: decoder/encoder ports and errors</li>
 *   <li>{@code codec.impl}: the header and recursive shape codecs</li>
 *   <li>{@code transport}: buffered transport ports</li>
 *   <li>{@code transport.netty}: {@code ByteBuf} buffers and pipeline framing</li>
 *   <li>{@code observability}: event sinks</li>
 *   <li>{@code config}: handler configuration</li>
 * </ul>
 */
package com.questrail.spatial.protocol.ewkb;
