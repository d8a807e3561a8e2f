/**
 * EWKB Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between the EWKB codec and whatever
 * buffered transport carries field values (a database wire connection, a file,
 * a Netty pipeline or a test fixture).
 *
 * <h2>Ownership</h2>
 * The transport owns its buffer. The codec borrows an {@link
 * com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer} or {@link
 * com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer} for the
 * duration of one decode or encode call and never keeps a reference.
 *
 * <h2>Blocking points</h2>
 * <ul>
 *   <li>{@code ensure(n)} before every fixed-size read</li>
 *   <li>{@code flush()} when a fixed-size write would not fit</li>
 * </ul>
 *
 * <p>Timeouts and cancellation belong to the transport. A failing transport
 * surfaces as {@link java.io.IOException}, which the codec propagates
 * unchanged.</p>
 */
package com.questrail.spatial.protocol.ewkb.transport;
