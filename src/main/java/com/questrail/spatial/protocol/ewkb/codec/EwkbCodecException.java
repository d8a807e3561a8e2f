package com.questrail.spatial.protocol.ewkb.codec;

/**
 * Indicates that a value could not be translated between EWKB bytes and a
 * {@link com.questrail.spatial.protocol.ewkb.model.Geometry}.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown byte order marker</li>
 *   <li>An unsupported shape code (see {@link UnrecognizedShapeCodeException})</li>
 *   <li>An element count or encoded length beyond what Java can address</li>
 * </ul>
 *
 * The failure is fatal for the value being processed; no partial geometry is
 * ever returned.
 */
public class EwkbCodecException extends RuntimeException
{
    public EwkbCodecException(String message) {
        super(message);
    }

    public EwkbCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
