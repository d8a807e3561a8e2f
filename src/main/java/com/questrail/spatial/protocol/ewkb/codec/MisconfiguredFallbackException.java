package com.questrail.spatial.protocol.ewkb.codec;

/**
 * Raised when a caller asks for undecoded bytes but the handler was built
 * without a {@link RawBytesCodec}. This is a setup error, not a data error.
 */
public final class MisconfiguredFallbackException extends IllegalStateException
{
    public MisconfiguredFallbackException(String message) {
        super(message);
    }
}
