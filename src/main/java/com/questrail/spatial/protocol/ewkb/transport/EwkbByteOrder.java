package com.questrail.spatial.protocol.ewkb.transport;

import java.util.Optional;

/**
 * Byte order selector carried as the first byte of every EWKB header.
 */
public enum EwkbByteOrder
{
    /** XDR, marker {@code 0}. The only order this library writes. */
    BIG_ENDIAN(0),

    /** NDR, marker {@code 1}. */
    LITTLE_ENDIAN(1);

    private final int marker;

    EwkbByteOrder(int marker) {
        this.marker = marker;
    }

    /**
     * Returns the wire marker byte (0 or 1).
     */
    public int marker() {
        return marker;
    }

    /**
     * Looks up the order for a marker byte.
     *
     * @return the order, or {@link Optional#empty()} for any marker other than 0 or 1
     */
    public static Optional<EwkbByteOrder> fromMarker(int marker) {
        return switch (marker) {
            case 0 -> Optional.of(BIG_ENDIAN);
            case 1 -> Optional.of(LITTLE_ENDIAN);
            default -> Optional.empty();
        };
    }
}
