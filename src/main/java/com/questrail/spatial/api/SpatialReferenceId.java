package com.questrail.spatial.api;

import java.util.Objects;

/**
 * Strongly typed spatial reference identifier (SRID).
 *
 * <h2>Why this type exists</h2>
 * <p>
 * An SRID names the coordinate reference system of a whole geometry value.
 * On the wire it is an unsigned 32-bit integer, which Java cannot hold in an
 * {@code int} without sign confusion, and {@code 0} carries the special
 * meaning "unspecified". Wrapping the value keeps both rules in one place and
 * stops SRIDs from being mixed up with counts or shape codes.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>Valid values are {@code 0}–{@code 4294967295} (inclusive)</li>
 *   <li>{@code 0} is {@link #UNSPECIFIED} and is never written to the wire</li>
 * </ul>
 */
public final class SpatialReferenceId
{
    /**
     * Largest value representable as an unsigned 32-bit integer.
     */
    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    /**
     * The "no reference system" marker.
     */
    public static final SpatialReferenceId UNSPECIFIED = new SpatialReferenceId(0L);

    private final long value;

    private SpatialReferenceId(long value) {
        this.value = value;
    }

    /**
     * Creates a {@code SpatialReferenceId} for the given numeric value.
     *
     * @param value the SRID (0–4294967295 inclusive)
     * @return the identifier; {@link #UNSPECIFIED} for {@code 0}
     * @throws IllegalArgumentException if the value is outside the valid range
     */
    public static SpatialReferenceId of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "SRID must be in range 0–" + MAX_VALUE + " (was " + value + ")"
            );
        }
        return value == 0 ? UNSPECIFIED : new SpatialReferenceId(value);
    }

    /**
     * Returns the numeric SRID value.
     */
    public long value() {
        return value;
    }

    /**
     * Returns {@code true} unless this is {@link #UNSPECIFIED}.
     */
    public boolean isSpecified() {
        return value != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpatialReferenceId that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "SRID[" + value + "]";
    }
}
