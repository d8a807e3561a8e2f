package com.questrail.spatial.api;

/**
 * Dimensionality
 * -----------------------------------------------------------------------------
 * Number of ordinates carried by every coordinate of a geometry tree.
 *
 * <p>The model is deliberately binary. EWKB can flag Z, M or both, but this
 * library has no separate measure slot: any of those variants is carried as a
 * third ordinate and surfaces as {@link #XYZ}.</p>
 */
public enum Dimensionality
{
    /** Two ordinates, X and Y. */
    XY(2),

    /** Three ordinates, X, Y and a third (Z, or M collapsed onto Z). */
    XYZ(3);

    private final int ordinates;

    Dimensionality(int ordinates) {
        this.ordinates = ordinates;
    }

    /**
     * Returns the number of ordinates per coordinate (2 or 3).
     */
    public int ordinates() {
        return ordinates;
    }

    /**
     * Returns the encoded size of one coordinate in bytes (8 per ordinate).
     */
    public int coordinateSize() {
        return ordinates * Double.BYTES;
    }
}
