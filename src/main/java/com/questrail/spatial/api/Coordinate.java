package com.questrail.spatial.api;

/**
 * Immutable coordinate tuple.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link CoordinateXY}: planar coordinates</li>
 *   <li>{@link CoordinateXYZ}: coordinates with a third ordinate</li>
 * </ul>
 *
 * <p>The variant a coordinate belongs to is its {@link Dimensionality}.
 * Geometry containers reject coordinates whose dimensionality does not match
 * their own, so a single tree never mixes the two.</p>
 */
public sealed interface Coordinate permits CoordinateXY, CoordinateXYZ
{
    double x();

    double y();

    /**
     * Returns the dimensionality implied by this coordinate's variant.
     */
    Dimensionality dimensionality();

    static CoordinateXY of(double x, double y) {
        return new CoordinateXY(x, y);
    }

    static CoordinateXYZ of(double x, double y, double z) {
        return new CoordinateXYZ(x, y, z);
    }
}
