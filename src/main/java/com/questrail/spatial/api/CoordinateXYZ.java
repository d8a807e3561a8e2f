package com.questrail.spatial.api;

/**
 * Coordinate with a third ordinate.
 *
 * <p>When decoded from an M-only EWKB value, {@link #z()} holds the measure.</p>
 */
public record CoordinateXYZ(double x, double y, double z) implements Coordinate
{
    @Override
    public Dimensionality dimensionality() {
        return Dimensionality.XYZ;
    }
}
