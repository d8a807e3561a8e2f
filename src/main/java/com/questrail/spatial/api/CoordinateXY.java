package com.questrail.spatial.api;

/**
 * Planar coordinate.
 */
public record CoordinateXY(double x, double y) implements Coordinate
{
    @Override
    public Dimensionality dimensionality() {
        return Dimensionality.XY;
    }
}
