package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.Objects;

/**
 * A single position.
 *
 * <p>Wire body: one coordinate, no length prefix.</p>
 */
public record Point(
        Coordinate coordinate,
        SpatialReferenceId srid
) implements Geometry
{
    public Point {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(srid, "srid");
    }

    public static Point of(Coordinate coordinate) {
        return new Point(coordinate, SpatialReferenceId.UNSPECIFIED);
    }

    public static Point of(double x, double y) {
        return of(Coordinate.of(x, y));
    }

    public static Point of(double x, double y, double z) {
        return of(Coordinate.of(x, y, z));
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.POINT;
    }

    @Override
    public Dimensionality dimensionality() {
        return coordinate.dimensionality();
    }

    @Override
    public Point withSrid(SpatialReferenceId srid) {
        return new Point(coordinate, srid);
    }
}
