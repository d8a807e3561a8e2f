package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of positions.
 *
 * <p>Wire body: point count, then that many coordinates.</p>
 */
public record LineString(
        Dimensionality dimensionality,
        List<Coordinate> points,
        SpatialReferenceId srid
) implements Geometry
{
    public LineString {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        points = ModelChecks.coordinates(dimensionality, points, "points");
    }

    /**
     * Creates a line string, taking the dimensionality from the first point
     * ({@link Dimensionality#XY} when empty).
     */
    public static LineString of(Coordinate... points) {
        List<Coordinate> list = Arrays.asList(points);
        return new LineString(ModelChecks.firstOf(list), list, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.LINE_STRING;
    }

    @Override
    public LineString withSrid(SpatialReferenceId srid) {
        return new LineString(dimensionality, points, srid);
    }
}
