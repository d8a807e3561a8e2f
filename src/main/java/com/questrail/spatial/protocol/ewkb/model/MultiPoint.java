package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An unordered set of positions, kept in insertion order.
 *
 * <p>Wire body: element count, then per element a mini-header and one
 * coordinate.</p>
 */
public record MultiPoint(
        Dimensionality dimensionality,
        List<Coordinate> points,
        SpatialReferenceId srid
) implements Geometry
{
    public MultiPoint {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        points = ModelChecks.coordinates(dimensionality, points, "points");
    }

    public static MultiPoint of(Coordinate... points) {
        List<Coordinate> list = Arrays.asList(points);
        return new MultiPoint(ModelChecks.firstOf(list), list, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.MULTI_POINT;
    }

    @Override
    public MultiPoint withSrid(SpatialReferenceId srid) {
        return new MultiPoint(dimensionality, points, srid);
    }
}
