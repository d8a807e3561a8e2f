package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A surface bounded by rings: the exterior ring first, then any holes.
 *
 * <p>Wire body: ring count, then per ring a point count and its coordinates.
 * Ring closure and orientation are not checked.</p>
 */
public record Polygon(
        Dimensionality dimensionality,
        List<List<Coordinate>> rings,
        SpatialReferenceId srid
) implements Geometry
{
    public Polygon {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        rings = ModelChecks.rings(dimensionality, rings);
    }

    /**
     * Creates a polygon, taking the dimensionality from the first coordinate of
     * the first non-empty ring ({@link Dimensionality#XY} when there is none).
     */
    @SafeVarargs
    public static Polygon of(List<Coordinate>... rings) {
        List<List<Coordinate>> list = Arrays.asList(rings);
        return new Polygon(ModelChecks.firstOfRings(list), list, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.POLYGON;
    }

    @Override
    public Polygon withSrid(SpatialReferenceId srid) {
        return new Polygon(dimensionality, rings, srid);
    }
}
