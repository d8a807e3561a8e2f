package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.List;
import java.util.Objects;

/**
 * A collection of polygons.
 *
 * <p>Wire body: element count, then per element a mini-header and a polygon
 * body. The SRID of each nested polygon is not encoded.</p>
 */
public record MultiPolygon(
        Dimensionality dimensionality,
        List<Polygon> polygons,
        SpatialReferenceId srid
) implements Geometry
{
    public MultiPolygon {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        polygons = ModelChecks.elements(dimensionality, polygons, "polygons");
    }

    public static MultiPolygon of(Dimensionality dimensionality, List<Polygon> polygons) {
        return new MultiPolygon(dimensionality, polygons, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.MULTI_POLYGON;
    }

    @Override
    public MultiPolygon withSrid(SpatialReferenceId srid) {
        return new MultiPolygon(dimensionality, polygons, srid);
    }
}
