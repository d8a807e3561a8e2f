package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.List;
import java.util.Objects;

/**
 * A heterogeneous collection of geometries, which may itself contain
 * collections to any depth.
 *
 * <p>Wire body: element count, then each element as a full header (without
 * SRID) followed by its own body.</p>
 *
 * <p>All elements must share the collection's dimensionality. The decoder
 * reads every element with the enclosing dimensionality, so a mixed tree
 * could not survive a round trip.</p>
 */
public record GeometryCollection(
        Dimensionality dimensionality,
        List<Geometry> geometries,
        SpatialReferenceId srid
) implements Geometry
{
    public GeometryCollection {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        geometries = ModelChecks.elements(dimensionality, geometries, "geometries");
    }

    public static GeometryCollection of(Dimensionality dimensionality, List<Geometry> geometries) {
        return new GeometryCollection(dimensionality, geometries, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.GEOMETRY_COLLECTION;
    }

    @Override
    public GeometryCollection withSrid(SpatialReferenceId srid) {
        return new GeometryCollection(dimensionality, geometries, srid);
    }
}
