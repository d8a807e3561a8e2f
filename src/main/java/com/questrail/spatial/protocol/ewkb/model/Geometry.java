package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

/**
 * Canonical in-memory representation of a PostGIS geometry value.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code Geometry} is a closed union over the seven OGC base shapes. Each
 * variant is an immutable record parameterized by its {@link Dimensionality},
 * so a single recursive codec can serve every shape in both 2D and 3D.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every coordinate and nested element has the same dimensionality as
 *       the value that contains it</li>
 *   <li>The {@link #srid()} belongs to the outermost value. Elements nested
 *       inside a multi-shape or collection may carry one, but it is never
 *       encoded and decodes as {@link SpatialReferenceId#UNSPECIFIED}</li>
 *   <li>Values are immutable; encoding never alters them</li>
 * </ul>
 *
 * <p>
 * Nothing here checks geometric well-formedness. Open rings, self
 * intersections and degenerate shapes are carried as given.
 * </p>
 */
public sealed interface Geometry
        permits Point, LineString, Polygon, MultiPoint, MultiLineString, MultiPolygon, GeometryCollection
{
    /**
     * Returns the base shape of this value.
     */
    ShapeKind kind();

    /**
     * Returns the dimensionality shared by every coordinate in this value.
     */
    Dimensionality dimensionality();

    /**
     * Returns the spatial reference identifier of this value.
     */
    SpatialReferenceId srid();

    /**
     * Returns a copy of this value carrying the given SRID.
     */
    Geometry withSrid(SpatialReferenceId srid);
}
