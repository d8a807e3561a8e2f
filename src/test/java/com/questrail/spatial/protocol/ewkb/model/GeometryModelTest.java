package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GeometryModelTest
 * -----------------------------------------------------------------------------
 * Construction invariants of the geometry records: uniform dimensionality,
 * defensive copies, SRID replacement.
 */
final class GeometryModelTest
{
    @Test
    void pointTakesDimensionalityFromCoordinate()
    {
        assertEquals(Dimensionality.XY, Point.of(1, 2).dimensionality());
        assertEquals(Dimensionality.XYZ, Point.of(1, 2, 3).dimensionality());
        assertEquals(ShapeKind.POINT, Point.of(1, 2).kind());
    }

    @Test
    void lineStringRejectsMixedCoordinates()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> LineString.of(Coordinate.of(0, 0), Coordinate.of(1, 1, 1)));
        assertTrue(e.getMessage().startsWith("Mixed dimensionality"));
    }

    @Test
    void polygonRejectsRingOfOtherDimensionality()
    {
        List<Coordinate> xy = List.of(Coordinate.of(0, 0), Coordinate.of(1, 0), Coordinate.of(0, 0));
        List<Coordinate> xyz = List.of(Coordinate.of(0, 0, 0), Coordinate.of(1, 0, 0), Coordinate.of(0, 0, 0));

        assertThrows(IllegalArgumentException.class,
                () -> new Polygon(Dimensionality.XY, List.of(xy, xyz), SpatialReferenceId.UNSPECIFIED));
    }

    @Test
    void collectionRejectsElementOfOtherDimensionality()
    {
        assertThrows(IllegalArgumentException.class,
                () -> GeometryCollection.of(Dimensionality.XY, List.of(Point.of(1, 2), Point.of(1, 2, 3))));
    }

    @Test
    void listsAreCopiedAndUnmodifiable()
    {
        List<Coordinate> source = new ArrayList<>(List.of(Coordinate.of(0, 0), Coordinate.of(1, 1)));
        LineString line = new LineString(Dimensionality.XY, source, SpatialReferenceId.UNSPECIFIED);

        source.add(Coordinate.of(2, 2));

        assertEquals(2, line.points().size());
        assertThrows(UnsupportedOperationException.class, () -> line.points().add(Coordinate.of(3, 3)));
    }

    @Test
    void emptyGeometriesDefaultToXy()
    {
        assertEquals(Dimensionality.XY, LineString.of().dimensionality());
        assertEquals(Dimensionality.XY, MultiPoint.of().dimensionality());
        assertEquals(Dimensionality.XY, Polygon.of().dimensionality());
    }

    @Test
    void polygonSkipsEmptyLeadingRing()
    {
        List<Coordinate> ring = List.of(Coordinate.of(0, 0, 1), Coordinate.of(1, 0, 1), Coordinate.of(0, 0, 1));

        Polygon polygon = Polygon.of(List.of(), ring);

        assertEquals(Dimensionality.XYZ, polygon.dimensionality());
        assertEquals(2, polygon.rings().size());
    }

    @Test
    void withSridReturnsCopy()
    {
        MultiPoint original = MultiPoint.of(Coordinate.of(1, 2));
        MultiPoint tagged = original.withSrid(SpatialReferenceId.of(4326));

        assertEquals(SpatialReferenceId.UNSPECIFIED, original.srid());
        assertEquals(SpatialReferenceId.of(4326), tagged.srid());
        assertEquals(original.points(), tagged.points());
    }

    @Test
    void shapeCodesResolveOnlyInRange()
    {
        assertEquals(ShapeKind.POINT, ShapeKind.fromCode(1).orElseThrow());
        assertEquals(ShapeKind.GEOMETRY_COLLECTION, ShapeKind.fromCode(7).orElseThrow());
        assertTrue(ShapeKind.fromCode(0).isEmpty());
        assertTrue(ShapeKind.fromCode(8).isEmpty());
        assertTrue(ShapeKind.fromCode(-1).isEmpty());
    }
}
