package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.api.Coordinate;
import com.questrail.spatial.api.CoordinateXY;
import com.questrail.spatial.api.CoordinateXYZ;
import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException;
import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.model.GeometryCollection;
import com.questrail.spatial.protocol.ewkb.model.LineString;
import com.questrail.spatial.protocol.ewkb.model.MultiLineString;
import com.questrail.spatial.protocol.ewkb.model.MultiPoint;
import com.questrail.spatial.protocol.ewkb.model.MultiPolygon;
import com.questrail.spatial.protocol.ewkb.model.Point;
import com.questrail.spatial.protocol.ewkb.model.Polygon;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;
import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * EwkbShapeCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the shape-specific body that follows an EWKB header.
 *
 * <p>One recursive reader and one recursive writer cover all seven shapes in
 * both dimensionalities; the only thing that varies between 2D and 3D is the
 * coordinate width (16 or 24 bytes).</p>
 *
 * <h2>Body grammar</h2>
 * <pre>
 *   Point              := Coordinate
 *   LineString         := Count Coordinate*
 *   Polygon            := Count (Count Coordinate*)*
 *   MultiPoint         := Count (MiniHeader Coordinate)*
 *   MultiLineString    := Count (MiniHeader LineString)*
 *   MultiPolygon       := Count (MiniHeader Polygon)*
 *   GeometryCollection := Count (MiniHeader Body)*
 * </pre>
 *
 * <h2>Nested elements</h2>
 * <ul>
 *   <li>Each mini-header's byte order governs the element it introduces.</li>
 *   <li>Only the low three bits of a mini-header's type word name the
 *       element's shape.</li>
 *   <li>Elements are read with the <em>enclosing</em> dimensionality. Their own
 *       Z/M flags are not re-examined; PostGIS never emits a collection whose
 *       elements disagree with it, and other producers are read the same way
 *       for wire compatibility.</li>
 *   <li>Elements are written without SRID.</li>
 * </ul>
 *
 * <p>Stateless; safe for concurrent use on independent buffers.</p>
 */
final class EwkbShapeCodec
{
    private static final Logger log = LoggerFactory.getLogger(EwkbShapeCodec.class);

    /**
     * Upper bound on list pre-sizing, so a corrupt count fails on a short
     * stream rather than on a huge allocation.
     */
    private static final int PRESIZE_LIMIT = 1024;

    private EwkbShapeCodec() {}

    // ========================================================================
    // Decode
    // ========================================================================

    /**
     * Reads the body of a {@code kind} value. The result carries
     * {@link SpatialReferenceId#UNSPECIFIED}; attaching the outer SRID is the
     * caller's job.
     */
    static Geometry decode(EwkbReadBuffer buffer,
                           ShapeKind kind,
                           Dimensionality dimensionality,
                           EwkbByteOrder order) throws IOException
    {
        final SpatialReferenceId none = SpatialReferenceId.UNSPECIFIED;

        return switch (kind) {

            case POINT -> new Point(readCoordinate(buffer, dimensionality, order), none);

            case LINE_STRING -> new LineString(
                    dimensionality, readCoordinates(buffer, dimensionality, order), none);

            case POLYGON -> new Polygon(
                    dimensionality, readRings(buffer, dimensionality, order), none);

            case MULTI_POINT -> {
                final int count = readCount(buffer, order);
                final List<Coordinate> points = new ArrayList<>(presize(count));
                for (int i = 0; i < count; i++) {
                    EwkbHeader element = readElementHeader(buffer, dimensionality);
                    points.add(readCoordinate(buffer, dimensionality, element.byteOrder()));
                }
                yield new MultiPoint(dimensionality, points, none);
            }

            case MULTI_LINE_STRING -> {
                final int count = readCount(buffer, order);
                final List<LineString> lines = new ArrayList<>(presize(count));
                for (int i = 0; i < count; i++) {
                    EwkbHeader element = readElementHeader(buffer, dimensionality);
                    lines.add(new LineString(
                            dimensionality, readCoordinates(buffer, dimensionality, element.byteOrder()), none));
                }
                yield new MultiLineString(dimensionality, lines, none);
            }

            case MULTI_POLYGON -> {
                final int count = readCount(buffer, order);
                final List<Polygon> polygons = new ArrayList<>(presize(count));
                for (int i = 0; i < count; i++) {
                    EwkbHeader element = readElementHeader(buffer, dimensionality);
                    polygons.add(new Polygon(
                            dimensionality, readRings(buffer, dimensionality, element.byteOrder()), none));
                }
                yield new MultiPolygon(dimensionality, polygons, none);
            }

            case GEOMETRY_COLLECTION -> {
                final int count = readCount(buffer, order);
                final List<Geometry> geometries = new ArrayList<>(presize(count));
                for (int i = 0; i < count; i++) {
                    EwkbHeader element = readElementHeader(buffer, dimensionality);
                    geometries.add(decode(buffer, element.kind(), dimensionality, element.byteOrder()));
                }
                yield new GeometryCollection(dimensionality, geometries, none);
            }
        };
    }

    private static EwkbHeader readElementHeader(EwkbReadBuffer buffer, Dimensionality enclosing) throws IOException
    {
        EwkbHeader element = EwkbHeaderCodec.decodeElement(buffer);
        if (element.dimensionality() != enclosing && log.isDebugEnabled()) {
            log.debug("Nested {} declares {} inside a {} value; reading it as {}",
                    element.kind(), element.dimensionality(), enclosing, enclosing);
        }
        return element;
    }

    private static List<List<Coordinate>> readRings(EwkbReadBuffer buffer,
                                                    Dimensionality dimensionality,
                                                    EwkbByteOrder order) throws IOException
    {
        final int count = readCount(buffer, order);
        final List<List<Coordinate>> rings = new ArrayList<>(presize(count));
        for (int i = 0; i < count; i++) {
            rings.add(readCoordinates(buffer, dimensionality, order));
        }
        return rings;
    }

    private static List<Coordinate> readCoordinates(EwkbReadBuffer buffer,
                                                    Dimensionality dimensionality,
                                                    EwkbByteOrder order) throws IOException
    {
        final int count = readCount(buffer, order);
        final List<Coordinate> points = new ArrayList<>(presize(count));
        for (int i = 0; i < count; i++) {
            points.add(readCoordinate(buffer, dimensionality, order));
        }
        return points;
    }

    private static Coordinate readCoordinate(EwkbReadBuffer buffer,
                                             Dimensionality dimensionality,
                                             EwkbByteOrder order) throws IOException
    {
        buffer.ensure(dimensionality.coordinateSize());

        final double x = buffer.readDouble(order);
        final double y = buffer.readDouble(order);
        if (dimensionality == Dimensionality.XY) {
            return new CoordinateXY(x, y);
        }
        return new CoordinateXYZ(x, y, buffer.readDouble(order));
    }

    private static int readCount(EwkbReadBuffer buffer, EwkbByteOrder order) throws IOException
    {
        buffer.ensure(EwkbHeaderCodec.UINT32_SIZE);

        final long count = buffer.readUInt32(order);
        if (count > Integer.MAX_VALUE) {
            throw new EwkbCodecException("EWKB element count too large: " + count);
        }
        return (int) count;
    }

    private static int presize(int count)
    {
        return Math.min(count, PRESIZE_LIMIT);
    }

    // ========================================================================
    // Encode
    // ========================================================================

    /**
     * Writes the body of {@code geometry}; the caller has already written its
     * header.
     */
    static void encode(EwkbWriteBuffer buffer, Geometry geometry) throws IOException
    {
        final Dimensionality dimensionality = geometry.dimensionality();

        if (geometry instanceof Point p) {
            writeCoordinate(buffer, p.coordinate());
        }
        else if (geometry instanceof LineString l) {
            writeCoordinates(buffer, l.points());
        }
        else if (geometry instanceof Polygon p) {
            writeRings(buffer, p.rings());
        }
        else if (geometry instanceof MultiPoint m) {
            writeCount(buffer, m.points().size());
            for (Coordinate c : m.points()) {
                writeElementHeader(buffer, ShapeKind.POINT, dimensionality);
                writeCoordinate(buffer, c);
            }
        }
        else if (geometry instanceof MultiLineString m) {
            writeCount(buffer, m.lineStrings().size());
            for (LineString l : m.lineStrings()) {
                writeElementHeader(buffer, ShapeKind.LINE_STRING, dimensionality);
                writeCoordinates(buffer, l.points());
            }
        }
        else if (geometry instanceof MultiPolygon m) {
            writeCount(buffer, m.polygons().size());
            for (Polygon p : m.polygons()) {
                writeElementHeader(buffer, ShapeKind.POLYGON, dimensionality);
                writeRings(buffer, p.rings());
            }
        }
        else if (geometry instanceof GeometryCollection c) {
            writeCount(buffer, c.geometries().size());
            for (Geometry element : c.geometries()) {
                // Each element re-derives its own header; its SRID is dropped.
                writeElementHeader(buffer, element.kind(), element.dimensionality());
                encode(buffer, element);
            }
        }
        else {
            // Sealed interface should make this unreachable.
            throw new IllegalArgumentException("Unsupported geometry type: " + geometry.getClass());
        }
    }

    private static void writeElementHeader(EwkbWriteBuffer buffer,
                                           ShapeKind kind,
                                           Dimensionality dimensionality) throws IOException
    {
        EwkbHeaderCodec.encode(buffer, kind, dimensionality, SpatialReferenceId.UNSPECIFIED);
    }

    private static void writeRings(EwkbWriteBuffer buffer, List<List<Coordinate>> rings) throws IOException
    {
        writeCount(buffer, rings.size());
        for (List<Coordinate> ring : rings) {
            writeCoordinates(buffer, ring);
        }
    }

    private static void writeCoordinates(EwkbWriteBuffer buffer, List<Coordinate> points) throws IOException
    {
        writeCount(buffer, points.size());
        for (Coordinate c : points) {
            writeCoordinate(buffer, c);
        }
    }

    private static void writeCoordinate(EwkbWriteBuffer buffer, Coordinate c) throws IOException
    {
        EwkbHeaderCodec.reserve(buffer, c.dimensionality().coordinateSize());

        buffer.writeDouble(c.x());
        buffer.writeDouble(c.y());
        if (c instanceof CoordinateXYZ xyz) {
            buffer.writeDouble(xyz.z());
        }
    }

    private static void writeCount(EwkbWriteBuffer buffer, int count) throws IOException
    {
        EwkbHeaderCodec.reserve(buffer, EwkbHeaderCodec.UINT32_SIZE);
        buffer.writeInt32(count);
    }

    // ========================================================================
    // Length
    // ========================================================================

    /**
     * Returns the number of bytes {@link #encode} writes for {@code geometry},
     * excluding its own header.
     */
    static long bodyLength(Geometry geometry)
    {
        final long coordinateSize = geometry.dimensionality().coordinateSize();
        final long header = EwkbHeaderCodec.HEADER_SIZE;
        final long count = EwkbHeaderCodec.UINT32_SIZE;

        if (geometry instanceof Point) {
            return coordinateSize;
        }
        if (geometry instanceof LineString l) {
            return count + l.points().size() * coordinateSize;
        }
        if (geometry instanceof Polygon p) {
            return ringsLength(p.rings(), coordinateSize);
        }
        if (geometry instanceof MultiPoint m) {
            return count + m.points().size() * (header + coordinateSize);
        }
        if (geometry instanceof MultiLineString m) {
            long length = count;
            for (LineString l : m.lineStrings()) {
                length += header + count + l.points().size() * coordinateSize;
            }
            return length;
        }
        if (geometry instanceof MultiPolygon m) {
            long length = count;
            for (Polygon p : m.polygons()) {
                length += header + ringsLength(p.rings(), coordinateSize);
            }
            return length;
        }
        if (geometry instanceof GeometryCollection c) {
            long length = count;
            for (Geometry element : c.geometries()) {
                length += header + bodyLength(element);
            }
            return length;
        }
        throw new IllegalArgumentException("Unsupported geometry type: " + geometry.getClass());
    }

    private static long ringsLength(List<List<Coordinate>> rings, long coordinateSize)
    {
        long length = EwkbHeaderCodec.UINT32_SIZE;
        for (List<Coordinate> ring : rings) {
            length += EwkbHeaderCodec.UINT32_SIZE + ring.size() * coordinateSize;
        }
        return length;
    }
}
