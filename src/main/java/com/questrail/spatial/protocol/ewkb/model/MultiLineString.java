package com.questrail.spatial.protocol.ewkb.model;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;

import java.util.List;
import java.util.Objects;

/**
 * A collection of line strings.
 *
 * <p>Wire body: element count, then per element a mini-header and a line
 * string body. The SRID of each nested line string is not encoded.</p>
 */
public record MultiLineString(
        Dimensionality dimensionality,
        List<LineString> lineStrings,
        SpatialReferenceId srid
) implements Geometry
{
    public MultiLineString {
        Objects.requireNonNull(dimensionality, "dimensionality");
        Objects.requireNonNull(srid, "srid");
        lineStrings = ModelChecks.elements(dimensionality, lineStrings, "lineStrings");
    }

    public static MultiLineString of(Dimensionality dimensionality, List<LineString> lineStrings) {
        return new MultiLineString(dimensionality, lineStrings, SpatialReferenceId.UNSPECIFIED);
    }

    @Override
    public ShapeKind kind() {
        return ShapeKind.MULTI_LINE_STRING;
    }

    @Override
    public MultiLineString withSrid(SpatialReferenceId srid) {
        return new MultiLineString(dimensionality, lineStrings, srid);
    }
}
