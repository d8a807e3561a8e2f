package com.questrail.spatial.protocol.ewkb.observability;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;

import java.time.Instant;

/**
 * Record describing a geometry value written to the transport.
 *
 * @param length the number of EWKB bytes written
 */
public record GeometryEncodedEvent(
    Instant timestamp,
    ShapeKind kind,
    Dimensionality dimensionality,
    SpatialReferenceId srid,
    int length
) {
}
