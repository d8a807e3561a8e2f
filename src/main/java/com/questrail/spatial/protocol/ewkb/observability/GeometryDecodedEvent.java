package com.questrail.spatial.protocol.ewkb.observability;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;

import java.time.Instant;

/**
 * Record describing a geometry value read from the transport.
 *
 * @param length the field length reported by the transport
 */
public record GeometryDecodedEvent(
    Instant timestamp,
    ShapeKind kind,
    Dimensionality dimensionality,
    SpatialReferenceId srid,
    int length
) {
}
