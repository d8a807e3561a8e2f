package com.questrail.spatial.protocol.ewkb.codec.impl;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;
import com.questrail.spatial.protocol.ewkb.transport.EwkbByteOrder;

/**
 * Decoded EWKB header: the fields every value and every nested element starts
 * with.
 *
 * @param byteOrder      order governing the fields that follow the header
 * @param kind           base shape named by the type word
 * @param dimensionality {@link Dimensionality#XYZ} when the Z or M flag is set
 * @param srid           the SRID field, or {@link SpatialReferenceId#UNSPECIFIED}
 *                       when the SRID flag is clear
 * @param typeWord       the unsigned type word as read, for diagnostics
 */
record EwkbHeader(
        EwkbByteOrder byteOrder,
        ShapeKind kind,
        Dimensionality dimensionality,
        SpatialReferenceId srid,
        long typeWord
) {
}
