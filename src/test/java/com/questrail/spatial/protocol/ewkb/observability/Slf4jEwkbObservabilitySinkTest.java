package com.questrail.spatial.protocol.ewkb.observability;

import com.questrail.spatial.api.Dimensionality;
import com.questrail.spatial.api.SpatialReferenceId;
import com.questrail.spatial.protocol.ewkb.model.ShapeKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

final class Slf4jEwkbObservabilitySinkTest
{
    private final Slf4jEwkbObservabilitySink sink = new Slf4jEwkbObservabilitySink();

    @Test
    void logsEveryEventKind()
    {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertDoesNotThrow(() -> {
            sink.onGeometryDecoded(new GeometryDecodedEvent(
                    now, ShapeKind.POINT, Dimensionality.XY, SpatialReferenceId.of(4326), 25));
            sink.onGeometryEncoded(new GeometryEncodedEvent(
                    now, ShapeKind.MULTI_POINT, Dimensionality.XYZ, SpatialReferenceId.UNSPECIFIED, 67));
            sink.onError(new EwkbErrorEvent(now, "decode failed", new IllegalStateException("boom")));
        });
    }
}
