package com.questrail.spatial.protocol.ewkb.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EwkbObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEwkbObservabilitySink implements EwkbObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEwkbObservabilitySink.class);

    @Override
    public void onGeometryDecoded(GeometryDecodedEvent event) {
        log.debug("EWKB decoded {} {} srid={} ({} bytes)",
            event.kind(), event.dimensionality(), event.srid().value(), event.length());
    }

    @Override
    public void onGeometryEncoded(GeometryEncodedEvent event) {
        log.debug("EWKB encoded {} {} srid={} ({} bytes)",
            event.kind(), event.dimensionality(), event.srid().value(), event.length());
    }

    @Override
    public void onError(EwkbErrorEvent event) {
        log.error("EWKB Error: {}", event.message(), event.cause());
    }
}
