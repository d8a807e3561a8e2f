package com.questrail.spatial.protocol.ewkb.observability;

/**
 * Main interface for receiving EWKB codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface EwkbObservabilitySink {
    /**
     * Called after a geometry value has been fully decoded.
     * @param event the decoded value's summary
     */
    void onGeometryDecoded(GeometryDecodedEvent event);

    /**
     * Called after a geometry value has been fully encoded.
     * @param event the encoded value's summary
     */
    void onGeometryEncoded(GeometryEncodedEvent event);

    /**
     * Called when decoding or encoding a value fails.
     * @param event the error event
     */
    void onError(EwkbErrorEvent event);
}
