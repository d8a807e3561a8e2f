package com.questrail.spatial.protocol.ewkb.observability;

/**
 * No-op implementation of EwkbObservabilitySink.
 */
public final class NullObservabilitySink implements EwkbObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onGeometryDecoded(GeometryDecodedEvent event) {}

    @Override
    public void onGeometryEncoded(GeometryEncodedEvent event) {}

    @Override
    public void onError(EwkbErrorEvent event) {}
}
