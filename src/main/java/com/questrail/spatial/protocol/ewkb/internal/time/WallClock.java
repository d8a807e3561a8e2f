package com.questrail.spatial.protocol.ewkb.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of timestamps for observability events.
 *
 * <p>
 * The codec itself never consults the time. Injecting the clock keeps event
 * timestamps deterministic in tests.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
