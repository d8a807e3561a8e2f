package com.questrail.spatial.protocol.ewkb.observability;

import java.time.Instant;

/**
 * Record representing a failed decode or encode.
 */
public record EwkbErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
