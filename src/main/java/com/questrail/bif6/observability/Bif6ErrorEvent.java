package com.questrail.bif6.observability;

import java.time.Instant;

/**
 * Record representing a failure that ended decoding of a BIF6 source.
 */
public record Bif6ErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
}
