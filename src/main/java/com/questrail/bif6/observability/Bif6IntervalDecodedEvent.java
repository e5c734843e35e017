package com.questrail.bif6.observability;

import java.time.Instant;

/**
 * Record representing one interval successfully decoded from a BIF6 source.
 */
public record Bif6IntervalDecodedEvent(
    Instant timestamp,
    String source,
    long recordIndex,
    long intervalId,
    long byteOffset
) {
}
