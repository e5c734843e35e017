package com.questrail.bif6.observability;

import java.time.Instant;

/**
 * Record representing a BIF6 source that was decoded through to end-of-input.
 */
public record Bif6StreamCompletedEvent(
    Instant timestamp,
    String source,
    long recordsDecoded,
    int declaredIntervalCount,
    long bytesConsumed
) {
    /**
     * Checks if the number of decoded records equals the count declared in the header.
     */
    public boolean matchesDeclaredCount() {
        return recordsDecoded == declaredIntervalCount;
    }
}
