package com.questrail.bif6.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of Bif6ObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBif6ObservabilitySink implements Bif6ObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBif6ObservabilitySink.class);

    @Override
    public void onIntervalDecoded(Bif6IntervalDecodedEvent event) {
        log.debug("BIF6 {}: record {} (interval id {}) at byte {}",
            event.source(),
            event.recordIndex(),
            event.intervalId(),
            event.byteOffset());
    }

    @Override
    public void onStreamCompleted(Bif6StreamCompletedEvent event) {
        if (!event.matchesDeclaredCount()) {
            log.warn("BIF6 {}: header declares {} intervals but {} were decoded",
                event.source(),
                event.declaredIntervalCount(),
                event.recordsDecoded());
        }
        log.info("BIF6 {}: decoded {} intervals ({} bytes)",
            event.source(),
            event.recordsDecoded(),
            event.bytesConsumed());
    }

    @Override
    public void onError(Bif6ErrorEvent event) {
        log.error("BIF6 {}: {}", event.source(), event.message(), event.cause());
    }
}
