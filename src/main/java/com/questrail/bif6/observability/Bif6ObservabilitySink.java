package com.questrail.bif6.observability;

/**
 * Main interface for receiving BIF6 decoding observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the decoding thread.</p>
 */
public interface Bif6ObservabilitySink {
    /**
     * Called after each interval record is decoded.
     * @param event the decoded interval details
     */
    void onIntervalDecoded(Bif6IntervalDecodedEvent event);

    /**
     * Called once when a source reaches end-of-input without error.
     * @param event the completion summary
     */
    void onStreamCompleted(Bif6StreamCompletedEvent event);

    /**
     * Called when a format or transport failure ends decoding.
     * @param event the error event
     */
    void onError(Bif6ErrorEvent event);
}
