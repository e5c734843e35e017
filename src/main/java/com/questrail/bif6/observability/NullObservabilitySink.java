package com.questrail.bif6.observability;

/**
 * No-op implementation of Bif6ObservabilitySink.
 */
public final class NullObservabilitySink implements Bif6ObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onIntervalDecoded(Bif6IntervalDecodedEvent event) {}

    @Override
    public void onStreamCompleted(Bif6StreamCompletedEvent event) {}

    @Override
    public void onError(Bif6ErrorEvent event) {}
}
