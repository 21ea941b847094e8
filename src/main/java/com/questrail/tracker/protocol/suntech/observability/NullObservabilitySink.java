package com.questrail.tracker.protocol.suntech.observability;

/**
 * No-op implementation of TelemetryObservabilitySink.
 */
public final class NullObservabilitySink implements TelemetryObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(TelemetryTransportEvent event) {}

    @Override
    public void onFrameDecoded(TelemetryFrameEvent event) {}

    @Override
    public void onError(TelemetryErrorEvent event) {}
}
