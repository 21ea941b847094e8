package com.questrail.tracker.protocol.suntech.observability;

/**
 * Receives observability events from the telemetry pipeline.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface TelemetryObservabilitySink {
    /**
     * Called when the listener binds or stops, or a device connection opens,
     * closes or times out.
     * @param event the transport event
     */
    void onTransportEvent(TelemetryTransportEvent event);

    /**
     * Called once per received frame, after decoding and before the report is
     * aggregated.
     * @param event the decoded frame
     */
    void onFrameDecoded(TelemetryFrameEvent event);

    /**
     * Called when an error or anomaly occurs outside the decoder's own error
     * values (I/O failures, sink failures).
     * @param event the error event
     */
    void onError(TelemetryErrorEvent event);
}
