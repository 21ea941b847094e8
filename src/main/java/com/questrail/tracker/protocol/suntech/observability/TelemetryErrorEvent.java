package com.questrail.tracker.protocol.suntech.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the telemetry pipeline.
 */
public record TelemetryErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
