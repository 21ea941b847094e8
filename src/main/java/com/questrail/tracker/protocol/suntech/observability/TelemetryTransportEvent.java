package com.questrail.tracker.protocol.suntech.observability;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Transport lifecycle observation.
 *
 * @param timestamp when the event was observed
 * @param kind      what happened
 * @param address   local address for listener events, remote address for connection events
 * @param detail    free-form detail, empty when there is none
 */
public record TelemetryTransportEvent(
    Instant timestamp,
    Kind kind,
    SocketAddress address,
    String detail
) {
    public enum Kind {
        LISTENING,
        STOPPED,
        CONNECTION_OPENED,
        CONNECTION_CLOSED,
        IDLE_TIMEOUT
    }

    public TelemetryTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = (detail == null) ? "" : detail;
    }
}
