package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.model.ParseError;
import com.questrail.tracker.protocol.suntech.model.UnknownHeader;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * One received frame together with what it decoded to.
 */
public record TelemetryFrameEvent(
    Instant timestamp,
    SocketAddress remote,
    DecodedReport report
) {
    public TelemetryFrameEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(report, "report");
    }

    /**
     * True when the frame did not decode into a status or scan report.
     */
    public boolean undecoded() {
        return report instanceof ParseError || report instanceof UnknownHeader;
    }

    public int byteLength() {
        return report.rawBytes().length;
    }
}
