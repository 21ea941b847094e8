package com.questrail.tracker.protocol.suntech.model;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * A decoded report together with when and from where its frame arrived.
 *
 * @param receivedAt receive time of the frame
 * @param remote     peer address of the connection the frame arrived on
 * @param report     what the frame decoded to
 */
public record ReceivedReport(Instant receivedAt, SocketAddress remote, DecodedReport report) {
    public ReceivedReport {
        Objects.requireNonNull(receivedAt, "receivedAt");
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(report, "report");
    }
}
