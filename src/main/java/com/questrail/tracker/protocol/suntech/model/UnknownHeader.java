package com.questrail.tracker.protocol.suntech.model;

import java.util.Objects;

/**
 * A frame whose header byte is not handled by any decoder, or a status variant
 * ({@code 0x82}) that did not decode as a status report.
 *
 * @param headerByte unsigned header value
 * @param label      description of the header, e.g. {@code "Unknown Header"} or {@code "STT Variant"}
 * @param rawBytes   the frame as received
 */
public record UnknownHeader(
        int headerByte,
        String label,
        byte[] rawBytes
) implements DecodedReport {

    public UnknownHeader {
        Objects.requireNonNull(label, "label");
        rawBytes = (rawBytes == null) ? new byte[0] : rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    @Override
    public String reportType() {
        return label;
    }

    @Override
    public String toString() {
        return String.format("UnknownHeader[header=0x%02X, label=%s, byteLength=%d]",
                headerByte, label, rawBytes.length);
    }
}
