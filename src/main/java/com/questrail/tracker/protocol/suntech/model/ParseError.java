package com.questrail.tracker.protocol.suntech.model;

import java.util.Objects;

/**
 * A frame that could not be decoded.
 *
 * @param kind       failure classification
 * @param reason     human-readable reason
 * @param rawBytes   the frame as received
 * @param byteLength length of the frame
 */
public record ParseError(
        DecodeErrorKind kind,
        String reason,
        byte[] rawBytes,
        int byteLength
) implements DecodedReport {

    public ParseError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
        rawBytes = (rawBytes == null) ? new byte[0] : rawBytes.clone();
    }

    public static ParseError of(DecodeErrorKind kind, String reason, byte[] frame) {
        byte[] bytes = (frame == null) ? new byte[0] : frame;
        return new ParseError(kind, reason, bytes, bytes.length);
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    @Override
    public String reportType() {
        return "Parse Error";
    }

    @Override
    public String toString() {
        return "ParseError[kind=" + kind + ", reason=" + reason + ", byteLength=" + byteLength + ']';
    }
}
