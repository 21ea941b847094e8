package com.questrail.tracker.protocol.suntech.model;

/**
 * Canonical result of decoding one Suntech frame.
 *
 * <h2>Purpose</h2>
 * <p>
 * Every frame handed to the codec produces exactly one {@code DecodedReport}.
 * Failures are values, not exceptions: a frame that cannot be decoded becomes a
 * {@link ParseError} or an {@link UnknownHeader}, so nothing received from a
 * device is ever dropped silently.
 * </p>
 *
 * <h2>Raw bytes</h2>
 * <p>
 * All variants retain a copy of the bytes they were decoded from, so any report
 * (including failed ones) can be re-analysed later.
 * </p>
 *
 * <p>
 * Instances are immutable once constructed by the frame decoder.
 * </p>
 */
public sealed interface DecodedReport
        permits StatusReport, BeaconScanReport, ParseError, UnknownHeader {

    /**
     * Returns a copy of the frame bytes this report was decoded from.
     */
    byte[] rawBytes();

    /**
     * Short human-readable description of the report kind.
     */
    String reportType();
}
