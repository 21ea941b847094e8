package com.questrail.tracker.protocol.suntech.model;

/**
 * Classification of decode outcomes that are not a fully decoded report.
 *
 * <p>{@link #INVALID_SENSOR_LAYOUT} never produces a {@link ParseError}; it is
 * the degrade recorded on a {@link BeaconScanReport} whose structured sensor
 * list stopped early.</p>
 */
public enum DecodeErrorKind {
    EMPTY_FRAME,
    UNKNOWN_HEADER,
    TRUNCATED_REQUIRED_FIELD,
    INVALID_SENSOR_LAYOUT,
    DECODE_FAILURE
}
