package com.questrail.tracker.protocol.suntech.codec.impl;

/**
 * Leading fields common to status and BLE scan reports.
 *
 * <pre>
 *   0      header
 *   1..2   packet length (informational, not validated)
 *   3..7   device id, BCD
 *   8..10  report bitmap
 *   11     model
 *   12..14 software version
 * </pre>
 */
record FramePrefix(
        int header,
        int packetLength,
        long deviceId,
        int reportMap,
        int model,
        String softwareVersion
) {
    static final int LENGTH = 15;

    /**
     * Reads the prefix; the caller must already have required at least
     * {@link #LENGTH} bytes.
     */
    static FramePrefix read(FrameReader reader) {
        return new FramePrefix(
                reader.u8(0),
                reader.u16(1),
                SuntechPrimitives.decodeBcd(reader.slice(3, 5)),
                reader.u24(8),
                reader.u8(11),
                SuntechPrimitives.formatSoftwareVersion(reader.slice(12, 3))
        );
    }
}
