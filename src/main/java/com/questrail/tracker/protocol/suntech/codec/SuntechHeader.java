package com.questrail.tracker.protocol.suntech.codec;

import java.util.Optional;

/**
 * Header bytes understood by the Suntech codec.
 *
 * <p>These values are a fixed external contract with the device firmware.</p>
 */
public enum SuntechHeader
{
    STATUS(0x81, false),
    STATUS_VARIANT(0x82, false),
    BLE_SCAN(0xAA, false),
    BLE_SCAN_WITH_ACK(0xBA, true);

    private final int value;
    private final boolean acknowledgmentRequired;

    SuntechHeader(int value, boolean acknowledgmentRequired) {
        this.value = value;
        this.acknowledgmentRequired = acknowledgmentRequired;
    }

    public int value() {
        return value;
    }

    public boolean acknowledgmentRequired() {
        return acknowledgmentRequired;
    }

    public static Optional<SuntechHeader> fromByte(int headerByte) {
        int unsigned = headerByte & 0xFF;
        for (SuntechHeader h : values()) {
            if (h.value == unsigned) {
                return Optional.of(h);
            }
        }
        return Optional.empty();
    }
}
