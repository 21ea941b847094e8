package com.questrail.tracker.protocol.suntech.model;

/**
 * GPS fix status as reported by the device.
 *
 * @param kind classified status
 * @param raw  the byte as received
 */
public record FixStatus(Kind kind, int raw) {

    public enum Kind {
        NOT_FIXED,
        FIXED,
        DEAD_RECKONING,
        OTHER
    }

    public static FixStatus fromRaw(int raw) {
        return switch (raw) {
            case 0 -> new FixStatus(Kind.NOT_FIXED, raw);
            case 1 -> new FixStatus(Kind.FIXED, raw);
            case 3 -> new FixStatus(Kind.DEAD_RECKONING, raw);
            default -> new FixStatus(Kind.OTHER, raw);
        };
    }

    public String label() {
        return switch (kind) {
            case NOT_FIXED -> "Not Fixed";
            case FIXED -> "Fixed";
            case DEAD_RECKONING -> "DR Activated";
            case OTHER -> Integer.toString(raw);
        };
    }
}
