package com.questrail.tracker.protocol.suntech.model;

/**
 * Whether a status report was sent live or replayed from device storage.
 */
public enum MessageType {
    REAL_TIME("Real Time (1)"),
    STORED("Stored (0)");

    private final String label;

    MessageType(String label) {
        this.label = label;
    }

    public static MessageType fromRaw(int raw) {
        return raw == 1 ? REAL_TIME : STORED;
    }

    public String label() {
        return label;
    }
}
