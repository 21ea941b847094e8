package com.questrail.tracker.protocol.suntech.model;

/**
 * Input/output and mode block of a status report.
 *
 * @param inputState    input-state bitmask; bit 0 is the ignition line
 * @param outputState   output-state bitmask
 * @param deviceMode    raw device mode
 * @param reportTypeId  report-type id
 * @param messageNumber message sequence number
 */
public record DeviceStatus(
        int inputState,
        int outputState,
        int deviceMode,
        int reportTypeId,
        int messageNumber
) {
    public static final String IGNITION_ON = "ON";
    public static final String IGNITION_OFF = "OFF";

    private static final int IGNITION_BIT = 0x01;

    public String ignitionStatus() {
        return (inputState & IGNITION_BIT) != 0 ? IGNITION_ON : IGNITION_OFF;
    }

    public String deviceModeLabel() {
        return switch (deviceMode) {
            case 1 -> "Driving";
            case 5 -> "Deactivate Zone";
            default -> Integer.toString(deviceMode);
        };
    }

    public String inputStateHex() {
        return String.format("0x%02X", inputState);
    }

    public String outputStateHex() {
        return String.format("0x%02X", outputState);
    }
}
