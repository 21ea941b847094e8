package com.questrail.tracker.protocol.suntech.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decoded STT (status) report, header {@code 0x81} or its {@code 0x82} variant.
 *
 * <p>Fields past the required prefix hold their defaults when the frame was
 * too short to carry them. {@link #status()} is empty when the input-state
 * byte itself was missing, so ignition is unknown rather than "OFF" for
 * truncated frames.</p>
 *
 * @param header                unsigned header byte
 * @param packetLength          length field as sent (informational)
 * @param deviceId              device serial (BCD decoded)
 * @param reportMap             24-bit report bitmap
 * @param model                 model id
 * @param softwareVersion       version rendered as {@code major.minor.patchhex}
 * @param messageType           live or stored
 * @param gpsDate               {@code YYYYMMDD}
 * @param gpsTime               {@code HH:MM:SS}
 * @param gps                   GPS block
 * @param cellular              cell block
 * @param status                input/output/mode block, when present
 * @param assignMap             assignment bitmap announcing trailing fields
 * @param rawTrailingDataLength bytes beyond the fixed 58-byte layout
 * @param inputVoltageMv        vehicle input voltage, only when within the plausible band
 * @param batteryLevel          backup battery level in percent, when announced
 * @param rawBytes              the frame as received
 */
public record StatusReport(
        int header,
        int packetLength,
        long deviceId,
        int reportMap,
        int model,
        String softwareVersion,
        MessageType messageType,
        String gpsDate,
        String gpsTime,
        GpsFix gps,
        CellInfo cellular,
        Optional<DeviceStatus> status,
        long assignMap,
        int rawTrailingDataLength,
        OptionalInt inputVoltageMv,
        OptionalInt batteryLevel,
        byte[] rawBytes
) implements DecodedReport {

    public StatusReport {
        Objects.requireNonNull(softwareVersion, "softwareVersion");
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(gpsDate, "gpsDate");
        Objects.requireNonNull(gpsTime, "gpsTime");
        Objects.requireNonNull(gps, "gps");
        Objects.requireNonNull(cellular, "cellular");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(inputVoltageMv, "inputVoltageMv");
        Objects.requireNonNull(batteryLevel, "batteryLevel");
        rawBytes = (rawBytes == null) ? new byte[0] : rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    @Override
    public String reportType() {
        return "STT (Status Report)";
    }

    public String gpsTimestamp() {
        return gpsDate + " " + gpsTime;
    }

    /**
     * Ignition line state ("ON"/"OFF"), or empty when the frame did not carry
     * the input-state byte.
     */
    public Optional<String> ignitionStatus() {
        return status.map(DeviceStatus::ignitionStatus);
    }

    @Override
    public String toString() {
        return String.format("StatusReport[header=0x%02X, deviceId=%d, fix=%s, ignition=%s, byteLength=%d]",
                header, deviceId, gps.fixStatus().label(), ignitionStatus().orElse("?"), rawBytes.length);
    }
}
