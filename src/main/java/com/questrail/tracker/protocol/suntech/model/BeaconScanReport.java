package com.questrail.tracker.protocol.suntech.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded BDA/SNB (BLE sensor data) report, header {@code 0xAA} or {@code 0xBA}.
 *
 * <p>The sensor list is the merged, address-deduplicated result of the
 * structured entry pass and the exhaustive address scan; it may be empty but
 * is never null. {@code sensorLayoutComplete} is false when the structured
 * pass ran out of bytes before reading {@code expectedSensorCount} entries.</p>
 */
public record BeaconScanReport(
        int header,
        int packetLength,
        long deviceId,
        int reportMap,
        int model,
        String softwareVersion,
        int scanStatus,
        int totalReportsExpected,
        int currentReportNumber,
        int expectedSensorCount,
        Optional<String> scanDate,
        Optional<String> scanTime,
        Optional<GpsFix> scanLocation,
        List<SensorSighting> sensors,
        boolean sensorLayoutComplete,
        byte[] rawBytes
) implements DecodedReport {

    public BeaconScanReport {
        Objects.requireNonNull(softwareVersion, "softwareVersion");
        Objects.requireNonNull(scanDate, "scanDate");
        Objects.requireNonNull(scanTime, "scanTime");
        Objects.requireNonNull(scanLocation, "scanLocation");
        sensors = List.copyOf(Objects.requireNonNull(sensors, "sensors"));
        rawBytes = (rawBytes == null) ? new byte[0] : rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    @Override
    public String reportType() {
        return "BDA/SNB (BLE Sensor Data Report)";
    }

    public boolean scanPerformed() {
        return scanStatus == 1;
    }

    public String scanStatusLabel() {
        return scanPerformed() ? "Scan Performed (1)" : "No Scan (0)";
    }

    public int sensorsParsed() {
        return sensors.size();
    }

    public boolean hasTargetMac() {
        return sensors.stream().anyMatch(SensorSighting::target);
    }

    /**
     * True for header {@code 0xBA}, which the device sends expecting a
     * transport-level acknowledgment.
     */
    public boolean acknowledgmentRequested() {
        return header == 0xBA;
    }

    @Override
    public String toString() {
        return String.format("BeaconScanReport[header=0x%02X, deviceId=%d, report=%d/%d, sensors=%d, targets=%s, byteLength=%d]",
                header, deviceId, currentReportNumber, totalReportsExpected, sensors.size(), hasTargetMac(), rawBytes.length);
    }
}
