package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.model.BeaconScanReport;
import com.questrail.tracker.protocol.suntech.model.FixStatus;
import com.questrail.tracker.protocol.suntech.model.GpsFix;
import com.questrail.tracker.protocol.suntech.model.SensorSighting;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * BeaconScanReportDecoder
 * -----------------------------------------------------------------------------
 * Decodes the variable-layout BDA/SNB BLE scan report ({@code 0xAA}/{@code 0xBA}).
 *
 * <h2>Layout (big-endian)</h2>
 * <pre>
 *   0..14   common prefix ({@link FramePrefix})
 *   15      scan status           16      total reports expected
 *   17      current report number 18..19  expected sensor count
 *   20..22  scan date (optional)  23..25  scan time (optional)
 *   26..29  scan latitude (opt.)  30..33  scan longitude (optional)
 *   34..    sensor entries
 * </pre>
 *
 * <h2>Sensor extraction</h2>
 * <ol>
 *   <li><b>Structured pass.</b> Reads up to {@code expectedSensorCount} entries
 *       of {@code {size:2, payload:size, mac:6, rssi:1}}. An entry cut short by
 *       the end of the frame ends the pass and is discarded.</li>
 *   <li><b>Address scan.</b> Slides a 6-byte window over every offset of the
 *       whole frame and keeps each window that resolves to a target address in
 *       either byte order, with the byte after it as RSSI when present. The
 *       firmware does not reliably align beacon records to the structured
 *       layout, so tag addresses are sometimes only found this way. The scan is
 *       brute force, linear in the frame length.</li>
 * </ol>
 *
 * <p>Both passes feed one list keyed by the resolved 12-digit address. The
 * first registration of an address wins; later sightings of it, in either pass
 * or orientation, are ignored.</p>
 */
final class BeaconScanReportDecoder
{
    static final int REQUIRED_LENGTH = 20;
    static final int SENSOR_DATA_OFFSET = 34;

    private static final int OFF_SCAN_STATUS = 15;
    private static final int OFF_TOTAL_REPORTS = 16;
    private static final int OFF_CURRENT_REPORT = 17;
    private static final int OFF_SENSOR_COUNT = 18;
    private static final int OFF_SCAN_DATE = 20;
    private static final int OFF_SCAN_TIME = 23;
    private static final int OFF_SCAN_LATITUDE = 26;
    private static final int OFF_SCAN_LONGITUDE = 30;

    private static final int ENTRY_SIZE_LENGTH = 2;
    private static final int RSSI_LENGTH = 1;

    private final MacAddressResolver resolver;

    BeaconScanReportDecoder(MacAddressResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * @throws SuntechDecodeException if the frame is shorter than the scan metadata
     */
    BeaconScanReport decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        FrameReader reader = new FrameReader(frame);
        reader.require(REQUIRED_LENGTH, "BDA message");

        FramePrefix prefix = FramePrefix.read(reader);
        int expectedSensors = reader.u16(OFF_SENSOR_COUNT);

        Optional<String> scanDate = reader.optSlice(OFF_SCAN_DATE, 3).map(SuntechPrimitives::decodeDate);
        Optional<String> scanTime = reader.optSlice(OFF_SCAN_TIME, 3).map(SuntechPrimitives::decodeTime);

        Map<String, SensorSighting> sightings = new LinkedHashMap<>();
        boolean layoutComplete = structuredPass(reader, expectedSensors, sightings);
        addressScan(frame, sightings);

        return new BeaconScanReport(
                prefix.header(),
                prefix.packetLength(),
                prefix.deviceId(),
                prefix.reportMap(),
                prefix.model(),
                prefix.softwareVersion(),
                reader.u8(OFF_SCAN_STATUS),
                reader.u8(OFF_TOTAL_REPORTS),
                reader.u8(OFF_CURRENT_REPORT),
                expectedSensors,
                scanDate,
                scanTime,
                scanLocation(reader),
                new ArrayList<>(sightings.values()),
                layoutComplete,
                frame
        );
    }

    /**
     * @return false if the frame ended before {@code expected} entries were read
     */
    private boolean structuredPass(FrameReader reader, int expected, Map<String, SensorSighting> out) {
        int offset = SENSOR_DATA_OFFSET;

        for (int i = 0; i < expected; i++) {
            if (!reader.has(offset, ENTRY_SIZE_LENGTH)) {
                return false;
            }
            int payloadSize = reader.u16(offset);
            int payloadOffset = offset + ENTRY_SIZE_LENGTH;
            int macOffset = payloadOffset + payloadSize;
            if (!reader.has(macOffset, MacAddressResolver.MAC_LENGTH + RSSI_LENGTH)) {
                return false;
            }

            MacAddressResolver.ResolvedMac mac = resolver.resolve(reader.slice(macOffset, MacAddressResolver.MAC_LENGTH), 0);
            int rssi = reader.s8(macOffset + MacAddressResolver.MAC_LENGTH);

            out.putIfAbsent(mac.addressKey(), new SensorSighting(
                    mac.address(),
                    mac.orientation(),
                    OptionalInt.of(rssi),
                    mac.target(),
                    OptionalInt.empty(),
                    reader.slice(payloadOffset, payloadSize)
            ));

            offset = macOffset + MacAddressResolver.MAC_LENGTH + RSSI_LENGTH;
        }
        return true;
    }

    private void addressScan(byte[] frame, Map<String, SensorSighting> out) {
        for (int pos = 0; pos + MacAddressResolver.MAC_LENGTH <= frame.length; pos++) {
            MacAddressResolver.ResolvedMac mac = resolver.resolve(frame, pos);
            if (!mac.target() || out.containsKey(mac.addressKey())) {
                continue;
            }

            int rssiOffset = pos + MacAddressResolver.MAC_LENGTH;
            OptionalInt rssi = rssiOffset < frame.length
                    ? OptionalInt.of(frame[rssiOffset])
                    : OptionalInt.empty();

            out.put(mac.addressKey(), new SensorSighting(
                    mac.address(),
                    mac.orientation(),
                    rssi,
                    true,
                    OptionalInt.of(pos),
                    null
            ));
        }
    }

    private static Optional<GpsFix> scanLocation(FrameReader reader) {
        OptionalInt lat = reader.optS32(OFF_SCAN_LATITUDE);
        OptionalInt lon = reader.optS32(OFF_SCAN_LONGITUDE);
        if (lat.isEmpty() || lon.isEmpty()) {
            return Optional.empty();
        }
        // Scan frames carry coordinates only.
        return Optional.of(new GpsFix(
                SuntechPrimitives.decodeCoordinate(lat.getAsInt()),
                SuntechPrimitives.decodeCoordinate(lon.getAsInt()),
                0.0,
                0.0,
                0,
                FixStatus.fromRaw(0)
        ));
    }
}
