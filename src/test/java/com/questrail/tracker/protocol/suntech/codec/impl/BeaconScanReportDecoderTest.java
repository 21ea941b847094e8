package com.questrail.tracker.protocol.suntech.codec.impl;

import com.questrail.tracker.protocol.suntech.config.TargetPrefixes;
import com.questrail.tracker.protocol.suntech.model.BeaconScanReport;
import com.questrail.tracker.protocol.suntech.model.DecodeErrorKind;
import com.questrail.tracker.protocol.suntech.model.MacOrientation;
import com.questrail.tracker.protocol.suntech.model.SensorSighting;
import com.questrail.tracker.protocol.suntech.test.SuntechFrames;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BeaconScanReportDecoderTest
 * -----------------------------------------------------------------------------
 * Scan metadata, the structured pass, the address scan and deduplication
 * across both.
 */
final class BeaconScanReportDecoderTest
{
    private static final byte[] ADVERTISEMENT = { 0x02, 0x01, 0x06 };
    private static final byte[] TAG = SuntechFrames.hex("AC233F000001");
    private static final byte[] OTHER = SuntechFrames.hex("112233445566");

    private final BeaconScanReportDecoder decoder =
            new BeaconScanReportDecoder(new MacAddressResolver(TargetPrefixes.defaults()));

    @Test
    void decodesCapturedFrame()
    {
        BeaconScanReport r = decoder.decode(SuntechFrames.capturedScan());

        assertEquals(0xAA, r.header());
        assertEquals(SuntechFrames.DEVICE_ID, r.deviceId());
        assertTrue(r.scanPerformed());
        assertEquals("Scan Performed (1)", r.scanStatusLabel());
        assertEquals(2, r.totalReportsExpected());
        assertEquals(2, r.currentReportNumber());
        assertEquals(3, r.expectedSensorCount());
        assertEquals("20191113", r.scanDate().orElseThrow());
        assertEquals("15:34:15", r.scanTime().orElseThrow());
        assertTrue(r.scanLocation().isPresent());

        // The first structured entry claims a payload longer than the frame.
        assertFalse(r.sensorLayoutComplete());

        List<SensorSighting> sensors = r.sensors();
        assertEquals(3, r.sensorsParsed());
        assertTrue(r.hasTargetMac());

        SensorSighting first = sensors.get(0);
        assertEquals("AC:23:3F:29:19:95", first.macAddress());
        assertEquals(MacOrientation.LITTLE_ENDIAN, first.orientation());
        assertEquals(51, first.bytePosition().getAsInt());
        assertEquals(0x56, first.rssi().getAsInt());
        assertFalse(first.hasRawPayload());

        assertEquals("AC:23:3F:5E:2B:05", sensors.get(1).macAddress());
        assertEquals(MacOrientation.LITTLE_ENDIAN, sensors.get(1).orientation());
        assertEquals(77, sensors.get(1).bytePosition().getAsInt());

        SensorSighting last = sensors.get(2);
        assertEquals("C3:00:00:40:08:9D", last.macAddress());
        assertEquals(MacOrientation.BIG_ENDIAN, last.orientation());
        assertEquals(132, last.bytePosition().getAsInt());
        assertEquals(-53, last.rssi().getAsInt());
    }

    @Test
    void addressesAreUniqueWithinReport()
    {
        BeaconScanReport r = decoder.decode(SuntechFrames.capturedScan());

        Set<String> keys = new HashSet<>();
        for (SensorSighting s : r.sensors()) {
            assertTrue(keys.add(s.addressKey()), "duplicate " + s.macAddress());
        }
    }

    @Test
    void structuredPassKeepsNonTargetsWithPayload()
    {
        byte[] frame = SuntechFrames.scan()
                .entry(ADVERTISEMENT, OTHER, -70)
                .entry(ADVERTISEMENT, TAG, -60)
                .build();

        BeaconScanReport r = decoder.decode(frame);

        assertTrue(r.sensorLayoutComplete());
        assertEquals(2, r.sensorsParsed());

        SensorSighting other = r.sensors().get(0);
        assertEquals("11:22:33:44:55:66", other.macAddress());
        assertFalse(other.target());
        assertEquals(-70, other.rssi().getAsInt());
        assertArrayEquals(ADVERTISEMENT, other.rawPayload());
        assertTrue(other.bytePosition().isEmpty());

        SensorSighting tag = r.sensors().get(1);
        assertEquals("AC:23:3F:00:00:01", tag.macAddress());
        assertTrue(tag.target());
        assertEquals(-60, tag.rssi().getAsInt());
    }

    @Test
    void firstRegistrationWinsAcrossPassesAndOrientations()
    {
        byte[] frame = SuntechFrames.scan()
                .entry(ADVERTISEMENT, SuntechFrames.reversed(TAG), -55)
                .raw(TAG)
                .raw(new byte[] { (byte) 0xC4 })
                .build();

        BeaconScanReport r = decoder.decode(frame);

        assertEquals(1, r.sensorsParsed());
        SensorSighting s = r.sensors().get(0);
        assertEquals("AC:23:3F:00:00:01", s.macAddress());
        assertEquals(MacOrientation.LITTLE_ENDIAN, s.orientation());
        assertEquals(-55, s.rssi().getAsInt());
        assertTrue(s.hasRawPayload());
        assertTrue(s.bytePosition().isEmpty());
    }

    @Test
    void truncatedStructuredEntryIsDiscarded()
    {
        byte[] frame = SuntechFrames.scan()
                .expectedSensors(2)
                .entry(ADVERTISEMENT, TAG, -60)
                .build();

        BeaconScanReport r = decoder.decode(frame);

        assertFalse(r.sensorLayoutComplete());
        assertEquals(1, r.sensorsParsed());
    }

    @Test
    void addressScanReadsRssiOnlyWhenPresent()
    {
        byte[] frame = SuntechFrames.scan().raw(TAG).build();

        BeaconScanReport r = decoder.decode(frame);

        SensorSighting s = r.sensors().get(0);
        assertEquals(34, s.bytePosition().getAsInt());
        assertTrue(s.rssi().isEmpty());
    }

    @Test
    void minimalFrameHasNoOptionalMetadata()
    {
        byte[] frame = Arrays.copyOf(SuntechFrames.scan().build(), BeaconScanReportDecoder.REQUIRED_LENGTH);

        BeaconScanReport r = decoder.decode(frame);

        assertEquals(0, r.expectedSensorCount());
        assertTrue(r.scanDate().isEmpty());
        assertTrue(r.scanTime().isEmpty());
        assertTrue(r.scanLocation().isEmpty());
        assertTrue(r.sensors().isEmpty());
        assertFalse(r.hasTargetMac());
    }

    @Test
    void frameShorterThanMetadataIsRejected()
    {
        byte[] frame = Arrays.copyOf(SuntechFrames.scan().build(), 19);

        SuntechDecodeException e = assertThrows(SuntechDecodeException.class, () -> decoder.decode(frame));
        assertEquals(DecodeErrorKind.TRUNCATED_REQUIRED_FIELD, e.kind());
    }

    @Test
    void acknowledgmentHeaderDecodesIdentically()
    {
        byte[] frame = SuntechFrames.scan().header(0xBA).entry(ADVERTISEMENT, TAG, -60).build();

        BeaconScanReport r = decoder.decode(frame);

        assertTrue(r.acknowledgmentRequested());
        assertEquals(1, r.sensorsParsed());
        assertEquals(49.148988, r.scanLocation().orElseThrow().latitude(), 1e-9);
    }
}
