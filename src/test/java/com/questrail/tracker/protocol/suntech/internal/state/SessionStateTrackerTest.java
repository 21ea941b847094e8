package com.questrail.tracker.protocol.suntech.internal.state;

import com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.codec.impl.DefaultSuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.model.DeviceStatus;
import com.questrail.tracker.protocol.suntech.model.SessionSnapshot;
import com.questrail.tracker.protocol.suntech.test.SuntechFrames;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionStateTrackerTest
 * -----------------------------------------------------------------------------
 * Drives the tracker with decoded frames, as the aggregator does.
 */
final class SessionStateTrackerTest
{
    private static final byte[] ADVERTISEMENT = { 0x02, 0x01, 0x06 };
    private static final byte[] TAG_A = SuntechFrames.hex("AC233F000001");
    private static final byte[] TAG_B = SuntechFrames.hex("AC233F000002");
    private static final byte[] TAG_C = SuntechFrames.hex("AC233F000003");

    private static final Instant T0 = Instant.parse("2025-03-14T12:30:45Z");

    private final SuntechFrameDecoder decoder = new DefaultSuntechFrameDecoder();
    private final SessionStateTracker tracker = new SessionStateTracker();
    private final DeviceSessionState state = new DeviceSessionState(100);

    private SessionStateTracker.Result apply(byte[] frame, Instant at) {
        DecodedReport report = decoder.decode(frame);
        return tracker.apply(state, report, at);
    }

    private static byte[] scanOf(byte[]... tags) {
        SuntechFrames.ScanFrameBuilder b = SuntechFrames.scan();
        for (byte[] tag : tags) {
            b.entry(ADVERTISEMENT, tag, -70);
        }
        return b.build();
    }

    // ---------------------------------------------------------------------
    // Status reports
    // ---------------------------------------------------------------------

    @Test
    void firstStatusOnlyPrimesIgnition()
    {
        SessionStateTracker.Result r = apply(SuntechFrames.status().ignition(true).build(), T0);

        assertTrue(r.events().isEmpty());
        assertTrue(r.stateChanged());
        assertEquals(DeviceStatus.IGNITION_ON, state.currentIgnitionStatus());
        assertEquals(Optional.of(DeviceStatus.IGNITION_ON), state.previousIgnitionStatus());
    }

    @Test
    void ignitionChangeEmitsOneEvent()
    {
        apply(SuntechFrames.status().ignition(false).inputVoltage(12500).build(), T0);
        SessionStateTracker.Result r = apply(SuntechFrames.status().ignition(true).build(), T0.plusSeconds(30));

        assertEquals(1, r.events().size());
        BeaconScanEvent e = r.events().get(0);
        assertTrue(e.ignitionChange());
        assertEquals(BeaconScanEvent.IGNITION_CHANGE_MARKER, e.macId());
        assertEquals(T0.plusSeconds(30), e.timestamp());
        assertEquals("ON", e.ignitionStatus());
        assertEquals(Optional.of("OFF"), e.previousStatus());
        assertEquals(Optional.of("ON"), e.newStatus());
        assertEquals(0, e.sensorCountInMessage());
        assertTrue(e.rssi().isEmpty());
        assertTrue(e.frequencySeconds().isEmpty());
        assertEquals(12500, e.inputVoltageMv().getAsInt());
        assertEquals(49.148988, e.latitude().getAsDouble(), 1e-9);
    }

    @Test
    void repeatedIgnitionEmitsNothing()
    {
        apply(SuntechFrames.status().ignition(true).build(), T0);

        assertTrue(apply(SuntechFrames.status().ignition(true).build(), T0.plusSeconds(1)).events().isEmpty());
        assertTrue(apply(SuntechFrames.status().inputState(0x81).build(), T0.plusSeconds(2)).events().isEmpty());
    }

    @Test
    void zeroPositionDoesNotOverwriteCache()
    {
        apply(SuntechFrames.status().build(), T0);
        apply(SuntechFrames.status().position(0, 0).build(), T0.plusSeconds(1));

        assertEquals(49.148988, state.latitude().getAsDouble(), 1e-9);
        assertEquals(-123.116226, state.longitude().getAsDouble(), 1e-9);
    }

    @Test
    void trailingValuesAreRetainedUntilReplaced()
    {
        apply(SuntechFrames.status().inputVoltage(12500).batteryLevel(80).build(), T0);
        apply(SuntechFrames.status().build(), T0.plusSeconds(1));

        assertEquals(12500, state.inputVoltageMv().getAsInt());
        assertEquals(80, state.batteryLevel().getAsInt());

        // Out-of-band voltage is not reported by the decoder and leaves the cache alone.
        apply(SuntechFrames.status().inputVoltage(9000).build(), T0.plusSeconds(2));
        assertEquals(12500, state.inputVoltageMv().getAsInt());

        apply(SuntechFrames.status().inputVoltage(13800).build(), T0.plusSeconds(3));
        assertEquals(13800, state.inputVoltageMv().getAsInt());
    }

    @Test
    void statusWithoutInputStateLeavesIgnitionUnprimed()
    {
        byte[] truncated = Arrays.copyOf(SuntechFrames.status().ignition(true).build(), 16);

        SessionStateTracker.Result r = apply(truncated, T0);

        assertTrue(r.events().isEmpty());
        assertFalse(r.stateChanged());
        assertEquals(DeviceStatus.IGNITION_OFF, state.currentIgnitionStatus());
        assertTrue(state.previousIgnitionStatus().isEmpty());
        assertTrue(state.latitude().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Beacon scans
    // ---------------------------------------------------------------------

    @Test
    void scanEmitsOneEventPerTarget()
    {
        apply(SuntechFrames.status().ignition(true).inputVoltage(12500).batteryLevel(90).build(), T0);

        byte[] frame = SuntechFrames.scan()
                .entry(ADVERTISEMENT, SuntechFrames.hex("112233445566"), -80)
                .entry(ADVERTISEMENT, TAG_A, -71)
                .entry(ADVERTISEMENT, TAG_B, -72)
                .build();
        List<BeaconScanEvent> events = apply(frame, T0.plusSeconds(10)).events();

        assertEquals(2, events.size());
        BeaconScanEvent a = events.get(0);
        assertEquals("AC:23:3F:00:00:01", a.macId());
        assertEquals("ON", a.ignitionStatus());
        assertEquals(3, a.sensorCountInMessage());
        assertEquals(-71, a.rssi().getAsInt());
        assertEquals(12500, a.inputVoltageMv().getAsInt());
        assertEquals(90, a.batteryLevel().getAsInt());
        assertFalse(a.ignitionChange());
        assertTrue(a.previousStatus().isEmpty());
        assertTrue(a.frequencySeconds().isEmpty());

        assertEquals("AC:23:3F:00:00:02", events.get(1).macId());
    }

    @Test
    void scanBeforeAnyStatusUsesDefaults()
    {
        BeaconScanEvent e = apply(scanOf(TAG_A), T0).events().get(0);

        assertEquals("OFF", e.ignitionStatus());
        assertTrue(e.latitude().isEmpty());
        assertTrue(e.inputVoltageMv().isEmpty());
    }

    @Test
    void frequencyIsSecondsSinceLastSighting()
    {
        apply(scanOf(TAG_A), T0);
        BeaconScanEvent e = apply(scanOf(TAG_A), T0.plusMillis(5000)).events().get(0);

        assertEquals(5.0, e.frequencySeconds().getAsDouble(), 1e-9);
        assertEquals(T0.plusMillis(5000), state.lastSeen("AC:23:3F:00:00:01").orElseThrow());
    }

    @Test
    void nonPositiveIntervalHasNoFrequency()
    {
        apply(scanOf(TAG_A), T0);

        assertTrue(apply(scanOf(TAG_A), T0).events().get(0).frequencySeconds().isEmpty());
        assertTrue(apply(scanOf(TAG_A), T0.minusSeconds(3)).events().get(0).frequencySeconds().isEmpty());
        assertEquals(T0.minusSeconds(3), state.lastSeen("AC:23:3F:00:00:01").orElseThrow());
    }

    @Test
    void unrepresentableIntervalHasNoFrequency()
    {
        assertEquals(OptionalDouble.empty(),
                SessionStateTracker.frequencySeconds(Optional.of(Instant.MIN), Instant.MAX, "AC:23:3F:00:00:01"));
        assertEquals(OptionalDouble.empty(),
                SessionStateTracker.frequencySeconds(Optional.empty(), T0, "AC:23:3F:00:00:01"));
    }

    @Test
    void scanWithoutTargetsChangesNothing()
    {
        byte[] frame = SuntechFrames.scan()
                .entry(ADVERTISEMENT, SuntechFrames.hex("112233445566"), -80)
                .build();

        SessionStateTracker.Result r = apply(frame, T0);

        assertTrue(r.events().isEmpty());
        assertFalse(r.stateChanged());
        assertTrue(state.snapshot().lastSeen().isEmpty());
    }

    @Test
    void errorReportsChangeNothing()
    {
        SessionStateTracker.Result r = apply(new byte[] { 0x55, 0x00 }, T0);

        assertTrue(r.events().isEmpty());
        assertFalse(r.stateChanged());
    }

    @Test
    void lastSeenTableEvictsLeastRecentlyUpdated()
    {
        DeviceSessionState small = new DeviceSessionState(2);
        tracker.apply(small, decoder.decode(scanOf(TAG_A)), T0);
        tracker.apply(small, decoder.decode(scanOf(TAG_B)), T0.plusSeconds(1));
        tracker.apply(small, decoder.decode(scanOf(TAG_A)), T0.plusSeconds(2));
        tracker.apply(small, decoder.decode(scanOf(TAG_C)), T0.plusSeconds(3));

        SessionSnapshot snapshot = small.snapshot();
        assertEquals(2, snapshot.lastSeen().size());
        assertTrue(small.lastSeen("AC:23:3F:00:00:01").isPresent());
        assertTrue(small.lastSeen("AC:23:3F:00:00:02").isEmpty());
        assertTrue(small.lastSeen("AC:23:3F:00:00:03").isPresent());
    }
}
