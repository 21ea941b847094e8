package com.questrail.tracker.protocol.suntech.internal.state;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import com.questrail.tracker.protocol.suntech.model.BeaconScanReport;
import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.model.GpsFix;
import com.questrail.tracker.protocol.suntech.model.SensorSighting;
import com.questrail.tracker.protocol.suntech.model.StatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * SessionStateTracker
 * -----------------------------------------------------------------------------
 * State transition engine that folds decoded reports into a
 * {@link DeviceSessionState} and derives {@link BeaconScanEvent}s.
 *
 * <h2>Role in the architecture</h2>
 * The tracker performs no I/O and owns no lock. The aggregator calls
 * {@link #apply} while holding its lock, passing the shared state object and
 * the receive time of the frame.
 *
 * <h2>Transitions</h2>
 * <ul>
 *   <li>{@link StatusReport}: caches position (unless it is the all-zero
 *       sentinel), input voltage and battery level when present, and emits one
 *       ignition-change event when the ignition status differs from the one
 *       previously reported. The first status report only primes the
 *       comparison.</li>
 *   <li>{@link BeaconScanReport} with sightings: one event per target
 *       sighting, carrying the seconds since that address was last seen.</li>
 *   <li>Everything else: no change, no events.</li>
 * </ul>
 */
public final class SessionStateTracker
{
    private static final Logger log = LoggerFactory.getLogger(SessionStateTracker.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    /**
     * Result of applying one report.
     *
     * @param events       events derived from the report, in emission order
     * @param stateChanged true if any cached value was updated
     */
    public record Result(List<BeaconScanEvent> events, boolean stateChanged) {
        public Result {
            events = List.copyOf(events);
        }

        static Result unchanged() {
            return new Result(List.of(), false);
        }
    }

    /**
     * Applies a single decoded report to the session state.
     *
     * @param state  shared session state, mutated in place
     * @param report decoded report
     * @param now    receive time of the frame the report was decoded from
     * @return derived events
     */
    public Result apply(DeviceSessionState state, DecodedReport report, Instant now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(now, "now");

        if (report instanceof StatusReport status) {
            return onStatusReport(state, status, now);
        }
        if (report instanceof BeaconScanReport scan) {
            return onBeaconScan(state, scan, now);
        }
        return Result.unchanged();
    }

    // ---------------------------------------------------------------------
    // Status reports
    // ---------------------------------------------------------------------

    private Result onStatusReport(DeviceSessionState state, StatusReport report, Instant now) {
        boolean changed = false;

        GpsFix gps = report.gps();
        if (!gps.isZeroPosition()) {
            state.position(gps.latitude(), gps.longitude());
            changed = true;
        }

        // The decoder only surfaces voltages inside the plausible band.
        if (report.inputVoltageMv().isPresent()) {
            state.inputVoltageMv(report.inputVoltageMv().getAsInt());
            changed = true;
        }
        if (report.batteryLevel().isPresent()) {
            state.batteryLevel(report.batteryLevel().getAsInt());
            changed = true;
        }

        Optional<String> reported = report.ignitionStatus();
        if (reported.isEmpty()) {
            return new Result(List.of(), changed);
        }

        String newStatus = reported.get();
        Optional<String> previous = state.previousIgnitionStatus();
        state.currentIgnitionStatus(newStatus);
        state.previousIgnitionStatus(newStatus);

        if (previous.isPresent() && !previous.get().equals(newStatus)) {
            log.info("Ignition changed {} -> {} (device {})",
                    previous.get(), newStatus, report.deviceId());
            BeaconScanEvent event = new BeaconScanEvent(
                    now,
                    BeaconScanEvent.IGNITION_CHANGE_MARKER,
                    newStatus,
                    state.latitude(),
                    state.longitude(),
                    OptionalDouble.empty(),
                    state.inputVoltageMv(),
                    0,
                    OptionalInt.empty(),
                    state.batteryLevel(),
                    previous,
                    Optional.of(newStatus),
                    true);
            return new Result(List.of(event), true);
        }
        return new Result(List.of(), true);
    }

    // ---------------------------------------------------------------------
    // Beacon scans
    // ---------------------------------------------------------------------

    private Result onBeaconScan(DeviceSessionState state, BeaconScanReport report, Instant now) {
        if (report.sensors().isEmpty()) {
            return Result.unchanged();
        }

        final int sensorCount = report.sensorsParsed();
        List<BeaconScanEvent> events = new ArrayList<>();
        for (SensorSighting sighting : report.sensors()) {
            if (!sighting.target()) {
                continue;
            }
            String mac = sighting.macAddress();
            OptionalDouble frequency = frequencySeconds(state.lastSeen(mac), now, mac);
            state.markSeen(mac, now);

            events.add(new BeaconScanEvent(
                    now,
                    mac,
                    state.currentIgnitionStatus(),
                    state.latitude(),
                    state.longitude(),
                    frequency,
                    state.inputVoltageMv(),
                    sensorCount,
                    sighting.rssi(),
                    state.batteryLevel(),
                    Optional.empty(),
                    Optional.empty(),
                    false));
        }
        return new Result(events, !events.isEmpty());
    }

    /**
     * Seconds between the previous sighting and {@code now}; absent when there
     * is no previous sighting or the delta is not positive.
     */
    static OptionalDouble frequencySeconds(Optional<Instant> previous, Instant now, String mac) {
        if (previous.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            Duration delta = Duration.between(previous.get(), now);
            if (delta.isZero() || delta.isNegative()) {
                log.debug("Non-positive sighting interval for {}: {}", mac, delta);
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(delta.toNanos() / NANOS_PER_SECOND);
        }
        catch (ArithmeticException e) {
            log.warn("Cannot compute sighting interval for {}: {}", mac, e.toString());
            return OptionalDouble.empty();
        }
    }
}
