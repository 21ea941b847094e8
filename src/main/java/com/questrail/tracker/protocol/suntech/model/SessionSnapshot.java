package com.questrail.tracker.protocol.suntech.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Immutable copy of the shared device session state, safe to hand out to readers.
 *
 * @param currentIgnitionStatus last ignition status seen ({@code "OFF"} before any status report)
 * @param previousIgnitionStatus ignition status the next report is compared against
 * @param latitude              last non-zero latitude
 * @param longitude             last non-zero longitude
 * @param inputVoltageMv        last input voltage inside the plausible band
 * @param batteryLevel          last reported battery level
 * @param lastSeen              last sighting time per target address
 */
public record SessionSnapshot(
        String currentIgnitionStatus,
        Optional<String> previousIgnitionStatus,
        OptionalDouble latitude,
        OptionalDouble longitude,
        OptionalInt inputVoltageMv,
        OptionalInt batteryLevel,
        Map<String, Instant> lastSeen
) {
    public SessionSnapshot {
        Objects.requireNonNull(currentIgnitionStatus, "currentIgnitionStatus");
        Objects.requireNonNull(previousIgnitionStatus, "previousIgnitionStatus");
        Objects.requireNonNull(latitude, "latitude");
        Objects.requireNonNull(longitude, "longitude");
        Objects.requireNonNull(inputVoltageMv, "inputVoltageMv");
        Objects.requireNonNull(batteryLevel, "batteryLevel");
        lastSeen = Map.copyOf(lastSeen);
    }
}
