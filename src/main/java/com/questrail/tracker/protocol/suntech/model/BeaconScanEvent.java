package com.questrail.tracker.protocol.suntech.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Enriched, timestamped record of either a target-tag sighting or an ignition
 * transition.
 *
 * <p>Sighting events carry the tag address in {@code macId}; ignition events
 * carry {@link #IGNITION_CHANGE_MARKER} there, set {@code ignitionChange} and
 * fill {@code previousStatus}/{@code newStatus}.</p>
 *
 * @param timestamp            receive time of the frame that produced the event
 * @param macId                tag address, or the ignition marker
 * @param ignitionStatus       cached ignition status at the time of the event
 * @param latitude             last known latitude
 * @param longitude            last known longitude
 * @param frequencySeconds     seconds since this tag was previously seen, when known and positive
 * @param inputVoltageMv       last plausible input voltage
 * @param sensorCountInMessage sightings in the scan report (0 for ignition events)
 * @param rssi                 signal strength of the sighting
 * @param batteryLevel         last reported battery level
 * @param previousStatus       ignition status before the change
 * @param newStatus            ignition status after the change
 * @param ignitionChange       true for ignition events
 */
public record BeaconScanEvent(
        Instant timestamp,
        String macId,
        String ignitionStatus,
        OptionalDouble latitude,
        OptionalDouble longitude,
        OptionalDouble frequencySeconds,
        OptionalInt inputVoltageMv,
        int sensorCountInMessage,
        OptionalInt rssi,
        OptionalInt batteryLevel,
        Optional<String> previousStatus,
        Optional<String> newStatus,
        boolean ignitionChange
) {
    public static final String IGNITION_CHANGE_MARKER = "IGNITION_CHANGE";

    public BeaconScanEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(macId, "macId");
        Objects.requireNonNull(ignitionStatus, "ignitionStatus");
        Objects.requireNonNull(latitude, "latitude");
        Objects.requireNonNull(longitude, "longitude");
        Objects.requireNonNull(frequencySeconds, "frequencySeconds");
        Objects.requireNonNull(inputVoltageMv, "inputVoltageMv");
        Objects.requireNonNull(rssi, "rssi");
        Objects.requireNonNull(batteryLevel, "batteryLevel");
        Objects.requireNonNull(previousStatus, "previousStatus");
        Objects.requireNonNull(newStatus, "newStatus");
    }
}
