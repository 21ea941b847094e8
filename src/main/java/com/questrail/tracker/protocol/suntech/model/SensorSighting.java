package com.questrail.tracker.protocol.suntech.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One BLE address observed in a beacon scan report.
 *
 * <p>{@code macAddress} is always the resolved address in canonical
 * colon-separated upper-case form, whichever byte order it was found in on the
 * wire; {@link #orientation()} records that byte order.</p>
 *
 * @param macAddress   canonical address, e.g. {@code AC:23:3F:29:19:95}
 * @param orientation  byte order the address was found in
 * @param rssi         signed RSSI in dBm, when a byte followed the address
 * @param target       true if the address carries one of the configured tag prefixes
 * @param bytePosition offset of the address in the frame, for heuristic-scan sightings
 * @param rawPayload   BLE advertisement bytes for structurally parsed sightings; empty otherwise
 */
public record SensorSighting(
        String macAddress,
        MacOrientation orientation,
        OptionalInt rssi,
        boolean target,
        OptionalInt bytePosition,
        byte[] rawPayload
) {
    public SensorSighting {
        Objects.requireNonNull(macAddress, "macAddress");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(rssi, "rssi");
        Objects.requireNonNull(bytePosition, "bytePosition");
        rawPayload = (rawPayload == null) ? new byte[0] : rawPayload.clone();
    }

    @Override
    public byte[] rawPayload() {
        return rawPayload.clone();
    }

    public boolean hasRawPayload() {
        return rawPayload.length > 0;
    }

    /**
     * Twelve hex digits without separators; the key used to deduplicate
     * sightings within one report.
     */
    public String addressKey() {
        return macAddress.replace(":", "");
    }
}
