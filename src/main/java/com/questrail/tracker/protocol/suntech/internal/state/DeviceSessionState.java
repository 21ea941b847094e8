package com.questrail.tracker.protocol.suntech.internal.state;

import com.questrail.tracker.protocol.suntech.model.DeviceStatus;
import com.questrail.tracker.protocol.suntech.model.SessionSnapshot;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * DeviceSessionState
 * -----------------------------------------------------------------------------
 * Last-known device values shared by every connection of one running server.
 *
 * <h2>Ownership</h2>
 * One instance is created by the aggregator and threaded into
 * {@link SessionStateTracker#apply}. It is mutated only by the tracker while the
 * aggregator lock is held. Readers obtain a {@link SessionSnapshot} instead of
 * touching the live object.
 *
 * <h2>Per-address table</h2>
 * The last-seen table is bounded. When a new address would exceed the capacity,
 * the address updated least recently is evicted.
 */
public final class DeviceSessionState
{
    private String currentIgnitionStatus = DeviceStatus.IGNITION_OFF;
    private String previousIgnitionStatus;
    private Double latitude;
    private Double longitude;
    private Integer inputVoltageMv;
    private Integer batteryLevel;

    private final int lastSeenCapacity;
    private final LinkedHashMap<String, Instant> lastSeen;

    public DeviceSessionState(int lastSeenCapacity) {
        if (lastSeenCapacity <= 0) {
            throw new IllegalArgumentException("lastSeenCapacity must be > 0");
        }
        this.lastSeenCapacity = lastSeenCapacity;
        this.lastSeen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > DeviceSessionState.this.lastSeenCapacity;
            }
        };
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public String currentIgnitionStatus() {
        return currentIgnitionStatus;
    }

    public Optional<String> previousIgnitionStatus() {
        return Optional.ofNullable(previousIgnitionStatus);
    }

    public OptionalDouble latitude() {
        return latitude == null ? OptionalDouble.empty() : OptionalDouble.of(latitude);
    }

    public OptionalDouble longitude() {
        return longitude == null ? OptionalDouble.empty() : OptionalDouble.of(longitude);
    }

    public OptionalInt inputVoltageMv() {
        return inputVoltageMv == null ? OptionalInt.empty() : OptionalInt.of(inputVoltageMv);
    }

    public OptionalInt batteryLevel() {
        return batteryLevel == null ? OptionalInt.empty() : OptionalInt.of(batteryLevel);
    }

    public Optional<Instant> lastSeen(String macAddress) {
        return Optional.ofNullable(lastSeen.get(macAddress));
    }

    public int lastSeenCapacity() {
        return lastSeenCapacity;
    }

    /**
     * Copies the current values. The caller must hold the lock that guards
     * mutation.
     */
    public SessionSnapshot snapshot() {
        return new SessionSnapshot(
                currentIgnitionStatus,
                previousIgnitionStatus(),
                latitude(),
                longitude(),
                inputVoltageMv(),
                batteryLevel(),
                Map.copyOf(lastSeen));
    }

    // ---------------------------------------------------------------------
    // Mutation (tracker only)
    // ---------------------------------------------------------------------

    void position(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    void inputVoltageMv(int millivolts) {
        this.inputVoltageMv = millivolts;
    }

    void batteryLevel(int level) {
        this.batteryLevel = level;
    }

    void currentIgnitionStatus(String status) {
        this.currentIgnitionStatus = status;
    }

    void previousIgnitionStatus(String status) {
        this.previousIgnitionStatus = status;
    }

    void markSeen(String macAddress, Instant at) {
        // Re-insert so insertion order tracks the most recent update.
        lastSeen.remove(macAddress);
        lastSeen.put(macAddress, at);
    }
}
