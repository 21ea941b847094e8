package com.questrail.tracker.protocol.suntech.model;

import java.util.Objects;

/**
 * Decoded GPS position.
 *
 * <p>Coordinates are decimal degrees with six decimal digits of precision.
 * Speed is km/h and course is degrees, both with two decimals.</p>
 */
public record GpsFix(
        double latitude,
        double longitude,
        double speedKmh,
        double courseDeg,
        int satellites,
        FixStatus fixStatus
) {
    public GpsFix {
        Objects.requireNonNull(fixStatus, "fixStatus");
    }

    /**
     * Returns true when both coordinates are exactly zero, which devices emit
     * when no position is known.
     */
    public boolean isZeroPosition() {
        return latitude == 0.0 && longitude == 0.0;
    }
}
