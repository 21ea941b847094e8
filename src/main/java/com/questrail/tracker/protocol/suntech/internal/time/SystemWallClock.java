package com.questrail.tracker.protocol.suntech.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <p>May jump forward or backward due to NTP or manual adjustments. For
 * deterministic testing, use a manually advanced clock instead.</p>
 *
 * <p>Thread-safe.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
