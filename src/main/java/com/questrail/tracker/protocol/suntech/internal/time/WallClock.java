package com.questrail.tracker.protocol.suntech.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the receive timestamps stamped on reports and beacon events.
 *
 * <p>
 * Sighting frequency is computed from these timestamps, so a clock that jumps
 * backwards yields a non-positive delta; the session tracker reports such
 * deltas as absent.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
