package com.questrail.tracker.api;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import com.questrail.tracker.protocol.suntech.model.ReceivedReport;
import com.questrail.tracker.protocol.suntech.model.SessionSnapshot;

import java.util.List;

/**
 * TelemetryQuery
 * -----------------------------------------------------------------------------
 * Read-only view of the aggregated telemetry, intended for an HTTP or
 * supervisory surface.
 *
 * <h2>Consistency</h2>
 * Every method returns an immutable copy taken under the aggregation lock.
 * A copy never reflects a partially applied frame: either all of a frame's
 * report, state update and events are visible or none are. Two separate calls
 * may observe different frames.
 *
 * <h2>Ordering</h2>
 * Both histories are oldest first. Once a history reaches its capacity the
 * oldest entries are evicted as new ones arrive.
 */
public interface TelemetryQuery
{
    /**
     * Every decoded frame, including parse errors and unknown headers.
     */
    List<ReceivedReport> rawReports();

    /**
     * Beacon sighting and ignition-change events.
     */
    List<BeaconScanEvent> beaconEvents();

    /**
     * Last-known ignition, position, voltage, battery and per-tag sighting
     * times.
     */
    SessionSnapshot currentSessionState();
}
