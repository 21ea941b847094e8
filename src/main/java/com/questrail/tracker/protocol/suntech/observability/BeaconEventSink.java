package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;

/**
 * Downstream consumer of beacon and ignition events.
 *
 * <p>Called by the aggregator after its lock is released, in the order events
 * were appended to history. Implementations may block briefly but must be
 * thread-safe; a thrown exception is logged and never rolls back state.</p>
 */
public interface BeaconEventSink {
    void onBeaconEvent(BeaconScanEvent event);
}
