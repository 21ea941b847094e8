package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;

/**
 * No-op implementation of BeaconEventSink.
 */
public final class NullBeaconEventSink implements BeaconEventSink {
    public static final NullBeaconEventSink INSTANCE = new NullBeaconEventSink();

    private NullBeaconEventSink() {}

    @Override
    public void onBeaconEvent(BeaconScanEvent event) {}
}
