package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Forwards each event to every delegate in order. A failing delegate is logged
 * and does not prevent delivery to the others.
 */
public final class CompositeBeaconEventSink implements BeaconEventSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeBeaconEventSink.class);

    private final List<BeaconEventSink> delegates;

    public CompositeBeaconEventSink(List<? extends BeaconEventSink> delegates) {
        Objects.requireNonNull(delegates, "delegates");
        this.delegates = List.copyOf(delegates);
    }

    public static CompositeBeaconEventSink of(BeaconEventSink... delegates) {
        return new CompositeBeaconEventSink(List.of(delegates));
    }

    @Override
    public void onBeaconEvent(BeaconScanEvent event) {
        for (BeaconEventSink delegate : delegates) {
            try {
                delegate.onBeaconEvent(event);
            }
            catch (RuntimeException e) {
                log.warn("Beacon event sink {} failed for {}", delegate, event.macId(), e);
            }
        }
    }
}
