package com.questrail.tracker.protocol.suntech.internal.exec;

import com.questrail.tracker.api.TelemetryQuery;
import com.questrail.tracker.protocol.suntech.internal.history.BoundedHistory;
import com.questrail.tracker.protocol.suntech.internal.state.DeviceSessionState;
import com.questrail.tracker.protocol.suntech.internal.state.SessionStateTracker;
import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.model.ReceivedReport;
import com.questrail.tracker.protocol.suntech.model.SessionSnapshot;
import com.questrail.tracker.protocol.suntech.observability.BeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.NullBeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.NullObservabilitySink;
import com.questrail.tracker.protocol.suntech.observability.TelemetryErrorEvent;
import com.questrail.tracker.protocol.suntech.observability.TelemetryObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TelemetryAggregator
 * -----------------------------------------------------------------------------
 * Single writer of the shared telemetry state: the raw-report history, the
 * beacon-event history and the {@link DeviceSessionState}.
 *
 * <h2>Locking</h2>
 * One {@link ReentrantLock} covers the whole of {@link #ingest}: appending the
 * report, applying the {@link SessionStateTracker}, and appending the derived
 * events. Appends therefore have a single global order across connections.
 * Decoding happens before {@code ingest} is called and never holds the lock.
 *
 * <h2>Event delivery</h2>
 * Derived events are handed to the {@link BeaconEventSink} after the lock is
 * released. A failing sink is reported and does not affect the stored state.
 */
public final class TelemetryAggregator implements TelemetryQuery
{
    private static final Logger log = LoggerFactory.getLogger(TelemetryAggregator.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final BoundedHistory<ReceivedReport> reports;
    private final BoundedHistory<BeaconScanEvent> events;
    private final DeviceSessionState state;
    private final SessionStateTracker tracker;

    private final BeaconEventSink eventSink;
    private final TelemetryObservabilitySink observability;

    public TelemetryAggregator(int reportHistoryCapacity,
                               int eventHistoryCapacity,
                               int macTableCapacity) {
        this(reportHistoryCapacity, eventHistoryCapacity, macTableCapacity,
             NullBeaconEventSink.INSTANCE, NullObservabilitySink.INSTANCE);
    }

    public TelemetryAggregator(int reportHistoryCapacity,
                               int eventHistoryCapacity,
                               int macTableCapacity,
                               BeaconEventSink eventSink,
                               TelemetryObservabilitySink observability) {
        this.reports = new BoundedHistory<>(reportHistoryCapacity);
        this.events = new BoundedHistory<>(eventHistoryCapacity);
        this.state = new DeviceSessionState(macTableCapacity);
        this.tracker = new SessionStateTracker();
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    /**
     * Records one decoded frame and folds it into the session state.
     *
     * @param remote     peer the frame arrived from
     * @param report     decoded frame
     * @param receivedAt receive time of the frame
     * @return events derived from the report, in append order
     */
    public List<BeaconScanEvent> ingest(SocketAddress remote, DecodedReport report, Instant receivedAt) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(receivedAt, "receivedAt");

        final List<BeaconScanEvent> derived;
        lock.lock();
        try {
            reports.append(new ReceivedReport(receivedAt, remote, report));
            derived = tracker.apply(state, report, receivedAt).events();
            events.appendAll(derived);
        }
        finally {
            lock.unlock();
        }

        for (BeaconScanEvent event : derived) {
            deliver(event);
        }
        return derived;
    }

    private void deliver(BeaconScanEvent event) {
        try {
            eventSink.onBeaconEvent(event);
        }
        catch (RuntimeException e) {
            log.warn("Beacon event sink failed for {}", event.macId(), e);
            observability.onError(new TelemetryErrorEvent(
                    event.timestamp(), "Beacon event sink failed for " + event.macId(), e));
        }
    }

    // ---------------------------------------------------------------------
    // TelemetryQuery
    // ---------------------------------------------------------------------

    @Override
    public List<ReceivedReport> rawReports() {
        lock.lock();
        try {
            return reports.snapshot();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public List<BeaconScanEvent> beaconEvents() {
        lock.lock();
        try {
            return events.snapshot();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public SessionSnapshot currentSessionState() {
        lock.lock();
        try {
            return state.snapshot();
        }
        finally {
            lock.unlock();
        }
    }
}
