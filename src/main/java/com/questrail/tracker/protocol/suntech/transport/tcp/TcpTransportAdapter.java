package com.questrail.tracker.protocol.suntech.transport.tcp;

import com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.internal.exec.TelemetryAggregator;
import com.questrail.tracker.protocol.suntech.internal.time.WallClock;
import com.questrail.tracker.protocol.suntech.model.DecodedReport;
import com.questrail.tracker.protocol.suntech.observability.TelemetryErrorEvent;
import com.questrail.tracker.protocol.suntech.observability.TelemetryFrameEvent;
import com.questrail.tracker.protocol.suntech.observability.TelemetryObservabilitySink;
import com.questrail.tracker.protocol.suntech.observability.TelemetryTransportEvent;
import com.questrail.tracker.protocol.suntech.transport.StreamEndpoint;
import com.questrail.tracker.protocol.suntech.transport.StreamEndpointListener;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * TcpTransportAdapter
 * =============================================================================
 * Connects a {@link StreamEndpoint} to the decode and aggregation pipeline.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   StreamEndpoint
 *        → SuntechFrameDecoder      (no lock held)
 *            → TelemetryAggregator.ingest
 *                → histories, session state, beacon events
 * </pre>
 *
 * <p>Every frame produces exactly one stored report: frames that do not decode
 * are stored as their error value rather than dropped. The receive time is
 * taken from the {@link WallClock} before decoding.</p>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class does not echo frames (the endpoint does) and performs no
 * acknowledgment or retransmission.
 */
public class TcpTransportAdapter implements StreamEndpointListener {

    private final TelemetryAggregator aggregator;
    private final StreamEndpoint endpoint;
    private final SuntechFrameDecoder decoder;
    private final WallClock clock;
    private final TelemetryObservabilitySink observability;

    public TcpTransportAdapter(TelemetryAggregator aggregator,
                               StreamEndpoint endpoint,
                               SuntechFrameDecoder decoder,
                               WallClock clock,
                               TelemetryObservabilitySink observability) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observability = Objects.requireNonNull(observability, "observability");

        // The endpoint is the raw I/O surface; this adapter is the translation layer.
        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp(SocketAddress localAddress) {
        transportEvent(TelemetryTransportEvent.Kind.LISTENING, localAddress, null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause == null) {
            transportEvent(TelemetryTransportEvent.Kind.STOPPED, null, null);
            return;
        }
        observability.onError(new TelemetryErrorEvent(clock.now(), "Listener failed", cause));
        transportEvent(TelemetryTransportEvent.Kind.STOPPED, null, cause.toString());
    }

    @Override
    public void onConnectionOpened(SocketAddress remote) {
        transportEvent(TelemetryTransportEvent.Kind.CONNECTION_OPENED, remote, null);
    }

    @Override
    public void onConnectionIdle(SocketAddress remote) {
        transportEvent(TelemetryTransportEvent.Kind.IDLE_TIMEOUT, remote, null);
    }

    @Override
    public void onConnectionClosed(SocketAddress remote, Throwable cause) {
        if (cause != null) {
            observability.onError(new TelemetryErrorEvent(
                    clock.now(), "Connection " + remote + " failed", cause));
        }
        transportEvent(TelemetryTransportEvent.Kind.CONNECTION_CLOSED, remote,
                cause == null ? null : cause.toString());
    }

    @Override
    public void onFrame(SocketAddress remote, byte[] frame) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(frame, "frame");

        Instant receivedAt = clock.now();

        // 1) Bytes -> report. Total: failures come back as values.
        DecodedReport report = decoder.decode(frame);
        observability.onFrameDecoded(new TelemetryFrameEvent(receivedAt, remote, report));

        // 2) Report -> shared state, under the aggregator lock.
        aggregator.ingest(remote, report, receivedAt);
    }

    private void transportEvent(TelemetryTransportEvent.Kind kind, SocketAddress address, String detail) {
        observability.onTransportEvent(new TelemetryTransportEvent(clock.now(), kind, address, detail));
    }
}
