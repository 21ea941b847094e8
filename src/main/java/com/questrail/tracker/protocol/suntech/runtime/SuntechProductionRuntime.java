package com.questrail.tracker.protocol.suntech.runtime;

import com.questrail.tracker.api.TelemetryQuery;
import com.questrail.tracker.protocol.suntech.codec.SuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.codec.impl.DefaultSuntechFrameDecoder;
import com.questrail.tracker.protocol.suntech.config.TelemetryRuntimeConfig;
import com.questrail.tracker.protocol.suntech.internal.exec.TelemetryAggregator;
import com.questrail.tracker.protocol.suntech.internal.time.SystemWallClock;
import com.questrail.tracker.protocol.suntech.internal.time.WallClock;
import com.questrail.tracker.protocol.suntech.observability.BeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.CompositeBeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.DailyJsonLinesBeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.NullBeaconEventSink;
import com.questrail.tracker.protocol.suntech.observability.Slf4jTelemetryObservabilitySink;
import com.questrail.tracker.protocol.suntech.observability.TelemetryObservabilitySink;
import com.questrail.tracker.protocol.suntech.transport.StreamEndpoint;
import com.questrail.tracker.protocol.suntech.transport.tcp.TcpTransportAdapter;
import com.questrail.tracker.protocol.suntech.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SuntechProductionRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for the Suntech telemetry stack.
 *
 * <pre>
 *   NettyTcpStreamEndpoint → TcpTransportAdapter → DefaultSuntechFrameDecoder
 *                                               → TelemetryAggregator → BeaconEventSink
 * </pre>
 */
public final class SuntechProductionRuntime {
    private final TcpTransportAdapter adapter;
    private final StreamEndpoint endpoint;
    private final TelemetryAggregator aggregator;

    private SuntechProductionRuntime(TcpTransportAdapter adapter,
                                     StreamEndpoint endpoint,
                                     TelemetryAggregator aggregator) {
        this.adapter = adapter;
        this.endpoint = endpoint;
        this.aggregator = aggregator;
    }

    /**
     * Binds the listener. Returns once the socket is bound.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start() {
        adapter.start();
    }

    public void stop() {
        adapter.stop();
    }

    /**
     * Read-only view of the aggregated histories and session state.
     */
    public TelemetryQuery query() {
        return aggregator;
    }

    public Optional<SocketAddress> localAddress() {
        return endpoint.localAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TelemetryRuntimeConfig config = TelemetryRuntimeConfig.defaults();
        private TelemetryObservabilitySink observabilitySink = new Slf4jTelemetryObservabilitySink();
        private BeaconEventSink beaconEventSink = NullBeaconEventSink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private StreamEndpoint endpoint;

        public Builder withConfig(TelemetryRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TelemetryObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Receives every beacon and ignition event in addition to the file log,
         * when one is configured.
         */
        public Builder withBeaconEventSink(BeaconEventSink sink) {
            this.beaconEventSink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Replaces the Netty endpoint, e.g. with a simulator.
         */
        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public SuntechProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(beaconEventSink, "beaconEventSink");
            Objects.requireNonNull(clock, "clock");

            // 1. Event sinks: caller callback first, then the daily file log
            List<BeaconEventSink> sinks = new ArrayList<>();
            sinks.add(beaconEventSink);
            config.beaconLogDirectory().ifPresent(dir ->
                sinks.add(new DailyJsonLinesBeaconEventSink(dir, config.beaconLogZone())));
            BeaconEventSink effectiveSink = (sinks.size() == 1)
                ? beaconEventSink
                : new CompositeBeaconEventSink(sinks);

            // 2. Aggregation core
            TelemetryAggregator aggregator = new TelemetryAggregator(
                config.reportHistoryCapacity(),
                config.eventHistoryCapacity(),
                config.macTableCapacity(),
                effectiveSink,
                observabilitySink
            );

            // 3. Codec
            SuntechFrameDecoder decoder = new DefaultSuntechFrameDecoder(config.targetPrefixes());

            // 4. Transport
            StreamEndpoint effectiveEndpoint = (endpoint != null)
                ? endpoint
                : new NettyTcpStreamEndpoint(config.bindAddress(), config.idleTimeout(), config.readBufferSize());

            TcpTransportAdapter adapter = new TcpTransportAdapter(
                aggregator,
                effectiveEndpoint,
                decoder,
                clock,
                observabilitySink
            );

            return new SuntechProductionRuntime(adapter, effectiveEndpoint, aggregator);
        }
    }
}
