package com.questrail.tracker.protocol.suntech.config;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Aggregated configuration for the Suntech telemetry runtime.
 *
 * <p>{@link #fromProperties(Properties)} recognizes these keys; any key that is
 * missing keeps the builder default:</p>
 * <ul>
 *   <li>{@code suntech.bind.host} (default all interfaces)</li>
 *   <li>{@code suntech.bind.port} (default {@value #DEFAULT_PORT})</li>
 *   <li>{@code suntech.idleTimeoutSeconds} (default 60)</li>
 *   <li>{@code suntech.readBufferSize} (default {@value #DEFAULT_READ_BUFFER_SIZE})</li>
 *   <li>{@code suntech.history.reports} (default {@value #DEFAULT_REPORT_HISTORY})</li>
 *   <li>{@code suntech.history.events} (default {@value #DEFAULT_EVENT_HISTORY})</li>
 *   <li>{@code suntech.macTable.capacity} (default {@value #DEFAULT_MAC_TABLE})</li>
 *   <li>{@code suntech.targetPrefixes}, comma separated (default {@code AC233F,C3000})</li>
 *   <li>{@code suntech.beaconLog.directory} (default none: no file log)</li>
 *   <li>{@code suntech.beaconLog.zone} (default the system zone)</li>
 * </ul>
 */
public record TelemetryRuntimeConfig(
    InetSocketAddress bindAddress,
    Duration idleTimeout,
    int readBufferSize,
    int reportHistoryCapacity,
    int eventHistoryCapacity,
    int macTableCapacity,
    TargetPrefixes targetPrefixes,
    Optional<Path> beaconLogDirectory,
    ZoneId beaconLogZone
) {
    public static final int DEFAULT_PORT = 18160;
    public static final int DEFAULT_READ_BUFFER_SIZE = 1024;
    public static final int DEFAULT_REPORT_HISTORY = 1000;
    public static final int DEFAULT_EVENT_HISTORY = 10000;
    public static final int DEFAULT_MAC_TABLE = 10000;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);

    static final String PREFIX = "suntech.";

    public TelemetryRuntimeConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(targetPrefixes, "targetPrefixes");
        Objects.requireNonNull(beaconLogDirectory, "beaconLogDirectory");
        Objects.requireNonNull(beaconLogZone, "beaconLogZone");
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        requirePositive(readBufferSize, "readBufferSize");
        requirePositive(reportHistoryCapacity, "reportHistoryCapacity");
        requirePositive(eventHistoryCapacity, "eventHistoryCapacity");
        requirePositive(macTableCapacity, "macTableCapacity");
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was " + value);
        }
    }

    public static TelemetryRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from {@code suntech.*} properties over the defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static TelemetryRuntimeConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String host = property(properties, "bind.host");
        String port = property(properties, "bind.port");
        if (host != null || port != null) {
            int p = (port == null) ? DEFAULT_PORT : parseInt("bind.port", port);
            builder.withBindAddress(host == null ? new InetSocketAddress(p) : new InetSocketAddress(host, p));
        }

        String idle = property(properties, "idleTimeoutSeconds");
        if (idle != null) {
            builder.withIdleTimeout(Duration.ofSeconds(parseInt("idleTimeoutSeconds", idle)));
        }
        String readBuffer = property(properties, "readBufferSize");
        if (readBuffer != null) {
            builder.withReadBufferSize(parseInt("readBufferSize", readBuffer));
        }
        String reports = property(properties, "history.reports");
        if (reports != null) {
            builder.withReportHistoryCapacity(parseInt("history.reports", reports));
        }
        String events = property(properties, "history.events");
        if (events != null) {
            builder.withEventHistoryCapacity(parseInt("history.events", events));
        }
        String macTable = property(properties, "macTable.capacity");
        if (macTable != null) {
            builder.withMacTableCapacity(parseInt("macTable.capacity", macTable));
        }
        String prefixes = property(properties, "targetPrefixes");
        if (prefixes != null) {
            builder.withTargetPrefixes(TargetPrefixes.parse(prefixes));
        }
        String logDirectory = property(properties, "beaconLog.directory");
        if (logDirectory != null) {
            builder.withBeaconLogDirectory(Path.of(logDirectory));
        }
        String zone = property(properties, "beaconLog.zone");
        if (zone != null) {
            builder.withBeaconLogZone(ZoneId.of(zone));
        }
        return builder.build();
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_PORT);
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
        private int reportHistoryCapacity = DEFAULT_REPORT_HISTORY;
        private int eventHistoryCapacity = DEFAULT_EVENT_HISTORY;
        private int macTableCapacity = DEFAULT_MAC_TABLE;
        private TargetPrefixes targetPrefixes = TargetPrefixes.defaults();
        private Path beaconLogDirectory;
        private ZoneId beaconLogZone = ZoneId.systemDefault();

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPort(int port) {
            this.bindAddress = new InetSocketAddress(port);
            return this;
        }

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withReadBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder withReportHistoryCapacity(int capacity) {
            this.reportHistoryCapacity = capacity;
            return this;
        }

        public Builder withEventHistoryCapacity(int capacity) {
            this.eventHistoryCapacity = capacity;
            return this;
        }

        public Builder withMacTableCapacity(int capacity) {
            this.macTableCapacity = capacity;
            return this;
        }

        public Builder withTargetPrefixes(TargetPrefixes targetPrefixes) {
            this.targetPrefixes = targetPrefixes;
            return this;
        }

        public Builder withBeaconLogDirectory(Path directory) {
            this.beaconLogDirectory = directory;
            return this;
        }

        public Builder withBeaconLogZone(ZoneId zone) {
            this.beaconLogZone = zone;
            return this;
        }

        public TelemetryRuntimeConfig build() {
            return new TelemetryRuntimeConfig(
                bindAddress,
                idleTimeout,
                readBufferSize,
                reportHistoryCapacity,
                eventHistoryCapacity,
                macTableCapacity,
                targetPrefixes,
                Optional.ofNullable(beaconLogDirectory),
                beaconLogZone);
        }
    }
}
