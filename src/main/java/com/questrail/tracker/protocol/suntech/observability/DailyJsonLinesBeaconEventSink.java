package com.questrail.tracker.protocol.suntech.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * DailyJsonLinesBeaconEventSink
 * -----------------------------------------------------------------------------
 * Appends each event as one JSON object per line to
 * {@code beacon_scans_YYYYMMDD.jsonl} in a configured directory.
 *
 * <p>The file is chosen from the event timestamp in the configured zone, so an
 * event stamped just before midnight lands in that day's file even if it is
 * written after midnight. Absent optional values are written as JSON
 * {@code null}.</p>
 *
 * <p>Thread-safe. Write failures surface as {@link UncheckedIOException}.</p>
 */
public final class DailyJsonLinesBeaconEventSink implements BeaconEventSink
{
    static final String FILE_PREFIX = "beacon_scans_";
    static final String FILE_SUFFIX = ".jsonl";

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path directory;
    private final ZoneId zone;
    private final ObjectMapper objectMapper;

    public DailyJsonLinesBeaconEventSink(Path directory, ZoneId zone) {
        this(directory, zone, new ObjectMapper());
    }

    public DailyJsonLinesBeaconEventSink(Path directory, ZoneId zone, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * File an event stamped on {@code day} is written to.
     */
    public Path fileFor(LocalDate day) {
        return directory.resolve(FILE_PREFIX + DAY.format(day) + FILE_SUFFIX);
    }

    @Override
    public void onBeaconEvent(BeaconScanEvent event) {
        Objects.requireNonNull(event, "event");
        final String line;
        try {
            line = objectMapper.writeValueAsString(toJson(event));
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize beacon event for " + event.macId(), e);
        }

        Path file = fileFor(LocalDate.ofInstant(event.timestamp(), zone));
        synchronized (this) {
            try {
                Files.createDirectories(directory);
                try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    writer.write(line);
                    writer.newLine();
                }
            }
            catch (IOException e) {
                throw new UncheckedIOException("Cannot append to " + file, e);
            }
        }
    }

    ObjectNode toJson(BeaconScanEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", event.timestamp().toString());
        node.put("mac_id", event.macId());
        node.put("ignition_status", event.ignitionStatus());
        putOptional(node, "latitude", event.latitude());
        putOptional(node, "longitude", event.longitude());
        putOptional(node, "frequency_seconds", event.frequencySeconds());
        putOptional(node, "input_voltage_mv", event.inputVoltageMv());
        node.put("sensor_count_in_message", event.sensorCountInMessage());
        putOptional(node, "rssi", event.rssi());
        putOptional(node, "battery_level", event.batteryLevel());
        if (event.ignitionChange()) {
            putOptional(node, "previous_status", event.previousStatus());
            putOptional(node, "new_status", event.newStatus());
            node.put("is_ignition_change", true);
        }
        return node;
    }

    private static void putOptional(ObjectNode node, String field, OptionalDouble value) {
        if (value.isPresent()) {
            node.put(field, value.getAsDouble());
        } else {
            node.putNull(field);
        }
    }

    private static void putOptional(ObjectNode node, String field, OptionalInt value) {
        if (value.isPresent()) {
            node.put(field, value.getAsInt());
        } else {
            node.putNull(field);
        }
    }

    private static void putOptional(ObjectNode node, String field, Optional<String> value) {
        if (value.isPresent()) {
            node.put(field, value.get());
        } else {
            node.putNull(field);
        }
    }

    @Override
    public String toString() {
        return "DailyJsonLinesBeaconEventSink[" + directory + ", " + zone + "]";
    }
}
