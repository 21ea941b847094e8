package com.questrail.tracker.protocol.suntech.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class DailyJsonLinesBeaconEventSinkTest
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private static BeaconScanEvent sighting(Instant at) {
        return new BeaconScanEvent(
                at,
                "AC:23:3F:29:19:95",
                "ON",
                OptionalDouble.of(49.148988),
                OptionalDouble.of(-123.116226),
                OptionalDouble.of(5.0),
                OptionalInt.of(12500),
                3,
                OptionalInt.of(-53),
                OptionalInt.empty(),
                Optional.empty(),
                Optional.empty(),
                false);
    }

    private static BeaconScanEvent ignitionChange(Instant at) {
        return new BeaconScanEvent(
                at,
                BeaconScanEvent.IGNITION_CHANGE_MARKER,
                "ON",
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                OptionalInt.empty(),
                0,
                OptionalInt.empty(),
                OptionalInt.of(80),
                Optional.of("OFF"),
                Optional.of("ON"),
                true);
    }

    private static List<String> lines(Path file) throws Exception {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    @Test
    void writesOneObjectPerLine() throws Exception
    {
        DailyJsonLinesBeaconEventSink sink = new DailyJsonLinesBeaconEventSink(dir, ZoneOffset.UTC);
        Instant at = Instant.parse("2025-03-14T12:30:45Z");

        sink.onBeaconEvent(sighting(at));
        sink.onBeaconEvent(sighting(at.plusSeconds(5)));

        Path file = dir.resolve("beacon_scans_20250314.jsonl");
        assertEquals(file, sink.fileFor(LocalDate.of(2025, 3, 14)));
        List<String> lines = lines(file);
        assertEquals(2, lines.size());

        JsonNode first = MAPPER.readTree(lines.get(0));
        assertEquals("2025-03-14T12:30:45Z", first.get("timestamp").asText());
        assertEquals("AC:23:3F:29:19:95", first.get("mac_id").asText());
        assertEquals("ON", first.get("ignition_status").asText());
        assertEquals(49.148988, first.get("latitude").asDouble(), 1e-9);
        assertEquals(5.0, first.get("frequency_seconds").asDouble(), 1e-9);
        assertEquals(12500, first.get("input_voltage_mv").asInt());
        assertEquals(3, first.get("sensor_count_in_message").asInt());
        assertEquals(-53, first.get("rssi").asInt());
        assertTrue(first.get("battery_level").isNull());
        assertFalse(first.has("is_ignition_change"));
        assertFalse(first.has("previous_status"));
    }

    @Test
    void ignitionChangeCarriesTransition() throws Exception
    {
        DailyJsonLinesBeaconEventSink sink = new DailyJsonLinesBeaconEventSink(dir, ZoneOffset.UTC);

        sink.onBeaconEvent(ignitionChange(Instant.parse("2025-03-14T08:00:00Z")));

        JsonNode node = MAPPER.readTree(lines(dir.resolve("beacon_scans_20250314.jsonl")).get(0));
        assertEquals("IGNITION_CHANGE", node.get("mac_id").asText());
        assertEquals("OFF", node.get("previous_status").asText());
        assertEquals("ON", node.get("new_status").asText());
        assertTrue(node.get("is_ignition_change").asBoolean());
        assertTrue(node.get("latitude").isNull());
        assertTrue(node.get("rssi").isNull());
        assertEquals(80, node.get("battery_level").asInt());
    }

    @Test
    void dayFollowsConfiguredZone() throws Exception
    {
        // 2025-03-15T02:00Z is still 2025-03-14 in Vancouver.
        Instant at = Instant.parse("2025-03-15T02:00:00Z");

        new DailyJsonLinesBeaconEventSink(dir.resolve("local"), ZoneId.of("America/Vancouver"))
                .onBeaconEvent(sighting(at));
        new DailyJsonLinesBeaconEventSink(dir.resolve("utc"), ZoneOffset.UTC)
                .onBeaconEvent(sighting(at));

        assertTrue(Files.exists(dir.resolve("local").resolve("beacon_scans_20250314.jsonl")));
        assertTrue(Files.exists(dir.resolve("utc").resolve("beacon_scans_20250315.jsonl")));
    }

    @Test
    void unwritableDirectoryFails() throws Exception
    {
        Path blocker = Files.writeString(dir.resolve("not-a-directory"), "x");
        DailyJsonLinesBeaconEventSink sink = new DailyJsonLinesBeaconEventSink(blocker, ZoneOffset.UTC);

        assertThrows(UncheckedIOException.class,
                () -> sink.onBeaconEvent(sighting(Instant.parse("2025-03-14T12:30:45Z"))));
    }
}
