package com.questrail.tracker.protocol.suntech.observability;

import com.questrail.tracker.protocol.suntech.model.BeaconScanEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class CompositeBeaconEventSinkTest
{
    private static final BeaconScanEvent EVENT = new BeaconScanEvent(
            Instant.parse("2025-03-14T12:30:45Z"),
            "AC:23:3F:00:00:01",
            "OFF",
            OptionalDouble.empty(),
            OptionalDouble.empty(),
            OptionalDouble.empty(),
            OptionalInt.empty(),
            1,
            OptionalInt.of(-70),
            OptionalInt.empty(),
            Optional.empty(),
            Optional.empty(),
            false);

    @Test
    void deliversToEveryDelegateInOrder()
    {
        RecordingBeaconEventSink first = new RecordingBeaconEventSink();
        RecordingBeaconEventSink second = new RecordingBeaconEventSink();

        CompositeBeaconEventSink.of(first, second).onBeaconEvent(EVENT);

        assertEquals(1, first.events().size());
        assertEquals(EVENT, second.events().get(0));
    }

    @Test
    void failingDelegateDoesNotStarveOthers()
    {
        BeaconEventSink failing = event -> {
            throw new IllegalStateException("boom");
        };
        RecordingBeaconEventSink after = new RecordingBeaconEventSink();

        assertDoesNotThrow(() -> CompositeBeaconEventSink.of(failing, after).onBeaconEvent(EVENT));
        assertEquals(1, after.events().size());
    }
}
