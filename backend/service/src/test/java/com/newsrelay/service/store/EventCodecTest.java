package com.newsrelay.service.store;

import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.BroadcastCompleted;
import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.TriggerSkipped;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    @Test
    void writesEnvelopeWithTypeAndTimestamp() {
        String line = EventCodec.toJsonLine(new TriggerSkipped(
                Instant.parse("2026-03-02T09:00:00Z"), "daily-news", "previous run still in progress"));

        assertTrue(line.contains("\"type\":\"TriggerSkipped\""));
        assertTrue(line.contains("\"timestamp\":\"2026-03-02T09:00:00Z\""));
        assertTrue(line.contains("\"triggerName\":\"daily-news\""));
        assertFalse(line.contains("\n"));
    }

    @Test
    void readsBackTheConcreteEventType() {
        BroadcastCompleted original = new BroadcastCompleted(Instant.parse("2026-03-02T09:00:05Z"), 4, 1, 120);

        Event decoded = EventCodec.fromJsonLine(EventCodec.toJsonLine(original));

        assertEquals(original, decoded);
    }

    @Test
    void alertDetailsSurviveEncoding() {
        AlertRaised alert = new AlertRaised(Instant.parse("2026-03-02T09:00:00Z"), "fetch", "Feed fetch failed",
                Map.of("source", "Cairo Daily", "kind", "TIMEOUT"));

        AlertRaised decoded = (AlertRaised) EventCodec.fromJsonLine(EventCodec.toJsonLine(alert));

        assertEquals("Cairo Daily", decoded.details().get("source"));
        assertEquals("TIMEOUT", decoded.details().get("kind"));
    }

    @Test
    void unknownTypeIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EventCodec.fromJsonLine("{\"type\":\"SignalChanged\",\"timestamp\":\"2026-03-02T09:00:00Z\",\"event\":{}}"));

        assertTrue(ex.getMessage().contains("SignalChanged"));
    }

    @Test
    void malformedLineIsRejected() {
        assertThrows(IllegalStateException.class, () -> EventCodec.fromJsonLine("not-json"));
    }

    @Test
    void knownTypesAreSorted() {
        List<String> types = EventCodec.knownTypes();

        assertEquals(7, types.size());
        assertEquals("AlertRaised", types.get(0));
        assertEquals("TriggerSkipped", types.get(types.size() - 1));
    }
}
