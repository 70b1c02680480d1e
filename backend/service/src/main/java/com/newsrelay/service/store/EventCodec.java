package com.newsrelay.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.core.events.BroadcastCompleted;
import com.newsrelay.core.events.BroadcastStarted;
import com.newsrelay.core.events.Event;
import com.newsrelay.core.events.FetchCycleCompleted;
import com.newsrelay.core.events.FetchCycleStarted;
import com.newsrelay.core.events.SourceFetched;
import com.newsrelay.core.events.TriggerSkipped;
import com.newsrelay.core.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;

// one event per line: {"type": ..., "timestamp": ..., "event": {...}}
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "FetchCycleStarted", FetchCycleStarted.class,
            "FetchCycleCompleted", FetchCycleCompleted.class,
            "SourceFetched", SourceFetched.class,
            "BroadcastStarted", BroadcastStarted.class,
            "BroadcastCompleted", BroadcastCompleted.class,
            "TriggerSkipped", TriggerSkipped.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<String> knownTypes() {
        return TYPES.keySet().stream().sorted().toList();
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new Envelope(event.type(), event.timestamp(), event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
        String type = node.path("type").asText();
        Class<? extends Event> eventClass = TYPES.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unsupported event type: " + type);
        }
        try {
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize " + type + " event", e);
        }
    }

    private record Envelope(String type, Instant timestamp, Event event) {
    }
}
