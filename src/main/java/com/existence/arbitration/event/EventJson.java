package com.existence.arbitration.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson serialization of binding events for external transports.
 */
public final class EventJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventJson() {
    }

    /**
     * Builds the wire payload of an event:
     * {@code {eventId, bindingId, linkedElementId, status, previousStatus, actorId[, reason], timestamp}}.
     */
    public static Map<String, Object> payload(BindingEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", event.eventId());
        payload.put("scopeId", event.scopeId());
        payload.put("bindingId", event.bindingId());
        payload.put("linkedElementId", event.linkedElementId());
        payload.put("status", event.status() != null ? event.status().wireName() : null);
        payload.put("previousStatus", event.previousStatus() != null ? event.previousStatus().wireName() : null);
        payload.put("actorId", event.actorId());
        if (event.reason() != null) {
            payload.put("reason", event.reason());
        }
        payload.put("timestamp", event.timestamp().toString());
        return payload;
    }

    public static String toJson(BindingEvent event) {
        try {
            return MAPPER.writeValueAsString(payload(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.eventId(), e);
        }
    }
}
