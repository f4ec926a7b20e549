package fr.lapetina.llm.verifier.domain.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Internal notification of a state change. Fire-and-forget, never persisted.
 */
public record Event(
        String id,
        EventType type,
        Severity severity,
        String source,
        Instant timestamp,
        Map<String, Object> payload
) {
    public Event {
        Objects.requireNonNull(type, "Event type is required");
        Objects.requireNonNull(severity, "Severity is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (source == null) {
            source = "llm-verifier";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static Event of(EventType type, Severity severity, String source, Map<String, Object> payload) {
        return new Event(null, type, severity, source, null, payload);
    }
}
