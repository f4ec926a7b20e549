package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Event;

import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders events into channel notifications.
 */
public final class NotificationRenderer {

    public Notification render(Event event, NotificationChannel channel) {
        return new Notification(
                null,
                channel.name(),
                channel.recipient(),
                title(event),
                body(event),
                Priority.forSeverity(event.severity()),
                event);
    }

    String title(Event event) {
        Object provider = event.payload().get("provider");
        Object model = event.payload().get("model");
        String subject = provider != null && model != null ? " " + provider + "/" + model : "";
        return "[" + event.severity() + "] " + headline(event) + subject;
    }

    String body(Event event) {
        StringBuilder body = new StringBuilder();
        body.append("Event: ").append(event.type().getWireName()).append('\n');
        body.append("Source: ").append(event.source()).append('\n');
        body.append("Time: ").append(DateTimeFormatter.ISO_INSTANT.format(event.timestamp())).append('\n');
        // Sorted for stable output
        for (Map.Entry<String, Object> entry : new TreeMap<>(event.payload()).entrySet()) {
            body.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return body.toString().stripTrailing();
    }

    private static String headline(Event event) {
        return switch (event.type()) {
            case VERIFICATION_STARTED -> "Verification started";
            case VERIFICATION_COMPLETED -> "Verification completed";
            case VERIFICATION_FAILED -> "Verification failed";
            case SCORE_CHANGED -> "Score changed";
        };
    }
}
