package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Event;

import java.util.Objects;
import java.util.UUID;

/**
 * A rendered message for one channel. Discarded after its single delivery attempt.
 *
 * @param source the event this notification was rendered from, null for direct sends
 */
public record Notification(
        String id,
        String channel,
        String recipient,
        String title,
        String body,
        Priority priority,
        Event source
) {
    public Notification {
        Objects.requireNonNull(channel, "Channel is required");
        Objects.requireNonNull(title, "Title is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (body == null) {
            body = "";
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    public static Notification of(String channel, String recipient, String title, String body) {
        return new Notification(null, channel, recipient, title, body, Priority.NORMAL, null);
    }
}
