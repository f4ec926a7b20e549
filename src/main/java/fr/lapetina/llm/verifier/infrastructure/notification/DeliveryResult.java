package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.model.ErrorType;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one delivery attempt, returned to whoever sent the notification.
 */
public record DeliveryResult(
        String notificationId,
        String channel,
        boolean delivered,
        ErrorType errorType,
        String error,
        Duration latency,
        Instant completedAt
) {
    public DeliveryResult {
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        if (delivered && error != null) {
            throw new IllegalArgumentException("A delivered notification cannot carry an error");
        }
    }

    public static DeliveryResult delivered(Notification notification, Duration latency) {
        return new DeliveryResult(notification.id(), notification.channel(), true, null, null, latency, null);
    }

    public static DeliveryResult failed(Notification notification, ErrorType errorType, String error) {
        return failed(notification, errorType, error, Duration.ZERO);
    }

    public static DeliveryResult failed(Notification notification, ErrorType errorType, String error, Duration latency) {
        return new DeliveryResult(notification.id(), notification.channel(), false, errorType, error, latency, null);
    }
}
