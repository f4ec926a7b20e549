package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Severity;

/**
 * Delivery priority of a rendered notification.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public static Priority forSeverity(Severity severity) {
        return switch (severity) {
            case INFO -> LOW;
            case WARNING -> NORMAL;
            case ERROR -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }
}
