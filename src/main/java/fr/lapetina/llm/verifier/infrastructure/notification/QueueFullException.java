package fr.lapetina.llm.verifier.infrastructure.notification;

/**
 * Thrown when the notification queue cannot accept a notification in time.
 *
 * This occurs when:
 * - Every ring slot is taken for longer than the send timeout
 * - The calling thread is interrupted while waiting for a slot
 */
public final class QueueFullException extends RuntimeException {

    private final Reason reason;

    public QueueFullException(Reason reason) {
        super("Queue full: " + reason.getMessage());
        this.reason = reason;
    }

    public QueueFullException(Reason reason, String details) {
        super("Queue full: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        SEND_TIMEOUT("No free slot before the send timeout"),
        INTERRUPTED("Interrupted while waiting for a free slot");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
