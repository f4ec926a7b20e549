package fr.lapetina.llm.verifier.infrastructure.notification;

/**
 * A destination for notifications.
 *
 * <p>Implementations are called from dispatcher workers, possibly concurrently,
 * and must be thread-safe. {@link #deliver} performs a single attempt.
 */
public interface NotificationChannel extends AutoCloseable {

    /**
     * Unique channel name, used for routing and metric tags.
     */
    String name();

    ChannelWeight weight();

    /**
     * Default recipient rendered into notifications for this channel.
     */
    String recipient();

    /**
     * @throws DeliveryException if the destination rejected or never received the notification
     */
    void deliver(Notification notification) throws DeliveryException;

    @Override
    default void close() {
    }
}
