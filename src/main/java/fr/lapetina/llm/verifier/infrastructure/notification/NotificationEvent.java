package fr.lapetina.llm.verifier.infrastructure.notification;

import com.lmax.disruptor.EventFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot. Pre-allocated by the Disruptor and reused;
 * only the worker owning the slot's sequence touches it between publish and clear.
 */
public final class NotificationEvent {

    public static final EventFactory<NotificationEvent> FACTORY = NotificationEvent::new;

    private Notification notification;
    private NotificationChannel channel;
    private CompletableFuture<DeliveryResult> resultFuture;

    void initialize(Notification notification, NotificationChannel channel, CompletableFuture<DeliveryResult> future) {
        this.notification = notification;
        this.channel = channel;
        this.resultFuture = future;
    }

    void clear() {
        this.notification = null;
        this.channel = null;
        this.resultFuture = null;
    }

    public Notification getNotification() {
        return notification;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public CompletableFuture<DeliveryResult> getResultFuture() {
        return resultFuture;
    }

    @Override
    public String toString() {
        return "NotificationEvent{" +
                "notificationId=" + (notification != null ? notification.id() : null) +
                ", channel=" + (channel != null ? channel.name() : null) +
                '}';
    }
}
