package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Event;
import fr.lapetina.llm.verifier.domain.event.EventBus;
import fr.lapetina.llm.verifier.domain.event.EventType;
import fr.lapetina.llm.verifier.domain.event.InMemoryEventBus;
import fr.lapetina.llm.verifier.domain.event.Severity;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationDispatcherTest {

    private NotificationDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private NotificationDispatcher start(NotificationDispatcher.Builder builder) {
        dispatcher = builder.build().start();
        return dispatcher;
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("should deliver to the named channel")
        void shouldDeliver() throws Exception {
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            start(NotificationDispatcher.builder().capacity(8).workers(2).channel(slack));

            DeliveryResult result = dispatcher.send(Notification.of("slack", "#ops", "Hello", "world"))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result.delivered()).isTrue();
            assertThat(result.channel()).isEqualTo("slack");
            assertThat(result.error()).isNull();
            assertThat(slack.delivered()).extracting(Notification::title).containsExactly("Hello");
        }

        @Test
        @DisplayName("should report a channel failure in the result")
        void shouldReportChannelFailure() throws Exception {
            RecordingChannel telegram = new RecordingChannel("telegram", ChannelWeight.STANDARD)
                    .failingWith(ErrorType.UNAUTHORIZED, "telegram returned HTTP 401");
            start(NotificationDispatcher.builder().capacity(8).workers(1).channel(telegram));

            DeliveryResult result = dispatcher.send(Notification.of("telegram", "42", "Hi", ""))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result.delivered()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.UNAUTHORIZED);
            assertThat(result.error()).contains("401");
        }

        @Test
        @DisplayName("should resolve unknown channels to NOT_FOUND without queueing")
        void shouldRejectUnknownChannel() throws Exception {
            start(NotificationDispatcher.builder().capacity(8).workers(1));

            DeliveryResult result = dispatcher.send(Notification.of("pager", null, "Hi", ""))
                    .get(1, TimeUnit.SECONDS);

            assertThat(result.delivered()).isFalse();
            assertThat(result.errorType()).isEqualTo(ErrorType.NOT_FOUND);
            assertThat(dispatcher.getRemainingCapacity()).isEqualTo(8);
        }

        @Test
        @DisplayName("should fail the future when not running")
        void shouldFailWhenNotRunning() {
            dispatcher = NotificationDispatcher.builder()
                    .channel(new RecordingChannel("slack", ChannelWeight.LIGHT))
                    .build();

            CompletableFuture<DeliveryResult> future = dispatcher.send(Notification.of("slack", null, "Hi", ""));

            assertThatThrownBy(future::get)
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should throw QueueFullException when every slot stays taken")
        void shouldRejectWhenQueueFull() throws Exception {
            RecordingChannel slow = new RecordingChannel("slow", ChannelWeight.LIGHT).blocking();
            start(NotificationDispatcher.builder()
                    .capacity(4)
                    .workers(1)
                    .sendTimeout(Duration.ofMillis(100))
                    .channel(slow));

            List<CompletableFuture<DeliveryResult>> accepted = new ArrayList<>();
            accepted.add(dispatcher.send(Notification.of("slow", null, "n0", "")));
            assertThat(slow.awaitFirstDelivery()).isTrue();
            for (int i = 1; i < 4; i++) {
                accepted.add(dispatcher.send(Notification.of("slow", null, "n" + i, "")));
            }

            assertThatThrownBy(() -> dispatcher.send(Notification.of("slow", null, "overflow", "")))
                    .isInstanceOf(QueueFullException.class)
                    .satisfies(e -> assertThat(((QueueFullException) e).getReason())
                            .isEqualTo(QueueFullException.Reason.SEND_TIMEOUT));

            slow.release();
            CompletableFuture.allOf(accepted.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
            assertThat(slow.delivered()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("sendEvent")
    class SendEvent {

        @Test
        @DisplayName("should fan a warning out to every non-heavy channel")
        void shouldRouteWarnings() throws Exception {
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            RecordingChannel telegram = new RecordingChannel("telegram", ChannelWeight.STANDARD);
            RecordingChannel email = new RecordingChannel("email", ChannelWeight.HEAVY);
            start(NotificationDispatcher.builder().capacity(16).workers(2)
                    .channel(email).channel(telegram).channel(slack));

            Event event = Event.of(EventType.SCORE_CHANGED, Severity.WARNING, "test",
                    Map.of("provider", "openai", "model", "gpt-4o"));
            List<DeliveryResult> results = dispatcher.sendEvent(event).get(5, TimeUnit.SECONDS);

            assertThat(results).extracting(DeliveryResult::channel).containsExactly("telegram", "slack");
            assertThat(results).allMatch(DeliveryResult::delivered);
            assertThat(email.delivered()).isEmpty();
            assertThat(slack.delivered().get(0).source()).isSameAs(event);
        }

        @Test
        @DisplayName("should deliver bus events for subscribed types only")
        void shouldDeliverSubscribedBusEvents() throws Exception {
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            start(NotificationDispatcher.builder().capacity(8).workers(1).channel(slack));
            InMemoryEventBus bus = new InMemoryEventBus();
            EventBus.Subscription subscription = dispatcher.subscribeTo(bus, Set.of(EventType.VERIFICATION_FAILED));

            bus.publish(Event.of(EventType.VERIFICATION_COMPLETED, Severity.INFO, "test", Map.of()));
            bus.publish(Event.of(EventType.VERIFICATION_FAILED, Severity.ERROR, "test", Map.of()));

            assertThat(slack.awaitDelivered(1)).isTrue();
            Thread.sleep(50);
            assertThat(slack.delivered()).hasSize(1);
            assertThat(slack.delivered().get(0).title()).startsWith("[ERROR] Verification failed");

            subscription.cancel();
            assertThat(bus.subscriberCount()).isZero();
        }

        @Test
        @DisplayName("should count deliveries in metrics")
        void shouldRecordMetrics() throws Exception {
            MetricsRegistry metrics = new MetricsRegistry("test_dispatch");
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            start(NotificationDispatcher.builder().capacity(8).workers(1).metrics(metrics).channel(slack));

            dispatcher.sendEvent(Event.of(EventType.VERIFICATION_FAILED, Severity.ERROR, "test", Map.of()))
                    .get(5, TimeUnit.SECONDS);

            assertThat(metrics.scrape()).contains("test_dispatch_notifications_total");
            metrics.close();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should reject duplicate channel names")
        void shouldRejectDuplicateChannel() {
            dispatcher = NotificationDispatcher.builder()
                    .channel(new RecordingChannel("slack", ChannelWeight.LIGHT))
                    .build();

            assertThatThrownBy(() -> dispatcher.register(new RecordingChannel("SLACK", ChannelWeight.LIGHT)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should require a power-of-two capacity")
        void shouldRequirePowerOfTwoCapacity() {
            assertThatThrownBy(() -> NotificationDispatcher.builder().capacity(10))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should stop and close its channels")
        void shouldCloseChannels() {
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            start(NotificationDispatcher.builder().capacity(8).workers(1).channel(slack));

            dispatcher.close();

            assertThat(dispatcher.isRunning()).isFalse();
            assertThat(slack.isClosed()).isTrue();
            assertThat(dispatcher.send(Notification.of("slack", null, "late", ""))).isCompletedExceptionally();
        }

        @Test
        @DisplayName("should complete every accepted send when closed while senders are active")
        void shouldCompleteSendsRacingClose() throws Exception {
            RecordingChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
            start(NotificationDispatcher.builder()
                    .capacity(64)
                    .workers(2)
                    .sendTimeout(Duration.ofMillis(50))
                    .shutdownGrace(Duration.ofMillis(200))
                    .channel(slack));
            List<CompletableFuture<DeliveryResult>> futures = new CopyOnWriteArrayList<>();
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService senders = Executors.newFixedThreadPool(4);
            try {
                for (int t = 0; t < 4; t++) {
                    senders.execute(() -> {
                        try {
                            go.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                        for (int i = 0; i < 500; i++) {
                            try {
                                futures.add(dispatcher.send(Notification.of("slack", null, "n" + i, "")));
                            } catch (QueueFullException e) {
                                // counted as not accepted
                            }
                        }
                    });
                }

                go.countDown();
                Thread.sleep(5);
                dispatcher.close();
                senders.shutdown();
                assertThat(senders.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                senders.shutdownNow();
            }

            CompletableFuture.allOf(futures.stream()
                            .map(f -> f.handle((r, ex) -> r))
                            .toArray(CompletableFuture<?>[]::new))
                    .get(5, TimeUnit.SECONDS);
            assertThat(futures).allMatch(CompletableFuture::isDone);
        }
    }
}
