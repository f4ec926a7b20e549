package fr.lapetina.llm.verifier.infrastructure.notification;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.verifier.domain.event.Event;
import fr.lapetina.llm.verifier.domain.event.EventBus;
import fr.lapetina.llm.verifier.domain.event.EventType;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import fr.lapetina.llm.verifier.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Asynchronous fan-out of notifications to channels through a bounded queue.
 *
 * <p>The queue is a Disruptor ring buffer shared by a fixed pool of workers; each
 * worker handles the sequences where {@code sequence % workers == ordinal}. A slot
 * stays claimed until its delivery attempt finishes, so a slow channel fills the
 * queue instead of growing it.
 *
 * <p>Producers wait at most {@code sendTimeout} for a free slot and then get a
 * {@link QueueFullException}. Delivery failures never escape a worker: they complete
 * the caller's future with a failed {@link DeliveryResult}. Nothing is retried.
 */
public final class NotificationDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final long CLAIM_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final Disruptor<NotificationEvent> disruptor;
    private final RingBuffer<NotificationEvent> ringBuffer;
    private final List<NotificationChannel> channels = new CopyOnWriteArrayList<>();
    private final Set<CompletableFuture<DeliveryResult>> pending = ConcurrentHashMap.newKeySet();
    private final ChannelRouter router = new ChannelRouter();
    private final NotificationRenderer renderer = new NotificationRenderer();
    private final MetricsRegistry metrics;
    private final Duration sendTimeout;
    private final Duration shutdownGrace;
    private final int workerCount;
    private final AtomicBoolean running = new AtomicBoolean(false);
    // Sends hold the read lock from the running check to publish; close() flips running under the write lock
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();

    private NotificationDispatcher(Builder builder) {
        this.metrics = builder.metrics;
        this.sendTimeout = builder.sendTimeout;
        this.shutdownGrace = builder.shutdownGrace;
        this.workerCount = builder.workers;

        this.disruptor = new Disruptor<>(
                NotificationEvent.FACTORY,
                builder.capacity,
                new WorkerThreadFactory("notification-worker"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        @SuppressWarnings("unchecked")
        EventHandler<NotificationEvent>[] workers = new EventHandler[workerCount];
        for (int i = 0; i < workerCount; i++) {
            workers[i] = new DeliveryWorker(i);
        }
        disruptor.handleEventsWith(workers);
        disruptor.setDefaultExceptionHandler(new DispatcherExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        builder.channels.forEach(this::register);

        log.info("NotificationDispatcher created: capacity={}, workers={}, sendTimeout={}, waitStrategy={}",
                builder.capacity, workerCount, sendTimeout, builder.waitStrategy);
    }

    public NotificationDispatcher start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("NotificationDispatcher started: channels={}", channelNames());
        }
        return this;
    }

    /**
     * Registers a channel. Registration order breaks routing ties.
     *
     * @throws IllegalArgumentException if a channel with the same name exists
     */
    public void register(NotificationChannel channel) {
        if (channel(channel.name()).isPresent()) {
            throw new IllegalArgumentException("Duplicate notification channel: " + channel.name());
        }
        channels.add(channel);
        log.info("Notification channel registered: name={}, weight={}", channel.name(), channel.weight());
    }

    public Optional<NotificationChannel> channel(String name) {
        return channels.stream()
                .filter(c -> c.name().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<NotificationChannel> getChannels() {
        return List.copyOf(channels);
    }

    /**
     * Queues a notification for its channel.
     *
     * @return future completed with the delivery outcome; failed futures only for
     *         a dispatcher that is not running
     * @throws QueueFullException if no slot frees up within the send timeout
     */
    public CompletableFuture<DeliveryResult> send(Notification notification) {
        lifecycle.readLock().lock();
        try {
            return enqueue(notification);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private CompletableFuture<DeliveryResult> enqueue(Notification notification) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Dispatcher not running"));
        }
        Optional<NotificationChannel> channel = channel(notification.channel());
        if (channel.isEmpty()) {
            log.warn("Notification for unknown channel dropped: id={}, channel={}",
                    notification.id(), notification.channel());
            return CompletableFuture.completedFuture(DeliveryResult.failed(
                    notification, ErrorType.NOT_FOUND, "Unknown channel: " + notification.channel()));
        }

        long sequence = claimSlot();
        CompletableFuture<DeliveryResult> future = new CompletableFuture<>();
        pending.add(future);
        future.whenComplete((r, ex) -> pending.remove(future));
        try {
            ringBuffer.get(sequence).initialize(notification, channel.get(), future);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Notification queued: id={}, channel={}, sequence={}",
                notification.id(), notification.channel(), sequence);
        return future;
    }

    /**
     * Routes an event by severity, renders one notification per selected channel and queues them.
     * A full queue yields a failed {@code QUEUE_FULL} result for that channel instead of an exception.
     */
    public CompletableFuture<List<DeliveryResult>> sendEvent(Event event) {
        List<NotificationChannel> targets = router.route(event.severity(), getChannels());
        if (targets.isEmpty()) {
            log.debug("No channel for event: type={}, severity={}", event.type(), event.severity());
            return CompletableFuture.completedFuture(List.of());
        }

        List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>(targets.size());
        for (NotificationChannel target : targets) {
            Notification notification = renderer.render(event, target);
            try {
                futures.add(send(notification));
            } catch (QueueFullException e) {
                log.warn("Notification queue full, dropping: eventId={}, channel={}, reason={}",
                        event.id(), target.name(), e.getReason());
                recordDelivery(target.name(), false);
                futures.add(CompletableFuture.completedFuture(
                        DeliveryResult.failed(notification, ErrorType.QUEUE_FULL, e.getMessage())));
            }
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Subscribes this dispatcher to the bus; failed deliveries are logged.
     */
    public EventBus.Subscription subscribeTo(EventBus eventBus, Set<EventType> eventTypes) {
        log.info("NotificationDispatcher subscribed: eventTypes={}", eventTypes.isEmpty() ? "ALL" : eventTypes);
        return eventBus.subscribe(event -> sendEvent(event).whenComplete((results, ex) -> {
            if (ex != null) {
                log.error("Event fan-out failed: eventId={}, type={}", event.id(), event.type(), ex);
                return;
            }
            results.stream()
                    .filter(r -> !r.delivered())
                    .forEach(r -> log.warn("Notification not delivered: eventId={}, channel={}, errorType={}, error={}",
                            event.id(), r.channel(), r.errorType(), r.error()));
        }), eventTypes);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getCapacity() {
        return ringBuffer.getBufferSize();
    }

    public boolean isRunning() {
        return running.get();
    }

    private long claimSlot() {
        long deadline = System.nanoTime() + sendTimeout.toNanos();
        while (true) {
            try {
                return ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                if (System.nanoTime() - deadline >= 0) {
                    throw new QueueFullException(QueueFullException.Reason.SEND_TIMEOUT,
                            "capacity=" + ringBuffer.getBufferSize() + ", waited=" + sendTimeout.toMillis() + "ms");
                }
                LockSupport.parkNanos(CLAIM_BACKOFF_NANOS);
                if (Thread.currentThread().isInterrupted()) {
                    throw new QueueFullException(QueueFullException.Reason.INTERRUPTED);
                }
            }
        }
    }

    private void recordDelivery(String channel, boolean success) {
        if (metrics != null) {
            metrics.recordDelivery(channel, success);
        }
    }

    private String channelNames() {
        return channels.stream().map(NotificationChannel::name).toList().toString();
    }

    /**
     * Stops accepting notifications, lets queued deliveries finish within the grace
     * period, then halts the workers and fails whatever is still pending.
     * A send waiting for a free slot delays the shutdown by at most the send timeout.
     */
    @Override
    public void close() {
        boolean wasRunning;
        lifecycle.writeLock().lock();
        try {
            wasRunning = running.compareAndSet(true, false);
        } finally {
            lifecycle.writeLock().unlock();
        }
        if (wasRunning) {
            log.info("Shutting down NotificationDispatcher...");
            try {
                disruptor.shutdown(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
                log.info("NotificationDispatcher shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("NotificationDispatcher shutdown timed out, halting: pending={}", pending.size());
                disruptor.halt();
            }
            for (CompletableFuture<DeliveryResult> future : List.copyOf(pending)) {
                future.completeExceptionally(new IllegalStateException("Dispatcher shut down before delivery"));
            }
        }
        for (NotificationChannel channel : channels) {
            try {
                channel.close();
            } catch (Exception e) {
                log.warn("Error closing notification channel: name={}", channel.name(), e);
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * One worker of the pool; handles only the sequences of its shard.
     */
    private final class DeliveryWorker implements EventHandler<NotificationEvent> {

        private final int ordinal;

        DeliveryWorker(int ordinal) {
            this.ordinal = ordinal;
        }

        @Override
        public void onEvent(NotificationEvent event, long sequence, boolean endOfBatch) {
            if (sequence % workerCount != ordinal) {
                return;
            }
            Notification notification = event.getNotification();
            NotificationChannel channel = event.getChannel();
            CompletableFuture<DeliveryResult> future = event.getResultFuture();
            try {
                future.complete(deliver(channel, notification));
            } finally {
                event.clear();
            }
        }

        private DeliveryResult deliver(NotificationChannel channel, Notification notification) {
            long start = System.nanoTime();
            try {
                channel.deliver(notification);
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                recordDelivery(channel.name(), true);
                log.info("Notification delivered: id={}, channel={}, priority={}, latencyMs={}",
                        notification.id(), channel.name(), notification.priority(), latency.toMillis());
                return DeliveryResult.delivered(notification, latency);
            } catch (DeliveryException e) {
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                recordDelivery(channel.name(), false);
                log.warn("Notification delivery failed: id={}, channel={}, errorType={}, error={}",
                        notification.id(), channel.name(), e.getErrorType(), e.getMessage());
                return DeliveryResult.failed(notification, e.getErrorType(), e.getMessage(), latency);
            } catch (RuntimeException e) {
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                recordDelivery(channel.name(), false);
                log.error("Notification channel failed unexpectedly: id={}, channel={}",
                        notification.id(), channel.name(), e);
                return DeliveryResult.failed(notification, ErrorType.UNCLASSIFIED,
                        e.getClass().getSimpleName() + ": " + e.getMessage(), latency);
            }
        }
    }

    /**
     * Thread factory for dispatcher workers.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for the Disruptor; keeps workers alive.
     */
    private static class DispatcherExceptionHandler implements ExceptionHandler<NotificationEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, NotificationEvent event) {
            log.error("Exception in delivery worker: sequence={}, event={}", sequence, event, ex);
            CompletableFuture<DeliveryResult> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                future.completeExceptionally(ex);
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during dispatcher start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during dispatcher shutdown", ex);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for NotificationDispatcher.
     */
    public static final class Builder {
        private int capacity = 1024;
        private int workers = 4;
        private Duration sendTimeout = Duration.ofSeconds(5);
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private String waitStrategy = "blocking";
        private MetricsRegistry metrics;
        private final List<NotificationChannel> channels = new ArrayList<>();

        private Builder() {
        }

        public Builder capacity(int capacity) {
            // Must be power of 2
            if (capacity <= 0 || Integer.bitCount(capacity) != 1) {
                throw new IllegalArgumentException("Queue capacity must be a power of 2: " + capacity);
            }
            this.capacity = capacity;
            return this;
        }

        public Builder workers(int workers) {
            if (workers <= 0) {
                throw new IllegalArgumentException("Worker count must be positive: " + workers);
            }
            this.workers = workers;
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder channel(NotificationChannel channel) {
            this.channels.add(channel);
            return this;
        }

        public Builder fromConfig(VerifierConfig.QueueConfig queue) {
            capacity(queue.getCapacity());
            workers(queue.getWorkers());
            this.sendTimeout = Duration.ofMillis(queue.getSendTimeoutMs());
            this.shutdownGrace = Duration.ofMillis(queue.getShutdownGraceMs());
            this.waitStrategy = queue.getWaitStrategy();
            return this;
        }

        public NotificationDispatcher build() {
            return new NotificationDispatcher(this);
        }
    }
}
