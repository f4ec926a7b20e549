package fr.lapetina.llm.verifier.orchestrator;

import fr.lapetina.llm.verifier.domain.adapter.ProviderAdapter;
import fr.lapetina.llm.verifier.domain.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds concurrent probes per provider.
 *
 * <p>Each provider gets a lane with as many slots as its adapter's optimal batch size.
 * A task submitted to a full lane waits in the lane's FIFO queue without holding a
 * thread; it is handed to the executor when a running task of the same provider
 * finishes.
 */
public final class ProviderConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ProviderConcurrencyLimiter.class);

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final AtomicInteger globalInFlight = new AtomicInteger(0);

    /**
     * Runs {@code task} on {@code executor} once the provider has a free slot.
     *
     * <p>The returned future completes with the task's result, or exceptionally if the
     * task throws or the executor rejects it. The slot is freed before the future completes.
     */
    public <T> CompletableFuture<T> submit(Provider provider, ProviderAdapter adapter, Supplier<T> task, Executor executor) {
        Lane lane = laneFor(provider, adapter);
        CompletableFuture<T> future = new CompletableFuture<>();
        lane.pending.add(() -> start(lane, task, executor, future));
        if (lane.permits.availablePermits() == 0) {
            log.debug("Provider at capacity, task queued: provider={}, capacity={}, queued={}",
                    lane.provider, lane.capacity, lane.pending.size());
        }
        drain(lane);
        return future;
    }

    /**
     * Free slots for a provider; the full batch size when it has not been used yet.
     */
    public int availableSlots(Provider provider, ProviderAdapter adapter) {
        return laneFor(provider, adapter).permits.availablePermits();
    }

    /**
     * Tasks waiting for a slot of the provider.
     */
    public int queuedTasks(Provider provider) {
        Lane lane = lanes.get(provider.key());
        return lane == null ? 0 : lane.pending.size();
    }

    public int getGlobalInFlight() {
        return globalInFlight.get();
    }

    private <T> void start(Lane lane, Supplier<T> task, Executor executor, CompletableFuture<T> future) {
        globalInFlight.incrementAndGet();
        try {
            executor.execute(() -> {
                T result = null;
                RuntimeException failure = null;
                try {
                    result = task.get();
                } catch (RuntimeException e) {
                    failure = e;
                } finally {
                    release(lane);
                }
                if (failure != null) {
                    future.completeExceptionally(failure);
                } else {
                    future.complete(result);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected provider task: provider={}, error={}", lane.provider, e.getMessage());
            release(lane);
            future.completeExceptionally(e);
        }
    }

    private void release(Lane lane) {
        globalInFlight.decrementAndGet();
        lane.permits.release();
        drain(lane);
    }

    // A task is only polled while holding a permit, which the task releases when done
    private void drain(Lane lane) {
        while (!lane.pending.isEmpty() && lane.permits.tryAcquire()) {
            Runnable next = lane.pending.poll();
            if (next == null) {
                lane.permits.release();
                continue;
            }
            next.run();
        }
    }

    private Lane laneFor(Provider provider, ProviderAdapter adapter) {
        return lanes.computeIfAbsent(provider.key(), key -> {
            int capacity = Math.max(1, adapter.optimalBatchSize());
            log.info("Provider concurrency limit initialized: provider={}, adapter={}, capacity={}",
                    provider.name(), adapter.name(), capacity);
            return new Lane(provider.name(), capacity);
        });
    }

    private static final class Lane {
        private final String provider;
        private final int capacity;
        private final Semaphore permits;
        private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();

        private Lane(String provider, int capacity) {
            this.provider = provider;
            this.capacity = capacity;
            this.permits = new Semaphore(capacity);
        }
    }
}
