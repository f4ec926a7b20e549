package fr.lapetina.llm.verifier.orchestrator;

import fr.lapetina.llm.verifier.domain.adapter.AdapterRegistry;
import fr.lapetina.llm.verifier.domain.adapter.ProviderAdapter;
import fr.lapetina.llm.verifier.domain.model.Provider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderConcurrencyLimiterTest {

    private final ProviderConcurrencyLimiter limiter = new ProviderConcurrencyLimiter();
    private final ProviderAdapter deepseek = AdapterRegistry.withDefaults().resolve("deepseek").orElseThrow();
    private final Provider provider = Provider.of("deepseek", "https://api.deepseek.com/v1", "k");
    private final ExecutorService executor = Executors.newFixedThreadPool(32);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("should size slots by the adapter batch size")
    void shouldSizeByBatch() throws Exception {
        assertThat(limiter.availableSlots(provider, deepseek)).isEqualTo(deepseek.optimalBatchSize());

        CountDownLatch gate = new CountDownLatch(1);
        CompletableFuture<String> running = limiter.submit(provider, deepseek, () -> await(gate), executor);

        assertThat(limiter.availableSlots(provider, deepseek)).isEqualTo(deepseek.optimalBatchSize() - 1);
        assertThat(limiter.getGlobalInFlight()).isEqualTo(1);
        gate.countDown();
        assertThat(running.get(2, TimeUnit.SECONDS)).isEqualTo("done");
        assertThat(limiter.getGlobalInFlight()).isZero();
        assertThat(limiter.availableSlots(provider, deepseek)).isEqualTo(deepseek.optimalBatchSize());
    }

    @Test
    @DisplayName("should queue tasks beyond the batch size and start them as slots free up")
    void shouldQueueWhenSaturated() throws Exception {
        int batch = deepseek.optimalBatchSize();
        CountDownLatch gate = new CountDownLatch(1);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < batch + 5; i++) {
            futures.add(limiter.submit(provider, deepseek, () -> await(gate), executor));
        }

        assertThat(limiter.getGlobalInFlight()).isEqualTo(batch);
        assertThat(limiter.queuedTasks(provider)).isEqualTo(5);

        gate.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
        assertThat(limiter.queuedTasks(provider)).isZero();
        assertThat(limiter.getGlobalInFlight()).isZero();
    }

    @Test
    @DisplayName("should never run more tasks at once than the batch size")
    void shouldCapConcurrency() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            futures.add(limiter.submit(provider, deepseek, () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(20);
                return running.decrementAndGet();
            }, executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(10, TimeUnit.SECONDS);

        assertThat(maxRunning.get()).isLessThanOrEqualTo(deepseek.optimalBatchSize());
    }

    @Test
    @DisplayName("should free the slot when a task throws")
    void shouldReleaseOnFailure() {
        CompletableFuture<String> failing = limiter.submit(provider, deepseek, () -> {
            throw new IllegalStateException("boom");
        }, executor);

        assertThatThrownBy(() -> failing.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(limiter.availableSlots(provider, deepseek)).isEqualTo(deepseek.optimalBatchSize());
    }

    @Test
    @DisplayName("should fail the task and free the slot when the executor rejects it")
    void shouldReleaseOnRejection() {
        executor.shutdown();

        CompletableFuture<String> rejected = limiter.submit(provider, deepseek, () -> "never", executor);

        assertThat(rejected).isCompletedExceptionally();
        assertThatThrownBy(rejected::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(limiter.availableSlots(provider, deepseek)).isEqualTo(deepseek.optimalBatchSize());
        assertThat(limiter.getGlobalInFlight()).isZero();
    }

    private static String await(CountDownLatch gate) {
        try {
            gate.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "done";
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
