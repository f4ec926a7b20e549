package fr.lapetina.llm.verifier.orchestrator;

import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background re-verification of every registered model.
 *
 * Each cycle force-refreshes all models so cached results never outlive one interval.
 * A cycle is skipped while the previous one is still running.
 */
public final class VerificationScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerificationScheduler.class);

    private final VerificationOrchestrator orchestrator;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
    private final AtomicInteger completedCycles = new AtomicInteger(0);

    public VerificationScheduler(VerificationOrchestrator orchestrator, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Scheduler interval must be positive");
        }
        this.orchestrator = orchestrator;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "verification-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic re-verification; the first cycle runs after one interval.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Verification scheduler started with interval: {}", interval);
        }
    }

    /**
     * Runs one re-verification cycle unless one is already in progress.
     *
     * @return the cycle's results, or an empty list when skipped
     */
    public CompletableFuture<List<VerificationResult>> runCycle() {
        if (!cycleInProgress.compareAndSet(false, true)) {
            log.warn("Previous verification cycle still running, skipping");
            return CompletableFuture.completedFuture(List.of());
        }
        log.debug("Verification cycle started");
        try {
            return orchestrator.verifyAllRegistered(true)
                    .whenComplete((results, ex) -> {
                        cycleInProgress.set(false);
                        if (ex != null) {
                            log.error("Verification cycle failed", ex);
                        } else {
                            int cycle = completedCycles.incrementAndGet();
                            log.info("Verification cycle completed: cycle={}, models={}", cycle, results.size());
                        }
                    });
        } catch (RuntimeException e) {
            cycleInProgress.set(false);
            log.error("Verification cycle could not start", e);
            return CompletableFuture.failedFuture(e);
        }
    }

    public int getCompletedCycles() {
        return completedCycles.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Verification scheduler stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
