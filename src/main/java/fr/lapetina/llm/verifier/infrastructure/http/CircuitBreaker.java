package fr.lapetina.llm.verifier.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-provider circuit breaker guarding probe traffic.
 *
 * States:
 * - CLOSED: probes go through; consecutive transport or 5xx failures are counted
 * - OPEN: threshold reached, probes are short-circuited
 * - HALF_OPEN: recovery timeout elapsed, probes go through until enough succeed
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String provider;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile Instant lastFailureTime;
    private volatile Instant openedAt;

    public CircuitBreaker(
            String provider,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        this.provider = provider;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = successThresholdInHalfOpen;
        this.clock = clock;
    }

    public CircuitBreaker(String provider, int failureThreshold, Duration recoveryTimeout) {
        this(provider, failureThreshold, recoveryTimeout, 1, Clock.systemUTC());
    }

    public CircuitBreaker(String provider) {
        this(provider, 5, Duration.ofSeconds(30));
    }

    /**
     * @return true if the probe should proceed, false if the circuit is open
     */
    public boolean allowRequest() {
        return switch (getState()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> false;
        };
    }

    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= successThresholdInHalfOpen
                    && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker CLOSED after recovery: provider={}", provider);
            }
        }
    }

    public void recordFailure() {
        Instant now = clock.instant();
        lastFailureTime = now;
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED (half-open failure): provider={}", provider);
            }
            return;
        }

        if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED: provider={}, failures={}", provider, failures);
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: provider={}", old, newState, provider);
    }

    public State getState() {
        // OPEN moves to HALF_OPEN lazily once the recovery timeout has elapsed
        if (state.get() == State.OPEN && openedAt != null
                && clock.instant().isAfter(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            successCountInHalfOpen.set(0);
            log.info("Circuit breaker transitioning to HALF_OPEN: provider={}", provider);
        }
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getProvider() {
        return provider;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "provider='" + provider + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
