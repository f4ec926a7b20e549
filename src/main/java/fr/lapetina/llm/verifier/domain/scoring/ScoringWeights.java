package fr.lapetina.llm.verifier.domain.scoring;

import java.time.Duration;
import java.util.Objects;

/**
 * Component weights (summing to 100) and the latency band used for scoring.
 */
public record ScoringWeights(
        int existence,
        int responsiveness,
        int features,
        int latency,
        int transportOptimization,
        Duration fastLatency,
        Duration slowLatency
) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(
            20, 25, 30, 15, 10, Duration.ofMillis(100), Duration.ofMillis(500));

    public ScoringWeights {
        Objects.requireNonNull(fastLatency, "Fast latency bound is required");
        Objects.requireNonNull(slowLatency, "Slow latency bound is required");
        if (existence < 0 || responsiveness < 0 || features < 0 || latency < 0 || transportOptimization < 0) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        int sum = existence + responsiveness + features + latency + transportOptimization;
        if (sum != 100) {
            throw new IllegalArgumentException("Weights must sum to 100, got " + sum);
        }
        if (slowLatency.compareTo(fastLatency) <= 0) {
            throw new IllegalArgumentException("Slow latency bound must exceed fast bound");
        }
    }
}
