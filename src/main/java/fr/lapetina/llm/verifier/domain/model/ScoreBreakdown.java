package fr.lapetina.llm.verifier.domain.model;

/**
 * Weighted points contributed by each scoring component, before rounding.
 */
public record ScoreBreakdown(
        double existence,
        double responsiveness,
        double features,
        double latency,
        double transportOptimization
) {
    public static final ScoreBreakdown ZERO = new ScoreBreakdown(0, 0, 0, 0, 0);

    public double total() {
        return existence + responsiveness + features + latency + transportOptimization;
    }
}
