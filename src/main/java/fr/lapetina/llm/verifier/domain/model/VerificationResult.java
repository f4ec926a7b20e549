package fr.lapetina.llm.verifier.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scored aggregate of all probes run for one (provider, model) pair.
 * Each re-run produces a new instance; history is the sequence of instances.
 */
public record VerificationResult(
        String provider,
        String model,
        List<ProbeResult> probes,
        int score,
        CapabilityCategory category,
        ScoreBreakdown breakdown,
        Instant verifiedAt
) {
    public VerificationResult {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(category, "Category is required");
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be within [0,100]: " + score);
        }
        probes = probes != null ? List.copyOf(probes) : List.of();
        if (breakdown == null) {
            breakdown = ScoreBreakdown.ZERO;
        }
        if (verifiedAt == null) {
            verifiedAt = Instant.now();
        }
    }

    public Optional<ProbeResult> probe(ProbeKind kind) {
        return probes.stream().filter(p -> p.kind() == kind).findFirst();
    }

    public boolean allFailed() {
        return probes.stream().noneMatch(ProbeResult::passed);
    }

    public long passedCount() {
        return probes.stream().filter(ProbeResult::passed).count();
    }
}
