package fr.lapetina.llm.verifier.domain.scoring;

import fr.lapetina.llm.verifier.domain.model.CapabilityCategory;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.ScoreBreakdown;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Maps probe outcomes to a 0-100 capability score and category.
 *
 * Pure and deterministic: the same probe results always give the same score.
 * Stateless, safe to share.
 */
public final class ScoreCalculator {

    private final ScoringWeights weights;

    public ScoreCalculator(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoreCalculator() {
        this(ScoringWeights.DEFAULT);
    }

    /**
     * Scores probe results and assembles the verification result.
     */
    public VerificationResult score(String provider, String model, List<ProbeResult> probes, Instant verifiedAt) {
        ScoreBreakdown breakdown = breakdown(probes);
        int score = toScore(breakdown);
        return new VerificationResult(provider, model, probes, score,
                CapabilityCategory.forScore(score), breakdown, verifiedAt);
    }

    public int score(Collection<ProbeResult> probes) {
        return toScore(breakdown(probes));
    }

    public ScoreBreakdown breakdown(Collection<ProbeResult> probes) {
        Optional<ProbeResult> existence = find(probes, ProbeKind.EXISTENCE);
        Optional<ProbeResult> responsiveness = find(probes, ProbeKind.RESPONSIVENESS);

        double existenceComponent = existence.filter(ProbeResult::passed).isPresent() ? 1.0 : 0.0;
        double responsivenessComponent = responsiveness.filter(ProbeResult::passed).isPresent() ? 1.0 : 0.0;

        return new ScoreBreakdown(
                weights.existence() * existenceComponent,
                weights.responsiveness() * responsivenessComponent,
                weights.features() * featureRatio(probes),
                weights.latency() * latencyBand(responsiveness.filter(ProbeResult::passed)),
                weights.transportOptimization() * transportComponent(probes)
        );
    }

    private static int toScore(ScoreBreakdown breakdown) {
        long rounded = Math.round(breakdown.total());
        return (int) Math.max(0, Math.min(100, rounded));
    }

    private static double featureRatio(Collection<ProbeResult> probes) {
        long attempted = probes.stream().filter(p -> p.kind().isFeature()).count();
        if (attempted == 0) {
            return 0.0;
        }
        long passed = probes.stream().filter(p -> p.kind().isFeature() && p.passed()).count();
        return (double) passed / attempted;
    }

    /**
     * 1.0 at or below the fast bound, 0.0 at or above the slow bound, linear in between.
     * A failed or missing responsiveness probe scores 0.
     */
    private double latencyBand(Optional<ProbeResult> responsiveness) {
        if (responsiveness.isEmpty()) {
            return 0.0;
        }
        ProbeResult probe = responsiveness.get();
        Duration reference = probe.timeToFirstToken() != null ? probe.timeToFirstToken() : probe.latency();
        long millis = reference.toMillis();
        long fast = weights.fastLatency().toMillis();
        long slow = weights.slowLatency().toMillis();
        if (millis <= fast) {
            return 1.0;
        }
        if (millis >= slow) {
            return 0.0;
        }
        return (double) (slow - millis) / (slow - fast);
    }

    // Compression on a failed exchange earns nothing
    private static double transportComponent(Collection<ProbeResult> probes) {
        return probes.stream().anyMatch(p -> p.passed() && p.transportOptimized()) ? 1.0 : 0.0;
    }

    private static Optional<ProbeResult> find(Collection<ProbeResult> probes, ProbeKind kind) {
        return probes.stream().filter(p -> p.kind() == kind).findFirst();
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
