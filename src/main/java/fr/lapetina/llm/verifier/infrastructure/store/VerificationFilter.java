package fr.lapetina.llm.verifier.infrastructure.store;

import fr.lapetina.llm.verifier.domain.model.CapabilityCategory;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * Criteria for listing stored results. Null fields match anything.
 */
public record VerificationFilter(
        String provider,
        String model,
        Integer minScore,
        CapabilityCategory category,
        Instant since
) implements Predicate<VerificationResult> {

    public static final VerificationFilter ALL = new VerificationFilter(null, null, null, null, null);

    public static VerificationFilter forModel(String provider, String model) {
        return new VerificationFilter(provider, model, null, null, null);
    }

    @Override
    public boolean test(VerificationResult result) {
        return (provider == null || provider.equalsIgnoreCase(result.provider()))
                && (model == null || model.equals(result.model()))
                && (minScore == null || result.score() >= minScore)
                && (category == null || category == result.category())
                && (since == null || !result.verifiedAt().isBefore(since));
    }
}
