package fr.lapetina.llm.verifier.orchestrator;

import java.util.Objects;

/**
 * A request to verify one (provider, model) pair.
 *
 * @param forceRefresh bypass cached probe and verification results and overwrite them
 */
public record VerificationRequest(String provider, String model, boolean forceRefresh) {

    public VerificationRequest {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(model, "Model is required");
    }

    public static VerificationRequest of(String provider, String model) {
        return new VerificationRequest(provider, model, false);
    }

    public static VerificationRequest refresh(String provider, String model) {
        return new VerificationRequest(provider, model, true);
    }
}
