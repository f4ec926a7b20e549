package fr.lapetina.llm.verifier.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A single probe to run against one model endpoint.
 * Constructed per probe, never persisted. The credential is kept out of {@link #toString()}.
 */
public record ProbeRequest(
        Provider provider,
        Model model,
        String credential,
        ProbeKind kind,
        ChatRequest payload,
        Duration timeout
) {
    public ProbeRequest {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(kind, "Probe kind is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }

    public ProbeRequest withKind(ProbeKind kind, ChatRequest payload) {
        return new ProbeRequest(provider, model, credential, kind, payload, timeout);
    }

    @Override
    public String toString() {
        return "ProbeRequest{provider=" + provider.name()
                + ", model=" + model.id()
                + ", kind=" + kind
                + ", timeout=" + timeout
                + ", credential=" + (credential == null || credential.isEmpty() ? "<none>" : "****")
                + '}';
    }
}
