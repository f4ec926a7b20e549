package fr.lapetina.llm.verifier.infrastructure.store;

import fr.lapetina.llm.verifier.domain.model.VerificationResult;

import java.util.List;
import java.util.Optional;

/**
 * Durable sink for verification results.
 * The orchestrator writes to it and reads the latest result for change detection only.
 */
public interface VerificationStore {

    void save(VerificationResult result);

    /**
     * Lists results matching the filter, newest first.
     */
    List<VerificationResult> list(VerificationFilter filter, int limit, int offset);

    Optional<VerificationResult> latest(String provider, String model);
}
