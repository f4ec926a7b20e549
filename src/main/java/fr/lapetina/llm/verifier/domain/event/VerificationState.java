package fr.lapetina.llm.verifier.domain.event;

/**
 * Lifecycle state of a (provider, model) verification in the orchestrator.
 */
public enum VerificationState {
    /** No verification running for the key */
    IDLE,

    /** Concurrency slot held, probes in flight */
    PROBING,

    /** All probes returned, score being computed */
    SCORING,

    /** Result cached, stored and published */
    DONE
}
