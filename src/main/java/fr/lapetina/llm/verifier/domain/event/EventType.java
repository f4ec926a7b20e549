package fr.lapetina.llm.verifier.domain.event;

/**
 * Kinds of state change published by the orchestrator.
 */
public enum EventType {
    /** Probing started for a (provider, model) key */
    VERIFICATION_STARTED("verification.started"),

    /** A verification result was produced, whatever its score */
    VERIFICATION_COMPLETED("verification.completed"),

    /** Every probe of a verification failed */
    VERIFICATION_FAILED("verification.failed"),

    /** The score differs from the previously stored result */
    SCORE_CHANGED("score.changed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
