package fr.lapetina.llm.verifier.domain.event;

/**
 * Event severity, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
