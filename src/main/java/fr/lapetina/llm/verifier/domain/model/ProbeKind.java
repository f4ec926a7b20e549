package fr.lapetina.llm.verifier.domain.model;

import java.util.Locale;

/**
 * The kind of test exchange a probe performs.
 */
public enum ProbeKind {
    EXISTENCE,
    RESPONSIVENESS,
    STREAMING,
    FUNCTION_CALLING,
    VISION,
    EMBEDDINGS;

    /**
     * Feature probes count toward the feature pass ratio.
     */
    public boolean isFeature() {
        return this == FUNCTION_CALLING || this == VISION || this == EMBEDDINGS;
    }

    /**
     * Name used in cache keys and metric tags.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
