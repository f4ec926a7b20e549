package fr.lapetina.llm.verifier.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Feature flags a model may declare.
 */
public enum ModelFeature {
    STREAMING("streaming"),
    FUNCTION_CALLING("function-calling"),
    VISION("vision"),
    EMBEDDINGS("embeddings");

    private final String configName;

    ModelFeature(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Probe kind that exercises this feature, if it has a dedicated feature probe.
     * Streaming is covered by the always-run streaming probe.
     */
    public Optional<ProbeKind> featureProbe() {
        return switch (this) {
            case FUNCTION_CALLING -> Optional.of(ProbeKind.FUNCTION_CALLING);
            case VISION -> Optional.of(ProbeKind.VISION);
            case EMBEDDINGS -> Optional.of(ProbeKind.EMBEDDINGS);
            case STREAMING -> Optional.empty();
        };
    }

    public static ModelFeature fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ModelFeature feature : values()) {
            if (feature.configName.equals(normalized)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown model feature: " + name);
    }
}
